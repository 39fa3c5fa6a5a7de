package io.agentcron4j.core;

/**
 * What happens when a job becomes due while its previous execution is still running.
 */
public enum OverlapPolicy {
    /**
     * Drop the new fire-time.
     */
    SKIP,
    /**
     * Remember at most one pending run and start it as soon as the current one finishes.
     */
    COALESCE
}
