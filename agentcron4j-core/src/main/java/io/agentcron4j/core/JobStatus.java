package io.agentcron4j.core;

import java.time.Instant;

/**
 * Snapshot of a registered job for listings.
 *
 * nextFireTime  : null when the job is disabled
 * lastSucceeded : null until the first execution finishes
 * lastError     : message of the most recent failure, cleared by a success
 * disabledReason: why the job was taken out of scheduling, null while enabled
 */
public record JobStatus(
        String name,
        String description,
        String schedule,
        ExecutionTarget target,
        Instant nextFireTime,
        Instant lastRunAt,
        Boolean lastSucceeded,
        String lastError,
        boolean running,
        boolean enabled,
        String disabledReason
) {
}
