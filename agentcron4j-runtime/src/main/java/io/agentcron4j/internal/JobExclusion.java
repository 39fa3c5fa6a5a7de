package io.agentcron4j.internal;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-job-name mutual exclusion with at most one pending re-run per name.
 *
 * @param <T> what a pending re-run carries
 */
final class JobExclusion<T> {

    private final Set<String> running = new HashSet<>();
    private final Map<String, T> pending = new HashMap<>();

    enum Claim {
        STARTED,
        QUEUED,
        BUSY
    }

    /**
     * Claims {@code name} if it is free. Otherwise queues {@code rerun} when it is non-null
     * and no other re-run is pending.
     */
    synchronized Claim claim(String name, T rerun) {
        if (running.add(name)) {
            return Claim.STARTED;
        }
        if (rerun != null && pending.putIfAbsent(name, rerun) == null) {
            return Claim.QUEUED;
        }
        return Claim.BUSY;
    }

    /**
     * Blocks until no execution of {@code name} is in progress, then claims it.
     */
    synchronized void awaitStart(String name) throws InterruptedException {
        while (running.contains(name)) {
            wait();
        }
        running.add(name);
    }

    /**
     * Releases the claim and returns null, unless a re-run is pending. In that case the claim
     * is kept and the pending re-run is handed to the caller.
     */
    synchronized T finishOrContinue(String name) {
        T next = pending.remove(name);
        if (next == null) {
            release(name);
        }
        return next;
    }

    /**
     * Releases the claim and drops any pending re-run of {@code name}.
     */
    synchronized void abandon(String name) {
        pending.remove(name);
        release(name);
    }

    synchronized void release(String name) {
        running.remove(name);
        notifyAll();
    }

    synchronized boolean isRunning(String name) {
        return running.contains(name);
    }

    synchronized void clearPending() {
        pending.clear();
    }
}
