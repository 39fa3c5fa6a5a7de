package io.agentcron4j.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Ephemeral record of one execution, used for output routing and logging only.
 */
public record ExecutionRecord(
        String jobName,
        Instant startedAt,
        Instant finishedAt,
        ExecutionOutcome outcome
) {
    public boolean isSuccess() {
        return outcome.isSuccess();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
