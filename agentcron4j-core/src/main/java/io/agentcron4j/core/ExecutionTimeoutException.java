package io.agentcron4j.core;

import java.time.Duration;

/**
 * Raised when an execution exceeds its time budget.
 */
public class ExecutionTimeoutException extends SchedulerException {

    private final Duration timeout;

    public ExecutionTimeoutException(String jobName, Duration timeout) {
        super("Job '" + jobName + "' timed out after " + timeout);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
