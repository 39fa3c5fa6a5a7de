package io.agentcron4j.core;

/**
 * Wraps any failure reported by the agent/team capability.
 */
public class JobExecutionException extends SchedulerException {

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
