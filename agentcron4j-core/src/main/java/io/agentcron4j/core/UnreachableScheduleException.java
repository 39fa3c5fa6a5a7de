package io.agentcron4j.core;

/**
 * Raised when a schedule has no fire-time within the search horizon (e.g. {@code 0 0 31 2 *}).
 */
public class UnreachableScheduleException extends SchedulerException {

    public UnreachableScheduleException(String message) {
        super(message);
    }
}
