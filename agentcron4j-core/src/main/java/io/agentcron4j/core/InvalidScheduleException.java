package io.agentcron4j.core;

/**
 * Raised when a cron string or field map cannot be parsed.
 * Fatal to the registration of the affected job only.
 */
public class InvalidScheduleException extends SchedulerException {

    public InvalidScheduleException(String message) {
        super(message);
    }
}
