package io.agentcron4j.core;

/**
 * Raised when a job configuration file is missing, unreadable or invalid.
 */
public class ConfigException extends SchedulerException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
