package io.agentcron4j.core;

/**
 * Raised when an output artifact cannot be rendered or written.
 */
public class OutputWriteException extends SchedulerException {

    public OutputWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
