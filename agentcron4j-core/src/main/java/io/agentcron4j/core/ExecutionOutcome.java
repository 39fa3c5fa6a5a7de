package io.agentcron4j.core;

import java.util.Objects;

/**
 * Result of one execution: either the agent's text or the error that ended it.
 */
public interface ExecutionOutcome {

    boolean isSuccess();

    record Success(String content) implements ExecutionOutcome {
        public Success {
            content = content == null ? "" : content;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    record Failure(Throwable error) implements ExecutionOutcome {
        public Failure {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        public String message() {
            return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        }
    }
}
