package io.agentcron4j;

import io.agentcron4j.core.AgentRequest;
import io.agentcron4j.core.ExecutionTarget;

import java.util.concurrent.CompletableFuture;

/**
 * Capability that runs an agent or team against a task and yields its text answer.
 *
 * <p>Calls may take minutes. Implementations should honour {@link CompletableFuture#cancel(boolean)}
 * where the underlying client allows it; the scheduler cancels on timeout and on shutdown.
 */
public interface AgentInvoker {

    CompletableFuture<String> invoke(AgentRequest request);

    /**
     * Whether this invoker can run the given target. Used when several invokers are combined.
     */
    default boolean supports(ExecutionTarget target) {
        return true;
    }
}
