package io.agentcron4j.internal;

import io.agentcron4j.AgentInvoker;
import io.agentcron4j.core.AgentRequest;
import io.agentcron4j.core.ExecutionTarget;
import io.agentcron4j.core.JobExecutionException;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Routes each request to the first invoker that supports its target.
 */
public class CompositeAgentInvoker implements AgentInvoker {

    private final List<AgentInvoker> invokers;

    public CompositeAgentInvoker(List<? extends AgentInvoker> invokers) {
        Objects.requireNonNull(invokers, "invokers must not be null");
        this.invokers = List.copyOf(invokers);
    }

    public static AgentInvoker of(List<? extends AgentInvoker> invokers) {
        return invokers.size() == 1 ? invokers.get(0) : new CompositeAgentInvoker(invokers);
    }

    @Override
    public CompletableFuture<String> invoke(AgentRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        for (AgentInvoker invoker : invokers) {
            if (invoker.supports(request.target())) {
                return invoker.invoke(request);
            }
        }
        return CompletableFuture.failedFuture(
                new JobExecutionException("No agent invoker supports target " + request.target(), null));
    }

    @Override
    public boolean supports(ExecutionTarget target) {
        for (AgentInvoker invoker : invokers) {
            if (invoker.supports(target)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return invokers.isEmpty();
    }
}
