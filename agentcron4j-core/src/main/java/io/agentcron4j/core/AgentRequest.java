package io.agentcron4j.core;

import java.util.List;

/**
 * Input handed to an {@link io.agentcron4j.AgentInvoker}.
 */
public record AgentRequest(
        String jobName,
        ExecutionTarget target,
        String task,
        List<String> instructions
) {
    public static AgentRequest of(JobDefinition job) {
        return new AgentRequest(job.name(), job.target(), job.task(), job.instructions());
    }
}
