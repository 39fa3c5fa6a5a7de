package io.agentcron4j.core;

import io.agentcron4j.schedule.ScheduleSpec;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable job definition produced by JobBuilder.build() or loaded from a job file.
 */
public record JobDefinition(

        // identity
        String name,
        String description,

        // scheduling
        ScheduleSpec schedule,

        // execution
        ExecutionTarget target,
        String task,
        List<String> instructions,
        Duration timeout,

        // result handling
        OutputConfig output,
        boolean notifyOnError
) {
    public JobDefinition {
        Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(task, "task must not be null");
        if (task.isBlank()) {
            throw new IllegalArgumentException("task must not be blank");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        instructions = instructions == null ? List.of() : List.copyOf(instructions);
    }
}
