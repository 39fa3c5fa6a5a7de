package io.agentcron4j.internal;

import io.agentcron4j.JobBuilder;
import io.agentcron4j.core.ExecutionTarget;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.OutputConfig;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.schedule.ScheduleSpec;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Default {@link JobBuilder} implementation used by the in-process scheduler.
 */
public class SimpleJobBuilder implements JobBuilder {

    private final String name;
    private final Consumer<JobDefinition> registrar;

    private String description;
    private ScheduleSpec schedule;
    private ExecutionTarget target;
    private String task;
    private List<String> instructions = List.of();
    private Duration timeout;

    private OutputType outputType;
    private Path outputDirectory;
    private String filename;
    private String title;
    private boolean notifyOnError;

    public SimpleJobBuilder(String name, Consumer<JobDefinition> registrar) {
        this.name = Objects.requireNonNull(name, "job name must not be null");
        this.registrar = Objects.requireNonNull(registrar, "registrar must not be null");
    }

    @Override
    public JobBuilder description(String description) {
        this.description = description;
        return this;
    }

    @Override
    public JobBuilder cron(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        this.schedule = ScheduleSpec.cron(expression);
        return this;
    }

    @Override
    public JobBuilder schedule(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        this.schedule = ScheduleSpec.fields(fields);
        return this;
    }

    @Override
    public JobBuilder agent(String name) {
        setTarget(ExecutionTarget.agent(name));
        return this;
    }

    @Override
    public JobBuilder team(String name) {
        setTarget(ExecutionTarget.team(name));
        return this;
    }

    private void setTarget(ExecutionTarget target) {
        if (this.target != null && this.target.kind() != target.kind()) {
            throw new IllegalArgumentException("job must target either an agent or a team, not both");
        }
        this.target = target;
    }

    @Override
    public JobBuilder task(String task) {
        this.task = Objects.requireNonNull(task, "task must not be null");
        return this;
    }

    @Override
    public JobBuilder instructions(List<String> instructions) {
        Objects.requireNonNull(instructions, "instructions must not be null");
        this.instructions = List.copyOf(instructions);
        return this;
    }

    @Override
    public JobBuilder timeout(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        this.timeout = timeout;
        return this;
    }

    @Override
    public JobBuilder output(OutputType type, String directory) {
        this.outputType = Objects.requireNonNull(type, "output type must not be null");
        this.outputDirectory = directory == null ? null : Path.of(directory);
        return this;
    }

    @Override
    public JobBuilder filename(String filename) {
        this.filename = filename;
        return this;
    }

    @Override
    public JobBuilder title(String title) {
        this.title = title;
        return this;
    }

    @Override
    public JobBuilder notifyOnError(boolean notifyOnError) {
        this.notifyOnError = notifyOnError;
        return this;
    }

    @Override
    public JobDefinition build() {
        if (schedule == null) {
            throw new IllegalStateException("job '" + name + "' has no schedule");
        }
        if (target == null) {
            throw new IllegalStateException("job '" + name + "' must target an agent or a team");
        }
        if (task == null) {
            throw new IllegalStateException("job '" + name + "' has no task");
        }
        if (outputType == null && (filename != null || title != null)) {
            throw new IllegalStateException("job '" + name + "' sets filename or title without an output type");
        }
        OutputConfig output = outputType == null
                ? null
                : new OutputConfig(outputType, outputDirectory, filename, title);
        return new JobDefinition(
                name,
                description,
                schedule,
                target,
                task,
                instructions,
                timeout,
                output,
                notifyOnError
        );
    }

    @Override
    public JobDefinition register() {
        JobDefinition job = this.build();
        registrar.accept(job);
        return job;
    }
}
