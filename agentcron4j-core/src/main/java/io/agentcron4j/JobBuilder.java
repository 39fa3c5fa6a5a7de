package io.agentcron4j;

import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.OutputType;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Fluent builder for configuring a job before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job definition</li>
 *   <li>register(): build() + add to the scheduler</li>
 * </ul>
 */
public interface JobBuilder {

    JobBuilder description(String description);

    /**
     * 5-field cron expression, e.g. "0 9 * * 1-5".
     */
    JobBuilder cron(String expression);

    /**
     * Sparse field map, e.g. {hour: 18, minute: 0, day_of_week: "fri"}.
     */
    JobBuilder schedule(Map<String, ?> fields);

    JobBuilder agent(String name);

    JobBuilder team(String name);

    JobBuilder task(String task);

    JobBuilder instructions(List<String> instructions);

    /**
     * Overrides the scheduler's default execution timeout for this job.
     */
    JobBuilder timeout(Duration timeout);

    JobBuilder output(OutputType type, String directory);

    /**
     * Base filename; may contain {@code <job_name>} and {@code <date_timestamp>} placeholders.
     */
    JobBuilder filename(String filename);

    JobBuilder title(String title);

    JobBuilder notifyOnError(boolean notifyOnError);

    JobDefinition build();

    /**
     * Build + add to the scheduler.
     */
    JobDefinition register();
}
