package io.agentcron4j;

import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.JobStatus;

import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Jobs run an agent or a team against a task on a cron-like schedule and write the result
 * to an output file. Typical usage:
 * <pre>{@code
 * scheduler.create("morning-brief")
 *          .cron("0 8 * * 1-5")
 *          .agent("investment")
 *          .task("Summarize overnight market moves")
 *          .output(OutputType.PDF, "output/briefs")
 *          .register();
 *
 * scheduler.start();
 * scheduler.runOnce("morning-brief");
 * scheduler.stop();
 * }</pre>
 */
public interface AgentScheduler {

    /**
     * Start dispatching due jobs. Idempotent. Fire-times are recomputed from now; missed
     * fire-times are not replayed.
     */
    void start();

    /**
     * Stop dispatching and drain in-flight executions within the configured grace period.
     * Idempotent.
     */
    void stop();

    boolean isRunning();

    /**
     * Create a job builder. Nothing is registered until {@code register()} is called.
     */
    JobBuilder create(String name);

    /**
     * Register a job. A schedule that can never fire registers the job disabled.
     *
     * @throws io.agentcron4j.core.InvalidScheduleException if the schedule cannot be parsed
     * @throws io.agentcron4j.core.DuplicateJobException    if the name is taken
     */
    void add(JobDefinition job);

    /**
     * @throws io.agentcron4j.core.JobNotFoundException if no job has this name
     */
    JobDefinition remove(String name);

    /**
     * @throws io.agentcron4j.core.JobNotFoundException if no job has this name
     */
    JobDefinition get(String name);

    List<JobDefinition> list();

    /**
     * Jobs with next fire-time and last known run state, in registration order.
     */
    List<JobStatus> statuses();

    /**
     * Execute a job immediately, regardless of its schedule, and write its output.
     * Works whether or not the scheduler has been started.
     *
     * @return the successful execution record
     * @throws io.agentcron4j.core.JobNotFoundException       if no job has this name
     * @throws io.agentcron4j.core.JobExecutionException      if the agent call failed
     * @throws io.agentcron4j.core.ExecutionTimeoutException  if the agent call timed out
     * @throws io.agentcron4j.core.OutputWriteException       if the result could not be written
     */
    ExecutionRecord runOnce(String name);
}
