package io.agentcron4j.core;

import io.agentcron4j.schedule.CronSchedule;

import java.time.Instant;

/**
 * A registered job whose fire-time has been reached.
 */
public record DueJob(
        JobDefinition job,
        CronSchedule schedule,
        Instant fireTime
) {
}
