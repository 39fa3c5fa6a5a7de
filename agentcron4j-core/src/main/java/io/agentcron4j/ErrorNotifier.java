package io.agentcron4j;

import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.JobDefinition;

/**
 * Side effect triggered when a job with {@code notifyOnError} fails.
 */
@FunctionalInterface
public interface ErrorNotifier {

    void jobFailed(JobDefinition job, ExecutionRecord record);
}
