package io.agentcron4j.internal;

import io.agentcron4j.ErrorNotifier;
import io.agentcron4j.core.ExecutionOutcome;
import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default notifier: a warning in the log.
 */
public class LoggingErrorNotifier implements ErrorNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingErrorNotifier.class);

    @Override
    public void jobFailed(JobDefinition job, ExecutionRecord record) {
        String msg = record.outcome() instanceof ExecutionOutcome.Failure f ? f.message() : "unknown error";
        log.warn("agent-scheduler error notification name={} target={} startedAt={} msg={}",
                job.name(), job.target(), record.startedAt(), msg);
    }
}
