package io.agentcron4j.config;

import io.agentcron4j.AgentScheduler;
import io.agentcron4j.core.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Bridges the scheduler start/stop lifecycle with the Spring container lifecycle.
 *
 * <p>On the first start, {@link JobDefinition} beans and then the jobs of
 * {@code agent-scheduler.jobs-file} are registered with the scheduler.
 */
public class AgentSchedulerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(AgentSchedulerLifecycle.class);

    private final AgentScheduler scheduler;
    private final SchedulerProperties props;
    private final JobConfigLoader loader;
    private final List<JobDefinition> jobBeans;
    private volatile boolean running = false;
    private boolean jobsRegistered = false;

    public AgentSchedulerLifecycle(AgentScheduler scheduler,
                                   SchedulerProperties props,
                                   JobConfigLoader loader,
                                   List<JobDefinition> jobBeans) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.loader = Objects.requireNonNull(loader, "loader must not be null");
        this.jobBeans = List.copyOf(Objects.requireNonNull(jobBeans, "jobBeans must not be null"));
    }

    @Override
    public void start() {
        if (!jobsRegistered) {
            registerJobs();
            jobsRegistered = true;
        }
        scheduler.start();
        running = true;
    }

    private void registerJobs() {
        jobBeans.forEach(scheduler::add);

        Path jobsFile = props.getJobsFile();
        if (jobsFile != null) {
            List<JobDefinition> fileJobs = loader.load(jobsFile);
            fileJobs.forEach(scheduler::add);
            log.info("agent-scheduler registered jobs beans={} file={} fileJobs={}",
                    jobBeans.size(), jobsFile, fileJobs.size());
        } else {
            log.info("agent-scheduler registered jobs beans={}", jobBeans.size());
        }
    }

    @Override
    public void stop() {
        scheduler.stop();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
