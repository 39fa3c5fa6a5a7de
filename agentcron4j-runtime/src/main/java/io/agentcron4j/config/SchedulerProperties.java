package io.agentcron4j.config;

import io.agentcron4j.core.OverlapPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for agent scheduler behavior.
 */
@ConfigurationProperties(prefix = "agent-scheduler")
public class SchedulerProperties {
    private boolean enabled = true;
    private int maxConcurrency = 4; // worker pool size
    private Duration defaultTimeout = Duration.ofMinutes(30); // per execution, unless the job overrides it
    private OverlapPolicy overlapPolicy = OverlapPolicy.SKIP;
    private Duration shutdownGracePeriod = Duration.ofMinutes(1);
    private Duration maxSleep = Duration.ofSeconds(30);
    private String timezone;
    private Path jobsFile;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getDefaultTimeout() {
        return defaultTimeout;
    }

    public void setDefaultTimeout(Duration defaultTimeout) {
        this.defaultTimeout = defaultTimeout;
    }

    public OverlapPolicy getOverlapPolicy() {
        return overlapPolicy;
    }

    public void setOverlapPolicy(OverlapPolicy overlapPolicy) {
        this.overlapPolicy = overlapPolicy;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getMaxSleep() {
        return maxSleep;
    }

    public void setMaxSleep(Duration maxSleep) {
        this.maxSleep = maxSleep;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Path getJobsFile() {
        return jobsFile;
    }

    public void setJobsFile(Path jobsFile) {
        this.jobsFile = jobsFile;
    }

    /**
     * Zone used to interpret schedules; the system default when {@code timezone} is unset.
     */
    public ZoneId zone() {
        return (timezone == null || timezone.isBlank()) ? ZoneId.systemDefault() : ZoneId.of(timezone);
    }
}
