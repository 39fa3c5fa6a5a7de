package io.agentcron4j.internal;

import io.agentcron4j.AgentScheduler;
import io.agentcron4j.JobBuilder;
import io.agentcron4j.config.SchedulerProperties;
import io.agentcron4j.core.DueJob;
import io.agentcron4j.core.ExecutionOutcome;
import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.JobExecutionException;
import io.agentcron4j.core.JobRegistry;
import io.agentcron4j.core.JobStatus;
import io.agentcron4j.core.OutputWriteException;
import io.agentcron4j.core.SchedulerException;
import io.agentcron4j.core.UnreachableScheduleException;
import io.agentcron4j.internal.output.OutputDispatcher;
import io.agentcron4j.schedule.CronSchedule;
import io.agentcron4j.schedule.ScheduleResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process agent scheduler.
 *
 * <p>One loop thread sleeps until the earliest next fire-time (never longer than
 * {@code maxSleep}) and hands due jobs to the {@link ExecutionEngine}. Adding, removing or
 * running a job wakes the loop early. Each due job gets its next fire-time computed from
 * {@code max(fireTime, now)} before it runs, so missed ticks are not replayed.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.create("weekly-digest")
 *          .schedule(Map.of("day_of_week", "fri", "hour", 18, "minute", 0))
 *          .team("research")
 *          .task("Write the weekly digest")
 *          .output(OutputType.HTML, "output/digests")
 *          .register();
 *
 * scheduler.start();
 * }</pre>
 */
public class DefaultAgentScheduler implements AgentScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultAgentScheduler.class);

    /**
     * IDLE: not started, or running with no enabled job to wait for.
     * SLEEPING: waiting for the earliest fire-time or a backoff delay.
     */
    public enum LoopState {
        IDLE,
        SLEEPING,
        DISPATCHING,
        STOPPED
    }

    static final int MAX_CONSECUTIVE_FAILURES = 30;

    private final SchedulerProperties props;
    private final JobRegistry registry;
    private final ExecutionEngine engine;
    private final OutputDispatcher dispatcher;
    private final Clock clock;
    private final ZoneId zone;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);
    private final ExecutionEngine.ExecutionListener scheduledRunTracker = new ExecutionEngine.ExecutionListener() {
        @Override
        public void started(JobDefinition job, Instant startedAt) {
            registry.markRunning(job.name(), startedAt);
        }

        @Override
        public void finished(JobDefinition job, ExecutionRecord record) {
            complete(job, record);
        }
    };

    private volatile LoopState state = LoopState.IDLE;
    private volatile Thread loopThread;
    private int systemErrorCount = 0;

    public DefaultAgentScheduler(SchedulerProperties props,
                                 JobRegistry registry,
                                 ExecutionEngine engine,
                                 OutputDispatcher dispatcher,
                                 Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = props.zone();
    }

    /**
     * Start the loop. Idempotent. Next fire-times are recomputed from now.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        Duration maxSleep = Objects.requireNonNull(props.getMaxSleep(), "agent-scheduler.maxSleep must not be null");
        if (maxSleep.isZero() || maxSleep.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("agent-scheduler.maxSleep must be a positive duration");
        }
        Duration grace = Objects.requireNonNull(props.getShutdownGracePeriod(), "agent-scheduler.shutdownGracePeriod must not be null");
        if (grace.isNegative()) {
            started.set(false);
            throw new IllegalArgumentException("agent-scheduler.shutdownGracePeriod must not be negative");
        }

        log.info("Agent scheduler starting with maxConcurrency={}, defaultTimeout={}, overlapPolicy={}, maxSleep={}, zone={}, jobs={}",
                props.getMaxConcurrency(),
                props.getDefaultTimeout(),
                props.getOverlapPolicy(),
                maxSleep,
                zone,
                registry.size());

        Instant now = clock.instant();
        for (String name : registry.rescheduleAll(schedule -> ScheduleResolver.nextFireAfter(schedule, now, zone))) {
            log.error("agent-scheduler schedule has no future fire-time, job disabled name={}", name);
        }

        engine.start();
        systemErrorCount = 0;
        wakeSignal.drainPermits();

        Thread t = new Thread(this::loop);
        t.setName("agent-scheduler.loop");
        t.setDaemon(true);
        loopThread = t;
        t.start();
        log.info("Agent scheduler started successfully.");
    }

    /**
     * Stop dispatching, then give in-flight executions the grace period before cancelling them.
     * Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("Agent scheduler stopping...");

        Thread t = loopThread;
        loopThread = null;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            try {
                t.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        engine.shutdown(props.getShutdownGracePeriod());
        wakeSignal.drainPermits();
        state = LoopState.STOPPED;
        log.info("Agent scheduler stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    public LoopState state() {
        return state;
    }

    @Override
    public JobBuilder create(String name) {
        return new SimpleJobBuilder(name, this::add);
    }

    @Override
    public void add(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        CronSchedule schedule = ScheduleResolver.parse(job.schedule());

        Instant next = null;
        String unreachable = null;
        try {
            next = ScheduleResolver.nextFireAfter(schedule, clock.instant(), zone);
        } catch (UnreachableScheduleException e) {
            unreachable = e.getMessage();
        }

        registry.add(job, schedule, next);
        if (unreachable != null) {
            registry.disable(job.name(), unreachable);
            log.warn("agent-scheduler schedule has no future fire-time, job registered disabled name={} schedule={}",
                    job.name(), schedule);
        } else {
            log.info("agent-scheduler job added name={} schedule={} target={} next={}",
                    job.name(), job.schedule().describe(), job.target(), next);
        }
        wakeSignal.release();
    }

    @Override
    public JobDefinition remove(String name) {
        JobDefinition removed = registry.remove(name);
        log.info("agent-scheduler job removed name={}", name);
        wakeSignal.release();
        return removed;
    }

    @Override
    public JobDefinition get(String name) {
        return registry.get(name);
    }

    @Override
    public List<JobDefinition> list() {
        return registry.list();
    }

    @Override
    public List<JobStatus> statuses() {
        return registry.statuses();
    }

    @Override
    public ExecutionRecord runOnce(String name) {
        JobDefinition job = registry.get(name);
        log.info("agent-scheduler running job now name={} target={}", job.name(), job.target());

        AtomicReference<OutputWriteException> outputError = new AtomicReference<>();
        ExecutionRecord record = engine.execute(job, new ExecutionEngine.ExecutionListener() {
            @Override
            public void started(JobDefinition job, Instant startedAt) {
                registry.markRunning(job.name(), startedAt);
            }

            @Override
            public void finished(JobDefinition job, ExecutionRecord record) {
                outputError.set(complete(job, record));
            }
        });
        wakeSignal.release();

        if (record.outcome() instanceof ExecutionOutcome.Failure failure) {
            if (failure.error() instanceof SchedulerException e) {
                throw e;
            }
            throw new JobExecutionException("Job '" + name + "' failed: " + failure.message(), failure.error());
        }
        if (outputError.get() != null) {
            throw outputError.get();
        }
        return record;
    }

    /**
     * Writes the output of a finished execution and stores its outcome.
     *
     * @return the output error, or null
     */
    private OutputWriteException complete(JobDefinition job, ExecutionRecord record) {
        OutputWriteException outputError = null;
        try {
            dispatcher.dispatch(job, record);
        } catch (OutputWriteException e) {
            log.error("agent-scheduler output failed name={} msg={}", job.name(), e.getMessage(), e);
            outputError = e;
        }
        registry.recordResult(record, outputError == null ? null : outputError.getMessage());
        return outputError;
    }

    private void loop() {
        while (started.get()) {
            try {
                state = LoopState.DISPATCHING;
                dispatchDue();
                systemErrorCount = 0;
            } catch (Exception e) {
                systemErrorCount++;
                log.error("agent-scheduler dispatch failed msg={}", e.getMessage(), e);
                if (systemErrorCount >= MAX_CONSECUTIVE_FAILURES) {
                    log.error("Agent scheduler stopped due to repeated system failures...");
                    stop();
                    break;
                }
                state = LoopState.SLEEPING;
                if (!await(backoff(systemErrorCount))) {
                    break;
                }
                continue;
            }

            if (!started.get()) {
                break;
            }

            state = registry.earliestNextFire().isEmpty() ? LoopState.IDLE : LoopState.SLEEPING;
            if (!await(sleepDuration())) {
                break;
            }
        }
    }

    private void dispatchDue() {
        Instant now = clock.instant();
        for (DueJob due : registry.due(now)) {
            if (!started.get()) {
                return;
            }
            String name = due.job().name();
            Instant next;
            try {
                next = ScheduleResolver.nextFireAfter(due.schedule(), laterOf(due.fireTime(), now), zone);
            } catch (UnreachableScheduleException e) {
                log.error("agent-scheduler schedule has no future fire-time, job disabled name={} msg={}",
                        name, e.getMessage());
                registry.disable(name, e.getMessage());
                next = null;
            }
            if (next != null && !registry.advance(name, due.fireTime(), next)) {
                // removed or re-registered since due() was read
                continue;
            }

            log.debug("agent-scheduler dispatching name={} fireTime={} next={}", name, due.fireTime(), next);
            engine.submit(due.job(), scheduledRunTracker);
        }
    }

    private Duration sleepDuration() {
        Duration maxSleep = props.getMaxSleep();
        Optional<Instant> earliest = registry.earliestNextFire();
        if (earliest.isEmpty()) {
            return maxSleep;
        }
        Duration untilDue = Duration.between(clock.instant(), earliest.get());
        if (untilDue.isNegative()) {
            return Duration.ZERO;
        }
        return untilDue.compareTo(maxSleep) < 0 ? untilDue : maxSleep;
    }

    /**
     * @return false if the loop thread was interrupted
     */
    private boolean await(Duration duration) {
        try {
            if (wakeSignal.tryAcquire(duration.toMillis(), TimeUnit.MILLISECONDS)) {
                wakeSignal.drainPermits();
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    // Exponential backoff for repeated loop failures.
    private Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private static Instant laterOf(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
