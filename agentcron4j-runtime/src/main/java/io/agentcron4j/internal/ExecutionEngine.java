package io.agentcron4j.internal;

import io.agentcron4j.AgentInvoker;
import io.agentcron4j.ErrorNotifier;
import io.agentcron4j.config.SchedulerProperties;
import io.agentcron4j.core.AgentRequest;
import io.agentcron4j.core.ExecutionOutcome;
import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.ExecutionTimeoutException;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.JobExecutionException;
import io.agentcron4j.core.OverlapPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one job against the {@link AgentInvoker} under a timeout and turns every outcome into an
 * {@link ExecutionRecord}. Errors never propagate out of the engine.
 *
 * <p>Executions of the same job name never overlap. A scheduled fire that finds its job still
 * running is skipped ({@link OverlapPolicy#SKIP}) or queued once ({@link OverlapPolicy#COALESCE}).
 */
public class ExecutionEngine {
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    /**
     * Callbacks around one execution. {@code finished} runs while the job is still held, so the
     * next execution of the same job observes its effects.
     */
    public interface ExecutionListener {
        default void started(JobDefinition job, Instant startedAt) {
        }

        void finished(JobDefinition job, ExecutionRecord record);
    }

    private static final ExecutionListener NO_OP = (job, record) -> { };

    private record Submission(JobDefinition job, ExecutionListener listener) {
    }

    private final AgentInvoker invoker;
    private final ErrorNotifier notifier;
    private final Duration defaultTimeout;
    private final OverlapPolicy overlapPolicy;
    private final int maxConcurrency;
    private final Clock clock;

    private final JobExclusion<Submission> exclusion = new JobExclusion<>();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger threadCounter = new AtomicInteger();

    private volatile ExecutorService workerPool;

    public ExecutionEngine(SchedulerProperties props, AgentInvoker invoker, ErrorNotifier notifier, Clock clock) {
        Objects.requireNonNull(props, "props must not be null");
        this.invoker = Objects.requireNonNull(invoker, "invoker must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultTimeout = Objects.requireNonNull(props.getDefaultTimeout(), "agent-scheduler.defaultTimeout must not be null");
        if (defaultTimeout.isZero() || defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("agent-scheduler.defaultTimeout must be a positive duration");
        }
        if (props.getMaxConcurrency() <= 0) {
            throw new IllegalArgumentException("agent-scheduler.maxConcurrency must be a positive number");
        }
        this.maxConcurrency = props.getMaxConcurrency();
        this.overlapPolicy = props.getOverlapPolicy() == null ? OverlapPolicy.SKIP : props.getOverlapPolicy();
    }

    /**
     * Creates the worker pool used by {@link #submit}. Idempotent.
     */
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        workerPool = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r);
            t.setName("agent-scheduler.worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Stops accepting submissions, waits up to {@code gracePeriod} for in-flight executions and
     * then interrupts them, which cancels the pending agent calls. Idempotent.
     */
    public void shutdown(Duration gracePeriod) {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        exclusion.clearPending();
        ExecutorService pool = workerPool;
        workerPool = null;
        if (pool == null) {
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("agent-scheduler executions still running after grace period={}, cancelling", gracePeriod);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    public boolean isRunning(String jobName) {
        return exclusion.isRunning(jobName);
    }

    /**
     * Hands a scheduled fire to the worker pool.
     *
     * @return true if an execution was started, false if it was skipped or queued behind a
     * running execution of the same job
     */
    public boolean submit(JobDefinition job, ExecutionListener listener) {
        Objects.requireNonNull(job, "job must not be null");
        Submission submission = new Submission(job, listener == null ? NO_OP : listener);
        if (!started.get()) {
            throw new IllegalStateException("execution engine is not started");
        }

        Submission rerun = overlapPolicy == OverlapPolicy.COALESCE ? submission : null;
        switch (exclusion.claim(job.name(), rerun)) {
            case STARTED -> {
                return dispatchClaimed(submission);
            }
            case QUEUED -> {
                log.info("agent-scheduler job still running, re-run queued name={}", job.name());
                return false;
            }
            default -> {
                log.warn("agent-scheduler job still running, skipping fire name={} policy={}", job.name(), overlapPolicy);
                return false;
            }
        }
    }

    public ExecutionRecord execute(JobDefinition job) {
        return execute(job, NO_OP);
    }

    /**
     * Runs the job on the calling thread, after any in-progress execution of the same job.
     * Does not need {@link #start()}.
     */
    public ExecutionRecord execute(JobDefinition job, ExecutionListener listener) {
        Objects.requireNonNull(job, "job must not be null");
        Submission submission = new Submission(job, listener == null ? NO_OP : listener);
        try {
            exclusion.awaitStart(job.name());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            Instant now = clock.instant();
            return new ExecutionRecord(job.name(), now, now, new ExecutionOutcome.Failure(
                    new JobExecutionException("Interrupted while waiting for job '" + job.name() + "'", e)));
        }

        boolean completed = false;
        try {
            ExecutionRecord record = runAndComplete(submission);
            completed = true;
            Submission next = exclusion.finishOrContinue(job.name());
            if (next != null) {
                dispatchClaimed(next);
            }
            return record;
        } finally {
            if (!completed) {
                exclusion.abandon(job.name());
            }
        }
    }

    private boolean dispatchClaimed(Submission submission) {
        ExecutorService pool = workerPool;
        String name = submission.job().name();
        if (pool == null) {
            exclusion.release(name);
            log.warn("agent-scheduler engine stopped, dropping execution name={}", name);
            return false;
        }
        try {
            pool.execute(() -> drain(submission));
            return true;
        } catch (RejectedExecutionException e) {
            exclusion.release(name);
            log.warn("agent-scheduler engine stopped, dropping execution name={}", name);
            return false;
        }
    }

    private void drain(Submission first) {
        String name = first.job().name();
        Submission next = first;
        try {
            while (next != null) {
                runAndComplete(next);
                next = exclusion.finishOrContinue(name);
            }
        } finally {
            // non-null here only if runAndComplete threw while holding the claim
            if (next != null) {
                exclusion.abandon(name);
            }
        }
    }

    private ExecutionRecord runAndComplete(Submission submission) {
        JobDefinition job = submission.job();
        ExecutionRecord record = run(job, submission.listener());
        try {
            submission.listener().finished(job, record);
        } catch (RuntimeException e) {
            log.error("agent-scheduler completion failed name={} msg={}", job.name(), e.getMessage(), e);
        }
        return record;
    }

    private ExecutionRecord run(JobDefinition job, ExecutionListener listener) {
        Instant startedAt = clock.instant();
        try {
            listener.started(job, startedAt);
        } catch (RuntimeException e) {
            log.warn("agent-scheduler start callback failed name={} msg={}", job.name(), e.getMessage(), e);
        }
        log.debug("agent-scheduler job started name={} target={} at={}", job.name(), job.target(), startedAt);

        ExecutionOutcome outcome = invoke(job);
        ExecutionRecord record = new ExecutionRecord(job.name(), startedAt, clock.instant(), outcome);

        if (outcome instanceof ExecutionOutcome.Failure failure) {
            log.error("agent-scheduler job failed name={} target={} msg={}",
                    job.name(), job.target(), failure.message(), failure.error());
            notifyFailure(job, record);
        } else {
            log.info("agent-scheduler job succeeded name={} target={} duration={}",
                    job.name(), job.target(), record.duration());
        }
        return record;
    }

    private ExecutionOutcome invoke(JobDefinition job) {
        Duration timeout = job.timeout() != null ? job.timeout() : defaultTimeout;

        CompletableFuture<String> future;
        try {
            future = invoker.invoke(AgentRequest.of(job));
        } catch (RuntimeException | LinkageError e) {
            return failed(job, e);
        }
        if (future == null) {
            return new ExecutionOutcome.Failure(
                    new JobExecutionException("Agent invoker returned no result for job '" + job.name() + "'", null));
        }

        try {
            return new ExecutionOutcome.Success(future.get(toMillis(timeout), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return new ExecutionOutcome.Failure(new ExecutionTimeoutException(job.name(), timeout));
        } catch (ExecutionException e) {
            return failed(job, e.getCause() != null ? e.getCause() : e);
        } catch (CancellationException e) {
            return new ExecutionOutcome.Failure(
                    new JobExecutionException("Agent call for job '" + job.name() + "' was cancelled", e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return new ExecutionOutcome.Failure(
                    new JobExecutionException("Job '" + job.name() + "' was interrupted", e));
        }
    }

    // Durations too long for a long of millis wait without bound.
    private static long toMillis(Duration timeout) {
        try {
            return timeout.toMillis();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static ExecutionOutcome failed(JobDefinition job, Throwable cause) {
        String msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new ExecutionOutcome.Failure(
                new JobExecutionException("Job '" + job.name() + "' failed: " + msg, cause));
    }

    private void notifyFailure(JobDefinition job, ExecutionRecord record) {
        if (!job.notifyOnError()) {
            return;
        }
        try {
            notifier.jobFailed(job, record);
        } catch (RuntimeException e) {
            log.warn("agent-scheduler error notifier failed name={} msg={}", job.name(), e.getMessage(), e);
        }
    }
}
