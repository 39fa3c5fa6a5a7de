package io.agentcron4j.core;

import io.agentcron4j.schedule.CronSchedule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * In-memory registry of job definitions, their parsed schedules and next fire-times.
 *
 * <p>Listing order is insertion order. Every operation takes the read or write side of one
 * {@link ReadWriteLock}, so the scheduler loop never observes a half-applied update.
 */
public class JobRegistry {

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private static final class Entry {
        private final JobDefinition job;
        private final CronSchedule schedule;
        private Instant nextFireTime;
        private boolean enabled;
        private boolean running;
        private Instant lastRunAt;
        private Boolean lastSucceeded;
        private String lastError;
        private String disabledReason;

        private Entry(JobDefinition job, CronSchedule schedule, Instant nextFireTime) {
            this.job = job;
            this.schedule = schedule;
            this.nextFireTime = nextFireTime;
            this.enabled = nextFireTime != null;
        }

        private JobStatus toStatus() {
            return new JobStatus(
                    job.name(),
                    job.description(),
                    schedule.expression(),
                    job.target(),
                    enabled ? nextFireTime : null,
                    lastRunAt,
                    lastSucceeded,
                    lastError,
                    running,
                    enabled,
                    enabled ? null : disabledReason
            );
        }
    }

    /**
     * Registers a job. A {@code null} next fire-time registers it disabled.
     *
     * @throws DuplicateJobException if a job with the same name exists
     */
    public void add(JobDefinition job, CronSchedule schedule, Instant nextFireTime) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        lock.writeLock().lock();
        try {
            if (entries.containsKey(job.name())) {
                throw new DuplicateJobException(job.name());
            }
            entries.put(job.name(), new Entry(job, schedule, nextFireTime));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws JobNotFoundException if no job has this name
     */
    public JobDefinition remove(String name) {
        lock.writeLock().lock();
        try {
            Entry removed = entries.remove(name);
            if (removed == null) {
                throw new JobNotFoundException(name);
            }
            return removed.job;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws JobNotFoundException if no job has this name
     */
    public JobDefinition get(String name) {
        lock.readLock().lock();
        try {
            return required(name).job;
        } finally {
            lock.readLock().unlock();
        }
    }

    public CronSchedule schedule(String name) {
        lock.readLock().lock();
        try {
            return required(name).schedule;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String name) {
        lock.readLock().lock();
        try {
            return entries.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<JobDefinition> list() {
        lock.readLock().lock();
        try {
            List<JobDefinition> jobs = new ArrayList<>(entries.size());
            for (Entry e : entries.values()) {
                jobs.add(e.job);
            }
            return List.copyOf(jobs);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<JobStatus> statuses() {
        lock.readLock().lock();
        try {
            List<JobStatus> out = new ArrayList<>(entries.size());
            for (Entry e : entries.values()) {
                out.add(e.toStatus());
            }
            return List.copyOf(out);
        } finally {
            lock.readLock().unlock();
        }
    }

    public JobStatus status(String name) {
        lock.readLock().lock();
        try {
            return required(name).toStatus();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Sets the next fire-time and re-enables the job.
     *
     * @throws JobNotFoundException if no job has this name
     */
    public void updateNextFire(String name, Instant nextFireTime) {
        Objects.requireNonNull(nextFireTime, "nextFireTime must not be null");
        lock.writeLock().lock();
        try {
            Entry e = required(name);
            e.nextFireTime = nextFireTime;
            e.enabled = true;
            e.disabledReason = null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves a due job to its next fire-time, but only if it is still registered with the
     * fire-time the caller observed. Returns false when the job was removed or rescheduled
     * concurrently.
     */
    public boolean advance(String name, Instant observedFireTime, Instant nextFireTime) {
        Objects.requireNonNull(nextFireTime, "nextFireTime must not be null");
        lock.writeLock().lock();
        try {
            Entry e = entries.get(name);
            if (e == null || !e.enabled || !Objects.equals(e.nextFireTime, observedFireTime)) {
                return false;
            }
            e.nextFireTime = nextFireTime;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Takes the job out of scheduling. The reason is kept as the disabled reason until the job
     * is re-enabled, and recorded as its last error. Unknown names are ignored.
     */
    public void disable(String name, String reason) {
        lock.writeLock().lock();
        try {
            Entry e = entries.get(name);
            if (e != null) {
                e.enabled = false;
                e.nextFireTime = null;
                e.lastError = reason;
                e.disabledReason = reason;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Enabled jobs whose fire-time is at or before {@code now}, in registration order.
     */
    public List<DueJob> due(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        lock.readLock().lock();
        try {
            List<DueJob> due = new ArrayList<>();
            for (Entry e : entries.values()) {
                if (e.enabled && e.nextFireTime != null && !e.nextFireTime.isAfter(now)) {
                    due.add(new DueJob(e.job, e.schedule, e.nextFireTime));
                }
            }
            return due;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Recomputes the next fire-time of every job, enabled or not. A schedule that throws
     * {@link UnreachableScheduleException} leaves its job disabled.
     *
     * @return names of the jobs that ended up disabled
     */
    public List<String> rescheduleAll(Function<CronSchedule, Instant> nextFire) {
        Objects.requireNonNull(nextFire, "nextFire must not be null");
        lock.writeLock().lock();
        try {
            List<String> disabled = new ArrayList<>();
            for (Entry e : entries.values()) {
                try {
                    e.nextFireTime = nextFire.apply(e.schedule);
                    e.enabled = true;
                    e.disabledReason = null;
                } catch (UnreachableScheduleException ex) {
                    e.nextFireTime = null;
                    e.enabled = false;
                    e.lastError = ex.getMessage();
                    e.disabledReason = ex.getMessage();
                    disabled.add(e.job.name());
                }
            }
            return disabled;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Instant> earliestNextFire() {
        lock.readLock().lock();
        try {
            Instant earliest = null;
            for (Entry e : entries.values()) {
                if (e.enabled && e.nextFireTime != null
                        && (earliest == null || e.nextFireTime.isBefore(earliest))) {
                    earliest = e.nextFireTime;
                }
            }
            return Optional.ofNullable(earliest);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void markRunning(String name, Instant startedAt) {
        lock.writeLock().lock();
        try {
            Entry e = entries.get(name);
            if (e != null) {
                e.running = true;
                e.lastRunAt = startedAt;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stores the outcome of a finished execution. {@code outputError} overrides a successful
     * outcome when the result could not be written. Unknown names are ignored, the job may
     * have been removed while it was running.
     */
    public void recordResult(ExecutionRecord record, String outputError) {
        Objects.requireNonNull(record, "record must not be null");
        lock.writeLock().lock();
        try {
            Entry e = entries.get(record.jobName());
            if (e == null) {
                return;
            }
            e.running = false;
            e.lastRunAt = record.startedAt();
            if (record.outcome() instanceof ExecutionOutcome.Failure failure) {
                e.lastSucceeded = false;
                e.lastError = failure.message();
            } else if (outputError != null) {
                e.lastSucceeded = false;
                e.lastError = outputError;
            } else {
                e.lastSucceeded = true;
                e.lastError = null;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Entry required(String name) {
        Entry e = entries.get(name);
        if (e == null) {
            throw new JobNotFoundException(name);
        }
        return e;
    }
}
