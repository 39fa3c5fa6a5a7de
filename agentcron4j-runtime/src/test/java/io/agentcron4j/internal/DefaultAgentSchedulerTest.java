package io.agentcron4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentcron4j.AgentInvoker;
import io.agentcron4j.config.SchedulerProperties;
import io.agentcron4j.core.AgentRequest;
import io.agentcron4j.core.DuplicateJobException;
import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.ExecutionTimeoutException;
import io.agentcron4j.core.InvalidScheduleException;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.JobExecutionException;
import io.agentcron4j.core.JobNotFoundException;
import io.agentcron4j.core.JobRegistry;
import io.agentcron4j.core.JobStatus;
import io.agentcron4j.core.OutputType;
import io.agentcron4j.core.OutputWriteException;
import io.agentcron4j.internal.output.OutputDispatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import static io.agentcron4j.internal.ExecutionEngineTest.waitUntil;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultAgentSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T08:59:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(T0);
    private final AtomicInteger calls = new AtomicInteger();
    private final JobRegistry registry = new JobRegistry();
    private DefaultAgentScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void addShouldComputeNextFireTime() {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("ok"));

        scheduler.create("daily").cron("0 9 * * *").agent("analyst").task("Brief").register();
        scheduler.create("friday")
                .schedule(Map.of("day_of_week", "fri", "hour", 18, "minute", 0))
                .team("research")
                .task("Digest")
                .register();

        List<JobStatus> statuses = scheduler.statuses();
        assertEquals(List.of("daily", "friday"), statuses.stream().map(JobStatus::name).toList());
        assertEquals(Instant.parse("2024-01-01T09:00:00Z"), statuses.get(0).nextFireTime());
        assertEquals(Instant.parse("2024-01-05T18:00:00Z"), statuses.get(1).nextFireTime());
        assertEquals("0 9 * * *", statuses.get(0).schedule());
        assertTrue(statuses.get(0).enabled());
        assertNull(statuses.get(0).lastSucceeded());
    }

    @Test
    void invalidAndDuplicateJobsShouldBeRejected() {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("ok"));
        scheduler.create("daily").cron("0 9 * * *").agent("analyst").task("Brief").register();

        assertThrows(DuplicateJobException.class,
                () -> scheduler.create("daily").cron("0 10 * * *").agent("analyst").task("Brief").register());
        assertThrows(InvalidScheduleException.class,
                () -> scheduler.create("broken").cron("61 * * * *").agent("analyst").task("Brief").register());
        assertEquals(1, scheduler.list().size());
        assertThrows(JobNotFoundException.class, () -> scheduler.get("broken"));
        assertThrows(JobNotFoundException.class, () -> scheduler.remove("broken"));
    }

    @Test
    void unreachableScheduleShouldRegisterDisabled() {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("ok"));

        scheduler.create("never").cron("0 0 31 2 *").agent("analyst").task("Brief").register();

        JobStatus status = scheduler.statuses().get(0);
        assertFalse(status.enabled());
        assertNull(status.nextFireTime());
        assertTrue(status.lastError().contains("0 0 31 2 *"));
    }

    @Test
    void removeShouldDropJob() {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("ok"));
        scheduler.create("a").cron("0 9 * * *").agent("analyst").task("Brief").register();
        scheduler.create("b").cron("0 9 * * *").agent("analyst").task("Brief").register();

        JobDefinition removed = scheduler.remove("a");

        assertEquals("a", removed.name());
        assertEquals(List.of("b"), scheduler.list().stream().map(JobDefinition::name).toList());
    }

    @Test
    void runOnceShouldWorkWithoutStartAndWriteOutput() throws IOException {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("# Report\nAll quiet."));
        scheduler.create("brief")
                .cron("0 9 * * *")
                .agent("analyst")
                .task("Brief")
                .output(OutputType.MARKDOWN, tempDir.toString())
                .register();

        ExecutionRecord record = scheduler.runOnce("brief");

        assertTrue(record.isSuccess());
        assertEquals(1, calls.get());
        assertFalse(scheduler.isRunning());
        try (Stream<Path> files = Files.list(tempDir)) {
            List<Path> written = files.toList();
            assertEquals(1, written.size());
            assertEquals("# Report\nAll quiet.", Files.readString(written.get(0)));
        }
        JobStatus status = scheduler.statuses().get(0);
        assertEquals(Boolean.TRUE, status.lastSucceeded());
        assertFalse(status.running());
        assertEquals(T0, status.lastRunAt());
    }

    @Test
    void runOnceShouldKeepDisabledReasonAfterSuccess() {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("ok"));
        scheduler.create("brief").cron("0 9 * * *").agent("analyst").task("Brief").register();
        registry.disable("brief", "Schedule '0 9 * * *' has no fire-time");

        scheduler.runOnce("brief");

        JobStatus status = scheduler.statuses().get(0);
        assertEquals(Boolean.TRUE, status.lastSucceeded());
        assertFalse(status.enabled());
        assertNull(status.nextFireTime());
        assertEquals("Schedule '0 9 * * *' has no fire-time", status.disabledReason());
    }

    @Test
    void runOnceShouldThrowAgentFailures() {
        scheduler = newScheduler(Duration.ofMillis(50),
                request -> CompletableFuture.failedFuture(new IllegalStateException("rate limited")));
        scheduler.create("brief").cron("0 9 * * *").agent("analyst").task("Brief").register();

        JobExecutionException e = assertThrows(JobExecutionException.class, () -> scheduler.runOnce("brief"));

        assertTrue(e.getMessage().contains("rate limited"));
        JobStatus status = scheduler.statuses().get(0);
        assertEquals(Boolean.FALSE, status.lastSucceeded());
        assertTrue(status.lastError().contains("rate limited"));
        assertThrows(JobNotFoundException.class, () -> scheduler.runOnce("missing"));
    }

    @Test
    void runOnceShouldThrowTimeout() {
        scheduler = newScheduler(Duration.ofMillis(50), request -> new CompletableFuture<>());
        scheduler.create("slow").cron("0 9 * * *").agent("analyst").task("Brief").timeout(Duration.ofMillis(100)).register();

        assertThrows(ExecutionTimeoutException.class, () -> scheduler.runOnce("slow"));
    }

    @Test
    void runOnceShouldThrowOutputFailures() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("file"), "x");
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("ok"));
        scheduler.create("brief")
                .cron("0 9 * * *")
                .agent("analyst")
                .task("Brief")
                .output(OutputType.TEXT, blocker.resolve("sub").toString())
                .register();

        assertThrows(OutputWriteException.class, () -> scheduler.runOnce("brief"));
        assertEquals(Boolean.FALSE, scheduler.statuses().get(0).lastSucceeded());
    }

    @Test
    void loopShouldFireDueJobAndAdvanceSchedule() throws Exception {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("done"));
        scheduler.create("daily")
                .cron("0 9 * * *")
                .agent("analyst")
                .task("Brief")
                .output(OutputType.TEXT, tempDir.toString())
                .register();
        scheduler.start();

        Thread.sleep(150);
        assertEquals(0, calls.get(), "nothing is due before 09:00");

        clock.set(Instant.parse("2024-01-01T09:00:00Z"));

        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 1));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> Boolean.TRUE.equals(scheduler.statuses().get(0).lastSucceeded())));
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), scheduler.statuses().get(0).nextFireTime());
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }

        clock.set(Instant.parse("2024-01-01T09:30:00Z"));
        Thread.sleep(200);
        assertEquals(1, calls.get());
    }

    @Test
    void jobsDueAtSameTimeShouldRunConcurrently() throws Exception {
        CountDownLatch entered = new CountDownLatch(2);
        AtomicInteger overlapped = new AtomicInteger();
        scheduler = newScheduler(Duration.ofMillis(50), request -> {
            entered.countDown();
            try {
                if (entered.await(2, TimeUnit.SECONDS)) {
                    overlapped.incrementAndGet();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CompletableFuture.completedFuture("done");
        });
        scheduler.create("first").cron("0 9 * * *").agent("analyst").task("Brief").register();
        scheduler.create("second").cron("0 9 * * *").team("research").task("Digest").register();
        scheduler.start();

        clock.set(Instant.parse("2024-01-01T09:00:00Z"));

        assertTrue(waitUntil(3, TimeUnit.SECONDS, () -> scheduler.statuses().stream()
                .allMatch(status -> Boolean.TRUE.equals(status.lastSucceeded()))));
        assertEquals(2, calls.get());
        assertEquals(2, overlapped.get(), "both agent calls must be in flight at once");
    }

    @Test
    void loopShouldBeIdleWithoutEnabledJobs() throws Exception {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("done"));
        scheduler.create("daily").cron("0 9 * * *").agent("analyst").task("Brief").register();
        scheduler.start();
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> scheduler.state() == DefaultAgentScheduler.LoopState.SLEEPING));

        scheduler.remove("daily");
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> scheduler.state() == DefaultAgentScheduler.LoopState.IDLE));

        scheduler.create("never").cron("0 0 31 2 *").agent("analyst").task("Brief").register();
        Thread.sleep(150);
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> scheduler.state() == DefaultAgentScheduler.LoopState.IDLE));

        scheduler.create("hourly").cron("0 * * * *").agent("analyst").task("Brief").register();
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> scheduler.state() == DefaultAgentScheduler.LoopState.SLEEPING));
    }

    @Test
    void missedFiresShouldNotBeReplayed() throws Exception {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("done"));
        scheduler.create("hourly").cron("0 * * * *").agent("analyst").task("Brief").register();
        scheduler.start();

        clock.set(Instant.parse("2024-01-04T12:34:00Z"));

        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 1));
        Thread.sleep(200);
        assertEquals(1, calls.get());
        assertEquals(Instant.parse("2024-01-04T13:00:00Z"), scheduler.statuses().get(0).nextFireTime());
    }

    @Test
    void failingJobShouldKeepItsSchedule() throws Exception {
        scheduler = newScheduler(Duration.ofMillis(50),
                request -> CompletableFuture.failedFuture(new RuntimeException("agent crashed")));
        scheduler.create("flaky").cron("* * * * *").agent("analyst").task("Brief").register();
        scheduler.start();

        clock.set(Instant.parse("2024-01-01T09:00:00Z"));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 1));
        assertTrue(waitUntil(2, TimeUnit.SECONDS,
                () -> scheduler.statuses().get(0).lastError() != null && !scheduler.statuses().get(0).running()));

        clock.set(Instant.parse("2024-01-01T09:01:00Z"));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 2));
        assertTrue(scheduler.isRunning());
        assertTrue(scheduler.statuses().get(0).lastError().contains("agent crashed"));
    }

    @Test
    void addShouldWakeSleepingLoop() throws Exception {
        scheduler = newScheduler(Duration.ofMinutes(1), request -> CompletableFuture.completedFuture("done"));
        scheduler.create("daily").cron("0 9 * * *").agent("analyst").task("Brief").register();
        scheduler.start();
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> scheduler.state() == DefaultAgentScheduler.LoopState.SLEEPING));

        clock.set(Instant.parse("2024-01-01T09:00:00Z"));
        scheduler.create("other").cron("0 12 * * *").agent("analyst").task("Brief").register();

        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 1));
    }

    @Test
    void startAndStopShouldBeIdempotent() {
        scheduler = newScheduler(Duration.ofMillis(50), request -> CompletableFuture.completedFuture("ok"));
        assertEquals(DefaultAgentScheduler.LoopState.IDLE, scheduler.state());

        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
        assertEquals(DefaultAgentScheduler.LoopState.STOPPED, scheduler.state());
    }

    private DefaultAgentScheduler newScheduler(Duration maxSleep, Function<AgentRequest, CompletableFuture<String>> agent) {
        SchedulerProperties props = new SchedulerProperties();
        props.setMaxSleep(maxSleep);
        props.setDefaultTimeout(Duration.ofSeconds(5));
        props.setShutdownGracePeriod(Duration.ofMillis(500));
        props.setTimezone("UTC");

        AgentInvoker invoker = request -> {
            calls.incrementAndGet();
            return agent.apply(request);
        };
        ExecutionEngine engine = new ExecutionEngine(props, invoker, new LoggingErrorNotifier(), clock);
        OutputDispatcher dispatcher = new OutputDispatcher(
                OutputDispatcher.defaultRenderers(new ObjectMapper()), ZoneOffset.UTC);
        return new DefaultAgentScheduler(props, registry, engine, dispatcher, clock);
    }
}
