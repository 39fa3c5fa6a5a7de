package io.agentcron4j.internal;

import io.agentcron4j.AgentInvoker;
import io.agentcron4j.ErrorNotifier;
import io.agentcron4j.config.SchedulerProperties;
import io.agentcron4j.core.AgentRequest;
import io.agentcron4j.core.ExecutionOutcome;
import io.agentcron4j.core.ExecutionRecord;
import io.agentcron4j.core.ExecutionTarget;
import io.agentcron4j.core.ExecutionTimeoutException;
import io.agentcron4j.core.JobDefinition;
import io.agentcron4j.core.JobExecutionException;
import io.agentcron4j.core.OverlapPolicy;
import io.agentcron4j.schedule.ScheduleSpec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExecutionEngineTest {

    private final ErrorNotifier notifier = mock(ErrorNotifier.class);
    private ExecutionEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown(Duration.ofMillis(200));
        }
    }

    @Test
    void executeShouldReturnAgentTextAndPassTaskAndInstructions() {
        AgentInvoker invoker = mock(AgentInvoker.class);
        when(invoker.invoke(any())).thenReturn(CompletableFuture.completedFuture("market is up"));
        engine = newEngine(invoker, OverlapPolicy.SKIP);

        ExecutionRecord record = engine.execute(job("brief", true, null));

        assertTrue(record.isSuccess());
        assertEquals("market is up", ((ExecutionOutcome.Success) record.outcome()).content());
        assertEquals("brief", record.jobName());
        assertFalse(record.finishedAt().isBefore(record.startedAt()));

        ArgumentCaptor<AgentRequest> captor = ArgumentCaptor.forClass(AgentRequest.class);
        verify(invoker).invoke(captor.capture());
        assertEquals(ExecutionTarget.agent("analyst"), captor.getValue().target());
        assertEquals("Summarize the market", captor.getValue().task());
        assertEquals(List.of("Be concise"), captor.getValue().instructions());
        verify(notifier, never()).jobFailed(any(), any());
    }

    @Test
    void failedAgentCallShouldBecomeFailureAndNotify() {
        RuntimeException boom = new IllegalStateException("model overloaded");
        engine = newEngine(request -> CompletableFuture.failedFuture(boom), OverlapPolicy.SKIP);
        JobDefinition job = job("brief", true, null);

        ExecutionRecord record = engine.execute(job);

        assertFalse(record.isSuccess());
        Throwable error = ((ExecutionOutcome.Failure) record.outcome()).error();
        assertInstanceOf(JobExecutionException.class, error);
        assertEquals(boom, error.getCause());
        assertTrue(error.getMessage().contains("model overloaded"));
        verify(notifier, times(1)).jobFailed(job, record);
    }

    @Test
    void failureShouldNotNotifyWhenDisabledForJob() {
        engine = newEngine(request -> CompletableFuture.failedFuture(new RuntimeException("x")), OverlapPolicy.SKIP);

        engine.execute(job("quiet", false, null));

        verify(notifier, never()).jobFailed(any(), any());
    }

    @Test
    void synchronousInvokerExceptionShouldBeContained() {
        engine = newEngine(request -> {
            throw new IllegalArgumentException("unknown agent");
        }, OverlapPolicy.SKIP);

        ExecutionRecord record = engine.execute(job("brief", false, null));

        assertInstanceOf(JobExecutionException.class, ((ExecutionOutcome.Failure) record.outcome()).error());
    }

    @Test
    void linkageErrorFromInvokerShouldBeContainedAndReleaseJob() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        engine = newEngine(request -> {
            if (calls.incrementAndGet() == 1) {
                throw new NoClassDefFoundError("com/example/AgentClient");
            }
            return CompletableFuture.completedFuture("recovered");
        }, OverlapPolicy.SKIP);
        JobDefinition job = job("brief", false, null);

        ExecutionRecord record = engine.execute(job);

        Throwable error = ((ExecutionOutcome.Failure) record.outcome()).error();
        assertInstanceOf(NoClassDefFoundError.class, error.getCause());
        assertFalse(engine.isRunning("brief"));

        engine.start();
        List<ExecutionRecord> finished = new CopyOnWriteArrayList<>();
        assertTrue(engine.submit(job, (j, r) -> finished.add(r)));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> finished.size() == 1));
        assertTrue(finished.get(0).isSuccess());
    }

    @Test
    void errorFromCompletionCallbackShouldReleaseJob() throws Exception {
        engine = newEngine(request -> CompletableFuture.completedFuture("ok"), OverlapPolicy.SKIP);
        JobDefinition job = job("brief", false, null);

        assertThrows(NoClassDefFoundError.class, () -> engine.execute(job, (j, r) -> {
            throw new NoClassDefFoundError("com/example/Renderer");
        }));
        assertFalse(engine.isRunning("brief"));
        assertTrue(engine.execute(job).isSuccess());

        engine.start();
        AtomicInteger completions = new AtomicInteger();
        assertTrue(engine.submit(job, (j, r) -> {
            completions.incrementAndGet();
            throw new NoClassDefFoundError("com/example/Renderer");
        }));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> completions.get() == 1 && !engine.isRunning("brief")));
        assertTrue(engine.submit(job, null));
    }

    @Test
    void timeoutTooLongForMillisShouldWaitWithoutBound() {
        engine = newEngine(request -> CompletableFuture.completedFuture("ok"), OverlapPolicy.SKIP);

        ExecutionRecord record = engine.execute(job("brief", false, Duration.ofSeconds(Long.MAX_VALUE)));

        assertTrue(record.isSuccess());
    }

    @Test
    void notifierFailureShouldNotPropagate() {
        doThrow(new RuntimeException("smtp down")).when(notifier).jobFailed(any(), any());
        engine = newEngine(request -> CompletableFuture.failedFuture(new RuntimeException("x")), OverlapPolicy.SKIP);

        ExecutionRecord record = engine.execute(job("brief", true, null));

        assertFalse(record.isSuccess());
    }

    @Test
    void slowAgentShouldTimeOutAndBeCancelled() {
        CompletableFuture<String> never = new CompletableFuture<>();
        engine = newEngine(request -> never, OverlapPolicy.SKIP);

        ExecutionRecord record = engine.execute(job("slow", true, Duration.ofMillis(100)));

        Throwable error = ((ExecutionOutcome.Failure) record.outcome()).error();
        ExecutionTimeoutException timeout = assertInstanceOf(ExecutionTimeoutException.class, error);
        assertEquals(Duration.ofMillis(100), timeout.timeout());
        assertTrue(never.isCancelled());
        verify(notifier).jobFailed(any(), any());
    }

    @Test
    void submitShouldFailBeforeStart() {
        engine = newEngine(request -> CompletableFuture.completedFuture("ok"), OverlapPolicy.SKIP);

        assertThrows(IllegalStateException.class, () -> engine.submit(job("brief", false, null), null));
    }

    @Test
    void overlappingFireShouldBeSkipped() throws Exception {
        CompletableFuture<String> first = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();
        engine = newEngine(request -> calls.incrementAndGet() == 1 ? first : CompletableFuture.completedFuture("again"),
                OverlapPolicy.SKIP);
        engine.start();
        List<ExecutionRecord> finished = new CopyOnWriteArrayList<>();
        JobDefinition job = job("brief", false, null);

        assertTrue(engine.submit(job, (j, r) -> finished.add(r)));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 1));
        assertFalse(engine.submit(job, (j, r) -> finished.add(r)));

        first.complete("done");

        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> finished.size() == 1));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> !engine.isRunning("brief")));
        assertEquals(1, calls.get());
    }

    @Test
    void overlappingFiresShouldCoalesceIntoOneRerun() throws Exception {
        CompletableFuture<String> first = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();
        engine = newEngine(request -> calls.incrementAndGet() == 1 ? first : CompletableFuture.completedFuture("again"),
                OverlapPolicy.COALESCE);
        engine.start();
        List<String> finished = new CopyOnWriteArrayList<>();
        JobDefinition job = job("brief", false, null);

        assertTrue(engine.submit(job, (j, r) -> finished.add(((ExecutionOutcome.Success) r.outcome()).content())));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 1));
        assertFalse(engine.submit(job, (j, r) -> finished.add(((ExecutionOutcome.Success) r.outcome()).content())));
        assertFalse(engine.submit(job, (j, r) -> finished.add(((ExecutionOutcome.Success) r.outcome()).content())));

        first.complete("done");

        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> finished.size() == 2));
        assertEquals(List.of("done", "again"), finished);
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> !engine.isRunning("brief")));
        assertEquals(2, calls.get());
    }

    @Test
    void executeShouldWaitForRunningExecutionOfSameJob() throws Exception {
        CompletableFuture<String> first = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();
        engine = newEngine(request -> calls.incrementAndGet() == 1 ? first : CompletableFuture.completedFuture("manual"),
                OverlapPolicy.SKIP);
        engine.start();
        JobDefinition job = job("brief", false, null);

        engine.submit(job, null);
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> calls.get() == 1));

        AtomicReference<ExecutionRecord> manual = new AtomicReference<>();
        Thread runner = new Thread(() -> manual.set(engine.execute(job)));
        runner.start();

        Thread.sleep(200);
        assertEquals(1, calls.get(), "manual run must not start while the scheduled one is in progress");

        first.complete("scheduled");
        runner.join(2000);

        assertEquals(2, calls.get());
        assertEquals("manual", ((ExecutionOutcome.Success) manual.get().outcome()).content());
    }

    @Test
    void shutdownShouldCancelExecutionsStillRunningAfterGracePeriod() throws Exception {
        CompletableFuture<String> never = new CompletableFuture<>();
        engine = newEngine(request -> never, OverlapPolicy.SKIP);
        engine.start();
        AtomicReference<ExecutionRecord> finished = new AtomicReference<>();

        engine.submit(job("stuck", false, Duration.ofMinutes(5)), (j, r) -> finished.set(r));
        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> engine.isRunning("stuck")));

        engine.shutdown(Duration.ofMillis(100));

        assertTrue(waitUntil(2, TimeUnit.SECONDS, () -> finished.get() != null));
        assertTrue(never.isCancelled());
        assertFalse(finished.get().isSuccess());
        assertFalse(engine.isStarted());
    }

    private ExecutionEngine newEngine(AgentInvoker invoker, OverlapPolicy policy) {
        SchedulerProperties props = new SchedulerProperties();
        props.setDefaultTimeout(Duration.ofSeconds(5));
        props.setMaxConcurrency(2);
        props.setOverlapPolicy(policy);
        return new ExecutionEngine(props, invoker, notifier, Clock.systemUTC());
    }

    private static JobDefinition job(String name, boolean notifyOnError, Duration timeout) {
        return new JobDefinition(
                name,
                null,
                ScheduleSpec.cron("0 9 * * *"),
                ExecutionTarget.agent("analyst"),
                "Summarize the market",
                List.of("Be concise"),
                timeout,
                null,
                notifyOnError
        );
    }

    static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return condition.getAsBoolean();
    }
}
