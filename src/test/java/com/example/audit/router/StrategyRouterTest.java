package com.example.audit.router;

import com.example.audit.error.AuditCancelledException;
import com.example.audit.error.StrategyExecutionException;
import com.example.audit.error.StrategySetupException;
import com.example.audit.event.AuditEventListener;
import com.example.audit.merge.SimilarityMerger;
import com.example.audit.model.AuditInput;
import com.example.audit.model.BatchResult;
import com.example.audit.model.Finding;
import com.example.audit.model.StrategyOutcome;
import com.example.audit.strategy.AnalysisStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("StrategyRouter Tests")
class StrategyRouterTest {

    private static final AuditInput INPUT = AuditInput.ofContracts("contract Vault {}");
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final SimilarityMerger merger = new SimilarityMerger(AuditEventListener.noop());

    @Test
    @DisplayName("Should return the other strategies' merged findings when one strategy fails")
    void testRun_FailureIsolation() {
        // Given: one strategy always raises, two report the same bug
        Finding bug = Finding.of("Missing access control", "Anyone can call setOwner", "High", "Vault.sol");
        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("general", 100, input -> { throw new StrategyExecutionException("general", "LLM down"); }),
                new StubStrategy("access_control", 60, input -> List.of(bug)),
                new StubStrategy("reentrancy", 80, input -> List.of(bug)));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, TIMEOUT, AuditEventListener.noop())) {
            // When
            List<Finding> findings = router.run(INPUT);

            // Then
            assertEquals(List.of(bug), findings);
        }
    }

    @Test
    @DisplayName("Should return empty without merging when no strategy reports anything")
    void testRun_EmptyBatch_SkipsMerger() {
        SimilarityMerger mockMerger = mock(SimilarityMerger.class);
        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("general", 100, input -> List.of()),
                new StubStrategy("reentrancy", 80, input -> List.of()),
                new StubStrategy("flash_loan", 70, input -> null),
                new StubStrategy("access_control", 60, input -> List.of()));

        try (StrategyRouter router = new StrategyRouter(strategies, mockMerger, TIMEOUT, AuditEventListener.noop())) {
            assertEquals(List.of(), router.run(INPUT));
        }
        verify(mockMerger, never()).merge(any());
    }

    @Test
    @DisplayName("Should return empty without raising when every strategy fails")
    void testRun_AllStrategiesFail() {
        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("general", 100, input -> { throw new IllegalStateException("boom"); }),
                new StubStrategy("reentrancy", 80, input -> { throw new StrategyExecutionException("reentrancy", "bad JSON"); }));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, TIMEOUT, AuditEventListener.noop())) {
            BatchResult result = router.runDetailed(INPUT);

            assertEquals(List.of(), result.findings());
            assertEquals(2, result.failedStrategies());
            assertEquals("boom", result.outcomes().get(0).failureMessage());
        }
    }

    @Test
    @DisplayName("Should reject an empty strategy set at construction")
    void testConstruct_NoStrategies() {
        assertThrows(StrategySetupException.class,
                () -> new StrategyRouter(List.of(), merger, TIMEOUT, AuditEventListener.noop()));
        assertThrows(StrategySetupException.class,
                () -> new StrategyRouter(null, merger, TIMEOUT, AuditEventListener.noop()));
        assertThrows(StrategySetupException.class,
                () -> new StrategyRouter(Collections.singletonList(null), merger, TIMEOUT, AuditEventListener.noop()));
    }

    @Test
    @DisplayName("Should order strategies by priority, keeping the supplied order on ties")
    void testConstruct_PriorityOrder() {
        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("low", 10, input -> List.of()),
                new StubStrategy("tie-first", 50, input -> List.of()),
                new StubStrategy("tie-second", 50, input -> List.of()),
                new StubStrategy("top", 100, input -> List.of()));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, TIMEOUT, AuditEventListener.noop())) {
            assertEquals(List.of("top", "tie-first", "tie-second", "low"), router.strategyNames());
        }
    }

    @Test
    @DisplayName("Should collect findings in execution order whatever the completion order")
    void testRun_CollectionOrder() {
        Finding slow = Finding.of("Slow finding", "desc", "High", "A.sol");
        Finding fast1 = Finding.of("Fast finding one", "desc", "Low", "B.sol");
        Finding fast2 = Finding.of("Fast finding two", "desc", "Medium", "C.sol");
        SimilarityMerger capturing = mock(SimilarityMerger.class);
        when(capturing.merge(any())).thenAnswer(inv -> inv.getArgument(0));

        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("fast", 10, input -> List.of(fast1, fast2)),
                new StubStrategy("slow", 100, input -> {
                    sleepQuietly(200);
                    return List.of(slow);
                }));

        try (StrategyRouter router = new StrategyRouter(strategies, capturing, TIMEOUT, AuditEventListener.noop())) {
            router.run(INPUT);
        }

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Finding>> captor = ArgumentCaptor.forClass(List.class);
        verify(capturing).merge(captor.capture());
        assertEquals(List.of(slow, fast1, fast2), captor.getValue());
    }

    @Test
    @DisplayName("Should run strategies concurrently")
    void testRun_Concurrent() {
        // Each strategy only finishes if the other one is running at the same time
        CountDownLatch bothRunning = new CountDownLatch(2);
        Function<AuditInput, List<Finding>> rendezvous = input -> {
            bothRunning.countDown();
            try {
                if (!bothRunning.await(3, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("strategies did not run concurrently");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return List.of(Finding.of("Finding " + Thread.currentThread().getName(), "desc", "Low", "X.sol"));
        };

        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("one", 20, rendezvous),
                new StubStrategy("two", 10, rendezvous));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, TIMEOUT, AuditEventListener.noop())) {
            BatchResult result = router.runDetailed(INPUT);

            assertEquals(0, result.failedStrategies());
            assertEquals(2, result.rawFindingCount());
        }
    }

    @Test
    @DisplayName("Should run overlapping batches on one router side by side without timing them out")
    void testRunDetailed_OverlappingBatches() throws Exception {
        // The strategy only finishes once both batches are running it at the same time
        CountDownLatch bothBatchesRunning = new CountDownLatch(2);
        List<AnalysisStrategy> strategies = List.of(new StubStrategy("general", 100, input -> {
            bothBatchesRunning.countDown();
            try {
                if (!bothBatchesRunning.await(1500, TimeUnit.MILLISECONDS)) {
                    throw new IllegalStateException("batches did not overlap");
                }
                Thread.sleep(400);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            return List.of(Finding.of("Unprotected initializer", "desc", "High", input.contracts()));
        }));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, Duration.ofSeconds(3),
                AuditEventListener.noop())) {
            ExecutorService callers = Executors.newFixedThreadPool(2);
            try {
                Future<BatchResult> first = callers.submit(() -> router.runDetailed(AuditInput.ofContracts("A.sol")));
                Future<BatchResult> second = callers.submit(() -> router.runDetailed(AuditInput.ofContracts("B.sol")));

                for (Future<BatchResult> batch : List.of(first, second)) {
                    BatchResult result = batch.get(5, TimeUnit.SECONDS);
                    assertEquals(0, result.failedStrategies(), () -> "outcomes: " + result.outcomes());
                    assertEquals(1, result.findings().size());
                }
            } finally {
                callers.shutdownNow();
            }
        }
    }

    @Test
    @DisplayName("Should reject batches once closed")
    void testRun_AfterClose() {
        StrategyRouter router = new StrategyRouter(
                List.of(new StubStrategy("general", 100, input -> List.of())), merger, TIMEOUT, AuditEventListener.noop());
        router.run(INPUT);
        router.close();

        assertThrows(IllegalStateException.class, () -> router.run(INPUT));
    }

    @Test
    @DisplayName("Should treat a strategy exceeding its timeout as failed and interrupt it")
    void testRun_StrategyTimeout() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        Finding quick = Finding.of("Reentrancy in withdraw", "desc", "High", "Bank.sol");
        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("stuck", 100, input -> {
                    try {
                        Thread.sleep(10_000);
                    } catch (InterruptedException e) {
                        interrupted.countDown();
                        Thread.currentThread().interrupt();
                    }
                    return List.of();
                }),
                new StubStrategy("quick", 50, input -> List.of(quick)));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, Duration.ofMillis(300),
                AuditEventListener.noop())) {
            long start = System.nanoTime();
            BatchResult result = router.runDetailed(INPUT);
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertEquals(List.of(quick), result.findings());
            assertEquals(StrategyOutcome.Status.TIMED_OUT, result.outcomes().get(0).status());
            assertEquals(StrategyOutcome.Status.SUCCEEDED, result.outcomes().get(1).status());
            assertTrue(elapsedMillis < 5_000, "batch should not wait for the stuck strategy");
            assertTrue(interrupted.await(2, TimeUnit.SECONDS), "stuck strategy should be interrupted");
        }
    }

    @Test
    @DisplayName("Should fail the whole batch and cancel strategies when the caller is interrupted")
    void testRun_Cancellation() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch strategyInterrupted = new CountDownLatch(1);
        List<AnalysisStrategy> strategies = List.of(new StubStrategy("blocking", 100, input -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                strategyInterrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return List.of();
        }));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, Duration.ofSeconds(30),
                AuditEventListener.noop())) {
            AtomicReference<Throwable> thrown = new AtomicReference<>();
            Thread caller = new Thread(() -> {
                try {
                    router.run(INPUT);
                } catch (Throwable t) {
                    thrown.set(t);
                }
            });
            caller.start();
            assertTrue(started.await(2, TimeUnit.SECONDS));

            caller.interrupt();
            caller.join(2_000);

            assertInstanceOf(AuditCancelledException.class, thrown.get());
            assertTrue(strategyInterrupted.await(2, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("Should emit one start and one completion event per strategy and a batch summary")
    void testRun_ListenerEvents() {
        RecordingListener listener = new RecordingListener();
        Finding bug = Finding.of("Missing access control", "desc", "High", "Vault.sol");
        List<AnalysisStrategy> strategies = List.of(
                new StubStrategy("general", 100, input -> List.of(bug)),
                new StubStrategy("reentrancy", 80, input -> { throw new IllegalStateException("boom"); }),
                new StubStrategy("access_control", 60, input -> List.of(bug)));

        try (StrategyRouter router = new StrategyRouter(strategies, merger, TIMEOUT, listener)) {
            router.run(INPUT);
        }

        assertEquals(List.of("start:general", "start:reentrancy", "start:access_control",
                "ok:general:1", "fail:reentrancy:FAILED", "ok:access_control:1", "batch:2:1:1"), listener.events);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private record StubStrategy(String name, int priority, Function<AuditInput, List<Finding>> body)
            implements AnalysisStrategy {

        @Override
        public List<Finding> analyze(AuditInput input) {
            return body.apply(input);
        }
    }

    private static class RecordingListener implements AuditEventListener {

        final List<String> events = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void strategyStarted(String strategy, int priority) {
            events.add("start:" + strategy);
        }

        @Override
        public void strategySucceeded(String strategy, int findingCount, long elapsedMillis) {
            events.add("ok:" + strategy + ":" + findingCount);
        }

        @Override
        public void strategyFailed(String strategy, StrategyOutcome.Status status, Throwable cause, long elapsedMillis) {
            events.add("fail:" + strategy + ":" + status);
        }

        @Override
        public void batchCompleted(int rawFindings, int mergedFindings, long failedStrategies) {
            events.add("batch:" + rawFindings + ":" + mergedFindings + ":" + failedStrategies);
        }
    }
}
