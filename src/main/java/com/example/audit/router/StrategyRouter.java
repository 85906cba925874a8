package com.example.audit.router;

import com.example.audit.error.AuditCancelledException;
import com.example.audit.error.StrategySetupException;
import com.example.audit.event.AuditEventListener;
import com.example.audit.merge.SimilarityMerger;
import com.example.audit.model.AuditInput;
import com.example.audit.model.BatchResult;
import com.example.audit.model.Finding;
import com.example.audit.model.StrategyOutcome;
import com.example.audit.strategy.AnalysisStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every strategy against the same input and merges what they report.
 * <p>
 * Every batch gets its own pool with one thread per strategy, shut down when the batch ends,
 * so concurrent batches never queue behind each other. The router waits for
 * each of them in priority order (highest first, ties in the order they were supplied), so
 * findings are collected in that order whatever the completion order. A strategy that throws,
 * returns nothing usable or exceeds {@code strategyTimeout} is logged and contributes no
 * findings; the batch always goes on.
 * <p>
 * The timeout is per strategy and counts from the moment the strategy is submitted to its
 * batch pool, where it starts right away. Interrupting the thread that called {@link #run} cancels every strategy still running
 * (their threads are interrupted) and fails the whole batch with {@link AuditCancelledException}.
 */
public class StrategyRouter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(StrategyRouter.class);

    /** Higher priority first; List sorting is stable, so ties keep the supplied order. */
    private static final Comparator<AnalysisStrategy> PRIORITY_ORDER =
            Comparator.comparingInt(AnalysisStrategy::priority).reversed();

    private final List<AnalysisStrategy> strategies;
    private final SimilarityMerger merger;
    private final Duration strategyTimeout;
    private final AuditEventListener listener;
    private final CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("audit-strategy-");

    /** Pools of the batches currently running, shut down by {@link #close()}. */
    private final Set<ExecutorService> activeBatches = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    /**
     * @param strategies      strategies to run, at least one
     * @param merger          merger applied to the collected findings
     * @param strategyTimeout time allotted to each strategy
     * @param listener        receives strategy and batch events
     * @throws StrategySetupException if no strategy is supplied
     */
    public StrategyRouter(Collection<? extends AnalysisStrategy> strategies,
                          SimilarityMerger merger,
                          Duration strategyTimeout,
                          AuditEventListener listener) {
        this.strategies = prioritize(strategies);
        this.merger = Objects.requireNonNull(merger, "merger");
        this.strategyTimeout = Objects.requireNonNull(strategyTimeout, "strategyTimeout");
        if (strategyTimeout.isNegative() || strategyTimeout.isZero()) {
            throw new IllegalArgumentException("strategyTimeout must be positive: " + strategyTimeout);
        }
        this.listener = listener != null ? listener : AuditEventListener.noop();

        log.info("Initialized StrategyRouter with {} strategies", this.strategies.size());
        this.strategies.forEach(s -> log.debug("  - {} (priority: {})", s.name(), s.priority()));
    }

    /**
     * Runs all strategies and returns the merged findings.
     *
     * @throws AuditCancelledException if the calling thread is interrupted while waiting
     */
    public List<Finding> run(AuditInput input) {
        return runDetailed(input).findings();
    }

    /**
     * Same as {@link #run} but also reports what every strategy contributed.
     *
     * @throws AuditCancelledException if the calling thread is interrupted while waiting
     * @throws IllegalStateException   if the router has been closed
     */
    public BatchResult runDetailed(AuditInput input) {
        ExecutorService executor = startBatch();
        List<Finding> collected = new ArrayList<>();
        List<StrategyOutcome> outcomes = new ArrayList<>(strategies.size());
        try {
            List<Submission> submissions = new ArrayList<>(strategies.size());
            for (AnalysisStrategy strategy : strategies) {
                listener.strategyStarted(strategy.name(), strategy.priority());
                submissions.add(new Submission(strategy, executor.submit(() -> strategy.analyze(input)),
                        System.nanoTime()));
            }

            try {
                for (Submission submission : submissions) {
                    outcomes.add(await(submission, collected));
                }
            } catch (InterruptedException e) {
                submissions.forEach(s -> s.future().cancel(true));
                Thread.currentThread().interrupt();
                throw new AuditCancelledException("Audit batch cancelled while " + strategies.size()
                        + " strategies were running", e);
            }
        } finally {
            activeBatches.remove(executor);
            executor.shutdownNow();
        }

        long failed = outcomes.stream().filter(o -> !o.succeeded()).count();
        if (collected.isEmpty()) {
            listener.batchCompleted(0, 0, failed);
            return new BatchResult(List.of(), 0, outcomes);
        }

        List<Finding> merged = merger.merge(collected);
        listener.batchCompleted(collected.size(), merged.size(), failed);
        return new BatchResult(merged, collected.size(), outcomes);
    }

    /** Strategies in execution order. */
    public List<AnalysisStrategy> strategies() {
        return strategies;
    }

    public List<String> strategyNames() {
        return strategies.stream().map(AnalysisStrategy::name).toList();
    }

    /** Rejects new batches and interrupts the strategies of the batches still running. */
    @Override
    public void close() {
        closed = true;
        activeBatches.forEach(ExecutorService::shutdownNow);
    }

    private ExecutorService startBatch() {
        if (closed) {
            throw new IllegalStateException("StrategyRouter is closed");
        }
        ExecutorService executor = Executors.newFixedThreadPool(strategies.size(), threadFactory);
        activeBatches.add(executor);
        if (closed) {
            // close() ran between the check and the registration
            activeBatches.remove(executor);
            executor.shutdownNow();
            throw new IllegalStateException("StrategyRouter is closed");
        }
        return executor;
    }

    private StrategyOutcome await(Submission submission, List<Finding> collected) throws InterruptedException {
        AnalysisStrategy strategy = submission.strategy();
        long deadline = submission.startedNanos() + strategyTimeout.toNanos();
        try {
            List<Finding> findings = submission.future().get(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            List<Finding> contributed = findings != null
                    ? findings.stream().filter(Objects::nonNull).toList()
                    : List.of();
            collected.addAll(contributed);

            long elapsed = elapsedMillis(submission);
            listener.strategySucceeded(strategy.name(), contributed.size(), elapsed);
            return StrategyOutcome.succeeded(strategy.name(), strategy.priority(), contributed.size(), elapsed);
        } catch (TimeoutException e) {
            submission.future().cancel(true);
            return failure(submission, StrategyOutcome.Status.TIMED_OUT, e,
                    "Timed out after " + strategyTimeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failure(submission, StrategyOutcome.Status.FAILED, cause, String.valueOf(cause.getMessage()));
        } catch (CancellationException e) {
            return failure(submission, StrategyOutcome.Status.FAILED, e, "Cancelled");
        }
    }

    private StrategyOutcome failure(Submission submission, StrategyOutcome.Status status, Throwable cause,
                                    String message) {
        AnalysisStrategy strategy = submission.strategy();
        long elapsed = elapsedMillis(submission);
        listener.strategyFailed(strategy.name(), status, cause, elapsed);
        return StrategyOutcome.failed(strategy.name(), strategy.priority(), status, elapsed, message);
    }

    private static long elapsedMillis(Submission submission) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - submission.startedNanos());
    }

    private static List<AnalysisStrategy> prioritize(Collection<? extends AnalysisStrategy> strategies) {
        if (strategies == null || strategies.isEmpty()) {
            throw new StrategySetupException("At least one analysis strategy is required");
        }
        if (strategies.stream().anyMatch(Objects::isNull)) {
            throw new StrategySetupException("Strategy list contains a null entry");
        }
        List<AnalysisStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(PRIORITY_ORDER);
        return List.copyOf(ordered);
    }

    private record Submission(AnalysisStrategy strategy, Future<List<Finding>> future, long startedNanos) {}
}
