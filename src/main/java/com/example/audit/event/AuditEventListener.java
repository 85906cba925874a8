package com.example.audit.event;

import com.example.audit.model.Finding;
import com.example.audit.model.StrategyOutcome;

/**
 * Receives structured events from the router and the merger.
 * <p>
 * Injected at construction so that each router instance reports to its own sink.
 * All methods default to no-ops. Events of one batch are emitted on the thread that runs the batch.
 */
public interface AuditEventListener {

    default void strategyStarted(String strategy, int priority) {}

    default void strategySucceeded(String strategy, int findingCount, long elapsedMillis) {}

    default void strategyFailed(String strategy, StrategyOutcome.Status status, Throwable cause, long elapsedMillis) {}

    /**
     * A finding was folded into an existing cluster.
     *
     * @param absorbed       the finding that matched
     * @param representative the cluster representative after the merge
     */
    default void findingsMerged(Finding absorbed, Finding representative) {}

    default void batchCompleted(int rawFindings, int mergedFindings, long failedStrategies) {}

    static AuditEventListener noop() {
        return NoopListener.INSTANCE;
    }

    enum NoopListener implements AuditEventListener {
        INSTANCE
    }
}
