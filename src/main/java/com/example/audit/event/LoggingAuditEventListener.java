package com.example.audit.event;

import com.example.audit.model.Finding;
import com.example.audit.model.StrategyOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default listener: writes every audit event to the application log.
 */
@Component
public class LoggingAuditEventListener implements AuditEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingAuditEventListener.class);

    /** Titles are cut to this length in merge messages. */
    private static final int TITLE_PREVIEW = 50;

    @Override
    public void strategyStarted(String strategy, int priority) {
        log.info("Executing strategy: {} (priority {})", strategy, priority);
    }

    @Override
    public void strategySucceeded(String strategy, int findingCount, long elapsedMillis) {
        log.info("Strategy {} found {} vulnerabilities in {}ms", strategy, findingCount, elapsedMillis);
    }

    @Override
    public void strategyFailed(String strategy, StrategyOutcome.Status status, Throwable cause, long elapsedMillis) {
        if (status == StrategyOutcome.Status.TIMED_OUT) {
            log.error("Strategy {} timed out after {}ms, contributing no findings", strategy, elapsedMillis);
        } else {
            log.error("Strategy {} failed after {}ms: {}", strategy, elapsedMillis,
                    cause != null ? cause.getMessage() : "unknown error", cause);
        }
    }

    @Override
    public void findingsMerged(Finding absorbed, Finding representative) {
        log.debug("Merged '{}' -> '{}' ({} locations)",
                preview(absorbed.title()), preview(representative.title()), representative.locations().size());
    }

    @Override
    public void batchCompleted(int rawFindings, int mergedFindings, long failedStrategies) {
        log.info("Total findings from all strategies: {}, after merging: {} unique findings ({} strategies failed)",
                rawFindings, mergedFindings, failedStrategies);
    }

    private static String preview(String title) {
        return title.length() > TITLE_PREVIEW ? title.substring(0, TITLE_PREVIEW) + "..." : title;
    }
}
