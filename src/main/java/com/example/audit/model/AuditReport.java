package com.example.audit.model;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Aggregated audit report handed to callers: merged findings plus batch statistics.
 */
public record AuditReport(
        LocalDateTime timestamp,
        List<Finding> findings,
        int totalFindings,
        int rawFindings,
        Map<String, Long> severityDistribution,
        List<StrategyOutcome> strategies
) {

    /**
     * Factory method that computes the severity distribution automatically.
     * Severities are counted by their reported label, in order of first appearance.
     */
    public static AuditReport from(BatchResult batch) {
        Map<String, Long> distribution = batch.findings().stream()
                .collect(Collectors.groupingBy(Finding::severity, LinkedHashMap::new, Collectors.counting()));
        return new AuditReport(
                LocalDateTime.now(),
                batch.findings(),
                batch.findings().size(),
                batch.rawFindingCount(),
                distribution,
                batch.outcomes()
        );
    }
}
