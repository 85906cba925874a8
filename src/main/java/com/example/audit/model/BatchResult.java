package com.example.audit.model;

import java.util.List;

/**
 * Result of one batch: the merged findings plus per-strategy diagnostics.
 *
 * @param findings         Deduplicated findings, in cluster-creation order
 * @param rawFindingCount  Number of findings collected before merging
 * @param outcomes         One outcome per strategy, in execution order
 */
public record BatchResult(
        List<Finding> findings,
        int rawFindingCount,
        List<StrategyOutcome> outcomes
) {
    public BatchResult {
        findings = List.copyOf(findings);
        outcomes = List.copyOf(outcomes);
    }

    public long failedStrategies() {
        return outcomes.stream().filter(o -> !o.succeeded()).count();
    }
}
