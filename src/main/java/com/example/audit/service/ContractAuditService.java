package com.example.audit.service;

import com.example.audit.model.AuditInput;
import com.example.audit.model.AuditReport;
import com.example.audit.model.BatchResult;
import com.example.audit.router.StrategyRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Audit pipeline entry point.
 * Pipeline:
 * 1. Parallel analysis: every enabled strategy on the same input
 * 2. Similarity merge of the collected findings
 * 3. Report assembly (severity distribution, per-strategy outcomes)
 * <p>
 * Strategy failures never reach the caller; only cancellation does.
 */
@Service
public class ContractAuditService {

    private static final Logger log = LoggerFactory.getLogger(ContractAuditService.class);

    private final StrategyRouter router;

    public ContractAuditService(StrategyRouter router) {
        this.router = router;
    }

    public AuditReport audit(AuditInput input) {
        log.info("═══════════════════════════════════════════════");
        log.info("Starting audit: {} characters of contracts, {} links, {} Q&A pairs",
                input.contracts().length(), input.additionalLinks().size(), input.qaResponses().size());
        log.info("═══════════════════════════════════════════════");

        long start = System.nanoTime();
        log.info("[1/2] Running {} strategies in parallel: {}", router.strategies().size(), router.strategyNames());
        BatchResult batch = router.runDetailed(input);
        log.info("[1/2] Strategies completed: {} raw findings, {} strategies failed",
                batch.rawFindingCount(), batch.failedStrategies());

        log.info("[2/2] Building report...");
        AuditReport report = AuditReport.from(batch);

        log.info("═══════════════════════════════════════════════");
        log.info("Audit completed in {}ms: {} unique findings {}",
                (System.nanoTime() - start) / 1_000_000, report.totalFindings(), report.severityDistribution());
        log.info("═══════════════════════════════════════════════");
        return report;
    }

    public List<String> strategyNames() {
        return router.strategyNames();
    }
}
