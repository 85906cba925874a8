package com.example.audit.strategy;

import com.example.audit.model.AuditInput;
import com.example.audit.model.Finding;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Detects economic manipulation reachable with flash-loaned capital:
 * oracle and pool manipulation, collateral inflation, governance capture.
 */
@Service
public class FlashLoanStrategy implements AnalysisStrategy {

    private static final String SYSTEM_PROMPT = """
            You are a Solidity auditor specializing in flash loan attack vectors.
            Your focus is EXCLUSIVELY on vulnerabilities exploitable with large, temporary capital.

            DETECT:
            - Price oracle manipulation via flash loans
            - Liquidity pool manipulation
            - Collateral ratio manipulation
            - Arbitrage that breaks protocol invariants
            - Economic logic flaws exploitable with large capital
            - Governance manipulation through borrowed voting power

            PROTOCOL:
            1. Identify operations depending on token prices, exchange rates, collateral ratios,
               liquidity or reserve-based rewards.
            2. For each, check whether an attacker can borrow, manipulate the value within one
               transaction, exploit the operation at the manipulated value and repay at a profit.
            3. Check invariants: total supply equals balances, collateral covers debt, pool reserves
               keep their curve, exchange rates stay bounded.
            4. Assess impact: maximum extractable profit, protocol insolvency, harm to other users,
               economic viability of the attack.

            SEVERITY:
            - High: direct fund loss, protocol insolvency, large-scale exploitation.
            - Medium: moderate fund loss, partial protocol compromise.
            - Low: minor economic manipulation, edge cases.
            """;

    private final LlmFindingExtractor extractor;

    public FlashLoanStrategy(LlmFindingExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return "flash_loan";
    }

    @Override
    public int priority() {
        return 70;
    }

    @Override
    public List<Finding> analyze(AuditInput input) {
        return extractor.extract(name(), SYSTEM_PROMPT, input);
    }
}
