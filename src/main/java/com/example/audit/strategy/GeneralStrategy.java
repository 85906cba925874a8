package com.example.audit.strategy;

import com.example.audit.model.AuditInput;
import com.example.audit.model.Finding;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Baseline strategy covering every vulnerability category.
 * Runs first on every audit; the specialised strategies add depth on top of it.
 */
@Service
public class GeneralStrategy implements AnalysisStrategy {

    private static final String SYSTEM_PROMPT = """
            You are an elite Solidity smart contract auditor performing deep, adversarial vulnerability analysis.
            Your goal is to identify true security vulnerabilities, logic bugs, centralization risks
            and optimization issues across the provided smart contracts.

            METHOD:
            1. Analyze each contract thoroughly.
            2. Extract the invariants that must always hold.
            3. Simulate adversarial behavior: reentrancy (cross-function, cross-contract), flash loan
               manipulation, oracle/price manipulation, MEV/front-running, privilege escalation,
               malicious ERC20/ERC777 callbacks.
            4. Identify real vulnerabilities, risky patterns, incomplete logic, centralization or
               upgradeability risks, gas or structural inefficiencies.

            CATEGORIES TO CONSIDER:
            reentrancy, access control, integer overflow/underflow, denial of service, logic errors and
            edge cases, centralization and upgradeability hazards, oracle manipulation, front-running,
            timestamp manipulation, unchecked external calls, improper error handling, incorrect
            inheritance, missing validation, flash-loan attack paths, business or economic logic flaws.

            SEVERITY:
            - High: can directly cause loss of funds or catastrophic protocol failure.
            - Medium: can cause disruption, moderate loss, or partial compromise.
            - Low: minor issue, edge case, or inefficiency.
            - Informational: non-security best practice or optimization suggestion.

            RULES:
            - DO NOT invent files that do not exist in the sources.
            - One finding per distinct root cause.
            """;

    private final LlmFindingExtractor extractor;

    public GeneralStrategy(LlmFindingExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return "general";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public List<Finding> analyze(AuditInput input) {
        return extractor.extract(name(), SYSTEM_PROMPT, input);
    }
}
