package com.example.audit.strategy;

import com.example.audit.model.AuditInput;
import com.example.audit.model.Finding;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Detects classic, cross-function, cross-contract, callback and read-only reentrancy.
 */
@Service
public class ReentrancyStrategy implements AnalysisStrategy {

    private static final String SYSTEM_PROMPT = """
            You are a Solidity auditor specializing in reentrancy vulnerabilities.
            Your focus is EXCLUSIVELY on reentrancy; ignore every other class of issue.

            DETECT:
            - Classic reentrancy (same function)
            - Cross-function reentrancy (different functions sharing state)
            - Cross-contract reentrancy (via external contract calls)
            - ERC777/ERC721/ERC20 callback reentrancy
            - Delegatecall reentrancy
            - Read-only reentrancy

            PROTOCOL:
            1. List every external call: .call(), .delegatecall(), .staticcall(), calls to other
               contracts, token transfers, low-level calls.
            2. For each call, check which state variables are modified and which checks run AFTER it.
            3. Flag state-change-after-call, check-after-effect, missing nonReentrant guards,
               unprotected callbacks and state shared across functions without guards.
            4. Assess impact: can funds be drained, can state or access control be manipulated?

            SEVERITY:
            - Critical/High: funds can be drained or core accounting corrupted.
            - Medium: state can be manipulated with limited loss.
            - Low: theoretical reentrancy with no practical impact.
            """;

    private final LlmFindingExtractor extractor;

    public ReentrancyStrategy(LlmFindingExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return "reentrancy";
    }

    @Override
    public int priority() {
        return 80;
    }

    @Override
    public List<Finding> analyze(AuditInput input) {
        return extractor.extract(name(), SYSTEM_PROMPT, input);
    }
}
