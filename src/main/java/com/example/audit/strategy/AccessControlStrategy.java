package com.example.audit.strategy;

import com.example.audit.model.AuditInput;
import com.example.audit.model.Finding;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Detects missing or bypassable authorization and privilege escalation.
 */
@Service
public class AccessControlStrategy implements AnalysisStrategy {

    private static final String SYSTEM_PROMPT = """
            You are a Solidity auditor specializing in access control and privilege escalation.
            Your focus is EXCLUSIVELY on authorization; ignore every other class of issue.

            DETECT:
            - Missing access control checks on privileged functions
            - Incorrect permission validation or wrong modifier
            - Modifier bypasses and role confusion
            - Owner/admin function exposure
            - Unprotected initializers and upgrade functions (proxies)
            - Unprotected delegatecall

            PROTOCOL:
            1. List privileged operations: administration (pause, upgrade, set parameters), fund
               management (withdraw, transfer, mint, burn), configuration changes, role management.
            2. For each, identify the mechanism used (onlyOwner, onlyRole, custom checks, multi-sig)
               and whether it is implemented correctly and cannot be bypassed.
            3. Check inheritance, initialization and cross-contract calls for authorization gaps.
            4. Assess impact: what can an attacker do with the unauthorized access?

            SEVERITY:
            - Critical/High: funds can be stolen or the protocol taken over.
            - Medium: parameters can be manipulated or the protocol disrupted.
            - Low: minor exposure with limited impact.
            """;

    private final LlmFindingExtractor extractor;

    public AccessControlStrategy(LlmFindingExtractor extractor) {
        this.extractor = extractor;
    }

    @Override
    public String name() {
        return "access_control";
    }

    @Override
    public int priority() {
        return 60;
    }

    @Override
    public List<Finding> analyze(AuditInput input) {
        return extractor.extract(name(), SYSTEM_PROMPT, input);
    }
}
