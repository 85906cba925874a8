package com.example.audit.strategy;

import com.example.audit.model.AuditInput;
import com.example.audit.model.Finding;

import java.util.List;

/**
 * A vulnerability detection strategy focused on one class of issues.
 *
 * <p>Implementations must be:
 * <ul>
 *   <li><b>Read-only</b> on the input: the same {@link AuditInput} is shared by all strategies of a batch</li>
 *   <li><b>Interruptible</b>: a batch cancels its strategies by interrupting their threads</li>
 * </ul>
 * A strategy signals failure by throwing; the router then counts it as contributing no findings.
 */
public interface AnalysisStrategy {

    /** Stable identifier, e.g. "reentrancy" or "flash_loan". */
    String name();

    /** Execution priority, higher runs first. Typical range 0-100. */
    int priority();

    /**
     * Analyzes the input and returns the findings in the order the strategy reports them.
     *
     * @throws RuntimeException if the analysis could not be completed
     */
    List<Finding> analyze(AuditInput input);
}
