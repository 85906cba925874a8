package com.example.audit.error;

/**
 * A strategy answered, but one of its findings is missing a mandatory field.
 */
public class MalformedFindingsException extends StrategyExecutionException {

    private final int findingIndex;

    public MalformedFindingsException(String strategy, int findingIndex, String reason) {
        super(strategy, "finding #" + findingIndex + " is malformed: " + reason);
        this.findingIndex = findingIndex;
    }

    public int getFindingIndex() {
        return findingIndex;
    }
}
