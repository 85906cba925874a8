package com.example.audit.model;

/**
 * What a single strategy contributed to a batch.
 *
 * @param strategy       Strategy name
 * @param priority       Strategy priority
 * @param status         Whether the strategy produced findings, failed or ran out of time
 * @param findingCount   Number of findings contributed (always 0 unless SUCCEEDED)
 * @param elapsedMillis  Wall-clock time from submission to completion or failure
 * @param failureMessage Failure detail, {@code null} on success
 */
public record StrategyOutcome(
        String strategy,
        int priority,
        Status status,
        int findingCount,
        long elapsedMillis,
        String failureMessage
) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        TIMED_OUT
    }

    public static StrategyOutcome succeeded(String strategy, int priority, int findingCount, long elapsedMillis) {
        return new StrategyOutcome(strategy, priority, Status.SUCCEEDED, findingCount, elapsedMillis, null);
    }

    public static StrategyOutcome failed(String strategy, int priority, Status status, long elapsedMillis,
                                         String failureMessage) {
        return new StrategyOutcome(strategy, priority, status, 0, elapsedMillis, failureMessage);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }
}
