package com.example.audit.error;

/**
 * A strategy could not produce findings (LLM call failed, response unusable).
 * The router treats it as a zero-finding contribution.
 * <p>
 * The message is prefixed with the strategy name, so callers pass only the detail.
 */
public class StrategyExecutionException extends AuditException {

    private final String strategy;

    public StrategyExecutionException(String strategy, String message) {
        super(prefixed(strategy, message));
        this.strategy = strategy;
    }

    public StrategyExecutionException(String strategy, String message, Throwable cause) {
        super(prefixed(strategy, message), cause);
        this.strategy = strategy;
    }

    public String getStrategy() {
        return strategy;
    }

    private static String prefixed(String strategy, String message) {
        return "[" + strategy + "] " + message;
    }
}
