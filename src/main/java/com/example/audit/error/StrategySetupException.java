package com.example.audit.error;

/**
 * Thrown at construction when a router is given no usable strategies.
 */
public class StrategySetupException extends AuditException {

    public StrategySetupException(String message) {
        super(message);
    }
}
