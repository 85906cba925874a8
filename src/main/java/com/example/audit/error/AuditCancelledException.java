package com.example.audit.error;

/**
 * The caller cancelled a batch while strategies were still running.
 * No partial result is returned.
 */
public class AuditCancelledException extends AuditException {

    public AuditCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
