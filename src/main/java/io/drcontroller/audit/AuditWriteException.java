package io.drcontroller.audit;

/**
 * Exception thrown when an audit record could not be appended to the audit log.
 */
public class AuditWriteException extends Exception {

    public AuditWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
