package io.drcontroller.executor;

/**
 * Exception thrown when a cluster cannot be reached or rejects authentication.
 */
public class ConnectionException extends Exception {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
