package io.drcontroller.actions;

/**
 * Exception thrown when a whole-application action is requested while the application's
 * volumes do not agree on a replication direction.
 */
public class InconsistentDirectionException extends RuntimeException {

    public InconsistentDirectionException(String message) {
        super(message);
    }
}
