package io.drcontroller.enums;

/**
 * Why a relationship failed: the transport could not reach the cluster, the relationship
 * was not in a state that permits the action, or the cluster rejected a command.
 */
public enum FailureKind {
    CONNECTION,
    PRECONDITION,
    REMOTE_COMMAND
}
