package io.drcontroller.enums;

/**
 * Final status of an apply request.
 */
public enum ApplyStatus {
    ABORTED,
    DRY_RUN,
    COMPLETED,
    PARTIAL_FAILURE
}
