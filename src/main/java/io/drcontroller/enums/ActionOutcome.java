package io.drcontroller.enums;

public enum ActionOutcome {
    SUCCEEDED,
    FAILED,
    CANCELLED
}
