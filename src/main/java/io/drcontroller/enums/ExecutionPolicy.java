package io.drcontroller.enums;

/**
 * How the relationships of one batch are executed.
 */
public enum ExecutionPolicy {
    SEQUENTIAL,
    PARALLEL;

    public static ExecutionPolicy fromString(String value) {
        if (value == null || value.isBlank()) return null;
        for (ExecutionPolicy policy : values()) {
            if (policy.name().equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        return null;
    }
}
