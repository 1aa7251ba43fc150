package io.drcontroller.enums;

/**
 * Operator actions against an application's replication relationships.
 */
public enum DrAction {
    UPDATE("update", false),
    QUIESCE("quiesce", false),
    BREAK("break", false),
    RESYNC("resync", false),
    RECOVERY("recovery", true),
    RECOVERY_EXTENDED("recovery-extended", true),
    RESTORATION_EXTENDED("restoration-extended", true),
    RESTORATION_FLIP_FLOP("restoration-flip-flop", true),
    RESTORATION_POST_TVT("restoration-post-tvt", true);

    private final String value;
    private final boolean orderSensitive;

    DrAction(String value, boolean orderSensitive) {
        this.value = value;
        this.orderSensitive = orderSensitive;
    }

    public String getValue() {
        return value;
    }

    /**
     * Multi-step workflows that must not run with the PARALLEL policy.
     */
    public boolean isOrderSensitive() {
        return orderSensitive;
    }

    public static DrAction fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (DrAction action : DrAction.values()) {
            if (action.value.equalsIgnoreCase(trimmed)) {
                return action;
            }
        }

        // Also accept enum names, e.g. RECOVERY_EXTENDED
        String normalized = trimmed.toUpperCase().replace('-', '_');
        for (DrAction action : DrAction.values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }

        return null;
    }
}
