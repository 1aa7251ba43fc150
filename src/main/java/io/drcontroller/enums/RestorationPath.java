package io.drcontroller.enums;

/**
 * Operator-asserted path taken after a recovery. It cannot be inferred from cluster
 * state alone: after a recovery the relationships look identical on both paths.
 */
public enum RestorationPath {
    EXTENDED,
    FLIP_FLOP;

    public static RestorationPath fromString(String value) {
        if (value == null || value.isBlank()) return null;
        String normalized = value.trim().toUpperCase().replace('-', '_');
        for (RestorationPath path : values()) {
            if (path.name().equals(normalized)) {
                return path;
            }
        }
        return null;
    }
}
