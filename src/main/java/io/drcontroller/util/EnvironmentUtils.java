package io.drcontroller.util;

import java.util.Map;

/**
 * Reads the controller's environment: gateway credentials and the fallback operator name.
 */
public final class EnvironmentUtils {

    private EnvironmentUtils() {
    }

    public static String getRequiredEnv(String name) {
        return getRequiredEnv(System.getenv(), name);
    }

    /**
     * @throws IllegalStateException if the variable is unset or blank
     */
    public static String getRequiredEnv(Map<String, String> environment, String name) {
        String value = trimToNull(environment.get(name));
        if (value == null) {
            throw new IllegalStateException("Environment variable " + name + " is required but not set");
        }
        return value;
    }

    public static String getEnv(String name, String defaultValue) {
        return getEnv(System.getenv(), name, defaultValue);
    }

    public static String getEnv(Map<String, String> environment, String name, String defaultValue) {
        String value = trimToNull(environment.get(name));
        return value != null ? value : defaultValue;
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
