package io.drcontroller.catalog;

import lombok.Getter;

import java.util.List;

/**
 * Exception thrown when the application catalog file is missing or malformed.
 */
@Getter
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    public ConfigurationException(String source, List<String> problems) {
        super("Invalid application configuration in " + source + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }
}
