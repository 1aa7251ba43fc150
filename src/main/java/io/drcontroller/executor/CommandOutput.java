package io.drcontroller.executor;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Text a cluster returned for one CLI command: standard output and error output.
 */
@Data
@AllArgsConstructor
public class CommandOutput {

    private static final String ERROR_MARKER = "Error:";

    private final String output;
    private final String error;

    public static CommandOutput of(String output) {
        return new CommandOutput(output, "");
    }

    /**
     * True when the cluster reported an error either on the error stream or inline.
     */
    public boolean isFailed() {
        return (error != null && !error.isBlank()) || (output != null && output.contains(ERROR_MARKER));
    }

    public String errorDetail() {
        if (error != null && !error.isBlank()) {
            return error.trim();
        }
        if (output != null) {
            int idx = output.indexOf(ERROR_MARKER);
            if (idx >= 0) {
                return output.substring(idx).trim();
            }
        }
        return "";
    }

    public String outputOrEmpty() {
        return output == null ? "" : output;
    }
}
