package io.drcontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_APPLICATIONS_FILE = "snapmirror_input.yaml";
    public static final String DEFAULT_AUDIT_LOG_FILE = "recent_actions.log";
    public static final int DEFAULT_STATUS_PARALLELISM = 8;
    public static final int DEFAULT_ACTION_PARALLELISM = 4;
    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 5000L;
    public static final long DEFAULT_POLL_TIMEOUT_SECONDS = 1800L;
    public static final String DEFAULT_GATEWAY_URL_TEMPLATE = "https://{cluster}/api/private/cli";
    public static final long DEFAULT_GATEWAY_CONNECT_TIMEOUT_SECONDS = 30L;
    public static final long DEFAULT_GATEWAY_REQUEST_TIMEOUT_SECONDS = 120L;
    public static final int DEFAULT_AUDIT_READ_LIMIT = 20;

    // Environment variables
    public static final String ENV_CONFIG_FILE = "DR_CONTROLLER_CONFIG_FILE";
    public static final String ENV_CLUSTER_USERNAME = "DR_CLUSTER_USERNAME";
    public static final String ENV_CLUSTER_PASSWORD = "DR_CLUSTER_PASSWORD";
    public static final String ENV_USER = "USER";

    // REST
    public static final String HEADER_OPERATOR = "X-Operator";
    public static final String UNKNOWN_OPERATOR = "unknown";
}
