package io.drcontroller.config;

import io.drcontroller.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.function.Function;

import static io.drcontroller.config.Constants.*;

/**
 * Configuration for the DR controller.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class DrControllerConfig {

    private final String applicationsFile;
    private final String auditLogFile;
    private final ZoneId auditZone;
    private final int statusParallelism;
    private final int actionParallelism;
    private final Duration pollInterval;
    private final Duration pollTimeout;
    private final String gatewayUrlTemplate;
    private final Duration gatewayConnectTimeout;
    private final Duration gatewayRequestTimeout;
    private final String defaultOperator;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    public DrControllerConfig() {
        this(DEFAULT_CONFIG_FILE_CLASSPATH);
    }

    public DrControllerConfig(String classpathResource) {
        ConfigModel config = loadYamlConfig(classpathResource);
        config.fillMissingSections();

        // Parse configuration values with null-safe defaults
        this.applicationsFile = value(config, c -> c.getApplications().getFile(), DEFAULT_APPLICATIONS_FILE);
        this.auditLogFile = value(config, c -> c.getAudit().getFile(), DEFAULT_AUDIT_LOG_FILE);
        this.auditZone = parseZone(value(config, c -> c.getAudit().getTimezone(), null));
        this.statusParallelism = positive(value(config, c -> c.getStatus().getParallelism(), DEFAULT_STATUS_PARALLELISM),
            DEFAULT_STATUS_PARALLELISM, "status.parallelism");
        this.actionParallelism = positive(value(config, c -> c.getActions().getParallelism(), DEFAULT_ACTION_PARALLELISM),
            DEFAULT_ACTION_PARALLELISM, "actions.parallelism");
        this.pollInterval = Duration.ofMillis(
            value(config, c -> c.getActions().getPollIntervalMillis(), DEFAULT_POLL_INTERVAL_MILLIS));
        this.pollTimeout = Duration.ofSeconds(
            value(config, c -> c.getActions().getPollTimeoutSeconds(), DEFAULT_POLL_TIMEOUT_SECONDS));
        this.gatewayUrlTemplate = value(config, c -> c.getGateway().getUrlTemplate(), DEFAULT_GATEWAY_URL_TEMPLATE);
        this.gatewayConnectTimeout = Duration.ofSeconds(
            value(config, c -> c.getGateway().getConnectTimeoutSeconds(), DEFAULT_GATEWAY_CONNECT_TIMEOUT_SECONDS));
        this.gatewayRequestTimeout = Duration.ofSeconds(
            value(config, c -> c.getGateway().getRequestTimeoutSeconds(), DEFAULT_GATEWAY_REQUEST_TIMEOUT_SECONDS));
        this.defaultOperator = value(config, c -> c.getOperator().getDefaultName(),
            EnvironmentUtils.getEnv(ENV_USER, UNKNOWN_OPERATOR));

        log.info("Loaded DR controller config - applications: {}, audit log: {} ({}), status workers: {}, "
                + "action workers: {}, poll: {}ms/{}s, gateway: {}",
            applicationsFile, auditLogFile, auditZone, statusParallelism, actionParallelism,
            pollInterval.toMillis(), pollTimeout.toSeconds(), gatewayUrlTemplate);
    }

    private ConfigModel loadYamlConfig(String classpathResource) {
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(ENV_CONFIG_FILE);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", ENV_CONFIG_FILE, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", ENV_CONFIG_FILE);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", classpathResource);
            inputStream = getClass().getClassLoader().getResourceAsStream(classpathResource);
            loadedFrom = "classpath (" + classpathResource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (IOException e) {
            log.error("Error closing config file input stream: {}", e.getMessage());
            return new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private static <T> T value(ConfigModel config, Function<ConfigModel, T> getter, T defaultValue) {
        T value = getter.apply(config);
        if (value instanceof String && ((String) value).isBlank()) {
            return defaultValue;
        }
        return value != null ? value : defaultValue;
    }

    private static int positive(int value, int defaultValue, String key) {
        if (value < 1) {
            log.warn("Invalid {} {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static ZoneId parseZone(String zone) {
        if (zone == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Invalid audit timezone '{}', using system zone: {}", zone, e.getMessage());
            return ZoneId.systemDefault();
        }
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Map<String, Object> server; // Spring server settings (used by Spring @Value)
        private Applications applications;
        private Audit audit;
        private Status status;
        private Actions actions;
        private Gateway gateway;
        private Operator operator;

        void fillMissingSections() {
            if (applications == null) applications = new Applications();
            if (audit == null) audit = new Audit();
            if (status == null) status = new Status();
            if (actions == null) actions = new Actions();
            if (gateway == null) gateway = new Gateway();
            if (operator == null) operator = new Operator();
        }
    }

    @Data
    public static class Applications {
        private String file;
    }

    @Data
    public static class Audit {
        private String file;
        private String timezone;
    }

    @Data
    public static class Status {
        private Integer parallelism;
    }

    @Data
    public static class Actions {
        private Integer parallelism;
        private Long pollIntervalMillis;
        private Long pollTimeoutSeconds;
    }

    @Data
    public static class Gateway {
        private String urlTemplate;
        private Long connectTimeoutSeconds;
        private Long requestTimeoutSeconds;
    }

    @Data
    public static class Operator {
        private String defaultName;
    }
}
