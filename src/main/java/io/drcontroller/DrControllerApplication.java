package io.drcontroller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.drcontroller.actions.ActionExecutor;
import io.drcontroller.actions.ActionPlanner;
import io.drcontroller.actions.ExecutionStrategy;
import io.drcontroller.actions.ParallelExecutionStrategy;
import io.drcontroller.actions.SequentialExecutionStrategy;
import io.drcontroller.actions.StepRunner;
import io.drcontroller.audit.AuditLineFormat;
import io.drcontroller.audit.AuditLog;
import io.drcontroller.audit.FileAuditLog;
import io.drcontroller.catalog.ApplicationCatalog;
import io.drcontroller.catalog.YamlApplicationCatalog;
import io.drcontroller.concurrent.BoundedFanOut;
import io.drcontroller.config.DrControllerConfig;
import io.drcontroller.enums.ExecutionPolicy;
import io.drcontroller.executor.ClusterConnector;
import io.drcontroller.executor.HttpCliGatewayConnector;
import io.drcontroller.metrics.MetricsProvider;
import io.drcontroller.orchestration.DrOrchestrator;
import io.drcontroller.status.DirectionResolver;
import io.drcontroller.status.RelationshipStatusAggregator;
import io.drcontroller.status.SnapMirrorStatusParser;
import io.drcontroller.util.EnvironmentUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.nio.file.Paths;
import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

import static io.drcontroller.config.Constants.ENV_CLUSTER_PASSWORD;
import static io.drcontroller.config.Constants.ENV_CLUSTER_USERNAME;

/**
 * Main Spring Boot application class for the DR Controller.
 *
 * Reports the SnapMirror replication state of every configured application and runs
 * operator-confirmed DR actions (update, quiesce, break, resync, recovery and the
 * restoration workflows) against the production and DR clusters, recording each
 * confirmed action in an append-only audit log.
 */
@Slf4j
@SpringBootApplication
public class DrControllerApplication {

    public static void main(String[] args) {
        log.info("Starting DR Controller Application with REST APIs");

        try {
            SpringApplication.run(DrControllerApplication.class, args);
            log.info("DR Controller with REST APIs started successfully");

        } catch (Exception e) {
            log.error("Failed to start DR Controller: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public DrControllerConfig config() {
        DrControllerConfig config = new DrControllerConfig();
        log.info("Loaded configuration");
        return config;
    }

    /**
     * Application catalog - a malformed file aborts startup before any cluster is contacted.
     */
    @Bean
    public ApplicationCatalog applicationCatalog(DrControllerConfig config) {
        log.info("Loading application catalog from {}", config.getApplicationsFile());
        return new YamlApplicationCatalog(Paths.get(config.getApplicationsFile()));
    }

    @Bean
    public ClusterConnector clusterConnector(DrControllerConfig config, ObjectMapper objectMapper) {
        log.info("Initializing HTTP CLI gateway connector: {}", config.getGatewayUrlTemplate());
        return new HttpCliGatewayConnector(
            config.getGatewayUrlTemplate(),
            EnvironmentUtils.getRequiredEnv(ENV_CLUSTER_USERNAME),
            EnvironmentUtils.getRequiredEnv(ENV_CLUSTER_PASSWORD),
            config.getGatewayConnectTimeout(),
            config.getGatewayRequestTimeout(),
            objectMapper);
    }

    @Bean(destroyMethod = "close")
    public BoundedFanOut statusFanOut(DrControllerConfig config) {
        return new BoundedFanOut("status-worker", config.getStatusParallelism());
    }

    @Bean(destroyMethod = "close")
    public BoundedFanOut actionFanOut(DrControllerConfig config) {
        return new BoundedFanOut("action-worker", config.getActionParallelism());
    }

    @Bean
    public SnapMirrorStatusParser snapMirrorStatusParser() {
        return new SnapMirrorStatusParser();
    }

    @Bean
    public DirectionResolver directionResolver() {
        return new DirectionResolver();
    }

    @Bean
    public RelationshipStatusAggregator relationshipStatusAggregator(ClusterConnector connector,
                                                                     @Qualifier("statusFanOut") BoundedFanOut fanOut,
                                                                     SnapMirrorStatusParser parser,
                                                                     DirectionResolver resolver) {
        log.info("Initializing RelationshipStatusAggregator with {} workers", fanOut.getParallelism());
        return new RelationshipStatusAggregator(connector, fanOut, parser, resolver);
    }

    @Bean
    public ActionPlanner actionPlanner() {
        return new ActionPlanner();
    }

    @Bean
    public ActionExecutor actionExecutor(ClusterConnector connector, SnapMirrorStatusParser parser,
                                         @Qualifier("actionFanOut") BoundedFanOut fanOut, DrControllerConfig config) {
        log.info("Initializing ActionExecutor with SEQUENTIAL and PARALLEL ({} workers) policies",
            fanOut.getParallelism());
        Map<ExecutionPolicy, ExecutionStrategy> strategies = new EnumMap<>(ExecutionPolicy.class);
        strategies.put(ExecutionPolicy.SEQUENTIAL, new SequentialExecutionStrategy());
        strategies.put(ExecutionPolicy.PARALLEL, new ParallelExecutionStrategy(fanOut));
        StepRunner stepRunner = new StepRunner(parser, config.getPollInterval(), config.getPollTimeout());
        return new ActionExecutor(connector, stepRunner, strategies);
    }

    @Bean
    public AuditLog auditLog(DrControllerConfig config) {
        log.info("Initializing audit log at {}", config.getAuditLogFile());
        return new FileAuditLog(Paths.get(config.getAuditLogFile()), new AuditLineFormat(config.getAuditZone()));
    }

    @Bean
    public DrOrchestrator drOrchestrator(ApplicationCatalog catalog, RelationshipStatusAggregator aggregator,
                                         ActionPlanner planner, ActionExecutor executor, AuditLog auditLog,
                                         MetricsProvider metricsProvider, DrControllerConfig config) {
        log.info("Initializing DrOrchestrator");
        return new DrOrchestrator(catalog, aggregator, planner, executor, auditLog, metricsProvider,
            Clock.systemDefaultZone(), config.getAuditZone());
    }
}
