package io.drcontroller.orchestration;

import io.drcontroller.actions.ActionExecutor;
import io.drcontroller.actions.ActionPlanner;
import io.drcontroller.audit.AuditLog;
import io.drcontroller.audit.AuditWriteException;
import io.drcontroller.catalog.ApplicationCatalog;
import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.ApplyStatus;
import io.drcontroller.metrics.MetricsProvider;
import io.drcontroller.models.ActionPlan;
import io.drcontroller.models.ActionRequest;
import io.drcontroller.models.Application;
import io.drcontroller.models.ApplicationStatus;
import io.drcontroller.models.AuditRecord;
import io.drcontroller.models.BatchResult;
import io.drcontroller.models.VolumeStatus;
import io.drcontroller.status.RelationshipStatusAggregator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for status views and operator actions: status, then plan, then confirmation,
 * then execution, then audit.
 */
@Slf4j
public class DrOrchestrator {

    private final ApplicationCatalog catalog;
    private final RelationshipStatusAggregator aggregator;
    private final ActionPlanner planner;
    private final ActionExecutor executor;
    private final AuditLog auditLog;
    private final MetricsProvider metricsProvider;
    private final Clock clock;
    private final ZoneId zone;
    private final Map<String, ReentrantLock> applyLocks = new ConcurrentHashMap<>();

    public DrOrchestrator(ApplicationCatalog catalog, RelationshipStatusAggregator aggregator, ActionPlanner planner,
                          ActionExecutor executor, AuditLog auditLog, MetricsProvider metricsProvider,
                          Clock clock, ZoneId zone) {
        this.catalog = catalog;
        this.aggregator = aggregator;
        this.planner = planner;
        this.executor = executor;
        this.auditLog = auditLog;
        this.metricsProvider = metricsProvider;
        this.clock = clock;
        this.zone = zone;
    }

    public List<Application> getApplications() {
        return catalog.getApplications();
    }

    public Application getApplication(String applicationName) {
        return catalog.getApplication(applicationName);
    }

    public ApplicationStatus status(String applicationName) {
        return status(applicationName, CancellationSignal.none());
    }

    public ApplicationStatus status(String applicationName, CancellationSignal signal) {
        Application application = catalog.getApplication(applicationName);
        ApplicationStatus status = aggregator.aggregate(application, signal);
        emitStatusMetrics(status);
        List<AuditRecord> recent = auditLog.readRecent(applicationName, 1);
        return recent.isEmpty() ? status : status.toBuilder().lastAction(recent.get(0)).build();
    }

    /**
     * Status of every catalogued application, sorted by name.
     */
    public List<ApplicationStatus> statusAll() {
        Map<String, AuditRecord> latest = auditLog.latestByApplication();
        List<ApplicationStatus> statuses = new ArrayList<>();
        for (Application application : catalog.getApplications()) {
            ApplicationStatus status = aggregator.aggregate(application);
            emitStatusMetrics(status);
            status.getVolumes().sort(Comparator.comparing(VolumeStatus::getVolumeName));
            statuses.add(status.toBuilder().lastAction(latest.get(application.getName())).build());
        }
        statuses.sort(Comparator.comparing(ApplicationStatus::getApplication));
        return statuses;
    }

    public ActionPreview preview(String applicationName, ActionRequest request) {
        Application application = catalog.getApplication(applicationName);
        ApplicationStatus status = aggregator.aggregate(application);
        ActionPlan plan = planner.plan(application, request, status);
        return new ActionPreview(status, plan);
    }

    public ApplyOutcome apply(String applicationName, ActionRequest request, OperatorConfirmation confirmation) {
        return apply(applicationName, request, confirmation, CancellationSignal.none());
    }

    public ApplyOutcome apply(String applicationName, ActionRequest request, OperatorConfirmation confirmation,
                              CancellationSignal signal) {
        Application application = catalog.getApplication(applicationName);
        ReentrantLock lock = applyLocks.computeIfAbsent(applicationName, name -> new ReentrantLock());
        lock.lock();
        try {
            ApplicationStatus status = aggregator.aggregate(application);
            ActionPlan plan = planner.plan(application, request, status);

            if (!confirmation.confirmPlan(plan)) {
                log.info("[App: {}] {} not confirmed by {}, aborting", applicationName,
                    request.getAction().getValue(), request.getOperator());
                return ApplyOutcome.builder().status(ApplyStatus.ABORTED).plan(plan).build();
            }

            if (plan.isDryRun()) {
                return ApplyOutcome.builder()
                    .status(ApplyStatus.DRY_RUN)
                    .plan(plan)
                    .batch(executor.simulate(plan))
                    .build();
            }

            BatchResult batch = executor.execute(application, plan, signal);
            emitActionMetrics(batch);
            ApplyOutcome.ApplyOutcomeBuilder outcome = ApplyOutcome.builder()
                .status(batch.isFullSuccess() ? ApplyStatus.COMPLETED : ApplyStatus.PARTIAL_FAILURE)
                .plan(plan)
                .batch(batch);

            boolean record = batch.isFullSuccess() || confirmation.acceptPartialOutcome(batch);
            if (!record) {
                log.warn("[App: {}] Partial outcome of {} not accepted, no audit record written",
                    applicationName, request.getAction().getValue());
                return outcome.build();
            }

            AuditRecord auditRecord = AuditRecord.builder()
                .action(request.getAction().getValue())
                .application(applicationName)
                .operator(request.getOperator())
                .timestamp(ZonedDateTime.now(clock).withZoneSameInstant(zone))
                .outcome(batch.summary())
                .build();
            try {
                auditLog.record(auditRecord);
                outcome.auditRecord(auditRecord);
            } catch (AuditWriteException e) {
                log.error("[App: {}] {} executed but audit failed: {}", applicationName,
                    request.getAction().getValue(), e.getMessage(), e);
                metricsProvider.recordAuditWriteFailure(applicationName);
                outcome.auditWarning(e.getMessage());
            }
            return outcome.build();
        } finally {
            lock.unlock();
        }
    }

    private void emitActionMetrics(BatchResult batch) {
        try {
            for (ActionOutcome outcome : ActionOutcome.values()) {
                metricsProvider.recordRelationshipOutcomes(batch.getApplication(), batch.getAction(), outcome,
                    batch.count(outcome));
            }
            if (batch.getStartedAt() != null && batch.getFinishedAt() != null) {
                metricsProvider.recordActionDuration(batch.getApplication(), batch.getAction(),
                    Duration.between(batch.getStartedAt(), batch.getFinishedAt()));
            }
        } catch (Exception e) {
            log.error("[App: {}] Failed to emit action metrics: {}", batch.getApplication(), e.getMessage(), e);
        }
    }

    private void emitStatusMetrics(ApplicationStatus status) {
        long unresolved = status.getVolumes().stream().filter(v -> v.getWritableSite() == null).count();
        metricsProvider.setUnresolvedVolumes(status.getApplication(), unresolved);
    }
}
