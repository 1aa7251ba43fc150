package io.drcontroller.actions;

import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.ExecutionPolicy;
import io.drcontroller.executor.ClusterConnector;
import io.drcontroller.executor.ClusterSessions;
import io.drcontroller.models.ActionPlan;
import io.drcontroller.models.ActionResult;
import io.drcontroller.models.Application;
import io.drcontroller.models.BatchResult;
import io.drcontroller.models.RelationshipPlan;
import io.drcontroller.models.RemoteStep;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Executes an {@link ActionPlan}: ineligible relationships become PRECONDITION results
 * without any remote call, eligible ones run under the requested policy.
 */
@Slf4j
public class ActionExecutor {

    private final ClusterConnector connector;
    private final StepRunner stepRunner;
    private final Map<ExecutionPolicy, ExecutionStrategy> strategies;

    public ActionExecutor(ClusterConnector connector, StepRunner stepRunner,
                          Map<ExecutionPolicy, ExecutionStrategy> strategies) {
        this.connector = connector;
        this.stepRunner = stepRunner;
        this.strategies = strategies;
    }

    public BatchResult execute(Application application, ActionPlan plan) {
        return execute(application, plan, CancellationSignal.none());
    }

    public BatchResult execute(Application application, ActionPlan plan, CancellationSignal signal) {
        ExecutionStrategy strategy = strategies.get(plan.getPolicy());
        if (strategy == null) {
            throw new IllegalArgumentException("No execution strategy for policy " + plan.getPolicy());
        }
        Instant startedAt = Instant.now();
        log.info("========================================");
        log.info("[App: {}] Executing {} ({} policy) on {} relationships", application.getName(),
            plan.getAction().getValue(), plan.getPolicy(), plan.getRelationships().size());
        log.info("========================================");

        List<ActionResult> eligibleResults;
        try (ClusterSessions sessions = new ClusterSessions(connector)) {
            eligibleResults = strategy.execute(plan.getEligible(),
                relationship -> stepRunner.run(application, relationship, sessions, signal),
                signal);
        }

        BatchResult batch = BatchResult.builder()
            .application(application.getName())
            .action(plan.getAction())
            .results(merge(plan, eligibleResults))
            .startedAt(startedAt)
            .finishedAt(Instant.now())
            .build();

        log.info("========================================");
        log.info("[App: {}] {} finished: {}", application.getName(), plan.getAction().getValue(), batch.summary());
        log.info("========================================");
        return batch;
    }

    /**
     * Dry run: report what would be executed without contacting any cluster.
     */
    public BatchResult simulate(ActionPlan plan) {
        Instant now = Instant.now();
        List<ActionResult> results = plan.getRelationships().stream()
            .map(relationship -> relationship.isEligible()
                ? ActionResult.builder()
                    .volumeName(relationship.getVolumeName())
                    .link(relationship.getLink())
                    .outcome(ActionOutcome.SUCCEEDED)
                    .resultingState(relationship.getToState())
                    .executedCommands(relationship.getSteps().stream()
                        .map(RemoteStep::describe)
                        .collect(Collectors.toList()))
                    .build()
                : ActionResult.precondition(relationship))
            .collect(Collectors.toList());
        log.info("[App: {}] Dry run of {} on {} relationships", plan.getApplication(),
            plan.getAction().getValue(), results.size());
        return BatchResult.builder()
            .application(plan.getApplication())
            .action(plan.getAction())
            .results(results)
            .startedAt(now)
            .finishedAt(now)
            .dryRun(true)
            .build();
    }

    private static List<ActionResult> merge(ActionPlan plan, List<ActionResult> eligibleResults) {
        List<ActionResult> merged = new ArrayList<>(plan.getRelationships().size());
        Iterator<ActionResult> executed = eligibleResults.iterator();
        for (RelationshipPlan relationship : plan.getRelationships()) {
            merged.add(relationship.isEligible() ? executed.next() : ActionResult.precondition(relationship));
        }
        return merged;
    }
}
