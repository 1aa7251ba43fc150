package io.drcontroller.actions;

import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.models.ActionResult;
import io.drcontroller.models.RelationshipPlan;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runs relationships one after the other in volume order.
 */
@Slf4j
public class SequentialExecutionStrategy implements ExecutionStrategy {

    @Override
    public List<ActionResult> execute(List<RelationshipPlan> plans, Function<RelationshipPlan, ActionResult> runner,
                                      CancellationSignal signal) {
        List<ActionResult> results = new ArrayList<>(plans.size());
        for (RelationshipPlan plan : plans) {
            if (signal.isCancelled()) {
                results.add(ActionResult.cancelled(plan));
                continue;
            }
            log.debug("Running {} {}", plan.getVolumeName(), plan.getLink());
            try {
                results.add(runner.apply(plan));
            } catch (RuntimeException e) {
                log.warn("Run of {} {} failed: {}", plan.getVolumeName(), plan.getLink(), e.toString());
                results.add(ActionResult.failed(plan, e));
            }
        }
        return results;
    }
}
