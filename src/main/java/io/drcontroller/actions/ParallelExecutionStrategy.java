package io.drcontroller.actions;

import io.drcontroller.concurrent.BoundedFanOut;
import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.models.ActionResult;
import io.drcontroller.models.RelationshipPlan;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Runs relationships concurrently on the bounded action pool.
 */
public class ParallelExecutionStrategy implements ExecutionStrategy {

    private final BoundedFanOut fanOut;

    public ParallelExecutionStrategy(BoundedFanOut fanOut) {
        this.fanOut = fanOut;
    }

    @Override
    public List<ActionResult> execute(List<RelationshipPlan> plans, Function<RelationshipPlan, ActionResult> runner,
                                      CancellationSignal signal) {
        Set<RelationshipPlan> started = ConcurrentHashMap.newKeySet();
        return fanOut.map(plans,
            plan -> {
                started.add(plan);
                return runner.apply(plan);
            },
            plan -> started.contains(plan) ? ActionResult.abandoned(plan) : ActionResult.cancelled(plan),
            ActionResult::failed,
            signal);
    }
}
