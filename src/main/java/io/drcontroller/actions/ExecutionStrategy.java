package io.drcontroller.actions;

import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.models.ActionResult;
import io.drcontroller.models.RelationshipPlan;

import java.util.List;
import java.util.function.Function;

/**
 * Strategy for running the eligible relationships of one batch.
 */
public interface ExecutionStrategy {

    /**
     * Run every plan and return one result per plan, in plan order.
     *
     * @param runner executes a single relationship; never throws for remote failures
     */
    List<ActionResult> execute(List<RelationshipPlan> plans, Function<RelationshipPlan, ActionResult> runner,
                               CancellationSignal signal);
}
