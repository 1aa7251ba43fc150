package io.drcontroller.orchestration;

import io.drcontroller.models.ActionPlan;
import io.drcontroller.models.BatchResult;

/**
 * The operator's answers to the two questions asked during an apply.
 */
public interface OperatorConfirmation {

    /**
     * Whether to proceed after seeing the plan.
     */
    boolean confirmPlan(ActionPlan plan);

    /**
     * Whether a partially failed batch should still be recorded in the audit log.
     */
    boolean acceptPartialOutcome(BatchResult batch);

    static OperatorConfirmation of(boolean confirmed, boolean acceptPartialOutcome) {
        return new OperatorConfirmation() {
            @Override
            public boolean confirmPlan(ActionPlan plan) {
                return confirmed;
            }

            @Override
            public boolean acceptPartialOutcome(BatchResult batch) {
                return acceptPartialOutcome;
            }
        };
    }
}
