package io.drcontroller.actions;

import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.FailureKind;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.models.ActionResult;
import io.drcontroller.models.RelationshipPlan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SequentialExecutionStrategyTest {

    private final SequentialExecutionStrategy strategy = new SequentialExecutionStrategy();

    static RelationshipPlan quiescePlan(String volume) {
        return RelationshipPlan.builder()
            .volumeName(volume)
            .link(ReplicationLink.PROD_TO_DR)
            .fromState(RelationshipState.MIRRORED)
            .toState(RelationshipState.QUIESCED)
            .build();
    }

    static ActionResult succeeded(RelationshipPlan plan) {
        return ActionResult.builder()
            .volumeName(plan.getVolumeName())
            .link(plan.getLink())
            .outcome(ActionOutcome.SUCCEEDED)
            .resultingState(plan.getToState())
            .build();
    }

    @Test
    void testExecute_UnexpectedErrorIsolatedToOneRelationship() {
        // Given
        List<RelationshipPlan> plans = List.of(quiescePlan("vol1"), quiescePlan("vol2"), quiescePlan("vol3"));

        // When
        List<ActionResult> results = strategy.execute(plans, plan -> {
            if (plan.getVolumeName().equals("vol2")) {
                throw new IllegalStateException("unexpected reply");
            }
            return succeeded(plan);
        }, CancellationSignal.none());

        // Then
        assertThat(results).extracting(ActionResult::getOutcome)
            .containsExactly(ActionOutcome.SUCCEEDED, ActionOutcome.FAILED, ActionOutcome.SUCCEEDED);
        ActionResult failed = results.get(1);
        assertThat(failed.getVolumeName()).isEqualTo("vol2");
        assertThat(failed.getFailureKind()).isEqualTo(FailureKind.REMOTE_COMMAND);
        assertThat(failed.getError()).isEqualTo("unexpected reply");
        assertThat(failed.getResultingState()).isEqualTo(RelationshipState.UNKNOWN);
    }

    @Test
    void testExecute_ErrorWithoutMessageIsDescribed() {
        // Given
        List<RelationshipPlan> plans = List.of(quiescePlan("vol1"));

        // When
        List<ActionResult> results = strategy.execute(plans, plan -> {
            throw new NullPointerException();
        }, CancellationSignal.none());

        // Then
        assertThat(results.get(0).getOutcome()).isEqualTo(ActionOutcome.FAILED);
        assertThat(results.get(0).getError()).contains("NullPointerException");
    }

    @Test
    void testExecute_CancelledPlansNeverRun() {
        // Given
        CancellationSignal signal = new CancellationSignal();
        List<RelationshipPlan> plans = List.of(quiescePlan("vol1"), quiescePlan("vol2"));

        // When
        List<ActionResult> results = strategy.execute(plans, plan -> {
            signal.cancel();
            return succeeded(plan);
        }, signal);

        // Then
        assertThat(results).extracting(ActionResult::getOutcome)
            .containsExactly(ActionOutcome.SUCCEEDED, ActionOutcome.CANCELLED);
        assertThat(results.get(1).getResultingState()).isEqualTo(RelationshipState.MIRRORED);
    }
}
