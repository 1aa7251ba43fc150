package io.drcontroller.actions;

import io.drcontroller.concurrent.BoundedFanOut;
import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.FailureKind;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.models.ActionResult;
import io.drcontroller.models.RelationshipPlan;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static io.drcontroller.actions.SequentialExecutionStrategyTest.quiescePlan;
import static io.drcontroller.actions.SequentialExecutionStrategyTest.succeeded;
import static org.assertj.core.api.Assertions.assertThat;

class ParallelExecutionStrategyTest {

    private BoundedFanOut fanOut;

    @AfterEach
    void tearDown() {
        if (fanOut != null) {
            fanOut.close();
        }
    }

    @Test
    void testExecute_UnexpectedErrorBecomesFailedResult() {
        // Given
        fanOut = new BoundedFanOut("test-actions", 2);
        ParallelExecutionStrategy strategy = new ParallelExecutionStrategy(fanOut);

        // When
        List<ActionResult> results = strategy.execute(List.of(quiescePlan("vol1"), quiescePlan("vol2")), plan -> {
            if (plan.getVolumeName().equals("vol1")) {
                throw new IllegalStateException("unexpected reply");
            }
            return succeeded(plan);
        }, CancellationSignal.none());

        // Then
        assertThat(results).extracting(ActionResult::getOutcome)
            .containsExactly(ActionOutcome.FAILED, ActionOutcome.SUCCEEDED);
        assertThat(results.get(0).getFailureKind()).isEqualTo(FailureKind.REMOTE_COMMAND);
        assertThat(results.get(0).getError()).isEqualTo("unexpected reply");
    }

    @Test
    void testExecute_CancelAbandonsRelationshipInFlight() {
        // Given - one worker: vol1 hangs after raising the signal, vol2 is still queued
        fanOut = new BoundedFanOut("test-actions", 1);
        ParallelExecutionStrategy strategy = new ParallelExecutionStrategy(fanOut);
        CancellationSignal signal = new CancellationSignal();
        CountDownLatch release = new CountDownLatch(1);
        List<RelationshipPlan> plans = List.of(quiescePlan("vol1"), quiescePlan("vol2"));

        // When
        List<ActionResult> results;
        try {
            results = strategy.execute(plans, plan -> {
                signal.cancel();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return succeeded(plan);
            }, signal);
        } finally {
            release.countDown();
        }

        // Then
        assertThat(results).extracting(ActionResult::getOutcome)
            .containsExactly(ActionOutcome.CANCELLED, ActionOutcome.CANCELLED);
        assertThat(results.get(0).getResultingState()).isEqualTo(RelationshipState.UNKNOWN);
        assertThat(results.get(1).getResultingState()).isEqualTo(RelationshipState.MIRRORED);
    }
}
