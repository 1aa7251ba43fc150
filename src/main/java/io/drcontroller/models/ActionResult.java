package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.FailureKind;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an action against one relationship.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionResult {

    @JsonProperty("volume")
    private String volumeName;

    @JsonProperty("link")
    private ReplicationLink link;

    @JsonProperty("outcome")
    private ActionOutcome outcome;

    @JsonProperty("failure_kind")
    private FailureKind failureKind;

    @JsonProperty("error")
    private String error;

    @JsonProperty("resulting_state")
    private RelationshipState resultingState;

    @Builder.Default
    @JsonProperty("executed_commands")
    private List<String> executedCommands = new ArrayList<>();

    public static ActionResult precondition(RelationshipPlan plan) {
        return ActionResult.builder()
            .volumeName(plan.getVolumeName())
            .link(plan.getLink())
            .outcome(ActionOutcome.FAILED)
            .failureKind(FailureKind.PRECONDITION)
            .error(plan.getViolation())
            .resultingState(plan.getFromState())
            .build();
    }

    public static ActionResult cancelled(RelationshipPlan plan) {
        return ActionResult.builder()
            .volumeName(plan.getVolumeName())
            .link(plan.getLink())
            .outcome(ActionOutcome.CANCELLED)
            .resultingState(plan.getFromState())
            .build();
    }

    /**
     * Step abandoned while in flight; its commands may or may not have been applied.
     */
    public static ActionResult abandoned(RelationshipPlan plan) {
        return ActionResult.builder()
            .volumeName(plan.getVolumeName())
            .link(plan.getLink())
            .outcome(ActionOutcome.CANCELLED)
            .error("Cancelled while in flight")
            .resultingState(RelationshipState.UNKNOWN)
            .build();
    }

    public static ActionResult failed(RelationshipPlan plan, Throwable error) {
        return ActionResult.builder()
            .volumeName(plan.getVolumeName())
            .link(plan.getLink())
            .outcome(ActionOutcome.FAILED)
            .failureKind(FailureKind.REMOTE_COMMAND)
            .error(error.getMessage() != null ? error.getMessage() : error.toString())
            .resultingState(RelationshipState.UNKNOWN)
            .build();
    }

    public boolean isSucceeded() {
        return outcome == ActionOutcome.SUCCEEDED;
    }
}
