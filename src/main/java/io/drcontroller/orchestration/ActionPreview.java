package io.drcontroller.orchestration;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.models.ActionPlan;
import io.drcontroller.models.ApplicationStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Status snapshot and the plan derived from it, shown to the operator before confirming.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActionPreview {

    @JsonProperty("status")
    private ApplicationStatus status;

    @JsonProperty("plan")
    private ActionPlan plan;
}
