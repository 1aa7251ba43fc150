package io.drcontroller.orchestration;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.ApplyStatus;
import io.drcontroller.models.ActionPlan;
import io.drcontroller.models.AuditRecord;
import io.drcontroller.models.BatchResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApplyOutcome {

    @JsonProperty("status")
    private ApplyStatus status;

    @JsonProperty("plan")
    private ActionPlan plan;

    @JsonProperty("batch")
    private BatchResult batch;

    @JsonProperty("audit_record")
    private AuditRecord auditRecord;

    @JsonProperty("audit_warning")
    private String auditWarning;

    public boolean isAudited() {
        return auditRecord != null;
    }
}
