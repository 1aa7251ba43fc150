package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.actions.PartialBatchFailureException;
import io.drcontroller.enums.ActionOutcome;
import io.drcontroller.enums.DrAction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-relationship results of one executed (or simulated) action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchResult {

    @JsonProperty("application")
    private String application;

    @JsonProperty("action")
    private DrAction action;

    @Builder.Default
    @JsonProperty("results")
    private List<ActionResult> results = new ArrayList<>();

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("finished_at")
    private Instant finishedAt;

    @JsonProperty("dry_run")
    private boolean dryRun;

    @JsonProperty("full_success")
    public boolean isFullSuccess() {
        return !results.isEmpty() && results.stream().allMatch(ActionResult::isSucceeded);
    }

    @JsonProperty("partial_failure")
    public boolean isPartialFailure() {
        return !isFullSuccess();
    }

    public long count(ActionOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }

    /**
     * Short outcome summary as written to the audit log, e.g. "succeeded 3/3".
     */
    public String summary() {
        long succeeded = count(ActionOutcome.SUCCEEDED);
        long failed = count(ActionOutcome.FAILED);
        long cancelled = count(ActionOutcome.CANCELLED);
        StringBuilder sb = new StringBuilder(isFullSuccess() ? "succeeded " : "partial ");
        sb.append(succeeded).append('/').append(results.size());
        if (failed > 0) {
            sb.append(", failed ").append(failed);
        }
        if (cancelled > 0) {
            sb.append(", cancelled ").append(cancelled);
        }
        return sb.toString();
    }

    public BatchResult requireFullSuccess() {
        if (!isFullSuccess()) {
            throw new PartialBatchFailureException(this);
        }
        return this;
    }
}
