package io.drcontroller.api.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request body for the preview and apply endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionRequestBody {

    @JsonProperty("targets")
    @Builder.Default
    private List<String> targets = new ArrayList<>();

    @JsonProperty("policy")
    private String policy; // SEQUENTIAL (default) or PARALLEL

    @JsonProperty("restoration_path")
    private String restorationPath; // EXTENDED or FLIP_FLOP

    @JsonProperty("dry_run")
    private boolean dryRun;

    @JsonProperty("confirmed")
    private boolean confirmed;

    @JsonProperty("accept_partial_outcome")
    private boolean acceptPartialOutcome;
}
