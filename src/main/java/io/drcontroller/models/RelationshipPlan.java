package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Planned work for one relationship, or the precondition violation that makes it ineligible.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelationshipPlan {

    @JsonProperty("volume")
    private String volumeName;

    @JsonProperty("link")
    private ReplicationLink link;

    @JsonProperty("from_state")
    private RelationshipState fromState; // null when the link does not exist yet

    @JsonProperty("to_state")
    private RelationshipState toState;

    @Builder.Default
    @JsonProperty("steps")
    private List<RemoteStep> steps = new ArrayList<>();

    @JsonProperty("violation")
    private String violation;

    @JsonIgnore
    public boolean isEligible() {
        return violation == null;
    }
}
