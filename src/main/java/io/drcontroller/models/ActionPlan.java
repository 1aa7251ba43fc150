package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.DrAction;
import io.drcontroller.enums.ExecutionPolicy;
import io.drcontroller.enums.ReplicationDirection;
import io.drcontroller.enums.RestorationPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Preview of an action: what would happen to every targeted relationship.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ActionPlan {

    @JsonProperty("application")
    private String application;

    @JsonProperty("action")
    private DrAction action;

    @JsonProperty("direction")
    private ReplicationDirection direction;

    @JsonProperty("policy")
    private ExecutionPolicy policy;

    @JsonProperty("restoration_path")
    private RestorationPath restorationPath;

    @JsonProperty("dry_run")
    private boolean dryRun;

    @Builder.Default
    @JsonProperty("relationships")
    private List<RelationshipPlan> relationships = new ArrayList<>();

    @JsonIgnore
    public List<RelationshipPlan> getEligible() {
        return relationships.stream().filter(RelationshipPlan::isEligible).collect(Collectors.toList());
    }

    @JsonIgnore
    public boolean hasEligibleRelationships() {
        return relationships.stream().anyMatch(RelationshipPlan::isEligible);
    }
}
