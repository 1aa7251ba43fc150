package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.ReplicationDirection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time snapshot of all relationships of one application.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApplicationStatus {

    @JsonProperty("application")
    private String application;

    @Builder.Default
    @JsonProperty("volumes")
    private List<VolumeStatus> volumes = new ArrayList<>();

    @JsonProperty("direction")
    private ReplicationDirection direction;

    @JsonProperty("partial_failure")
    private boolean partialFailure;

    @JsonProperty("cancelled")
    private boolean cancelled;

    @JsonProperty("collected_at")
    private Instant collectedAt;

    @JsonProperty("last_action")
    private AuditRecord lastAction;

    public Optional<VolumeStatus> findVolume(String volumeName) {
        return volumes.stream().filter(v -> v.getVolumeName().equals(volumeName)).findFirst();
    }
}
