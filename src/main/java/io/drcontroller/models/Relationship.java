package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.Site;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Live state of one volume's replication on one link, as read from the destination cluster.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Relationship {

    @JsonProperty("volume")
    private String volumeName;

    @JsonProperty("link")
    private ReplicationLink link;

    @JsonProperty("source_path")
    private String sourcePath;

    @JsonProperty("destination_path")
    private String destinationPath;

    @JsonProperty("state")
    private RelationshipState state;

    @JsonProperty("mirror_state")
    private String mirrorState; // raw, e.g. "Snapmirrored", "Broken-off"

    @JsonProperty("status")
    private String status; // raw, e.g. "Idle", "Transferring", "Quiesced"

    @JsonProperty("lag_time")
    private String lagTime;

    @JsonProperty("last_transfer_timestamp")
    private String lastTransferTimestamp;

    @JsonProperty("schedule")
    private String schedule;

    @JsonProperty("policy")
    private String policy;

    @JsonProperty("writable_site")
    private Site writableSite;

    @JsonProperty("present")
    private boolean present;

    @JsonProperty("error")
    private String error;

    public static Relationship absent(String volumeName, ReplicationLink link, String sourcePath, String destinationPath) {
        return Relationship.builder()
            .volumeName(volumeName)
            .link(link)
            .sourcePath(sourcePath)
            .destinationPath(destinationPath)
            .present(false)
            .build();
    }

    public static Relationship unknown(String volumeName, ReplicationLink link, String sourcePath,
                                       String destinationPath, String error) {
        return Relationship.builder()
            .volumeName(volumeName)
            .link(link)
            .sourcePath(sourcePath)
            .destinationPath(destinationPath)
            .state(RelationshipState.UNKNOWN)
            .present(true)
            .error(error)
            .build();
    }

    public static Relationship cancelled(String volumeName, ReplicationLink link, String sourcePath, String destinationPath) {
        return Relationship.builder()
            .volumeName(volumeName)
            .link(link)
            .sourcePath(sourcePath)
            .destinationPath(destinationPath)
            .state(RelationshipState.CANCELLED)
            .present(true)
            .build();
    }

    public boolean isInState(RelationshipState expected) {
        return present && state == expected;
    }
}
