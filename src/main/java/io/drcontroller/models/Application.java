package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.Site;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Application protected by SnapMirror: a production and a DR cluster/vserver pair and the
 * volumes replicated between them.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Application {

    @JsonProperty("app_name")
    private String name;

    @JsonProperty("prod_cluster")
    private String prodCluster;

    @JsonProperty("dr_cluster")
    private String drCluster;

    @JsonProperty("prod_vserver")
    private String prodVserver;

    @JsonProperty("dr_vserver")
    private String drVserver;

    @JsonProperty("details")
    private String details;

    @Builder.Default
    @JsonProperty("volume_names")
    private List<Volume> volumes = new ArrayList<>();

    public String clusterAt(Site site) {
        return site == Site.PROD ? prodCluster : drCluster;
    }

    public String vserverAt(Site site) {
        return site == Site.PROD ? prodVserver : drVserver;
    }

    /**
     * Cluster on which commands for the given link run, i.e. the one hosting its destination.
     */
    public String clusterFor(ReplicationLink link) {
        return clusterAt(link.getDestinationSite());
    }

    public String sourcePath(ReplicationLink link, String volumeName) {
        return vserverAt(link.getSourceSite()) + ":" + volumeName;
    }

    public String destinationPath(ReplicationLink link, String volumeName) {
        return vserverAt(link.getDestinationSite()) + ":" + volumeName;
    }

    @JsonIgnore
    public Optional<Volume> findVolume(String volumeName) {
        return volumes.stream().filter(v -> v.getName().equals(volumeName)).findFirst();
    }
}
