package io.drcontroller.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.models.Application;
import io.drcontroller.models.Qtree;
import io.drcontroller.models.Volume;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Static details of an application: clusters, vservers, replication paths, qtrees and shares.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ApplicationDetailsResponse {
    private String appName;
    private String details;
    private String prodCluster;
    private String prodVserver;
    private String drCluster;
    private String drVserver;
    private List<VolumeDetails> volumes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VolumeDetails {
        private String volumeName;
        private String sourcePath;
        private String destinationPath;
        private String shareName;
        private List<Qtree> qtrees;
    }

    public static ApplicationDetailsResponse from(Application application) {
        return ApplicationDetailsResponse.builder()
            .appName(application.getName())
            .details(application.getDetails())
            .prodCluster(application.getProdCluster())
            .prodVserver(application.getProdVserver())
            .drCluster(application.getDrCluster())
            .drVserver(application.getDrVserver())
            .volumes(application.getVolumes().stream()
                .map(volume -> volumeDetails(application, volume))
                .collect(Collectors.toList()))
            .build();
    }

    private static VolumeDetails volumeDetails(Application application, Volume volume) {
        return VolumeDetails.builder()
            .volumeName(volume.getName())
            .sourcePath(application.sourcePath(ReplicationLink.PROD_TO_DR, volume.getName()))
            .destinationPath(application.destinationPath(ReplicationLink.PROD_TO_DR, volume.getName()))
            .shareName(volume.getShare() != null ? volume.getShare().getName() : null)
            .qtrees(volume.getQtrees())
            .build();
    }
}
