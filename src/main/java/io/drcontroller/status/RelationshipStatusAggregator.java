package io.drcontroller.status;

import io.drcontroller.concurrent.BoundedFanOut;
import io.drcontroller.concurrent.CancellationSignal;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.executor.ClusterConnector;
import io.drcontroller.executor.ClusterSessions;
import io.drcontroller.executor.CommandOutput;
import io.drcontroller.executor.ConnectionException;
import io.drcontroller.executor.OntapCommands;
import io.drcontroller.models.Application;
import io.drcontroller.models.ApplicationStatus;
import io.drcontroller.models.Relationship;
import io.drcontroller.models.Volume;
import io.drcontroller.models.VolumeStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.List;

/**
 * Collects the live status of every relationship of an application, one task per volume
 * on a bounded pool. Every call is a fresh remote read.
 */
@Slf4j
public class RelationshipStatusAggregator {

    private final ClusterConnector connector;
    private final BoundedFanOut fanOut;
    private final SnapMirrorStatusParser parser;
    private final DirectionResolver resolver;

    public RelationshipStatusAggregator(ClusterConnector connector, BoundedFanOut fanOut,
                                        SnapMirrorStatusParser parser, DirectionResolver resolver) {
        this.connector = connector;
        this.fanOut = fanOut;
        this.parser = parser;
        this.resolver = resolver;
    }

    public ApplicationStatus aggregate(Application application) {
        return aggregate(application, CancellationSignal.none());
    }

    public ApplicationStatus aggregate(Application application, CancellationSignal signal) {
        log.info("[App: {}] Collecting status of {} volumes", application.getName(), application.getVolumes().size());
        long startTime = System.currentTimeMillis();

        List<VolumeStatus> volumes;
        try (ClusterSessions sessions = new ClusterSessions(connector)) {
            volumes = fanOut.map(
                application.getVolumes(),
                volume -> queryVolume(application, volume, sessions, signal),
                volume -> cancelledVolume(application, volume),
                (volume, error) -> failedVolume(application, volume, describe(error)),
                signal);
        }

        boolean partialFailure = volumes.stream().anyMatch(VolumeStatus::hasErrors);
        boolean cancelled = volumes.stream().anyMatch(VolumeStatus::isCancelled);
        ApplicationStatus status = ApplicationStatus.builder()
            .application(application.getName())
            .volumes(volumes)
            .direction(resolver.resolve(volumes))
            .partialFailure(partialFailure)
            .cancelled(cancelled)
            .collectedAt(Instant.now())
            .build();

        log.info("[App: {}] Status collected in {}ms - direction: {}, partial failure: {}, cancelled: {}",
            application.getName(), System.currentTimeMillis() - startTime, status.getDirection(),
            partialFailure, cancelled);
        return status;
    }

    /**
     * Fresh read of a single relationship, used while waiting on workflow steps.
     */
    public Relationship queryRelationship(Application application, String volumeName, ReplicationLink link,
                                          ClusterSessions sessions) {
        String sourcePath = application.sourcePath(link, volumeName);
        String destinationPath = application.destinationPath(link, volumeName);
        String cluster = application.clusterFor(link);
        Relationship relationship;
        try {
            CommandOutput output = sessions.execute(cluster, OntapCommands.snapmirrorShow(destinationPath));
            relationship = parser.parse(volumeName, link, sourcePath, destinationPath, output);
        } catch (ConnectionException e) {
            log.warn("[App: {}] Failed to query {} on cluster {}: {}",
                application.getName(), destinationPath, cluster, e.getMessage());
            relationship = Relationship.unknown(volumeName, link, sourcePath, destinationPath, e.getMessage());
        }
        relationship.setWritableSite(resolver.writableSite(relationship));
        return relationship;
    }

    private VolumeStatus queryVolume(Application application, Volume volume, ClusterSessions sessions,
                                     CancellationSignal signal) {
        Relationship prodToDr = queryRelationship(application, volume.getName(), ReplicationLink.PROD_TO_DR, sessions);
        if (signal.isCancelled()) {
            return cancelledVolume(application, volume);
        }
        Relationship drToProd = queryRelationship(application, volume.getName(), ReplicationLink.DR_TO_PROD, sessions);
        return VolumeStatus.builder()
            .volumeName(volume.getName())
            .prodToDr(prodToDr)
            .drToProd(drToProd)
            .writableSite(resolver.writableSite(prodToDr, drToProd))
            .build();
    }

    private VolumeStatus cancelledVolume(Application application, Volume volume) {
        String name = volume.getName();
        return VolumeStatus.builder()
            .volumeName(name)
            .prodToDr(Relationship.cancelled(name, ReplicationLink.PROD_TO_DR,
                application.sourcePath(ReplicationLink.PROD_TO_DR, name),
                application.destinationPath(ReplicationLink.PROD_TO_DR, name)))
            .drToProd(Relationship.cancelled(name, ReplicationLink.DR_TO_PROD,
                application.sourcePath(ReplicationLink.DR_TO_PROD, name),
                application.destinationPath(ReplicationLink.DR_TO_PROD, name)))
            .build();
    }

    private VolumeStatus failedVolume(Application application, Volume volume, String error) {
        String name = volume.getName();
        return VolumeStatus.builder()
            .volumeName(name)
            .prodToDr(Relationship.unknown(name, ReplicationLink.PROD_TO_DR,
                application.sourcePath(ReplicationLink.PROD_TO_DR, name),
                application.destinationPath(ReplicationLink.PROD_TO_DR, name), error))
            .drToProd(Relationship.unknown(name, ReplicationLink.DR_TO_PROD,
                application.sourcePath(ReplicationLink.DR_TO_PROD, name),
                application.destinationPath(ReplicationLink.DR_TO_PROD, name), error))
            .build();
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }
}
