package io.drcontroller.status;

import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationDirection;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.Site;
import io.drcontroller.models.Relationship;
import io.drcontroller.models.VolumeStatus;

import java.util.List;
import java.util.Set;

/**
 * Decides which site is writable, per relationship, per volume and for a whole application.
 * Pure functions; no remote calls.
 */
public class DirectionResolver {

    // States in which the destination of a link is still a read-only mirror
    private static final Set<RelationshipState> DESTINATION_READ_ONLY = Set.of(
        RelationshipState.MIRRORED,
        RelationshipState.QUIESCED,
        RelationshipState.TRANSFERRING,
        RelationshipState.RESYNCING,
        RelationshipState.UNINITIALIZED
    );

    /**
     * Writable site implied by one relationship, or null when it cannot be determined.
     */
    public Site writableSite(Relationship relationship) {
        if (relationship == null || !relationship.isPresent() || relationship.getState() == null) {
            return null;
        }
        ReplicationLink link = relationship.getLink();
        if (DESTINATION_READ_ONLY.contains(relationship.getState())) {
            return link.getSourceSite();
        }
        if (relationship.getState() == RelationshipState.BROKEN_OFF) {
            return link.getDestinationSite();
        }
        return null;
    }

    /**
     * Writable site of a volume: the present links must agree. Null when they disagree,
     * any present link is undetermined, or no link exists at all.
     */
    public Site writableSite(Relationship prodToDr, Relationship drToProd) {
        Site result = null;
        boolean anyPresent = false;
        for (Relationship relationship : new Relationship[]{prodToDr, drToProd}) {
            if (relationship == null || !relationship.isPresent()) {
                continue;
            }
            anyPresent = true;
            Site site = writableSite(relationship);
            if (site == null) {
                return null;
            }
            if (result != null && result != site) {
                return null;
            }
            result = site;
        }
        return anyPresent ? result : null;
    }

    /**
     * Application direction: unanimous writable site across every volume, INCONSISTENT otherwise.
     */
    public ReplicationDirection resolve(List<VolumeStatus> volumes) {
        if (volumes == null || volumes.isEmpty()) {
            return ReplicationDirection.INCONSISTENT;
        }
        Site agreed = null;
        for (VolumeStatus volume : volumes) {
            Site site = volume.getWritableSite();
            if (site == null || (agreed != null && agreed != site)) {
                return ReplicationDirection.INCONSISTENT;
            }
            agreed = site;
        }
        return ReplicationDirection.fromWritableSite(agreed);
    }
}
