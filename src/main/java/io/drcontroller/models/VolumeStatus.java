package io.drcontroller.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.drcontroller.enums.RelationshipState;
import io.drcontroller.enums.ReplicationLink;
import io.drcontroller.enums.Site;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Both relationships of one volume plus the site currently writable for it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VolumeStatus {

    @JsonProperty("volume")
    private String volumeName;

    @JsonProperty("prod_to_dr")
    private Relationship prodToDr;

    @JsonProperty("dr_to_prod")
    private Relationship drToProd;

    @JsonProperty("writable_site")
    private Site writableSite; // null when undetermined

    public Relationship relationship(ReplicationLink link) {
        return link == ReplicationLink.PROD_TO_DR ? prodToDr : drToProd;
    }

    /**
     * Link that day-to-day actions (update, quiesce, break, resync) operate on.
     * DR_TO_PROD once it exists and the PROD_TO_DR link is gone or broken off.
     */
    @JsonIgnore
    public ReplicationLink getWorkingLink() {
        boolean reversePresent = drToProd != null && drToProd.isPresent();
        boolean forwardUsable = prodToDr != null && prodToDr.isPresent()
            && prodToDr.getState() != RelationshipState.BROKEN_OFF;
        if (reversePresent && !forwardUsable) {
            return ReplicationLink.DR_TO_PROD;
        }
        return ReplicationLink.PROD_TO_DR;
    }

    @JsonIgnore
    public boolean isCancelled() {
        return (prodToDr != null && prodToDr.getState() == RelationshipState.CANCELLED)
            || (drToProd != null && drToProd.getState() == RelationshipState.CANCELLED);
    }

    @JsonIgnore
    public boolean hasErrors() {
        return (prodToDr != null && prodToDr.getError() != null)
            || (drToProd != null && drToProd.getError() != null);
    }
}
