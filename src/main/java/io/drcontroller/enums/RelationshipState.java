package io.drcontroller.enums;

/**
 * Lifecycle state of one SnapMirror relationship, derived from the mirror state and
 * relationship status columns reported by the cluster.
 *
 * CANCELLED is never produced by parsing; it marks queries or actions abandoned by cancellation.
 */
public enum RelationshipState {
    UNINITIALIZED,
    MIRRORED,
    QUIESCED,
    BROKEN_OFF,
    RESYNCING,
    TRANSFERRING,
    UNKNOWN,
    CANCELLED;

    public boolean isDetermined() {
        return this != UNKNOWN && this != CANCELLED;
    }
}
