package io.drcontroller.enums;

/**
 * Resolved replication direction of a whole application.
 *
 * PROD_TO_DR: production is writable, DR_TO_PROD: DR is writable,
 * INCONSISTENT: volumes disagree or at least one could not be determined.
 */
public enum ReplicationDirection {
    PROD_TO_DR,
    DR_TO_PROD,
    INCONSISTENT;

    public static ReplicationDirection fromWritableSite(Site site) {
        if (site == null) return INCONSISTENT;
        return site == Site.PROD ? PROD_TO_DR : DR_TO_PROD;
    }

    public Site getWritableSite() {
        switch (this) {
            case PROD_TO_DR:
                return Site.PROD;
            case DR_TO_PROD:
                return Site.DR;
            default:
                return null;
        }
    }
}
