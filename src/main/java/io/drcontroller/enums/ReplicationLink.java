package io.drcontroller.enums;

/**
 * The two possible replication pairings of a volume. Commands for a link always run on
 * the cluster hosting its destination.
 */
public enum ReplicationLink {
    PROD_TO_DR(Site.PROD, Site.DR),
    DR_TO_PROD(Site.DR, Site.PROD);

    private final Site sourceSite;
    private final Site destinationSite;

    ReplicationLink(Site sourceSite, Site destinationSite) {
        this.sourceSite = sourceSite;
        this.destinationSite = destinationSite;
    }

    public Site getSourceSite() {
        return sourceSite;
    }

    public Site getDestinationSite() {
        return destinationSite;
    }

    public ReplicationLink reverse() {
        return this == PROD_TO_DR ? DR_TO_PROD : PROD_TO_DR;
    }
}
