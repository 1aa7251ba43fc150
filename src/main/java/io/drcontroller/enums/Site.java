package io.drcontroller.enums;

/**
 * Physical site of a cluster: production or disaster recovery.
 */
public enum Site {
    PROD,
    DR;

    public Site other() {
        return this == PROD ? DR : PROD;
    }
}
