package io.drcontroller.executor;

/**
 * Opens sessions to clusters by name.
 */
public interface ClusterConnector {

    ClusterSession open(String cluster) throws ConnectionException;
}
