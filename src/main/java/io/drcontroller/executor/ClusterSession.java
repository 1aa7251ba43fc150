package io.drcontroller.executor;

/**
 * An open connection to one cluster's management CLI. Safe to call from several threads.
 */
public interface ClusterSession extends AutoCloseable {

    String getCluster();

    CommandOutput execute(String command) throws ConnectionException;

    @Override
    void close();
}
