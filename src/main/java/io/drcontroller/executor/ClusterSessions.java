package io.drcontroller.executor;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions used by one batch: at most one per cluster, opened on first use and all closed
 * together when the batch ends.
 */
@Slf4j
public class ClusterSessions implements AutoCloseable {

    private final ClusterConnector connector;
    private final Map<String, ClusterSession> sessions = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ClusterSessions(ClusterConnector connector) {
        this.connector = connector;
    }

    public ClusterSession forCluster(String cluster) throws ConnectionException {
        ClusterSession existing = sessions.get(cluster);
        if (existing != null) {
            return existing;
        }
        synchronized (this) {
            if (closed) {
                throw new ConnectionException("Sessions already closed, cannot open " + cluster);
            }
            existing = sessions.get(cluster);
            if (existing != null) {
                return existing;
            }
            log.debug("Opening session to cluster {}", cluster);
            ClusterSession session = connector.open(cluster);
            sessions.put(cluster, session);
            return session;
        }
    }

    public CommandOutput execute(String cluster, String command) throws ConnectionException {
        return forCluster(cluster).execute(command);
    }

    public int openCount() {
        return sessions.size();
    }

    @Override
    public synchronized void close() {
        closed = true;
        List<ClusterSession> toClose = new ArrayList<>(sessions.values());
        sessions.clear();
        for (ClusterSession session : toClose) {
            try {
                session.close();
                log.debug("Closed session to cluster {}", session.getCluster());
            } catch (Exception e) {
                log.warn("Error closing session to cluster {}: {}", session.getCluster(), e.getMessage());
            }
        }
    }
}
