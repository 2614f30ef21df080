/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import io.hybridnet.operator.cluster.operator.remotecluster.session.RemoteClusterSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions keyed by the name of their remote cluster
 */
public class SessionRegistry {
    private static final Logger LOGGER = LogManager.getLogger(SessionRegistry.class);

    private final Map<String, RemoteClusterSession> sessions = new ConcurrentHashMap<>();

    /**
     * @param name  Name of the remote cluster
     *
     * @return  Session of the remote cluster or null
     */
    public RemoteClusterSession get(String name) {
        return sessions.get(name);
    }

    /**
     * Registers a session. A session previously registered under the same name is closed.
     *
     * @param name      Name of the remote cluster
     * @param session   New session
     */
    public void set(String name, RemoteClusterSession session) {
        RemoteClusterSession previous = sessions.put(name, session);

        if (previous != null && previous != session) {
            closeQuietly(name, previous);
        }
    }

    /**
     * Closes and removes the session of the remote cluster
     *
     * @param name  Name of the remote cluster
     *
     * @return  True when a session was removed
     */
    public boolean delete(String name) {
        RemoteClusterSession removed = sessions.remove(name);

        if (removed != null) {
            closeQuietly(name, removed);
            return true;
        }

        return false;
    }

    /**
     * Closes and removes all sessions
     */
    public void closeAll() {
        for (String name : sessions.keySet()) {
            delete(name);
        }
    }

    /**
     * @return  Number of live sessions
     */
    public int size() {
        return sessions.size();
    }

    private static void closeQuietly(String name, RemoteClusterSession session) {
        try {
            session.close();
            LOGGER.debug("Closed session of remote cluster {}", name);
        } catch (RuntimeException e) {
            LOGGER.warn("Failed to close session of remote cluster {}", name, e);
        }
    }
}
