/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.event;

/**
 * Side effect requested by a session or by the reconciler. Events are consumed once, in the order they were
 * submitted.
 */
public final class RemoteClusterEvent {
    /**
     * Kinds of events
     */
    public enum Type {
        /**
         * Persist a newly observed peer UUID
         */
        REFRESH_UUID,
        /**
         * Refresh the status of the remote cluster now instead of waiting for the next health check round
         */
        UPDATE_STATUS,
        /**
         * Record a Kubernetes event on the remote cluster
         */
        RECORD_EVENT
    }

    private final Type type;
    private final String clusterName;
    private final String uuid;
    private final EventBody body;

    private RemoteClusterEvent(Type type, String clusterName, String uuid, EventBody body) {
        this.type = type;
        this.clusterName = clusterName;
        this.uuid = uuid;
        this.body = body;
    }

    /**
     * @param uuid          Observed UUID of the peer
     * @param clusterName   Name of the remote cluster
     *
     * @return  RefreshUUID event
     */
    public static RemoteClusterEvent refreshUuid(String uuid, String clusterName) {
        return new RemoteClusterEvent(Type.REFRESH_UUID, clusterName, uuid, null);
    }

    /**
     * @param clusterName   Name of the remote cluster
     *
     * @return  UpdateStatus event
     */
    public static RemoteClusterEvent updateStatus(String clusterName) {
        return new RemoteClusterEvent(Type.UPDATE_STATUS, clusterName, null, null);
    }

    /**
     * @param clusterName   Name of the remote cluster
     * @param type          Event type
     * @param reason        Event reason
     * @param message       Event message
     *
     * @return  RecordEvent event
     */
    public static RemoteClusterEvent recordEvent(String clusterName, String type, String reason, String message) {
        return new RemoteClusterEvent(Type.RECORD_EVENT, clusterName, null, new EventBody(type, reason, message));
    }

    public Type getType() {
        return type;
    }

    public String getClusterName() {
        return clusterName;
    }

    public String getUuid() {
        return uuid;
    }

    public EventBody getBody() {
        return body;
    }

    @Override
    public String toString() {
        return "RemoteClusterEvent(type=" + type + ", clusterName=" + clusterName
                + (uuid != null ? ", uuid=" + uuid : "")
                + (body != null ? ", body=" + body : "") + ")";
    }
}
