/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.remotecluster;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;
import io.hybridnet.api.networking.model.common.Constants;

import java.util.List;

/**
 * A peer Kubernetes cluster taking part in the same overlay network fabric. RemoteCluster resources are cluster
 * scoped and are created by the administrator. Their status is owned by the remote cluster operator.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(RemoteCluster.GROUP)
@Version(RemoteCluster.VERSION)
@Kind(RemoteCluster.RESOURCE_KIND)
@Plural(RemoteCluster.RESOURCE_PLURAL)
public class RemoteCluster extends CustomResource<RemoteClusterSpec, RemoteClusterStatus> {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = Constants.RESOURCE_GROUP_NAME;
    public static final String VERSION = Constants.V1;

    public static final String SCOPE = Constants.CLUSTER_SCOPE;
    public static final String RESOURCE_KIND = "RemoteCluster";
    public static final String RESOURCE_LIST_KIND = RESOURCE_KIND + "List";
    public static final String RESOURCE_PLURAL = "remoteclusters";
    public static final String RESOURCE_SINGULAR = "remotecluster";
    public static final String CRD_NAME = RESOURCE_PLURAL + "." + GROUP;
    public static final String SHORT_NAME = "rc";
    public static final List<String> RESOURCE_SHORTNAMES = List.of(SHORT_NAME);

    /**
     * Returns the UUID reported in the status, or null when the peer identity is not known yet
     *
     * @return  Peer UUID or null
     */
    public String statusUuid() {
        return getStatus() != null ? getStatus().getUuid() : null;
    }

    /**
     * Returns the connection configuration from the spec, or null when it is missing
     *
     * @return  Connection configuration or null
     */
    public ConnConfig connConfig() {
        return getSpec() != null ? getSpec().getConnConfig() : null;
    }

    /**
     * Indicates whether the resource has been marked for deletion
     *
     * @return  True when the deletion timestamp is set
     */
    @JsonIgnore
    public boolean isMarkedForDeletion() {
        return getMetadata() != null && getMetadata().getDeletionTimestamp() != null;
    }
}
