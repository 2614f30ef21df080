/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.network;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;
import io.hybridnet.api.networking.model.common.Constants;

/**
 * A network of the local cluster. The remote cluster operator only reads networks, to find the identifier of the
 * overlay network.
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(Network.GROUP)
@Version(Network.VERSION)
@Kind(Network.RESOURCE_KIND)
@Plural(Network.RESOURCE_PLURAL)
public class Network extends CustomResource<NetworkSpec, NetworkStatus> {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = Constants.RESOURCE_GROUP_NAME;
    public static final String VERSION = Constants.V1;
    public static final String RESOURCE_KIND = "Network";
    public static final String RESOURCE_PLURAL = "networks";

    /**
     * @return  True when this is an overlay network
     */
    @JsonIgnore
    public boolean isOverlay() {
        return getSpec() != null && NetworkType.OVERLAY.equals(getSpec().getType());
    }

    /**
     * @return  The network identifier, or null when the spec does not set one
     */
    public Long netId() {
        return getSpec() != null ? getSpec().getNetId() : null;
    }
}
