/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.subnet;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Kind;
import io.fabric8.kubernetes.model.annotation.Plural;
import io.fabric8.kubernetes.model.annotation.Version;
import io.hybridnet.api.networking.model.common.Constants;

/**
 * An address range of a Hybridnet network
 */
@JsonDeserialize
@JsonInclude(JsonInclude.Include.NON_NULL)
@Group(Subnet.GROUP)
@Version(Subnet.VERSION)
@Kind(Subnet.RESOURCE_KIND)
@Plural(Subnet.RESOURCE_PLURAL)
public class Subnet extends CustomResource<SubnetSpec, SubnetStatus> {
    private static final long serialVersionUID = 1L;

    public static final String GROUP = Constants.RESOURCE_GROUP_NAME;
    public static final String VERSION = Constants.V1;
    public static final String RESOURCE_KIND = "Subnet";
    public static final String RESOURCE_PLURAL = "subnets";

    /**
     * @return  CIDR of the subnet, or null when the range is not set
     */
    public String cidr() {
        return getSpec() != null && getSpec().getRange() != null ? getSpec().getRange().getCidr() : null;
    }
}
