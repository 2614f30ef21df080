/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.subnet;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

public class SubnetList extends DefaultKubernetesResourceList<Subnet> {
    private static final long serialVersionUID = 1L;
}
