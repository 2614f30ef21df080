/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.remotecluster;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.fabric8.kubernetes.api.model.KubernetesResource;
import io.hybridnet.api.networking.model.common.Condition;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Observed state of a remote cluster. Fields left null are omitted when serialized, so a partially filled status
 * can be used as a JSON merge patch without touching the other fields.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(using = JsonDeserializer.None.class)
@JsonPropertyOrder({"uuid", "state", "conditions"})
@EqualsAndHashCode
@ToString
public class RemoteClusterStatus implements KubernetesResource {
    private static final long serialVersionUID = 1L;

    private String uuid;
    private String state;
    private List<Condition> conditions;

    /**
     * @return  UUID of the remote cluster (UID of its kube-system namespace)
     */
    public String getUuid() {
        return uuid;
    }

    public void setUuid(String uuid) {
        this.uuid = uuid;
    }

    /**
     * @return  One of the {@link ClusterState} values
     */
    public String getState() {
        return state;
    }

    public void setState(String state) {
        this.state = state;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions;
    }
}
