/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.remotecluster;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;

/**
 * Parameters used to connect to the API server of a remote cluster. Two connection configurations are equal when
 * all their fields are equal. Any difference means the live session to the peer has to be replaced.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"endpoint", "caBundle", "clientCert", "clientKey", "timeout"})
@EqualsAndHashCode
@ToString(exclude = {"clientKey"})
public class ConnConfig implements Serializable {
    private static final long serialVersionUID = 1L;

    private String endpoint;
    private String caBundle;
    private String clientCert;
    private String clientKey;
    private Integer timeout;

    /**
     * @return  URL of the remote API server
     */
    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    /**
     * @return  Base64 encoded PEM bundle of the remote cluster CA
     */
    public String getCaBundle() {
        return caBundle;
    }

    public void setCaBundle(String caBundle) {
        this.caBundle = caBundle;
    }

    /**
     * @return  Base64 encoded PEM client certificate
     */
    public String getClientCert() {
        return clientCert;
    }

    public void setClientCert(String clientCert) {
        this.clientCert = clientCert;
    }

    /**
     * @return  Base64 encoded PEM client key
     */
    public String getClientKey() {
        return clientKey;
    }

    public void setClientKey(String clientKey) {
        this.clientKey = clientKey;
    }

    /**
     * @return  Connection and request timeout in seconds, or null for the client default
     */
    public Integer getTimeout() {
        return timeout;
    }

    public void setTimeout(Integer timeout) {
        this.timeout = timeout;
    }
}
