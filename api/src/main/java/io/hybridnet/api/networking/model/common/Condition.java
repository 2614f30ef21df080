/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.api.networking.model.common;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serializable;

/**
 * Condition of a resource as reported in its status. The status is one of "True", "False" or "Unknown".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"type", "status", "lastTransitionTime", "reason", "message"})
@EqualsAndHashCode
@ToString
public class Condition implements Serializable {
    private static final long serialVersionUID = 1L;

    /**
     * Value of the status field for a satisfied condition
     */
    public static final String TRUE = "True";

    /**
     * Value of the status field for an unsatisfied condition
     */
    public static final String FALSE = "False";

    private String type;
    private String status;
    private String lastTransitionTime;
    private String reason;
    private String message;

    /**
     * Creates an empty condition (used by Jackson)
     */
    public Condition() {
    }

    /**
     * Creates a condition without a transition time
     *
     * @param type      Condition type
     * @param status    True, False or Unknown
     * @param reason    Machine readable reason
     * @param message   Human readable message
     */
    public Condition(String type, String status, String reason, String message) {
        this.type = type;
        this.status = status;
        this.reason = reason;
        this.message = message;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public String getLastTransitionTime() {
        return lastTransitionTime;
    }

    public void setLastTransitionTime(String lastTransitionTime) {
        this.lastTransitionTime = lastTransitionTime;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
