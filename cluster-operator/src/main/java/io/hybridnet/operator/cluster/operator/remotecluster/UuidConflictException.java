/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

/**
 * Thrown when a remote cluster claims a UUID which is already owned by another remote cluster
 */
public class UuidConflictException extends Exception {
    private static final long serialVersionUID = 1L;

    private final String uuid;
    private final String owner;

    /**
     * Constructor
     *
     * @param uuid      The contested UUID
     * @param owner     Current owner of the UUID
     * @param claimant  Remote cluster which tried to claim it
     */
    public UuidConflictException(String uuid, String owner, String claimant) {
        super("UUID " + uuid + " is already owned by remote cluster " + owner + " and cannot be claimed by " + claimant);
        this.uuid = uuid;
        this.owner = owner;
    }

    /**
     * @return  The contested UUID
     */
    public String getUuid() {
        return uuid;
    }

    /**
     * @return  Current owner of the UUID
     */
    public String getOwner() {
        return owner;
    }
}
