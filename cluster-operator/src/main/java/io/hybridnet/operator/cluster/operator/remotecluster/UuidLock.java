/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory lock mapping each peer UUID to the single remote cluster which owns it. Two RemoteCluster resources can
 * never own the same UUID at the same time. A remote cluster keeps every UUID it claimed until it is unlocked, which
 * happens only once its RemoteCluster resource is deleted.
 */
public class UuidLock {
    private static final Logger LOGGER = LogManager.getLogger(UuidLock.class);

    private final Map<String, String> ownerByUuid = new HashMap<>();
    private final Map<String, Set<String>> uuidsByOwner = new HashMap<>();

    /**
     * Claims the UUID for the owner. Claiming a UUID already owned by the same owner does nothing. UUIDs claimed
     * earlier by the same owner stay owned by it.
     *
     * @param uuid      UUID to claim
     * @param owner     Name of the claiming remote cluster
     *
     * @throws UuidConflictException    When the UUID is owned by another remote cluster
     */
    public synchronized void lockByOwner(String uuid, String owner) throws UuidConflictException {
        if (uuid == null || uuid.isEmpty() || owner == null || owner.isEmpty()) {
            throw new IllegalArgumentException("UUID and owner must not be empty");
        }

        String current = ownerByUuid.get(uuid);
        if (owner.equals(current)) {
            return;
        } else if (current != null) {
            throw new UuidConflictException(uuid, current, owner);
        }

        ownerByUuid.put(uuid, owner);
        uuidsByOwner.computeIfAbsent(owner, o -> new LinkedHashSet<>()).add(uuid);
        LOGGER.debug("Remote cluster {} claimed UUID {}", owner, uuid);
    }

    /**
     * Releases all UUIDs owned by the remote cluster
     *
     * @param owner     Name of the remote cluster
     *
     * @return  The released UUIDs, empty when the remote cluster did not own any
     */
    public synchronized Set<String> unlockByOwner(String owner) {
        Set<String> uuids = uuidsByOwner.remove(owner);

        if (uuids == null) {
            return Collections.emptySet();
        }

        uuids.forEach(ownerByUuid::remove);
        LOGGER.debug("Remote cluster {} released UUIDs {}", owner, uuids);

        return Collections.unmodifiableSet(uuids);
    }

    /**
     * @param uuid  UUID
     *
     * @return  Name of the remote cluster owning the UUID or null
     */
    public synchronized String ownerOf(String uuid) {
        return ownerByUuid.get(uuid);
    }

    /**
     * @return  Number of owned UUIDs
     */
    public synchronized int size() {
        return ownerByUuid.size();
    }
}
