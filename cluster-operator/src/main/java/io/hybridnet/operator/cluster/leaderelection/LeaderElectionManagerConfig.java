/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.leaderelection;

import io.hybridnet.operator.common.InvalidConfigurationException;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration of the leader election
 *
 * @param namespace         Namespace of the Lease resource
 * @param leaseName         Name of the Lease resource
 * @param identity          Identity of this replica
 * @param leaseDuration     Duration of the lease
 * @param renewDeadline     Time within which the leader has to renew the lease
 * @param retryPeriod       Period of the attempts to acquire or renew the lease
 */
public record LeaderElectionManagerConfig(String namespace, String leaseName, String identity,
                                          Duration leaseDuration, Duration renewDeadline, Duration retryPeriod) {
    /**
     * Enables the leader election
     */
    public static final String ENV_VAR_LEADER_ELECTION_ENABLED = "HYBRIDNET_LEADER_ELECTION_ENABLED";

    /**
     * Name of the Lease resource
     */
    public static final String ENV_VAR_LEADER_ELECTION_LEASE_NAME = "HYBRIDNET_LEADER_ELECTION_LEASE_NAME";

    /**
     * Identity of this replica
     */
    public static final String ENV_VAR_LEADER_ELECTION_IDENTITY = "HYBRIDNET_LEADER_ELECTION_IDENTITY";

    /**
     * Duration of the lease
     */
    public static final String ENV_VAR_LEADER_ELECTION_LEASE_DURATION_MS = "HYBRIDNET_LEADER_ELECTION_LEASE_DURATION_MS";

    /**
     * Time within which the leader has to renew the lease
     */
    public static final String ENV_VAR_LEADER_ELECTION_RENEW_DEADLINE_MS = "HYBRIDNET_LEADER_ELECTION_RENEW_DEADLINE_MS";

    /**
     * Period of the attempts to acquire or renew the lease
     */
    public static final String ENV_VAR_LEADER_ELECTION_RETRY_PERIOD_MS = "HYBRIDNET_LEADER_ELECTION_RETRY_PERIOD_MS";

    static final String DEFAULT_LEASE_NAME = "hybridnet-remote-cluster-operator";
    static final long DEFAULT_LEASE_DURATION_MS = 15_000L;
    static final long DEFAULT_RENEW_DEADLINE_MS = 10_000L;
    static final long DEFAULT_RETRY_PERIOD_MS = 2_000L;

    /**
     * Creates the leader election configuration from the environment
     *
     * @param map           Environment variables
     * @param namespace     Namespace of the operator
     *
     * @return  Leader election configuration or null when the leader election is disabled
     */
    public static LeaderElectionManagerConfig fromMap(Map<String, String> map, String namespace) {
        if (!Boolean.parseBoolean(map.getOrDefault(ENV_VAR_LEADER_ELECTION_ENABLED, "false"))) {
            return null;
        }

        String identity = map.getOrDefault(ENV_VAR_LEADER_ELECTION_IDENTITY, map.get("HOSTNAME"));
        if (identity == null || identity.isBlank()) {
            throw new InvalidConfigurationException(ENV_VAR_LEADER_ELECTION_IDENTITY + " or HOSTNAME has to be set when the leader election is enabled");
        }

        Duration leaseDuration = duration(map, ENV_VAR_LEADER_ELECTION_LEASE_DURATION_MS, DEFAULT_LEASE_DURATION_MS);
        Duration renewDeadline = duration(map, ENV_VAR_LEADER_ELECTION_RENEW_DEADLINE_MS, DEFAULT_RENEW_DEADLINE_MS);
        Duration retryPeriod = duration(map, ENV_VAR_LEADER_ELECTION_RETRY_PERIOD_MS, DEFAULT_RETRY_PERIOD_MS);

        if (renewDeadline.compareTo(leaseDuration) >= 0 || retryPeriod.compareTo(renewDeadline) >= 0) {
            throw new InvalidConfigurationException("Leader election requires retry period < renew deadline < lease duration");
        }

        return new LeaderElectionManagerConfig(namespace,
                map.getOrDefault(ENV_VAR_LEADER_ELECTION_LEASE_NAME, DEFAULT_LEASE_NAME),
                identity,
                leaseDuration,
                renewDeadline,
                retryPeriod);
    }

    private static Duration duration(Map<String, String> map, String key, long defaultMs) {
        String value = map.get(key);

        if (value == null || value.isBlank()) {
            return Duration.ofMillis(defaultMs);
        }

        try {
            long ms = Long.parseLong(value.trim());
            if (ms <= 0) {
                throw new InvalidConfigurationException(key + " has to be positive, but was " + ms);
            }
            return Duration.ofMillis(ms);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse " + key + " with value " + value, e);
        }
    }
}
