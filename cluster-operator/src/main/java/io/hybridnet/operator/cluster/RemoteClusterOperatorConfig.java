/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster;

import io.hybridnet.operator.cluster.leaderelection.LeaderElectionManagerConfig;
import io.hybridnet.operator.cluster.operator.remotecluster.RemoteClusterEventPipeline;
import io.hybridnet.operator.cluster.operator.remotecluster.RemoteClusterHealthChecker;
import io.hybridnet.operator.common.InvalidConfigurationException;

import java.util.Map;

/**
 * Remote Cluster Operator configuration
 */
public class RemoteClusterOperatorConfig {
    /**
     * Delay between two rounds of health checks
     */
    public static final String HEALTH_CHECK_PERIOD_MS = "HYBRIDNET_HEALTH_CHECK_PERIOD_MS";

    /**
     * Number of events which can wait in the event pipeline
     */
    public static final String EVENT_QUEUE_CAPACITY = "HYBRIDNET_EVENT_QUEUE_CAPACITY";

    /**
     * Pause of the event pipeline after each event
     */
    public static final String EVENT_THROTTLE_MS = "HYBRIDNET_EVENT_THROTTLE_MS";

    /**
     * Initial delay before a failed reconciliation is retried
     */
    public static final String WORKQUEUE_BASE_DELAY_MS = "HYBRIDNET_WORKQUEUE_BASE_DELAY_MS";

    /**
     * Maximal delay before a failed reconciliation is retried
     */
    public static final String WORKQUEUE_MAX_DELAY_MS = "HYBRIDNET_WORKQUEUE_MAX_DELAY_MS";

    /**
     * Number of retries before a failing remote cluster is dropped from the work queue
     */
    public static final String WORKQUEUE_MAX_RETRIES = "HYBRIDNET_WORKQUEUE_MAX_RETRIES";

    /**
     * Maximal time to wait for the informer caches to sync during startup
     */
    public static final String CACHE_SYNC_TIMEOUT_MS = "HYBRIDNET_CACHE_SYNC_TIMEOUT_MS";

    /**
     * Resync period of the informers
     */
    public static final String INFORMER_RESYNC_MS = "HYBRIDNET_INFORMER_RESYNC_MS";

    /**
     * Namespace the operator runs in
     */
    public static final String OPERATOR_NAMESPACE = "HYBRIDNET_OPERATOR_NAMESPACE";

    static final long DEFAULT_WORKQUEUE_BASE_DELAY_MS = 5L;
    static final long DEFAULT_WORKQUEUE_MAX_DELAY_MS = 1_000_000L;
    static final int DEFAULT_WORKQUEUE_MAX_RETRIES = 15;
    static final long DEFAULT_CACHE_SYNC_TIMEOUT_MS = 120_000L;
    static final long DEFAULT_INFORMER_RESYNC_MS = 300_000L;
    static final String DEFAULT_OPERATOR_NAMESPACE = "kube-system";

    private final long healthCheckPeriodMs;
    private final int eventQueueCapacity;
    private final long eventThrottleMs;
    private final long workQueueBaseDelayMs;
    private final long workQueueMaxDelayMs;
    private final int workQueueMaxRetries;
    private final long cacheSyncTimeoutMs;
    private final long informerResyncMs;
    private final String operatorNamespace;
    private final LeaderElectionManagerConfig leaderElectionConfig;

    /**
     * Constructor
     *
     * @param healthCheckPeriodMs   Delay between two rounds of health checks, non-positive values use the default
     * @param eventQueueCapacity    Capacity of the event pipeline
     * @param eventThrottleMs       Pause of the event pipeline after each event
     * @param workQueueBaseDelayMs  Initial retry delay of the work queue
     * @param workQueueMaxDelayMs   Maximal retry delay of the work queue
     * @param workQueueMaxRetries   Number of retries of a failing remote cluster
     * @param cacheSyncTimeoutMs    Timeout of the initial cache sync
     * @param informerResyncMs      Resync period of the informers
     * @param operatorNamespace     Namespace the operator runs in
     * @param leaderElectionConfig  Leader election configuration or null when leader election is disabled
     */
    @SuppressWarnings("checkstyle:ParameterNumber")
    public RemoteClusterOperatorConfig(long healthCheckPeriodMs, int eventQueueCapacity, long eventThrottleMs,
                                       long workQueueBaseDelayMs, long workQueueMaxDelayMs, int workQueueMaxRetries,
                                       long cacheSyncTimeoutMs, long informerResyncMs, String operatorNamespace,
                                       LeaderElectionManagerConfig leaderElectionConfig) {
        this.healthCheckPeriodMs = healthCheckPeriodMs > 0 ? healthCheckPeriodMs : RemoteClusterHealthChecker.DEFAULT_PERIOD_MS;
        this.eventQueueCapacity = eventQueueCapacity;
        this.eventThrottleMs = eventThrottleMs;
        this.workQueueBaseDelayMs = workQueueBaseDelayMs;
        this.workQueueMaxDelayMs = workQueueMaxDelayMs;
        this.workQueueMaxRetries = workQueueMaxRetries;
        this.cacheSyncTimeoutMs = cacheSyncTimeoutMs;
        this.informerResyncMs = informerResyncMs;
        this.operatorNamespace = operatorNamespace;
        this.leaderElectionConfig = leaderElectionConfig;
    }

    /**
     * Loads configuration parameters from a related map
     *
     * @param map   map from which loading configuration parameters
     *
     * @return  Remote Cluster Operator configuration instance
     */
    public static RemoteClusterOperatorConfig buildFromMap(Map<String, String> map) {
        long healthCheckPeriodMs = parseLong(map, HEALTH_CHECK_PERIOD_MS, RemoteClusterHealthChecker.DEFAULT_PERIOD_MS);
        int eventQueueCapacity = parseInt(map, EVENT_QUEUE_CAPACITY, RemoteClusterEventPipeline.DEFAULT_CAPACITY);
        long eventThrottleMs = parseLong(map, EVENT_THROTTLE_MS, RemoteClusterEventPipeline.DEFAULT_THROTTLE_MS);
        long baseDelayMs = parseLong(map, WORKQUEUE_BASE_DELAY_MS, DEFAULT_WORKQUEUE_BASE_DELAY_MS);
        long maxDelayMs = parseLong(map, WORKQUEUE_MAX_DELAY_MS, DEFAULT_WORKQUEUE_MAX_DELAY_MS);
        int maxRetries = parseInt(map, WORKQUEUE_MAX_RETRIES, DEFAULT_WORKQUEUE_MAX_RETRIES);
        long cacheSyncTimeoutMs = parseLong(map, CACHE_SYNC_TIMEOUT_MS, DEFAULT_CACHE_SYNC_TIMEOUT_MS);
        long informerResyncMs = parseLong(map, INFORMER_RESYNC_MS, DEFAULT_INFORMER_RESYNC_MS);
        String namespace = map.getOrDefault(OPERATOR_NAMESPACE, DEFAULT_OPERATOR_NAMESPACE);

        if (eventQueueCapacity <= 0) {
            throw new InvalidConfigurationException(EVENT_QUEUE_CAPACITY + " has to be positive, but was " + eventQueueCapacity);
        } else if (eventThrottleMs < 0) {
            throw new InvalidConfigurationException(EVENT_THROTTLE_MS + " must not be negative, but was " + eventThrottleMs);
        } else if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new InvalidConfigurationException(WORKQUEUE_BASE_DELAY_MS + " has to be positive and not larger than "
                    + WORKQUEUE_MAX_DELAY_MS + ", but they were " + baseDelayMs + " and " + maxDelayMs);
        } else if (maxRetries < 0) {
            throw new InvalidConfigurationException(WORKQUEUE_MAX_RETRIES + " must not be negative, but was " + maxRetries);
        } else if (cacheSyncTimeoutMs <= 0) {
            throw new InvalidConfigurationException(CACHE_SYNC_TIMEOUT_MS + " has to be positive, but was " + cacheSyncTimeoutMs);
        } else if (informerResyncMs < 0) {
            throw new InvalidConfigurationException(INFORMER_RESYNC_MS + " must not be negative, but was " + informerResyncMs);
        } else if (namespace.isBlank()) {
            throw new InvalidConfigurationException(OPERATOR_NAMESPACE + " must not be empty");
        }

        return new RemoteClusterOperatorConfig(healthCheckPeriodMs, eventQueueCapacity, eventThrottleMs, baseDelayMs,
                maxDelayMs, maxRetries, cacheSyncTimeoutMs, informerResyncMs, namespace,
                LeaderElectionManagerConfig.fromMap(map, namespace));
    }

    private static long parseLong(Map<String, String> map, String key, long defaultValue) {
        String value = map.get(key);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse " + key + " with value " + value, e);
        }
    }

    private static int parseInt(Map<String, String> map, String key, int defaultValue) {
        String value = map.get(key);

        if (value == null || value.isBlank()) {
            return defaultValue;
        }

        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse " + key + " with value " + value, e);
        }
    }

    /**
     * @return  Delay between two rounds of health checks
     */
    public long getHealthCheckPeriodMs() {
        return healthCheckPeriodMs;
    }

    /**
     * @return  Capacity of the event pipeline
     */
    public int getEventQueueCapacity() {
        return eventQueueCapacity;
    }

    /**
     * @return  Pause of the event pipeline after each event
     */
    public long getEventThrottleMs() {
        return eventThrottleMs;
    }

    /**
     * @return  Initial retry delay of the work queue
     */
    public long getWorkQueueBaseDelayMs() {
        return workQueueBaseDelayMs;
    }

    /**
     * @return  Maximal retry delay of the work queue
     */
    public long getWorkQueueMaxDelayMs() {
        return workQueueMaxDelayMs;
    }

    /**
     * @return  Number of retries of a failing remote cluster
     */
    public int getWorkQueueMaxRetries() {
        return workQueueMaxRetries;
    }

    /**
     * @return  Timeout of the initial cache sync
     */
    public long getCacheSyncTimeoutMs() {
        return cacheSyncTimeoutMs;
    }

    /**
     * @return  Resync period of the informers
     */
    public long getInformerResyncMs() {
        return informerResyncMs;
    }

    /**
     * @return  Namespace the operator runs in
     */
    public String getOperatorNamespace() {
        return operatorNamespace;
    }

    /**
     * @return  Leader election configuration or null when leader election is disabled
     */
    public LeaderElectionManagerConfig getLeaderElectionConfig() {
        return leaderElectionConfig;
    }

    @Override
    public String toString() {
        return "RemoteClusterOperatorConfig(" +
                "healthCheckPeriodMs=" + healthCheckPeriodMs +
                ",eventQueueCapacity=" + eventQueueCapacity +
                ",eventThrottleMs=" + eventThrottleMs +
                ",workQueueBaseDelayMs=" + workQueueBaseDelayMs +
                ",workQueueMaxDelayMs=" + workQueueMaxDelayMs +
                ",workQueueMaxRetries=" + workQueueMaxRetries +
                ",cacheSyncTimeoutMs=" + cacheSyncTimeoutMs +
                ",informerResyncMs=" + informerResyncMs +
                ",operatorNamespace=" + operatorNamespace +
                ",leaderElectionConfig=" + leaderElectionConfig +
                ")";
    }
}
