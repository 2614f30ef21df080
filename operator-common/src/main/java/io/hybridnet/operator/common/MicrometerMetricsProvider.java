/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Metrics provider backed by a Micrometer registry. All metric names are prefixed with "hybridnet_".
 */
public class MicrometerMetricsProvider implements MetricsProvider {
    private static final String METRICS_PREFIX = "hybridnet_";

    private final MeterRegistry metrics;

    /**
     * Constructor
     *
     * @param metrics   Meter registry where the metrics are registered
     */
    public MicrometerMetricsProvider(MeterRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public MeterRegistry meterRegistry() {
        return metrics;
    }

    @Override
    public Counter counter(String name, String description, Tags tags) {
        return Counter.builder(METRICS_PREFIX + name)
                .description(description)
                .tags(tags)
                .register(metrics);
    }

    @Override
    public Timer timer(String name, String description, Tags tags) {
        return Timer.builder(METRICS_PREFIX + name)
                .description(description)
                .tags(tags)
                .register(metrics);
    }

    @Override
    public AtomicInteger gauge(String name, String description, Tags tags) {
        AtomicInteger gauge = new AtomicInteger(0);
        Gauge.builder(METRICS_PREFIX + name, () -> gauge)
                .description(description)
                .tags(tags)
                .register(metrics);

        return gauge;
    }
}
