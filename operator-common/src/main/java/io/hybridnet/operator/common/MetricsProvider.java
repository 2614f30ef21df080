/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.common;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Interface for providing metrics to the operator components
 */
public interface MetricsProvider {
    /**
     * Returns the Micrometer MeterRegistry used for the metrics
     *
     * @return  Metrics registry
     */
    MeterRegistry meterRegistry();

    /**
     * Creates new Counter type metric
     *
     * @param name          Name of the metric
     * @param description   Description of the metric
     * @param tags          Tags used for the metric
     * @return  Counter metric
     */
    Counter counter(String name, String description, Tags tags);

    /**
     * Creates new Timer type metric
     *
     * @param name          Name of the metric
     * @param description   Description of the metric
     * @param tags          Tags used for the metric
     * @return  Timer metric
     */
    Timer timer(String name, String description, Tags tags);

    /**
     * Creates new Gauge type metric
     *
     * @param name          Name of the metric
     * @param description   Description of the metric
     * @param tags          Tags used for the metric
     * @return  AtomicInteger which represents the Gauge metric
     */
    AtomicInteger gauge(String name, String description, Tags tags);
}
