/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event recorder keeping the recorded events in memory
 */
public class RecordingEventRecorder implements EventRecorder {
    /**
     * Recorded event
     *
     * @param name      Name of the resource
     * @param type      Event type
     * @param reason    Event reason
     * @param message   Event message
     */
    public record Recorded(String name, String type, String reason, String message) { }

    private final List<Recorded> events = new CopyOnWriteArrayList<>();

    @Override
    public void event(HasMetadata target, String type, String reason, String message) {
        events.add(new Recorded(target.getMetadata().getName(), type, reason, message));
    }

    public List<Recorded> events() {
        return new ArrayList<>(events);
    }

    public List<String> reasons() {
        return events.stream().map(Recorded::reason).toList();
    }
}
