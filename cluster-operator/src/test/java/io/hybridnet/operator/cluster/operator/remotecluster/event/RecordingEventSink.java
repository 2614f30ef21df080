/*
 * Copyright Hybridnet authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.hybridnet.operator.cluster.operator.remotecluster.event;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Event sink which only records the submitted events
 */
public class RecordingEventSink implements RemoteClusterEventSink {
    private final List<RemoteClusterEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public boolean submit(RemoteClusterEvent event) {
        events.add(event);
        return true;
    }

    public List<RemoteClusterEvent> events() {
        return new ArrayList<>(events);
    }

    public List<RemoteClusterEvent> events(RemoteClusterEvent.Type type) {
        return events.stream().filter(e -> e.getType() == type).toList();
    }
}
