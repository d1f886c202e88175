package com.danieljhkim.meshcoord.meshcoordinator.support;

import com.danieljhkim.meshcoord.meshcoordinator.event.EventPublisher;
import com.danieljhkim.meshcoord.meshcoordinator.event.MeshEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publisher that just keeps what it was given.
 */
public class RecordingPublisher implements EventPublisher {

    private final List<MeshEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(MeshEvent event) {
        events.add(event);
    }

    public List<MeshEvent> events() {
        return List.copyOf(events);
    }

    public <T extends MeshEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public void clear() {
        events.clear();
    }
}
