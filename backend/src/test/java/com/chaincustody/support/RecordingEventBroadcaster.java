package com.chaincustody.support;

import com.chaincustody.event.EventBroadcaster;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

public class RecordingEventBroadcaster implements EventBroadcaster {

    public record Published(String topic, Object payload) {
    }

    private final List<Published> published = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String topic, Object payload) {
        published.add(new Published(topic, payload));
    }

    public List<Published> all() {
        return List.copyOf(published);
    }

    public List<Published> ofTopic(String topic) {
        return published.stream().filter(p -> p.topic().equals(topic)).toList();
    }
}
