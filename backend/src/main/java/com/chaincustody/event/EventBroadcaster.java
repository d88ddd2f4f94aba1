package com.chaincustody.event;

/**
 * Fan-out of (topic, payload) to subscribers. Delivery is best effort; implementations must not throw
 * back into the publisher for subscriber failures.
 */
public interface EventBroadcaster {

    void publish(String topic, Object payload);
}
