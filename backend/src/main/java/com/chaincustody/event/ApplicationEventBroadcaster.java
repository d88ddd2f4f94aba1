package com.chaincustody.event;

import com.chaincustody.domain.ChainEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Publishes broadcasts as {@link ChainEvent} application events; subscribers are {@code @EventListener}s.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApplicationEventBroadcaster implements EventBroadcaster {

    private final ApplicationEventPublisher applicationEventPublisher;

    @Override
    public void publish(String topic, Object payload) {
        try {
            applicationEventPublisher.publishEvent(new ChainEvent(topic, payload, Instant.now()));
        } catch (RuntimeException e) {
            log.warn("Subscriber failed for topic {}: {}", topic, e.getMessage(), e);
        }
    }
}
