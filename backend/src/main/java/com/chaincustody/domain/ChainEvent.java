package com.chaincustody.domain;

import java.time.Instant;

/**
 * Application event carrying one broadcast: a topic and its payload.
 */
public record ChainEvent(String topic, Object payload, Instant publishedAt) {
}
