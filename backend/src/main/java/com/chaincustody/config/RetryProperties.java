package com.chaincustody.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Node RPC retry policy (exponential backoff ± jitter) for transient failures.
 */
@ConfigurationProperties(prefix = "chaincustody.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. */
    private long baseDelayMs = 500L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Total attempts per call, including the first. */
    private int maxAttempts = 3;
}
