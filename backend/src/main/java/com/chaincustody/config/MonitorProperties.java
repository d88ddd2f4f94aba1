package com.chaincustody.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deposit monitor cadence and fail-stop threshold.
 */
@ConfigurationProperties(prefix = "chaincustody.monitor")
@NoArgsConstructor
@Getter
@Setter
public class MonitorProperties {

    /** Baseline interval between poll cycles. */
    private long pollIntervalMs = 30_000;

    /** Ceiling of the error backoff. */
    private long maxBackoffMs = 300_000;

    /** Consecutive failed cycles after which a monitor stops itself. */
    private int maxConsecutiveErrors = 5;

    /** Start monitors for all stored watched addresses when the application is ready. */
    private boolean autostart = true;

    private int schedulerPoolSize = 8;
}
