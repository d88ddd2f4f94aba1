package com.chaincustody.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound HTTP settings for explorer and third-party APIs.
 */
@ConfigurationProperties(prefix = "chaincustody.explorer")
@NoArgsConstructor
@Getter
@Setter
public class ExplorerProperties {

    /** Explorer request budget for this instance (Etherscan free tier allows 5/s). */
    private int maxRequestsPerSecond = 5;

    /** How long a caller may wait for a limiter permit before the call fails. */
    private long limiterTimeoutMs = 2_000;

    /** Per-request timeout. */
    private long timeoutMs = 3_000;
}
