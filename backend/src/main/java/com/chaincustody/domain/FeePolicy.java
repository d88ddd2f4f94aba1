package com.chaincustody.domain;

/**
 * Which fee components apply to a withdrawal on a chain. The service fee always applies.
 */
public enum FeePolicy {
    SERVICE_ONLY,
    NETWORK_ESTIMATE,
    ACTIVATION_AND_ESTIMATE
}
