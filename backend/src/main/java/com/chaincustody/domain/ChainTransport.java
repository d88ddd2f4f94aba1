package com.chaincustody.domain;

/**
 * How observed transactions reach this service for a chain.
 */
public enum ChainTransport {
    NODE_RPC,
    EXPLORER_API,
    THIRD_PARTY
}
