package com.chaincustody.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * A transaction as seen by one poll of the external chain view. Rebuilt on every poll, never persisted.
 * {@code rawAmount} is in minor units of the chain.
 */
public record ObservedTransaction(
        String hash,
        String chain,
        String address,
        BigInteger rawAmount,
        int confirmations,
        TransactionDirection direction,
        Instant blockTime
) {
}
