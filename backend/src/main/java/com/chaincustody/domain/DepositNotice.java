package com.chaincustody.domain;

import java.math.BigDecimal;

/**
 * Payload of deposit.pending / deposit.confirmed events.
 */
public record DepositNotice(
        String walletId,
        String chain,
        String hash,
        String address,
        BigDecimal amount,
        int confirmations,
        int requiredConfirmations,
        TransactionStatus status
) {
}
