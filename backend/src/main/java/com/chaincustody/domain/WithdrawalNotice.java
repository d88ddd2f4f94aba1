package com.chaincustody.domain;

import java.math.BigDecimal;

/**
 * Payload of withdrawal.* events.
 */
public record WithdrawalNotice(
        String transactionId,
        String walletId,
        String chain,
        String currency,
        BigDecimal amount,
        BigDecimal fee,
        String toAddress,
        TransactionStatus status,
        String broadcastHash
) {

    public static WithdrawalNotice of(PersistedTransaction tx) {
        return new WithdrawalNotice(tx.getId(), tx.getWalletId(), tx.getChain(), tx.getCurrency(), tx.getAmount(),
                tx.getFee(), tx.getToAddress(), tx.getStatus(), tx.getBroadcastHash());
    }
}
