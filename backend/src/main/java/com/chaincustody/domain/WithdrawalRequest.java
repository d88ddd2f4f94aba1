package com.chaincustody.domain;

import java.math.BigDecimal;

/**
 * Authorized withdrawal handed to the settlement queue. {@code computedFee} is null until the queue prices it.
 */
public record WithdrawalRequest(
        String userId,
        String walletId,
        String chain,
        String currency,
        BigDecimal amount,
        String toAddress,
        BigDecimal computedFee
) {

    public WithdrawalRequest withFee(BigDecimal fee) {
        return new WithdrawalRequest(userId, walletId, chain, currency, amount, toAddress, fee);
    }
}
