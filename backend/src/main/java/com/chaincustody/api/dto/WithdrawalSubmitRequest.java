package com.chaincustody.api.dto;

import com.chaincustody.domain.WithdrawalRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * POST /api/v1/withdrawals request body. Authorization happens upstream; this service trusts the caller.
 */
public record WithdrawalSubmitRequest(
        @NotBlank(message = "INVALID_USER")
        String userId,

        @NotBlank(message = "WALLET_NOT_FOUND")
        String walletId,

        @NotBlank(message = "UNSUPPORTED_CHAIN")
        String chain,

        @NotBlank(message = "TOKEN_NOT_FOUND")
        String currency,

        @NotNull(message = "INVALID_AMOUNT")
        @Positive(message = "INVALID_AMOUNT")
        BigDecimal amount,

        @NotBlank(message = "INVALID_ADDRESS")
        String toAddress
) {

    public WithdrawalRequest toRequest() {
        return new WithdrawalRequest(userId, walletId, chain, currency, amount, toAddress.trim(), null);
    }
}
