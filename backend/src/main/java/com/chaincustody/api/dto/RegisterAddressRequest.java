package com.chaincustody.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/monitors request body.
 */
public record RegisterAddressRequest(
        @NotBlank(message = "WALLET_NOT_FOUND")
        String walletId,

        @NotBlank(message = "UNSUPPORTED_CHAIN")
        String chain,

        @NotBlank(message = "INVALID_ADDRESS")
        String address
) {
}
