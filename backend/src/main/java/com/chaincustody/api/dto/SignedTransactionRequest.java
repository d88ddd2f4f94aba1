package com.chaincustody.api.dto;

import jakarta.validation.constraints.NotBlank;

public record SignedTransactionRequest(@NotBlank(message = "INVALID_TRANSACTION") String signedTransaction) {
}
