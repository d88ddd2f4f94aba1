package com.chaincustody.domain;

/**
 * Domain error codes surfaced to the withdrawal caller. Never retried.
 */
public enum SettlementErrorCode {
    INSUFFICIENT_FUNDS,
    UNSUPPORTED_CHAIN,
    INVALID_ADDRESS,
    INVALID_AMOUNT,
    PRECISION_EXCEEDED,
    WALLET_NOT_FOUND,
    TOKEN_NOT_FOUND,
    TRANSACTION_NOT_FOUND,
    ALREADY_BROADCAST
}
