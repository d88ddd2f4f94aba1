package com.chaincustody.domain;

import lombok.Getter;

/**
 * Domain failure of a settlement or ledger operation. The API layer maps the code to 400/404.
 */
@Getter
public class SettlementException extends RuntimeException {

    private final SettlementErrorCode errorCode;

    public SettlementException(SettlementErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
