package com.chaincustody.domain;

import java.math.BigDecimal;

/**
 * Terminal result of one withdrawal request.
 */
public record WithdrawalOutcome(
        Status status,
        String transactionId,
        BigDecimal amount,
        BigDecimal fee,
        SettlementErrorCode errorCode,
        String message
) {

    public enum Status {
        SETTLED,
        REJECTED
    }

    public static WithdrawalOutcome settled(PersistedTransaction transaction) {
        return new WithdrawalOutcome(Status.SETTLED, transaction.getId(), transaction.getAmount(),
                transaction.getFee(), null, "Withdrawal request submitted successfully");
    }

    public static WithdrawalOutcome rejected(SettlementErrorCode errorCode, String message) {
        return new WithdrawalOutcome(Status.REJECTED, null, null, null, errorCode, message);
    }

    public boolean isSettled() {
        return status == Status.SETTLED;
    }
}
