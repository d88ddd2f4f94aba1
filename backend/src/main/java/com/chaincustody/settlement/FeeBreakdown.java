package com.chaincustody.settlement;

import java.math.BigDecimal;

/**
 * Fee components of one withdrawal, in the withdrawn currency. {@code total} is what is debited on top of the amount.
 */
public record FeeBreakdown(BigDecimal networkFee, BigDecimal activationFee, BigDecimal serviceFee, BigDecimal total) {

    public static FeeBreakdown of(BigDecimal networkFee, BigDecimal activationFee, BigDecimal serviceFee) {
        return new FeeBreakdown(networkFee, activationFee, serviceFee, networkFee.add(activationFee).add(serviceFee));
    }
}
