package com.chaincustody.settlement;

import java.math.BigDecimal;

final class AmountPrecision {

    private AmountPrecision() {
    }

    /** Significant decimal places, ignoring trailing zeros: 1.50 has 1. */
    static int decimalPlaces(BigDecimal amount) {
        return Math.max(0, amount.stripTrailingZeros().scale());
    }
}
