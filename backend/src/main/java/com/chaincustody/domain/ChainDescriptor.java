package com.chaincustody.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Immutable per-chain settings, built once at startup by the chain registry.
 */
public record ChainDescriptor(
        String id,
        ChainFamily family,
        ChainTransport transport,
        int decimals,
        int requiredConfirmations,
        FeePolicy feePolicy,
        boolean cacheable,
        String currency,
        BigDecimal activationFee,
        TransportConfig transportConfig
) {

    /**
     * Converts minor units (satoshi, wei, sun) to standard units using the chain decimals.
     */
    public BigDecimal toStandardUnits(BigInteger rawAmount) {
        if (rawAmount == null) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(rawAmount).divide(BigDecimal.TEN.pow(decimals), decimals, RoundingMode.DOWN);
    }

    /**
     * Converts standard units to minor units; digits beyond the chain decimals are truncated.
     */
    public BigInteger toMinorUnits(BigDecimal amount) {
        if (amount == null) {
            return BigInteger.ZERO;
        }
        return amount.movePointRight(decimals).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
    }

    /**
     * Transport endpoints. Fields not relevant to the chain's transport are null.
     *
     * @param network          network selector, e.g. "mainnet" or "sepolia"
     * @param explorerHost     explorer API host for the selected network
     * @param explorerChainId  chain id query parameter for multi-chain explorers
     * @param explorerApiKey   explorer API key
     * @param explorerApiKeyRequired whether the explorer rejects requests without a key
     * @param baseUrl          base URL of a third-party service
     */
    public record TransportConfig(
            String network,
            String explorerHost,
            Long explorerChainId,
            String explorerApiKey,
            boolean explorerApiKeyRequired,
            String baseUrl
    ) {
        public static TransportConfig none() {
            return new TransportConfig(null, null, null, null, false, null);
        }
    }
}
