package com.chaincustody.settlement;

import com.chaincustody.domain.ChainDescriptor;

import java.math.BigDecimal;

/**
 * Estimates the on-chain fee of a withdrawal, in standard units of the chain currency.
 */
public interface NetworkFeeEstimator {

    boolean supports(ChainDescriptor chain);

    BigDecimal estimate(ChainDescriptor chain, BigDecimal amount, String toAddress);
}
