package com.chaincustody.settlement;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.FeePolicy;
import com.chaincustody.domain.TokenSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Withdrawal fee: service fee (percentage with a floor) plus, per the chain's fee policy, the network fee
 * estimate and the activation fee for destinations that are not yet activated.
 */
@Component
@RequiredArgsConstructor
public class FeeCalculator {

    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private final List<NetworkFeeEstimator> networkFeeEstimators;
    private final List<AccountActivationChecker> activationCheckers;

    public FeeBreakdown computeFee(BigDecimal amount, ChainDescriptor chain, TokenSettings token, String toAddress) {
        BigDecimal service = serviceFee(amount, token.getFeePercentage(), token.getFeeMinimum());
        FeePolicy policy = chain.feePolicy();
        if (policy == FeePolicy.SERVICE_ONLY) {
            return FeeBreakdown.of(BigDecimal.ZERO, BigDecimal.ZERO, service);
        }
        BigDecimal network = networkFeeEstimators.stream()
                .filter(e -> e.supports(chain))
                .findFirst()
                .map(e -> e.estimate(chain, amount, toAddress))
                .orElse(BigDecimal.ZERO);
        BigDecimal activation = BigDecimal.ZERO;
        if (policy == FeePolicy.ACTIVATION_AND_ESTIMATE) {
            boolean needsActivation = activationCheckers.stream()
                    .filter(c -> c.supports(chain))
                    .findFirst()
                    .map(c -> !c.isActivated(chain, toAddress))
                    .orElse(false);
            if (needsActivation && chain.activationFee() != null) {
                activation = chain.activationFee();
            }
        }
        return FeeBreakdown.of(network, activation, service);
    }

    /** max(amount × percentage / 100, minimum); absent settings count as zero. */
    public static BigDecimal serviceFee(BigDecimal amount, BigDecimal percentage, BigDecimal minimum) {
        BigDecimal pct = percentage != null ? percentage : BigDecimal.ZERO;
        BigDecimal min = minimum != null ? minimum : BigDecimal.ZERO;
        BigDecimal proportional = amount.multiply(pct).divide(ONE_HUNDRED);
        return proportional.max(min);
    }
}
