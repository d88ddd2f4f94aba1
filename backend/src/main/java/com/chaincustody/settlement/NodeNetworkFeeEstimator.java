package com.chaincustody.settlement;

import com.chaincustody.config.SettlementProperties;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.node.NodeClientRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * UTXO fee: node fee rate (coin per kvB) times the assumed withdrawal size.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NodeNetworkFeeEstimator implements NetworkFeeEstimator {

    private static final BigDecimal VBYTES_PER_KVB = BigDecimal.valueOf(1000);

    private final NodeClientRegistry nodeClients;
    private final SettlementProperties settlementProperties;

    @Override
    public boolean supports(ChainDescriptor chain) {
        return chain.family() == ChainFamily.UTXO;
    }

    @Override
    public BigDecimal estimate(ChainDescriptor chain, BigDecimal amount, String toAddress) {
        return nodeClients.forChain(chain.id())
                .estimateFee(settlementProperties.getFeeConfTarget())
                .map(rate -> rate.multiply(BigDecimal.valueOf(settlementProperties.getUtxoTxSizeVbytes()))
                        .divide(VBYTES_PER_KVB, chain.decimals(), RoundingMode.UP))
                .orElseGet(() -> {
                    log.warn("No fee estimate from {} node, network fee set to zero", chain.id());
                    return BigDecimal.ZERO;
                });
    }
}
