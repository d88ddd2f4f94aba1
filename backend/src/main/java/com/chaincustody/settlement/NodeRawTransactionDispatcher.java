package com.chaincustody.settlement;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.node.NodeClientRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Broadcasts pre-signed UTXO withdrawals ({@code metadata.signedTransaction}) through the chain's node.
 */
@Component
@Order(0)
@RequiredArgsConstructor
@Slf4j
public class NodeRawTransactionDispatcher implements WithdrawalDispatcher {

    static final String SIGNED_TRANSACTION = "signedTransaction";

    private final NodeClientRegistry nodeClients;

    @Override
    public boolean supports(ChainDescriptor chain, PersistedTransaction withdrawal) {
        return chain.family() == ChainFamily.UTXO
                && withdrawal.getMetadata() != null
                && withdrawal.getMetadata().get(SIGNED_TRANSACTION) instanceof String;
    }

    @Override
    public Optional<String> dispatch(ChainDescriptor chain, PersistedTransaction withdrawal) {
        String hex = (String) withdrawal.getMetadata().get(SIGNED_TRANSACTION);
        String hash = nodeClients.forChain(chain.id()).broadcastRaw(hex);
        log.info("Broadcast withdrawal {} on {}: {}", withdrawal.getId(), chain.id(), hash);
        return Optional.of(hash);
    }
}
