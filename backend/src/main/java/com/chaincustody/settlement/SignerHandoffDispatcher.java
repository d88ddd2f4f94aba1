package com.chaincustody.settlement;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.domain.WithdrawalNotice;
import com.chaincustody.event.EventBroadcaster;
import com.chaincustody.event.EventTopics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Fallback: asks the external signer to sign and broadcast. The signer reports back either the signed payload
 * or the broadcast hash.
 */
@Component
@Order(Ordered.LOWEST_PRECEDENCE)
@RequiredArgsConstructor
@Slf4j
public class SignerHandoffDispatcher implements WithdrawalDispatcher {

    private final EventBroadcaster eventBroadcaster;

    @Override
    public boolean supports(ChainDescriptor chain, PersistedTransaction withdrawal) {
        return true;
    }

    @Override
    public Optional<String> dispatch(ChainDescriptor chain, PersistedTransaction withdrawal) {
        eventBroadcaster.publish(EventTopics.WITHDRAWAL_SIGNING_REQUESTED, WithdrawalNotice.of(withdrawal));
        log.debug("Signing requested for withdrawal {} on {}", withdrawal.getId(), chain.id());
        return Optional.empty();
    }
}
