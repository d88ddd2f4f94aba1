package com.chaincustody.settlement;

import com.chaincustody.chain.ChainRegistry;
import com.chaincustody.deposit.fetch.TransactionFetcherDispatcher;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.domain.TransactionDetail;
import com.chaincustody.domain.TransactionStatus;
import com.chaincustody.domain.WithdrawalNotice;
import com.chaincustody.event.EventBroadcaster;
import com.chaincustody.event.EventTopics;
import com.chaincustody.ledger.LedgerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Marks broadcast withdrawals CONFIRMED once the chain reports the required confirmations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BroadcastTracker {

    private final LedgerGateway ledgerGateway;
    private final ChainRegistry chainRegistry;
    private final TransactionFetcherDispatcher fetcherDispatcher;
    private final EventBroadcaster eventBroadcaster;

    @Scheduled(fixedDelayString = "${chaincustody.settlement.tracker-interval-ms:60000}",
            initialDelayString = "${chaincustody.settlement.tracker-interval-ms:60000}")
    public void track() {
        int confirmed = 0;
        for (PersistedTransaction withdrawal : ledgerGateway.findPendingWithdrawals()) {
            if (withdrawal.getBroadcastHash() == null) {
                continue;
            }
            try {
                if (checkConfirmation(withdrawal)) {
                    confirmed++;
                }
            } catch (RuntimeException e) {
                log.warn("Confirmation check of withdrawal {} ({}) failed: {}", withdrawal.getId(),
                        withdrawal.getBroadcastHash(), e.getMessage());
            }
        }
        if (confirmed > 0) {
            log.info("Confirmed {} withdrawals", confirmed);
        }
    }

    boolean checkConfirmation(PersistedTransaction withdrawal) {
        Optional<ChainDescriptor> chain = chainRegistry.find(withdrawal.getChain());
        if (chain.isEmpty()) {
            return false;
        }
        Optional<TransactionDetail> detail = fetcherDispatcher.fetchDetail(chain.get().id(), withdrawal.getBroadcastHash());
        if (detail.isEmpty() || detail.get().confirmations() < chain.get().requiredConfirmations()) {
            return false;
        }
        withdrawal.setStatus(TransactionStatus.CONFIRMED);
        withdrawal.putMetadata("confirmations", detail.get().confirmations());
        PersistedTransaction saved = ledgerGateway.updateTransaction(withdrawal);
        eventBroadcaster.publish(EventTopics.WITHDRAWAL_CONFIRMED, WithdrawalNotice.of(saved));
        return true;
    }
}
