package com.chaincustody.deposit.monitor;

import com.chaincustody.chain.ChainRegistry;
import com.chaincustody.config.MonitorProperties;
import com.chaincustody.deposit.fetch.TransactionFetcherDispatcher;
import com.chaincustody.domain.WatchedAddress;
import com.chaincustody.event.EventBroadcaster;
import com.chaincustody.ledger.LedgerGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DepositMonitorFactory {

    private final ChainRegistry chainRegistry;
    private final TransactionFetcherDispatcher fetcherDispatcher;
    private final LedgerGateway ledgerGateway;
    private final EventBroadcaster eventBroadcaster;
    private final PollScheduler pollScheduler;
    private final MonitorProperties monitorProperties;

    public DepositMonitor create(WatchedAddress watched) {
        return new DepositMonitor(watched, chainRegistry.resolve(watched.getChain()), fetcherDispatcher,
                ledgerGateway, eventBroadcaster, pollScheduler, monitorProperties);
    }
}
