package com.chaincustody.deposit.monitor;

import java.time.Instant;

/**
 * Point-in-time view of a deposit monitor.
 */
public record MonitorStatus(
        String walletId,
        String chain,
        String address,
        DepositMonitor.RunState state,
        int consecutiveErrors,
        String lastError,
        int processedCount,
        Instant lastPollAt
) {
}
