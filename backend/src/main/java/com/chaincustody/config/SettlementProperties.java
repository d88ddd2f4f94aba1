package com.chaincustody.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Withdrawal settlement: ledger conflict retries, fee estimation and broadcast tracking.
 */
@ConfigurationProperties(prefix = "chaincustody.settlement")
@NoArgsConstructor
@Getter
@Setter
public class SettlementProperties {

    /** Attempts of a ledger debit that lost an optimistic-lock or write-conflict race. */
    private int lockRetryAttempts = 3;

    /** Confirmation target passed to estimatesmartfee. */
    private int feeConfTarget = 6;

    /** Assumed virtual size of a withdrawal transaction for UTXO fee estimates. */
    private int utxoTxSizeVbytes = 250;

    /** Bandwidth consumed by a plain TRX transfer. */
    private int tronTransferBandwidthBytes = 268;

    /** Interval of the broadcast tracker that confirms pending withdrawals. */
    private long trackerIntervalMs = 60_000;
}
