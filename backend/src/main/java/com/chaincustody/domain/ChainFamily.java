package com.chaincustody.domain;

/**
 * Ledger model of a chain. Drives fetcher, fee and amount-computation dispatch.
 */
public enum ChainFamily {
    /** Bitcoin-like chains tracked through a watch-only node wallet. */
    UTXO,
    /** Account-based chains read through an Etherscan-style explorer API. */
    ACCOUNT,
    /** Chains read only through a third-party public service (e.g. TronGrid). */
    EXPLORER_ONLY
}
