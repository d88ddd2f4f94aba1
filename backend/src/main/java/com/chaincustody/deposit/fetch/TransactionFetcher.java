package com.chaincustody.deposit.fetch;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.ObservedTransaction;
import com.chaincustody.domain.TransactionDetail;

import java.util.List;
import java.util.Optional;

/**
 * Chain-family strategy for reading the transactions of a watched address. One implementation per
 * {@link ChainFamily}; resolved through {@link TransactionFetcherDispatcher}.
 */
public interface TransactionFetcher {

    ChainFamily family();

    /**
     * Recent transactions touching the address. No ordering guarantee.
     */
    List<ObservedTransaction> fetch(ChainDescriptor chain, String address);

    /**
     * Full inputs/outputs of a transaction, where the family needs them to compute the credited amount.
     */
    default Optional<TransactionDetail> fetchDetail(ChainDescriptor chain, String hash) {
        return Optional.empty();
    }
}
