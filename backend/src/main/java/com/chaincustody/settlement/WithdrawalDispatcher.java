package com.chaincustody.settlement;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.PersistedTransaction;

import java.util.Optional;

/**
 * Hands a debited withdrawal over for broadcast. Implementations are tried in order; the first one that
 * supports the withdrawal is used.
 */
public interface WithdrawalDispatcher {

    boolean supports(ChainDescriptor chain, PersistedTransaction withdrawal);

    /**
     * @return on-chain hash when the transaction was broadcast here, empty when it was handed off
     */
    Optional<String> dispatch(ChainDescriptor chain, PersistedTransaction withdrawal);
}
