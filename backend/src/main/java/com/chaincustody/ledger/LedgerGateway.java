package com.chaincustody.ledger;

import com.chaincustody.domain.PersistedTransaction;
import com.chaincustody.domain.SettlementException;
import com.chaincustody.domain.WithdrawalRequest;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Internal ledger and durable transaction store. Mutating operations are atomic: balance change and
 * transaction record commit together or not at all.
 */
public interface LedgerGateway {

    /** Metadata key on an internal transfer's withdrawal record naming the credited wallet. */
    String RECIPIENT_WALLET_ID = "recipientWalletId";

    Optional<PersistedTransaction> findTransaction(String txHash, String walletId);

    Optional<PersistedTransaction> findTransactionById(String transactionId);

    /**
     * Debits amount + computed fee from the wallet and creates the PENDING withdrawal record.
     *
     * @throws SettlementException WALLET_NOT_FOUND, or INSUFFICIENT_FUNDS when available balance is below the total
     * @throws org.springframework.dao.ConcurrencyFailureException when another writer changed the wallet concurrently
     */
    PersistedTransaction debitAndRecord(WithdrawalRequest request, Map<String, Object> metadata);

    /**
     * Settles a withdrawal to an internal deposit address without touching the chain: debits amount + computed fee
     * from the sender, credits amount to the recipient owner's wallet for the same currency (created when missing)
     * and records a CONFIRMED withdrawal and a CONFIRMED deposit under one reference.
     *
     * @param recipientWalletId wallet owning the destination deposit address
     * @return the sender's withdrawal record, with {@link #RECIPIENT_WALLET_ID} in its metadata
     * @throws SettlementException WALLET_NOT_FOUND, INSUFFICIENT_FUNDS, or INVALID_ADDRESS when both sides are
     *                             the same wallet
     */
    PersistedTransaction transferInternal(WithdrawalRequest request, String recipientWalletId,
                                          Map<String, Object> metadata);

    /**
     * Records a CONFIRMED deposit and credits its amount.
     *
     * @return false when a record for (txHash, walletId) already exists and nothing was changed
     * @throws org.springframework.dao.DuplicateKeyException when a concurrent writer recorded the same deposit
     */
    boolean creditDeposit(PersistedTransaction deposit);

    PersistedTransaction updateTransaction(PersistedTransaction transaction);

    List<PersistedTransaction> findPendingWithdrawals();

    BigDecimal availableBalance(String walletId);
}
