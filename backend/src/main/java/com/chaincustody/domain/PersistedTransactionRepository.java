package com.chaincustody.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Durable transaction store keyed by (txHash, walletId).
 */
public interface PersistedTransactionRepository extends MongoRepository<PersistedTransaction, String> {

    Optional<PersistedTransaction> findByTxHashAndWalletId(String txHash, String walletId);

    boolean existsByTxHashAndWalletId(String txHash, String walletId);

    List<PersistedTransaction> findByTypeAndStatus(TransactionType type, TransactionStatus status);
}
