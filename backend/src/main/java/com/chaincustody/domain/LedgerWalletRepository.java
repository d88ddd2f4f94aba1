package com.chaincustody.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface LedgerWalletRepository extends MongoRepository<LedgerWallet, String> {

    Optional<LedgerWallet> findByUserIdAndCurrency(String userId, String currency);
}
