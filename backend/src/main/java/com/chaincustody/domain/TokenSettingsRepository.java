package com.chaincustody.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface TokenSettingsRepository extends MongoRepository<TokenSettings, String> {

    Optional<TokenSettings> findByChainAndCurrency(String chain, String currency);
}
