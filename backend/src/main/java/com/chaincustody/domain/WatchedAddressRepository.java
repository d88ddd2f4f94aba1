package com.chaincustody.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface WatchedAddressRepository extends MongoRepository<WatchedAddress, String> {

    Optional<WatchedAddress> findByChainAndAddress(String chain, String address);
}
