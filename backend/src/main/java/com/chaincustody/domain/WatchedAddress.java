package com.chaincustody.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Deposit address of a wallet on one chain. Created once, never mutated.
 */
@Document(collection = "watched_addresses")
@CompoundIndex(name = "chain_address_uniq", def = "{'chain': 1, 'address': 1}", unique = true)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WatchedAddress {

    @Id
    private String id;
    @EqualsAndHashCode.Include
    private String walletId;
    @EqualsAndHashCode.Include
    private String chain;
    @EqualsAndHashCode.Include
    private String address;
    private Instant createdAt;

    public static WatchedAddress of(String walletId, String chain, String address) {
        return new WatchedAddress(null, walletId, chain, address, Instant.now());
    }

    /** Monitor key: one monitor per (chain, address). */
    public String monitorKey() {
        return chain + ":" + address;
    }
}
