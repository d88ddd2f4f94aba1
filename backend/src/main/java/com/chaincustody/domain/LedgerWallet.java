package com.chaincustody.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Internal ledger balance for one (user, currency). {@code inOrder} is reserved and not withdrawable.
 * Versioned so concurrent read-check-write cycles cannot both commit.
 */
@Document(collection = "wallets")
@CompoundIndex(name = "user_currency", def = "{'userId': 1, 'currency': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LedgerWallet {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String currency;
    private BigDecimal balance = BigDecimal.ZERO;
    private BigDecimal inOrder = BigDecimal.ZERO;
    @Version
    private Long version;
    private Instant updatedAt;

    /** Balance minus the amount reserved in orders. */
    public BigDecimal available() {
        BigDecimal b = balance != null ? balance : BigDecimal.ZERO;
        BigDecimal o = inOrder != null ? inOrder : BigDecimal.ZERO;
        return b.subtract(o);
    }
}
