package com.chaincustody.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Durable deposit/withdrawal record. (txHash, walletId) is the idempotency key: an existing row for a hash
 * means the ledger effect already happened. Withdrawals carry a generated reference as txHash; the on-chain
 * hash is stored in {@link #broadcastHash} once the transaction is broadcast.
 */
@Document(collection = "transactions")
@CompoundIndexes({
    @CompoundIndex(name = "tx_wallet_uniq", def = "{'txHash': 1, 'walletId': 1}", unique = true),
    @CompoundIndex(name = "type_status", def = "{'type': 1, 'status': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PersistedTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String txHash;
    private String walletId;
    private String userId;
    private TransactionType type;
    private TransactionStatus status;
    private String chain;
    private String currency;
    private BigDecimal amount;
    private BigDecimal fee;
    private String toAddress;
    private String broadcastHash;
    private Map<String, Object> metadata = new HashMap<>();
    private Instant createdAt;
    private Instant updatedAt;

    public void putMetadata(String key, Object value) {
        if (metadata == null) {
            metadata = new HashMap<>();
        }
        metadata.put(key, value);
    }
}
