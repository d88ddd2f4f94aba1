package com.chaincustody.deposit.fetch;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.ObservedTransaction;
import com.chaincustody.domain.TransactionDetail;
import com.chaincustody.domain.TransactionDirection;
import com.chaincustody.http.UpstreamException;
import com.chaincustody.node.NodeClient;
import com.chaincustody.node.NodeClientRegistry;
import com.chaincustody.node.RpcException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reads incoming transfers from the node's watch-only wallet. Several outputs of one transaction paying the same
 * address are merged into a single observation.
 */
@Slf4j
@RequiredArgsConstructor
public class UtxoNodeTransactionFetcher implements TransactionFetcher {

    private final NodeClientRegistry nodeClients;

    @Override
    public ChainFamily family() {
        return ChainFamily.UTXO;
    }

    @Override
    public List<ObservedTransaction> fetch(ChainDescriptor chain, String address) {
        JsonNode entries = nodeClients.forChain(chain.id()).listTransactions();
        if (entries == null || !entries.isArray()) {
            throw new UpstreamException("listtransactions returned no array on " + chain.id());
        }
        Map<String, ObservedTransaction> byHash = new LinkedHashMap<>();
        for (JsonNode entry : entries) {
            if (!address.equals(entry.path("address").asText(null))
                    || !"receive".equals(entry.path("category").asText())) {
                continue;
            }
            String txid = entry.path("txid").asText(null);
            if (txid == null) {
                continue;
            }
            BigInteger raw = chain.toMinorUnits(entry.path("amount").decimalValue().abs());
            int confirmations = Math.max(0, entry.path("confirmations").asInt(0));
            Instant blockTime = entry.has("blocktime") ? Instant.ofEpochSecond(entry.get("blocktime").asLong()) : null;
            byHash.merge(txid,
                    new ObservedTransaction(txid, chain.id(), address, raw, confirmations,
                            TransactionDirection.INCOMING, blockTime),
                    (a, b) -> new ObservedTransaction(txid, chain.id(), address, a.rawAmount().add(b.rawAmount()),
                            Math.min(a.confirmations(), b.confirmations()), TransactionDirection.INCOMING,
                            a.blockTime() != null ? a.blockTime() : b.blockTime()));
        }
        return new ArrayList<>(byHash.values());
    }

    @Override
    public Optional<TransactionDetail> fetchDetail(ChainDescriptor chain, String hash) {
        NodeClient node = nodeClients.forChain(chain.id());
        JsonNode tx;
        int confirmations;
        try {
            JsonNode walletTx = node.getTransaction(hash);
            tx = walletTx.get("decoded");
            confirmations = walletTx.path("confirmations").asInt(0);
            if (tx == null || !tx.has("vout")) {
                tx = node.getRawTransaction(hash, true);
                confirmations = tx.path("confirmations").asInt(confirmations);
            }
        } catch (RpcException e) {
            if (e.isTransient()) {
                throw e;
            }
            log.debug("gettransaction {} on {} failed ({}), falling back to getrawtransaction",
                    hash, chain.id(), e.getMessage());
            tx = node.getRawTransaction(hash, true);
            confirmations = tx.path("confirmations").asInt(0);
        }
        if (tx == null || tx.isNull()) {
            return Optional.empty();
        }
        return Optional.of(toDetail(chain, hash, tx, confirmations));
    }

    private static TransactionDetail toDetail(ChainDescriptor chain, String hash, JsonNode tx, int confirmations) {
        List<TransactionDetail.Input> inputs = new ArrayList<>();
        for (JsonNode vin : tx.path("vin")) {
            if (vin.has("txid")) {
                inputs.add(new TransactionDetail.Input(vin.get("txid").asText(), vin.path("vout").asInt()));
            }
        }
        List<TransactionDetail.Output> outputs = new ArrayList<>();
        for (JsonNode vout : tx.path("vout")) {
            BigInteger value = chain.toMinorUnits(vout.path("value").decimalValue());
            List<String> addresses = new ArrayList<>();
            JsonNode script = vout.path("scriptPubKey");
            if (script.hasNonNull("address")) {
                addresses.add(script.get("address").asText());
            }
            for (JsonNode a : script.path("addresses")) {
                addresses.add(a.asText());
            }
            outputs.add(new TransactionDetail.Output(value, addresses));
        }
        Instant blockTime = tx.has("blocktime") ? Instant.ofEpochSecond(tx.get("blocktime").asLong()) : null;
        return new TransactionDetail(hash, Math.max(0, confirmations), blockTime, inputs, outputs);
    }
}
