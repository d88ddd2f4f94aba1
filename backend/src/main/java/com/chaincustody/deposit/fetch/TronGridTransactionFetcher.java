package com.chaincustody.deposit.fetch;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.ObservedTransaction;
import com.chaincustody.domain.TransactionDetail;
import com.chaincustody.domain.TransactionDirection;
import com.chaincustody.http.HttpJsonClient;
import com.chaincustody.http.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TRON native transfers via TronGrid. Only confirmed incoming transfers are requested, so every observation
 * carries the chain's required confirmation count.
 */
@RequiredArgsConstructor
public class TronGridTransactionFetcher implements TransactionFetcher {

    static final String API_KEY_HEADER = "TRON-PRO-API-KEY";
    private static final String TRANSFER_CONTRACT = "TransferContract";

    private final HttpJsonClient http;
    private final ObjectMapper objectMapper;

    @Override
    public ChainFamily family() {
        return ChainFamily.EXPLORER_ONLY;
    }

    @Override
    public List<ObservedTransaction> fetch(ChainDescriptor chain, String address) {
        String url = baseUrl(chain) + "/v1/accounts/" + address
                + "/transactions?only_to=true&only_confirmed=true&limit=50&order_by=block_timestamp,asc";
        String body = http.get(url, headers(chain)).block();
        JsonNode data = parse(body, chain).get("data");
        if (data == null || !data.isArray()) {
            throw new UpstreamException("TronGrid response for " + address + " has no data array");
        }
        List<ObservedTransaction> out = new ArrayList<>();
        for (JsonNode tx : data) {
            JsonNode contract = tx.path("raw_data").path("contract").path(0);
            if (!TRANSFER_CONTRACT.equals(contract.path("type").asText())) {
                continue;
            }
            if (!"SUCCESS".equals(tx.path("ret").path(0).path("contractRet").asText())) {
                continue;
            }
            String hash = tx.path("txID").asText(null);
            if (hash == null) {
                continue;
            }
            BigInteger amount = BigInteger.valueOf(contract.path("parameter").path("value").path("amount").asLong(0));
            Instant blockTime = tx.has("block_timestamp") ? Instant.ofEpochMilli(tx.get("block_timestamp").asLong()) : null;
            out.add(new ObservedTransaction(hash, chain.id(), address, amount, chain.requiredConfirmations(),
                    TransactionDirection.INCOMING, blockTime));
        }
        return out;
    }

    /**
     * Solidified transactions only: a hit means the transaction is final, so it reports the required
     * confirmation count. Empty while not yet solidified.
     */
    @Override
    public Optional<TransactionDetail> fetchDetail(ChainDescriptor chain, String hash) {
        String body = http.post(baseUrl(chain) + "/walletsolidity/gettransactioninfobyid",
                Map.of("value", hash), headers(chain)).block();
        JsonNode info = parse(body, chain);
        if (!info.hasNonNull("blockNumber")) {
            return Optional.empty();
        }
        if ("FAILED".equals(info.path("result").asText())) {
            throw new UpstreamException("TRON transaction " + hash + " failed on chain");
        }
        Instant blockTime = info.has("blockTimeStamp") ? Instant.ofEpochMilli(info.get("blockTimeStamp").asLong()) : null;
        return Optional.of(new TransactionDetail(hash, chain.requiredConfirmations(), blockTime, List.of(), List.of()));
    }

    static String baseUrl(ChainDescriptor chain) {
        String base = chain.transportConfig().baseUrl();
        if (base == null || base.isBlank()) {
            throw new IllegalStateException("No base-url configured for " + chain.id());
        }
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    static Map<String, String> headers(ChainDescriptor chain) {
        String key = chain.transportConfig().explorerApiKey();
        return key == null || key.isBlank() ? Map.of() : Map.of(API_KEY_HEADER, key);
    }

    private JsonNode parse(String body, ChainDescriptor chain) {
        if (body == null || body.isBlank()) {
            throw new UpstreamException("Empty TronGrid response for " + chain.id());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed TronGrid response for " + chain.id(), e);
        }
    }
}
