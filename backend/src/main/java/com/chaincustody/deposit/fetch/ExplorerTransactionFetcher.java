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
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Account-model chains through an Etherscan v2 style explorer ({@code /v2/api?module=account&action=txlist}).
 */
@Slf4j
public class ExplorerTransactionFetcher implements TransactionFetcher {

    private final HttpJsonClient http;
    private final ObjectMapper objectMapper;
    private final RateLimiter explorerRateLimiter;

    public ExplorerTransactionFetcher(HttpJsonClient http, ObjectMapper objectMapper, RateLimiter explorerRateLimiter) {
        this.http = http;
        this.objectMapper = objectMapper;
        this.explorerRateLimiter = explorerRateLimiter;
    }

    @Override
    public ChainFamily family() {
        return ChainFamily.ACCOUNT;
    }

    @Override
    public List<ObservedTransaction> fetch(ChainDescriptor chain, String address) {
        String url = buildUrl(chain, address);
        if (!explorerRateLimiter.acquirePermission()) {
            throw new UpstreamException("Local limiter timeout before explorer call for " + chain.id());
        }
        JsonNode root = parse(http.get(url).block(), chain);
        if ("0".equals(root.path("status").asText()) && isEmptyMarker(root.path("message").asText())) {
            if (!root.path("result").isArray()) {
                log.warn("Explorer for {} answered NOTOK: {}", chain.id(), root.path("result").asText());
            }
            return List.of();
        }
        JsonNode result = root.get("result");
        if (result == null || !result.isArray()) {
            throw new UpstreamException("Explorer response for " + chain.id() + " has no result array");
        }
        List<ObservedTransaction> out = new ArrayList<>();
        for (JsonNode tx : result) {
            if ("1".equals(tx.path("isError").asText()) || "0".equals(tx.path("txreceipt_status").asText())) {
                continue;
            }
            String hash = tx.path("hash").asText(null);
            if (hash == null) {
                continue;
            }
            TransactionDirection direction = address.equalsIgnoreCase(tx.path("to").asText())
                    ? TransactionDirection.INCOMING
                    : TransactionDirection.OUTGOING;
            Instant blockTime = tx.has("timeStamp") ? Instant.ofEpochSecond(tx.get("timeStamp").asLong()) : null;
            out.add(new ObservedTransaction(hash, chain.id(), address, parseWei(tx.path("value").asText("0")),
                    tx.path("confirmations").asInt(0), direction, blockTime));
        }
        return out;
    }

    /**
     * Confirmation count of a transaction from its receipt block and the current head, both through the
     * explorer's JSON-RPC proxy. Empty while the transaction has no receipt.
     */
    @Override
    public Optional<TransactionDetail> fetchDetail(ChainDescriptor chain, String hash) {
        JsonNode receipt = proxyCall(chain, "eth_getTransactionReceipt&txhash=" + hash);
        if (receipt == null || receipt.isNull() || !receipt.hasNonNull("blockNumber")) {
            return Optional.empty();
        }
        long txBlock = hexToLong(receipt.get("blockNumber").asText());
        long head = hexToLong(proxyCall(chain, "eth_blockNumber").asText());
        int confirmations = (int) Math.max(0L, head - txBlock + 1);
        return Optional.of(new TransactionDetail(hash, confirmations, null, List.of(), List.of()));
    }

    private JsonNode proxyCall(ChainDescriptor chain, String actionAndParams) {
        String url = baseUrl(chain) + "?module=proxy&action=" + actionAndParams + apiParams(chain);
        if (!explorerRateLimiter.acquirePermission()) {
            throw new UpstreamException("Local limiter timeout before explorer call for " + chain.id());
        }
        JsonNode root = parse(http.get(url).block(), chain);
        if (root.has("error")) {
            throw new UpstreamException("Explorer proxy error for " + chain.id() + ": " + root.get("error"));
        }
        JsonNode result = root.get("result");
        if (result == null) {
            throw new UpstreamException("Explorer proxy response for " + chain.id() + " has no result");
        }
        return result;
    }

    String buildUrl(ChainDescriptor chain, String address) {
        return baseUrl(chain) + "?module=account&action=txlist&address=" + address
                + "&startblock=0&endblock=99999999&sort=desc" + apiParams(chain);
    }

    private static String baseUrl(ChainDescriptor chain) {
        ChainDescriptor.TransportConfig cfg = chain.transportConfig();
        if (cfg.explorerHost() == null || cfg.explorerHost().isBlank()) {
            throw new IllegalStateException("No explorer configured for " + chain.id() + " network " + cfg.network());
        }
        if (cfg.explorerApiKeyRequired() && (cfg.explorerApiKey() == null || cfg.explorerApiKey().isBlank())) {
            throw new IllegalStateException("Explorer API key missing for " + chain.id());
        }
        return "https://" + cfg.explorerHost() + "/v2/api";
    }

    private static String apiParams(ChainDescriptor chain) {
        ChainDescriptor.TransportConfig cfg = chain.transportConfig();
        StringBuilder url = new StringBuilder();
        if (cfg.explorerChainId() != null) {
            url.append("&chainid=").append(cfg.explorerChainId());
        }
        if (cfg.explorerApiKey() != null && !cfg.explorerApiKey().isBlank()) {
            url.append("&apikey=").append(cfg.explorerApiKey());
        }
        return url.toString();
    }

    private JsonNode parse(String body, ChainDescriptor chain) {
        if (body == null || body.isBlank()) {
            throw new UpstreamException("Empty explorer response for " + chain.id());
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed explorer response for " + chain.id(), e);
        }
    }

    private static boolean isEmptyMarker(String message) {
        return "NOTOK".equalsIgnoreCase(message) || message.startsWith("No transactions found");
    }

    private static long hexToLong(String hex) {
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        try {
            return Long.parseLong(digits, 16);
        } catch (NumberFormatException e) {
            throw new UpstreamException("Invalid hex quantity: " + hex, e);
        }
    }

    private static BigInteger parseWei(String value) {
        try {
            return new BigInteger(value);
        } catch (NumberFormatException e) {
            throw new UpstreamException("Invalid value field: " + value, e);
        }
    }
}
