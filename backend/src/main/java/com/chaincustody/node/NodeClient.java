package com.chaincustody.node;

import com.chaincustody.common.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JSON-RPC client for one UTXO full node. Wallet-scoped calls go to {@code /wallet/<name>}, a watch-only wallet
 * that is loaded (or created) on first use. Transient failures are retried per {@link RetryPolicy}.
 */
@Slf4j
public class NodeClient {

    static final int LIST_TRANSACTIONS_DEFAULT_COUNT = 100;
    private static final int LIST_UNSPENT_MAX_CONF = 9_999_999;
    static final int RPC_WALLET_NOT_FOUND = -18;

    private final String chain;
    private final String nodeUrl;
    private final String walletName;
    private final NodeRpcTransport transport;
    private final ObjectMapper objectMapper;
    private final RetryPolicy retryPolicy;
    private final Object walletLock = new Object();
    private volatile boolean walletReady;

    public NodeClient(String chain, String nodeUrl, String walletName, NodeRpcTransport transport,
                      ObjectMapper objectMapper, RetryPolicy retryPolicy) {
        this.chain = chain;
        this.nodeUrl = nodeUrl;
        this.walletName = walletName;
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.retryPolicy = retryPolicy;
    }

    public String getChain() {
        return chain;
    }

    /** Node-scoped call. Returns the {@code result} node. */
    public JsonNode call(String method, Object params) {
        return callWithRetry(nodeUrl, method, params);
    }

    /** Wallet-scoped call; loads the watch-only wallet first if needed. */
    public JsonNode walletCall(String method, Object params) {
        ensureWalletLoaded();
        try {
            return callWithRetry(walletUrl(), method, params);
        } catch (RpcException e) {
            if (e.isTransient() || !Integer.valueOf(RPC_WALLET_NOT_FOUND).equals(e.getCode())) {
                throw e;
            }
            // node restarted and unloaded the wallet
            log.warn("Wallet {} not loaded on {}, loading again: {}", walletName, chain, e.getMessage());
            walletReady = false;
            ensureWalletLoaded();
            return callWithRetry(walletUrl(), method, params);
        }
    }

    /**
     * Imports an address into the watch-only wallet without rescanning. Already-imported addresses are accepted.
     */
    public void importWatchAddress(String address, String label) {
        try {
            walletCall("importaddress", List.of(address, label != null ? label : "", false));
            log.info("Imported watch address {} on {}", address, chain);
        } catch (RpcException e) {
            if (!e.isTransient() && containsAny(e.getMessage(), "already have this key", "already imported")) {
                log.debug("Address {} already imported on {}", address, chain);
                return;
            }
            throw e;
        }
    }

    public JsonNode listTransactions(int count, int skip) {
        return walletCall("listtransactions", List.of("*", count, skip, true));
    }

    public JsonNode listTransactions() {
        return listTransactions(LIST_TRANSACTIONS_DEFAULT_COUNT, 0);
    }

    public JsonNode listUnspent(String address) {
        return walletCall("listunspent", List.of(0, LIST_UNSPENT_MAX_CONF, List.of(address)));
    }

    /** Sum of unspent outputs (including unconfirmed) paying the address, in standard units. */
    public BigDecimal getAddressBalance(String address) {
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode utxo : listUnspent(address)) {
            JsonNode amount = utxo.get("amount");
            if (amount != null && amount.isNumber()) {
                total = total.add(amount.decimalValue());
            }
        }
        return total;
    }

    /** Wallet view of a transaction including the decoded form ({@code decoded}). */
    public JsonNode getTransaction(String txid) {
        return walletCall("gettransaction", List.of(txid, true, true));
    }

    public JsonNode getRawTransaction(String txid, boolean verbose) {
        return call("getrawtransaction", List.of(txid, verbose));
    }

    /**
     * Broadcasts a signed transaction hex. Returns the transaction id. A transaction the node already has in its
     * mempool or chain (an earlier attempt got through) counts as broadcast; its id is decoded from the payload.
     */
    public String broadcastRaw(String signedHex) {
        try {
            return call("sendrawtransaction", List.of(signedHex)).asText();
        } catch (RpcException e) {
            if (e.isTransient() || !containsAny(e.getMessage(), "already-in-mempool", "already in block chain",
                    "already known", "outputs already in utxo set")) {
                throw e;
            }
            String txid = call("decoderawtransaction", List.of(signedHex)).path("txid").asText("");
            if (txid.isEmpty()) {
                throw e;
            }
            log.info("Transaction {} already known to {} node: {}", txid, chain, e.getMessage());
            return txid;
        }
    }

    /**
     * Fee rate in coin per kvB for the confirmation target, or empty when the node has no estimate yet.
     */
    public Optional<BigDecimal> estimateFee(int confTarget) {
        JsonNode result = walletCall("estimatesmartfee", List.of(confTarget));
        JsonNode feerate = result.get("feerate");
        if (feerate == null || !feerate.isNumber()) {
            log.debug("No fee estimate on {} for target {}: {}", chain, confTarget, result.path("errors"));
            return Optional.empty();
        }
        return Optional.of(feerate.decimalValue());
    }

    public JsonNode getBlockchainInfo() {
        return call("getblockchaininfo", List.of());
    }

    /** True when the node has validated all but at most one of the known headers. */
    public boolean isSynced() {
        JsonNode info = getBlockchainInfo();
        long blocks = info.path("blocks").asLong(0);
        long headers = info.path("headers").asLong(0);
        return blocks >= headers - 1;
    }

    public JsonNode rescanBlockchain(long fromHeight) {
        log.info("Rescanning {} wallet {} from height {}", chain, walletName, fromHeight);
        return walletCall("rescanblockchain", List.of(fromHeight));
    }

    void ensureWalletLoaded() {
        if (walletReady) {
            return;
        }
        synchronized (walletLock) {
            if (walletReady) {
                return;
            }
            try {
                call("loadwallet", List.of(walletName));
                log.info("Loaded wallet {} on {}", walletName, chain);
            } catch (RpcException e) {
                if (e.isTransient()) {
                    throw e;
                }
                if (containsAny(e.getMessage(), "already loaded")) {
                    log.debug("Wallet {} already loaded on {}", walletName, chain);
                } else if (containsAny(e.getMessage(), "not found", "does not exist")) {
                    // name, disable_private_keys, blank, passphrase, avoid_reuse, descriptors
                    call("createwallet", List.of(walletName, true, false, "", false, false));
                    log.info("Created watch-only wallet {} on {}", walletName, chain);
                } else {
                    throw e;
                }
            }
            walletReady = true;
        }
    }

    private String walletUrl() {
        return nodeUrl + "/wallet/" + walletName;
    }

    private JsonNode callWithRetry(String url, String method, Object params) {
        RpcException lastException = null;
        for (int attempt = 0; attempt < retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(retryPolicy.delayMs(attempt - 1));
            }
            try {
                String json = transport.call(url, method, params).block();
                return extractResult(method, json);
            } catch (RpcException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                lastException = e;
                log.warn("{} {} attempt {}/{} failed: {}", chain, method, attempt + 1,
                        retryPolicy.getMaxAttempts(), e.getMessage());
            }
        }
        throw RpcException.transientFailure(method + " failed after " + retryPolicy.getMaxAttempts()
                + " attempts: " + messageOf(lastException), lastException);
    }

    private JsonNode extractResult(String method, String json) {
        if (json == null || json.isBlank()) {
            throw RpcException.transientFailure("Empty RPC response for " + method, null);
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw RpcException.transientFailure("Unparseable RPC response for " + method, e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            Integer code = error.has("code") ? error.get("code").asInt() : null;
            String message = error.path("message").asText(error.toString());
            throw RpcException.fatal(method + ": " + message, code);
        }
        JsonNode result = root.get("result");
        return result != null ? result : objectMapper.nullNode();
    }

    private static boolean containsAny(String message, String... fragments) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        for (String f : fragments) {
            if (lower.contains(f)) {
                return true;
            }
        }
        return false;
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw RpcException.transientFailure("Interrupted during RPC retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
