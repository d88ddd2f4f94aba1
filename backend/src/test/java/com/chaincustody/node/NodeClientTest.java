package com.chaincustody.node;

import com.chaincustody.common.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NodeClientTest {

    private static final String NODE = "http://127.0.0.1:8332";
    private static final String WALLET = NODE + "/wallet/ecosystem_wallets";

    @Mock
    private NodeRpcTransport transport;

    private NodeClient client;

    @BeforeEach
    void setUp() {
        client = new NodeClient("BTC", NODE, "ecosystem_wallets", transport, new ObjectMapper(),
                new RetryPolicy(1L, 0, 3));
    }

    private static Mono<String> ok(String result) {
        return Mono.just("{\"result\":" + result + ",\"error\":null,\"id\":1}");
    }

    private static Mono<String> rpcError(int code, String message) {
        return Mono.just("{\"result\":null,\"error\":{\"code\":" + code + ",\"message\":\"" + message + "\"},\"id\":1}");
    }

    @Test
    void call_returnsResultNode() {
        when(transport.call(eq(NODE), eq("getblockchaininfo"), any())).thenReturn(ok("{\"blocks\":100,\"headers\":101}"));

        JsonNode info = client.getBlockchainInfo();

        assertThat(info.get("blocks").asInt()).isEqualTo(100);
    }

    @Test
    @DisplayName("node error object is FATAL and not retried")
    void call_rpcError_fatalWithoutRetry() {
        when(transport.call(eq(NODE), eq("getrawtransaction"), any())).thenReturn(rpcError(-32601, "Method not found"));

        assertThatThrownBy(() -> client.getRawTransaction("abc", true))
                .isInstanceOfSatisfying(RpcException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(RpcException.Kind.FATAL);
                    assertThat(e.getCode()).isEqualTo(-32601);
                });
        verify(transport, times(1)).call(eq(NODE), eq("getrawtransaction"), any());
    }

    @Test
    @DisplayName("transient failures are retried until a call succeeds")
    void call_transientThenSuccess_retries() {
        when(transport.call(eq(NODE), eq("getblockchaininfo"), any()))
                .thenReturn(Mono.error(RpcException.transientFailure("connection refused", null)))
                .thenReturn(Mono.just(""))
                .thenReturn(ok("{\"blocks\":5,\"headers\":5}"));

        assertThat(client.isSynced()).isTrue();
        verify(transport, times(3)).call(eq(NODE), eq("getblockchaininfo"), any());
    }

    @Test
    void call_transientExhausted_throwsTransient() {
        when(transport.call(eq(NODE), eq("getblockchaininfo"), any()))
                .thenReturn(Mono.error(RpcException.transientFailure("timeout", null)));

        assertThatThrownBy(() -> client.getBlockchainInfo())
                .isInstanceOfSatisfying(RpcException.class, e -> assertThat(e.isTransient()).isTrue())
                .hasMessageContaining("after 3 attempts");
    }

    @Test
    void isSynced_oneHeaderBehind_true_twoBehind_false() {
        when(transport.call(eq(NODE), eq("getblockchaininfo"), any()))
                .thenReturn(ok("{\"blocks\":99,\"headers\":100}"))
                .thenReturn(ok("{\"blocks\":98,\"headers\":100}"));

        assertThat(client.isSynced()).isTrue();
        assertThat(client.isSynced()).isFalse();
    }

    @Test
    @DisplayName("wallet is loaded once, then wallet calls go to the wallet URL")
    void walletCall_loadsWalletOnce() {
        when(transport.call(eq(NODE), eq("loadwallet"), any())).thenReturn(ok("{\"name\":\"ecosystem_wallets\"}"));
        when(transport.call(eq(WALLET), eq("listtransactions"), any())).thenReturn(ok("[]"));

        client.listTransactions();
        client.listTransactions();

        verify(transport, times(1)).call(eq(NODE), eq("loadwallet"), any());
        verify(transport, times(2)).call(WALLET, "listtransactions", List.of("*", 100, 0, true));
    }

    @Test
    @DisplayName("missing wallet is created watch-only")
    void walletCall_walletNotFound_createsWallet() {
        when(transport.call(eq(NODE), eq("loadwallet"), any()))
                .thenReturn(rpcError(-18, "Wallet file not found: ecosystem_wallets"));
        when(transport.call(eq(NODE), eq("createwallet"), any())).thenReturn(ok("{\"name\":\"ecosystem_wallets\"}"));
        when(transport.call(eq(WALLET), eq("listunspent"), any())).thenReturn(ok("[]"));

        client.listUnspent("addr");

        verify(transport).call(NODE, "createwallet", List.of("ecosystem_wallets", true, false, "", false, false));
    }

    @Test
    void walletCall_walletAlreadyLoaded_isSuccess() {
        when(transport.call(eq(NODE), eq("loadwallet"), any()))
                .thenReturn(rpcError(-35, "Wallet \\\"ecosystem_wallets\\\" is already loaded."));
        when(transport.call(eq(WALLET), eq("listunspent"), any())).thenReturn(ok("[]"));

        client.listUnspent("addr");

        verify(transport, never()).call(eq(NODE), eq("createwallet"), any());
    }

    @Test
    @DisplayName("importaddress uses rescan=false and treats an existing key as success")
    void importWatchAddress_alreadyImported_isSuccess() {
        when(transport.call(eq(NODE), eq("loadwallet"), any())).thenReturn(ok("{}"));
        when(transport.call(eq(WALLET), eq("importaddress"), any()))
                .thenReturn(rpcError(-4, "The wallet already contains the private key for this address or script (already have this key)"));

        client.importWatchAddress("bc1qxyz", "wallet-1");

        verify(transport).call(WALLET, "importaddress", List.of("bc1qxyz", "wallet-1", false));
    }

    @Test
    void getAddressBalance_sumsUnspentAmounts() {
        when(transport.call(eq(NODE), eq("loadwallet"), any())).thenReturn(ok("{}"));
        when(transport.call(eq(WALLET), eq("listunspent"), any()))
                .thenReturn(ok("[{\"amount\":0.5},{\"amount\":0.25000001}]"));

        assertThat(client.getAddressBalance("bc1q")).isEqualByComparingTo(new BigDecimal("0.75000001"));
        verify(transport).call(WALLET, "listunspent", List.of(0, 9_999_999, List.of("bc1q")));
    }

    @Test
    void estimateFee_noFeerate_empty() {
        when(transport.call(eq(NODE), eq("loadwallet"), any())).thenReturn(ok("{}"));
        when(transport.call(eq(WALLET), eq("estimatesmartfee"), any()))
                .thenReturn(ok("{\"errors\":[\"Insufficient data\"],\"blocks\":0}"))
                .thenReturn(ok("{\"feerate\":0.0001,\"blocks\":6}"));

        assertThat(client.estimateFee(6)).isEmpty();
        assertThat(client.estimateFee(6)).hasValueSatisfying(rate -> assertThat(rate).isEqualByComparingTo("0.0001"));
    }

    @Test
    void broadcastRaw_returnsTxid() {
        when(transport.call(eq(NODE), eq("sendrawtransaction"), any())).thenReturn(ok("\"txid123\""));

        assertThat(client.broadcastRaw("0200")).isEqualTo("txid123");
    }

    @Test
    @DisplayName("retried broadcast the node already accepted resolves to the decoded txid")
    void broadcastRaw_alreadyInMempoolAfterTimeout_returnsDecodedTxid() {
        when(transport.call(eq(NODE), eq("sendrawtransaction"), any()))
                .thenReturn(Mono.error(RpcException.transientFailure("read timeout", null)))
                .thenReturn(rpcError(-26, "txn-already-in-mempool"));
        when(transport.call(NODE, "decoderawtransaction", List.of("0200")))
                .thenReturn(ok("{\"txid\":\"txid456\",\"vout\":[]}"));

        assertThat(client.broadcastRaw("0200")).isEqualTo("txid456");
        verify(transport, times(2)).call(eq(NODE), eq("sendrawtransaction"), any());
    }

    @Test
    void broadcastRaw_alreadyInChain_returnsDecodedTxid() {
        when(transport.call(eq(NODE), eq("sendrawtransaction"), any()))
                .thenReturn(rpcError(-27, "Transaction already in block chain"));
        when(transport.call(eq(NODE), eq("decoderawtransaction"), any())).thenReturn(ok("{\"txid\":\"mined1\"}"));

        assertThat(client.broadcastRaw("0200")).isEqualTo("mined1");
    }

    @Test
    void broadcastRaw_rejected_stillFatal() {
        when(transport.call(eq(NODE), eq("sendrawtransaction"), any()))
                .thenReturn(rpcError(-25, "bad-txns-inputs-missingorspent"));

        assertThatThrownBy(() -> client.broadcastRaw("0200"))
                .isInstanceOfSatisfying(RpcException.class, e -> assertThat(e.getCode()).isEqualTo(-25));
        verify(transport, never()).call(eq(NODE), eq("decoderawtransaction"), any());
    }

    @Test
    @DisplayName("wallet unloaded by a node restart is loaded again and the call retried once")
    void walletCall_walletUnloaded_reloadsAndRetries() {
        when(transport.call(eq(NODE), eq("loadwallet"), any())).thenReturn(ok("{\"name\":\"ecosystem_wallets\"}"));
        when(transport.call(eq(WALLET), eq("listtransactions"), any()))
                .thenReturn(ok("[]"))
                .thenReturn(rpcError(-18, "Requested wallet does not exist or is not loaded"))
                .thenReturn(ok("[{\"txid\":\"t1\"}]"));

        client.listTransactions();
        JsonNode afterRestart = client.listTransactions();

        assertThat(afterRestart.size()).isEqualTo(1);
        verify(transport, times(2)).call(eq(NODE), eq("loadwallet"), any());
        verify(transport, times(3)).call(eq(WALLET), eq("listtransactions"), any());
    }
}
