package com.chaincustody.deposit.fetch;

import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ObservedTransaction;
import com.chaincustody.domain.TransactionDetail;
import com.chaincustody.domain.TransactionDirection;
import com.chaincustody.http.HttpJsonClient;
import com.chaincustody.http.UpstreamException;
import com.chaincustody.support.TestChains;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExplorerTransactionFetcherTest {

    private static final String ADDRESS = TestChains.ETH_ADDRESS;

    @Mock
    private HttpJsonClient http;

    private ExplorerTransactionFetcher fetcher;

    @BeforeEach
    void setUp() {
        RateLimiter limiter = RateLimiter.of("test-explorer", RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMillis(100))
                .limitForPeriod(1000)
                .timeoutDuration(Duration.ofMillis(100))
                .build());
        fetcher = new ExplorerTransactionFetcher(http, new ObjectMapper(), limiter);
    }

    @Test
    @DisplayName("txlist entries map to observations with direction by recipient")
    void fetch_mapsIncomingAndOutgoing() {
        String body = """
                {"status":"1","message":"OK","result":[
                  {"hash":"0xin","from":"0xabc","to":"%s","value":"1500000000000000000","confirmations":"4","timeStamp":"1700000000","isError":"0"},
                  {"hash":"0xout","from":"%s","to":"0xdef","value":"1","confirmations":"10","timeStamp":"1700000100","isError":"0"},
                  {"hash":"0xfailed","from":"0xabc","to":"%s","value":"5","confirmations":"10","isError":"1"}
                ]}
                """.formatted(ADDRESS.toLowerCase(), ADDRESS, ADDRESS);
        when(http.get(anyString())).thenReturn(Mono.just(body));

        List<ObservedTransaction> txs = fetcher.fetch(TestChains.eth(), ADDRESS);

        assertThat(txs).hasSize(2);
        ObservedTransaction in = txs.get(0);
        assertThat(in.hash()).isEqualTo("0xin");
        assertThat(in.direction()).isEqualTo(TransactionDirection.INCOMING);
        assertThat(in.rawAmount()).isEqualTo(new BigInteger("1500000000000000000"));
        assertThat(in.confirmations()).isEqualTo(4);
        assertThat(txs.get(1).direction()).isEqualTo(TransactionDirection.OUTGOING);
    }

    @Test
    void fetch_buildsEtherscanV2Url() {
        when(http.get(anyString())).thenReturn(Mono.just("{\"status\":\"1\",\"message\":\"OK\",\"result\":[]}"));

        fetcher.fetch(TestChains.eth(), ADDRESS);

        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(http).get(url.capture());
        assertThat(url.getValue()).isEqualTo("https://api.etherscan.io/v2/api?module=account&action=txlist&address="
                + ADDRESS + "&startblock=0&endblock=99999999&sort=desc&chainid=1&apikey=KEY");
    }

    @Test
    @DisplayName("NOTOK status yields no transactions")
    void fetch_notOk_returnsEmpty() {
        when(http.get(anyString())).thenReturn(Mono.just("{\"status\":\"0\",\"message\":\"NOTOK\",\"result\":\"Invalid API Key\"}"));

        assertThat(fetcher.fetch(TestChains.eth(), ADDRESS)).isEmpty();
    }

    @Test
    void fetch_noTransactionsFound_returnsEmpty() {
        when(http.get(anyString())).thenReturn(Mono.just("{\"status\":\"0\",\"message\":\"No transactions found\",\"result\":[]}"));

        assertThat(fetcher.fetch(TestChains.eth(), ADDRESS)).isEmpty();
    }

    @Test
    void fetch_missingResult_throwsUpstream() {
        when(http.get(anyString())).thenReturn(Mono.just("{\"status\":\"1\",\"message\":\"OK\"}"));

        assertThatThrownBy(() -> fetcher.fetch(TestChains.eth(), ADDRESS)).isInstanceOf(UpstreamException.class);
    }

    @Test
    void fetch_malformedBody_throwsUpstream() {
        when(http.get(anyString())).thenReturn(Mono.just("<html>rate limited</html>"));

        assertThatThrownBy(() -> fetcher.fetch(TestChains.eth(), ADDRESS)).isInstanceOf(UpstreamException.class);
    }

    @Test
    @DisplayName("missing network endpoint or API key is a configuration error")
    void fetch_missingConfiguration_failsBeforeCalling() {
        ChainDescriptor noKey = withTransport(new ChainDescriptor.TransportConfig("mainnet", "api.etherscan.io", 1L, null, true, null));
        ChainDescriptor noHost = withTransport(new ChainDescriptor.TransportConfig("mainnet", null, null, "K", true, null));

        assertThatThrownBy(() -> fetcher.fetch(noKey, ADDRESS)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> fetcher.fetch(noHost, ADDRESS)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void fetchDetail_confirmationsFromReceiptAndHead() {
        when(http.get(contains("eth_getTransactionReceipt"))).thenReturn(Mono.just("{\"result\":{\"blockNumber\":\"0x64\",\"status\":\"0x1\"}}"));
        when(http.get(contains("eth_blockNumber"))).thenReturn(Mono.just("{\"result\":\"0x6d\"}"));

        Optional<TransactionDetail> detail = fetcher.fetchDetail(TestChains.eth(), "0xhash");

        assertThat(detail).hasValueSatisfying(d -> assertThat(d.confirmations()).isEqualTo(10));
    }

    @Test
    void fetchDetail_noReceiptYet_empty() {
        when(http.get(contains("eth_getTransactionReceipt"))).thenReturn(Mono.just("{\"result\":null}"));

        assertThat(fetcher.fetchDetail(TestChains.eth(), "0xhash")).isEmpty();
    }

    private static ChainDescriptor withTransport(ChainDescriptor.TransportConfig cfg) {
        ChainDescriptor eth = TestChains.eth();
        return new ChainDescriptor(eth.id(), eth.family(), eth.transport(), eth.decimals(), eth.requiredConfirmations(),
                eth.feePolicy(), eth.cacheable(), eth.currency(), eth.activationFee(), cfg);
    }
}
