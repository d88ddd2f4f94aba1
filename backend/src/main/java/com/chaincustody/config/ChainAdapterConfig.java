package com.chaincustody.config;

import com.chaincustody.chain.ChainRegistry;
import com.chaincustody.common.RetryPolicy;
import com.chaincustody.deposit.fetch.ExplorerTransactionFetcher;
import com.chaincustody.deposit.fetch.TransactionFetcher;
import com.chaincustody.deposit.fetch.TransactionFetcherDispatcher;
import com.chaincustody.deposit.fetch.TronGridTransactionFetcher;
import com.chaincustody.deposit.fetch.UtxoNodeTransactionFetcher;
import com.chaincustody.deposit.monitor.PollScheduler;
import com.chaincustody.deposit.monitor.TaskSchedulerPollScheduler;
import com.chaincustody.http.HttpJsonClient;
import com.chaincustody.http.WebClientHttpJsonClient;
import com.chaincustody.node.NodeClient;
import com.chaincustody.node.NodeClientRegistry;
import com.chaincustody.node.WebClientNodeRpcTransport;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chain access wiring: registry, node clients, explorer HTTP client with its rate limiter, fetchers and the
 * monitor poll scheduler.
 */
@Configuration
@EnableConfigurationProperties({
        ChainProperties.class,
        NodeProperties.class,
        MonitorProperties.class,
        RetryProperties.class,
        ExplorerProperties.class,
        SettlementProperties.class
})
@Slf4j
public class ChainAdapterConfig {

    @Bean
    public ChainRegistry chainRegistry(ChainProperties chainProperties) {
        ChainRegistry registry = ChainRegistry.fromProperties(chainProperties);
        log.info("Registered chains: {}", registry.all().stream().map(c -> c.id()).toList());
        return registry;
    }

    @Bean
    public RetryPolicy nodeRetryPolicy(RetryProperties retryProperties) {
        return new RetryPolicy(retryProperties.getBaseDelayMs(), retryProperties.getJitterFactor(),
                Math.max(1, retryProperties.getMaxAttempts()));
    }

    @Bean
    public NodeClientRegistry nodeClientRegistry(NodeProperties nodeProperties, WebClient.Builder webClientBuilder,
                                                 ObjectMapper objectMapper, RetryPolicy nodeRetryPolicy) {
        Map<String, NodeClient> clients = new LinkedHashMap<>();
        nodeProperties.getNode().forEach((chain, entry) -> {
            String id = chain.trim().toUpperCase(Locale.ROOT);
            WebClientNodeRpcTransport transport = new WebClientNodeRpcTransport(webClientBuilder.clone(),
                    entry.getUsername(), entry.getPassword(), Duration.ofMillis(entry.getTimeoutMs()));
            clients.put(id, new NodeClient(id, entry.url(), entry.getWalletName(), transport, objectMapper,
                    nodeRetryPolicy));
        });
        return new NodeClientRegistry(clients);
    }

    @Bean
    public HttpJsonClient httpJsonClient(WebClient.Builder webClientBuilder, ExplorerProperties explorerProperties) {
        return new WebClientHttpJsonClient(webClientBuilder.clone(), Duration.ofMillis(explorerProperties.getTimeoutMs()));
    }

    @Bean(name = "explorerRateLimiter")
    public RateLimiter explorerRateLimiter(ExplorerProperties explorerProperties) {
        int rps = Math.max(1, explorerProperties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, explorerProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("explorer-api", config);
    }

    @Bean
    public UtxoNodeTransactionFetcher utxoNodeTransactionFetcher(NodeClientRegistry nodeClientRegistry) {
        return new UtxoNodeTransactionFetcher(nodeClientRegistry);
    }

    @Bean
    public ExplorerTransactionFetcher explorerTransactionFetcher(HttpJsonClient httpJsonClient, ObjectMapper objectMapper,
                                                                 @Qualifier("explorerRateLimiter") RateLimiter rateLimiter) {
        return new ExplorerTransactionFetcher(httpJsonClient, objectMapper, rateLimiter);
    }

    @Bean
    public TronGridTransactionFetcher tronGridTransactionFetcher(HttpJsonClient httpJsonClient, ObjectMapper objectMapper) {
        return new TronGridTransactionFetcher(httpJsonClient, objectMapper);
    }

    @Bean
    public TransactionFetcherDispatcher transactionFetcherDispatcher(ChainRegistry chainRegistry,
                                                                     List<TransactionFetcher> fetchers,
                                                                     CacheManager cacheManager) {
        return new TransactionFetcherDispatcher(chainRegistry, fetchers, cacheManager);
    }

    @Bean
    public PollScheduler pollScheduler(@Qualifier(SchedulerConfig.MONITOR_SCHEDULER) ThreadPoolTaskScheduler monitorScheduler) {
        return new TaskSchedulerPollScheduler(monitorScheduler);
    }
}
