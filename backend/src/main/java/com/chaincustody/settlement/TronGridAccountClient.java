package com.chaincustody.settlement;

import com.chaincustody.config.CaffeineConfig;
import com.chaincustody.config.SettlementProperties;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.http.HttpJsonClient;
import com.chaincustody.http.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Map;

/**
 * TronGrid account lookups for TRON withdrawals: activation status of the destination and the bandwidth fee of
 * a plain transfer. Only positive activation results are cached, activation being permanent.
 */
@Component
@RequiredArgsConstructor
public class TronGridAccountClient implements AccountActivationChecker, NetworkFeeEstimator {

    static final String API_KEY_HEADER = "TRON-PRO-API-KEY";
    private static final String TRANSACTION_FEE_PARAMETER = "getTransactionFee";

    private final HttpJsonClient http;
    private final ObjectMapper objectMapper;
    private final SettlementProperties settlementProperties;
    private final CacheManager cacheManager;

    @Override
    public boolean supports(ChainDescriptor chain) {
        return chain.family() == ChainFamily.EXPLORER_ONLY;
    }

    @Override
    public boolean isActivated(ChainDescriptor chain, String address) {
        Cache cache = cacheManager.getCache(CaffeineConfig.ACCOUNT_ACTIVATION_CACHE);
        String key = chain.id() + ":" + address;
        if (cache != null && Boolean.TRUE.equals(cache.get(key, Boolean.class))) {
            return true;
        }
        JsonNode data = read(http.get(baseUrl(chain) + "/v1/accounts/" + address, headers(chain)).block()).get("data");
        if (data == null || !data.isArray()) {
            throw new UpstreamException("TronGrid account response for " + address + " has no data array");
        }
        boolean activated = !data.isEmpty();
        if (activated && cache != null) {
            cache.put(key, Boolean.TRUE);
        }
        return activated;
    }

    /**
     * Bandwidth fee of a TRX transfer: fee per byte (sun) times transfer size, in TRX.
     */
    @Override
    public BigDecimal estimate(ChainDescriptor chain, BigDecimal amount, String toAddress) {
        JsonNode params = read(http.post(baseUrl(chain) + "/wallet/getchainparameters", Map.of(), headers(chain))
                .block()).path("chainParameter");
        for (JsonNode p : params) {
            if (TRANSACTION_FEE_PARAMETER.equals(p.path("key").asText())) {
                BigDecimal sunPerByte = BigDecimal.valueOf(p.path("value").asLong(0));
                return sunPerByte.multiply(BigDecimal.valueOf(settlementProperties.getTronTransferBandwidthBytes()))
                        .movePointLeft(chain.decimals());
            }
        }
        throw new UpstreamException("TronGrid chain parameters lack " + TRANSACTION_FEE_PARAMETER);
    }

    private JsonNode read(String body) {
        if (body == null || body.isBlank()) {
            throw new UpstreamException("Empty TronGrid response");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Malformed TronGrid response", e);
        }
    }

    private static String baseUrl(ChainDescriptor chain) {
        String base = chain.transportConfig().baseUrl();
        if (base == null || base.isBlank()) {
            throw new IllegalStateException("No base-url configured for " + chain.id());
        }
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static Map<String, String> headers(ChainDescriptor chain) {
        String key = chain.transportConfig().explorerApiKey();
        return key == null || key.isBlank() ? Map.of() : Map.of(API_KEY_HEADER, key);
    }
}
