package com.chaincustody.config;

import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.ChainTransport;
import com.chaincustody.domain.FeePolicy;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Static chain table. Key = chain id (e.g. BTC, ETH, TRON). Read once at startup; the registry is built from it.
 * Network selector and explorer API key are usually supplied via environment (CHAINCUSTODY_CHAIN_ETH_NETWORK, ...).
 */
@ConfigurationProperties(prefix = "chaincustody")
@NoArgsConstructor
@Getter
@Setter
public class ChainProperties {

    private Map<String, ChainEntry> chain = new LinkedHashMap<>();

    public void setChain(Map<String, ChainEntry> chain) {
        this.chain = chain != null ? chain : new LinkedHashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class ChainEntry {

        private ChainFamily family;
        /** Defaults from family: UTXO → NODE_RPC, ACCOUNT → EXPLORER_API, EXPLORER_ONLY → THIRD_PARTY. */
        private ChainTransport transport;
        private int decimals = 18;
        /** Confirmations before a deposit is credited. Default 3. */
        private Integer confirmations;
        private FeePolicy feePolicy = FeePolicy.SERVICE_ONLY;
        private boolean cacheable = true;
        private String currency;
        /** Charged when the destination account is not yet activated (ACTIVATION_AND_ESTIMATE only). */
        private BigDecimal activationFee = BigDecimal.ZERO;
        /** Selected entry of {@link #networks}, e.g. "mainnet". */
        private String network;
        private String explorerApiKey;
        /** False for explorers that accept keyless requests. */
        private boolean explorerApi = true;
        private Map<String, NetworkEndpoint> networks = new HashMap<>();
        /** Third-party service base URL (e.g. https://api.trongrid.io). */
        private String baseUrl;

        public void setNetworks(Map<String, NetworkEndpoint> networks) {
            this.networks = networks != null ? networks : new HashMap<>();
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NetworkEndpoint {
        private String explorer;
        private Long chainId;
    }
}
