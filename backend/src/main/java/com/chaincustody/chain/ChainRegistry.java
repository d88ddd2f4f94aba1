package com.chaincustody.chain;

import com.chaincustody.config.ChainProperties;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.ChainTransport;
import com.chaincustody.domain.FeePolicy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable chain table, constructed once at startup and injected where needed.
 */
@Slf4j
public class ChainRegistry {

    static final int DEFAULT_CONFIRMATIONS = 3;

    private final Map<String, ChainDescriptor> chains;

    public ChainRegistry(Collection<ChainDescriptor> descriptors) {
        Map<String, ChainDescriptor> byId = new LinkedHashMap<>();
        for (ChainDescriptor d : descriptors) {
            byId.put(normalize(d.id()), d);
        }
        this.chains = Map.copyOf(byId);
    }

    public static ChainRegistry fromProperties(ChainProperties properties) {
        return new ChainRegistry(properties.getChain().entrySet().stream()
                .map(e -> toDescriptor(normalize(e.getKey()), e.getValue()))
                .toList());
    }

    /**
     * @throws UnsupportedChainException when the chain is not registered
     */
    public ChainDescriptor resolve(String chainId) {
        return find(chainId).orElseThrow(() -> new UnsupportedChainException(chainId));
    }

    public Optional<ChainDescriptor> find(String chainId) {
        if (chainId == null || chainId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(chains.get(normalize(chainId)));
    }

    public Collection<ChainDescriptor> all() {
        return chains.values();
    }

    private static ChainDescriptor toDescriptor(String id, ChainProperties.ChainEntry entry) {
        if (entry.getFamily() == null) {
            throw new IllegalStateException("Chain " + id + " has no family configured");
        }
        ChainTransport transport = entry.getTransport() != null ? entry.getTransport() : defaultTransport(entry.getFamily());
        int confirmations = entry.getConfirmations() != null ? entry.getConfirmations() : DEFAULT_CONFIRMATIONS;
        FeePolicy feePolicy = entry.getFeePolicy() != null ? entry.getFeePolicy() : FeePolicy.SERVICE_ONLY;
        BigDecimal activationFee = entry.getActivationFee() != null ? entry.getActivationFee() : BigDecimal.ZERO;
        return new ChainDescriptor(
                id,
                entry.getFamily(),
                transport,
                entry.getDecimals(),
                confirmations,
                feePolicy,
                entry.isCacheable(),
                entry.getCurrency() != null ? entry.getCurrency() : id,
                activationFee,
                transportConfig(id, entry));
    }

    private static ChainDescriptor.TransportConfig transportConfig(String id, ChainProperties.ChainEntry entry) {
        String network = entry.getNetwork();
        String explorerHost = null;
        Long explorerChainId = null;
        if (network != null && !network.isBlank()) {
            ChainProperties.NetworkEndpoint endpoint = entry.getNetworks().get(network);
            if (endpoint == null) {
                log.warn("Chain {} selects network '{}' which has no endpoint configured", id, network);
            } else {
                explorerHost = endpoint.getExplorer();
                explorerChainId = endpoint.getChainId();
            }
        }
        return new ChainDescriptor.TransportConfig(
                network,
                explorerHost,
                explorerChainId,
                entry.getExplorerApiKey(),
                entry.isExplorerApi(),
                entry.getBaseUrl());
    }

    private static ChainTransport defaultTransport(ChainFamily family) {
        return switch (family) {
            case UTXO -> ChainTransport.NODE_RPC;
            case ACCOUNT -> ChainTransport.EXPLORER_API;
            case EXPLORER_ONLY -> ChainTransport.THIRD_PARTY;
        };
    }

    private static String normalize(String chainId) {
        return chainId.trim().toUpperCase(Locale.ROOT);
    }
}
