package com.chaincustody.node;

import com.chaincustody.chain.UnsupportedChainException;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Node clients keyed by chain id, one per configured node.
 */
public class NodeClientRegistry {

    private final Map<String, NodeClient> clients;

    public NodeClientRegistry(Map<String, NodeClient> clients) {
        Map<String, NodeClient> byChain = new LinkedHashMap<>();
        clients.forEach((chain, client) -> byChain.put(chain.trim().toUpperCase(Locale.ROOT), client));
        this.clients = Map.copyOf(byChain);
    }

    /**
     * @throws UnsupportedChainException when no node is configured for the chain
     */
    public NodeClient forChain(String chain) {
        return find(chain).orElseThrow(() -> new UnsupportedChainException(chain));
    }

    public Optional<NodeClient> find(String chain) {
        if (chain == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(chain.trim().toUpperCase(Locale.ROOT)));
    }
}
