package com.chaincustody.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full-node RPC connection per UTXO chain. Key = chain id.
 */
@ConfigurationProperties(prefix = "chaincustody")
@NoArgsConstructor
@Getter
@Setter
public class NodeProperties {

    private Map<String, NodeEntry> node = new LinkedHashMap<>();

    public void setNode(Map<String, NodeEntry> node) {
        this.node = node != null ? node : new LinkedHashMap<>();
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class NodeEntry {
        private String host = "127.0.0.1";
        private int port = 8332;
        private String username = "";
        private String password = "";
        /** Watch-only wallet used for all wallet-scoped calls. */
        private String walletName = "ecosystem_wallets";
        private long timeoutMs = 3_000;

        public String url() {
            return "http://" + host + ":" + port;
        }
    }
}
