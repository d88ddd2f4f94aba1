package com.chaincustody.support;

import com.chaincustody.chain.ChainRegistry;
import com.chaincustody.domain.ChainDescriptor;
import com.chaincustody.domain.ChainFamily;
import com.chaincustody.domain.ChainTransport;
import com.chaincustody.domain.FeePolicy;

import java.math.BigDecimal;
import java.util.List;

/**
 * Chain descriptors shared by unit tests.
 */
public final class TestChains {

    public static final String BTC_ADDRESS = "bc1qar0srrr7xfkvy5l643lydnw9re59gtzzwf5mdq";
    public static final String ETH_ADDRESS = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e";
    public static final String TRON_ADDRESS = "TLa2f6VPqDgRE67v1736s7bJ8Ray5wYjU7";

    private TestChains() {
    }

    public static ChainDescriptor btc() {
        return new ChainDescriptor("BTC", ChainFamily.UTXO, ChainTransport.NODE_RPC, 8, 3,
                FeePolicy.NETWORK_ESTIMATE, true, "BTC", BigDecimal.ZERO, ChainDescriptor.TransportConfig.none());
    }

    public static ChainDescriptor eth() {
        return new ChainDescriptor("ETH", ChainFamily.ACCOUNT, ChainTransport.EXPLORER_API, 18, 3,
                FeePolicy.SERVICE_ONLY, true, "ETH", BigDecimal.ZERO,
                new ChainDescriptor.TransportConfig("mainnet", "api.etherscan.io", 1L, "KEY", true, null));
    }

    public static ChainDescriptor tron() {
        return new ChainDescriptor("TRON", ChainFamily.EXPLORER_ONLY, ChainTransport.THIRD_PARTY, 6, 19,
                FeePolicy.ACTIVATION_AND_ESTIMATE, true, "TRX", BigDecimal.ONE,
                new ChainDescriptor.TransportConfig(null, null, null, null, false, "https://api.trongrid.io"));
    }

    public static ChainRegistry registry() {
        return new ChainRegistry(List.of(btc(), eth(), tron()));
    }
}
