package com.chaincustody.chain;

import com.chaincustody.domain.ChainDescriptor;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Format check of a destination or deposit address for the chain's family.
 * UTXO addresses are only checked for a plausible Base58/Bech32 shape; the node rejects invalid ones at broadcast.
 */
@Component
public class AddressValidator {

    private static final Pattern EVM_ADDRESS = Pattern.compile("^0x[0-9a-fA-F]{40}$");
    /** Tron Base58Check: 'T' + 33 chars. */
    private static final Pattern TRON_ADDRESS = Pattern.compile("^T[1-9A-HJ-NP-Za-km-z]{33}$");
    private static final Pattern UTXO_ADDRESS = Pattern.compile("^[a-zA-Z0-9]{26,90}$");

    public boolean isValidAddress(ChainDescriptor chain, String address) {
        if (chain == null || address == null || address.isBlank()) return false;
        String trimmed = address.trim();
        return switch (chain.family()) {
            case ACCOUNT -> EVM_ADDRESS.matcher(trimmed).matches();
            case EXPLORER_ONLY -> TRON_ADDRESS.matcher(trimmed).matches();
            case UTXO -> UTXO_ADDRESS.matcher(trimmed).matches();
        };
    }
}
