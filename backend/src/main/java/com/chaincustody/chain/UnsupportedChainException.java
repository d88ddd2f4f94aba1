package com.chaincustody.chain;

/**
 * Thrown when a chain id has no registry entry or no registered strategy.
 */
public class UnsupportedChainException extends RuntimeException {

    private final String chain;

    public UnsupportedChainException(String chain) {
        super("Unsupported chain: " + chain);
        this.chain = chain;
    }

    public String getChain() {
        return chain;
    }
}
