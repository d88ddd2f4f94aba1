package com.chaincustody.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Full inputs/outputs of a UTXO transaction. Output values are in minor units.
 */
public record TransactionDetail(
        String hash,
        int confirmations,
        Instant blockTime,
        List<Input> inputs,
        List<Output> outputs
) {

    public TransactionDetail {
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    /**
     * Sum of outputs paying the given address.
     */
    public BigInteger amountPaidTo(String address) {
        return outputs.stream()
                .filter(o -> o.addresses().contains(address))
                .map(Output::value)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public record Input(String prevHash, int outputIndex) {
    }

    public record Output(BigInteger value, List<String> addresses) {

        public Output {
            addresses = addresses != null ? List.copyOf(addresses) : List.of();
        }
    }
}
