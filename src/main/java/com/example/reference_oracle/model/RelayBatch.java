package com.example.reference_oracle.model;

import java.math.BigInteger;
import java.util.List;

/**
 * One relay call: four positionally aligned sequences, index i across all of
 * them describes one update. Missing sequences are treated as empty.
 */
public record RelayBatch(
        List<String> symbols,
        List<BigInteger> rates,
        List<BigInteger> resolveTimes,
        List<BigInteger> requestIds
) {

    public RelayBatch {
        symbols = symbols == null ? List.of() : symbols;
        rates = rates == null ? List.of() : rates;
        resolveTimes = resolveTimes == null ? List.of() : resolveTimes;
        requestIds = requestIds == null ? List.of() : requestIds;
    }

    public int size() {
        return symbols.size();
    }
}
