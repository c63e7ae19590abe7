package com.example.reference_oracle.service;

import com.example.reference_oracle.model.ExecutionContext;
import com.example.reference_oracle.model.RateRecord;
import com.example.reference_oracle.model.ReferenceData;
import com.example.reference_oracle.model.RelayBatch;

import java.util.Map;
import java.util.Optional;

public interface ReferenceDataService {

    /**
     * Resets the store to an empty mapping.
     */
    void initialize();

    // Relayer Methods

    /**
     * Applies a batch of rate updates atomically: either every record is written or none is.
     */
    void relay(RelayBatch batch, ExecutionContext context);

    // Consumer Methods

    /**
     * Returns every stored record keyed by symbol.
     */
    Map<String, RateRecord> getAllRefs();

    Optional<RateRecord> getRef(String symbol);

    /**
     * Cross-rate of base in quote, resolved at the context's block time.
     */
    ReferenceData getReferenceData(String base, String quote, ExecutionContext context);
}
