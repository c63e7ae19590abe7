package com.example.reference_oracle.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The whole persisted state: symbol to rate record. Saved and loaded as one blob.
 */
public record ReferenceState(@JsonProperty("refs") Map<String, RateRecord> refs) {

    public ReferenceState {
        refs = refs == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(refs));
    }

    public static ReferenceState empty() {
        return new ReferenceState(Map.of());
    }

    public Optional<RateRecord> get(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(refs.get(symbol));
    }
}
