package com.example.reference_oracle.model;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.math.BigInteger;

/**
 * Cross-rate of base in quote, scaled by 10^18, with the update time of each side.
 * Serialized as decimal strings since the rate routinely exceeds 64 bits.
 */
public record ReferenceData(
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger rate,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger lastUpdatedBase,
        @JsonFormat(shape = JsonFormat.Shape.STRING) BigInteger lastUpdatedQuote
) {
}
