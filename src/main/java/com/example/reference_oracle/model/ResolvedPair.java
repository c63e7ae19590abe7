package com.example.reference_oracle.model;

import java.math.BigInteger;

/**
 * A symbol resolved to its rate and the time that rate became valid.
 * Not persisted.
 */
public record ResolvedPair(BigInteger rate, BigInteger lastUpdate) {
}
