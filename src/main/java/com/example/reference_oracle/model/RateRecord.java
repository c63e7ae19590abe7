package com.example.reference_oracle.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigInteger;

/**
 * Relayed rate for a single symbol.
 * All three fields are unsigned 64-bit values; a resolveTime of zero means the
 * rate has never been resolved and must not be served.
 */
public record RateRecord(
        BigInteger rate,          // fixed-point, 10^9 per anchor unit
        BigInteger resolveTime,   // nanos, 0 = never resolved
        BigInteger requestId      // audit only
) {

    public RateRecord {
        Uint64.require(rate, "rate");
        Uint64.require(resolveTime, "resolveTime");
        Uint64.require(requestId, "requestId");
    }

    public static RateRecord of(long rate, long resolveTime, long requestId) {
        return new RateRecord(BigInteger.valueOf(rate), BigInteger.valueOf(resolveTime), BigInteger.valueOf(requestId));
    }

    @JsonIgnore
    public boolean isResolved() {
        return resolveTime.signum() > 0;
    }
}
