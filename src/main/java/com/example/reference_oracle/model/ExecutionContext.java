package com.example.reference_oracle.model;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;

/**
 * Who is calling and at what instant. Block time is in nanoseconds since the epoch.
 */
public record ExecutionContext(String sender, BigInteger blockTime) {

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);

    public static ExecutionContext of(String sender, Clock clock) {
        Instant now = clock.instant();
        BigInteger nanos = BigInteger.valueOf(now.getEpochSecond())
                .multiply(NANOS_PER_SECOND)
                .add(BigInteger.valueOf(now.getNano()));
        return new ExecutionContext(sender, nanos);
    }
}
