package com.example.reference_oracle.model;

import java.math.BigInteger;

/**
 * Range checks for values that travel as unsigned 64-bit integers.
 */
public final class Uint64 {

    public static final BigInteger MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

    private Uint64() {
    }

    public static BigInteger require(BigInteger value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        if (value.signum() < 0 || value.compareTo(MAX) > 0) {
            throw new IllegalArgumentException(name + " out of unsigned 64-bit range: " + value);
        }
        return value;
    }
}
