package com.example.reference_oracle.error;

public enum ErrorCode {
    MISMATCHED_BATCH_LENGTH,
    UNKNOWN_SYMBOL,
    REF_DATA_NOT_AVAILABLE,
    DIVISION_BY_ZERO,
    UNAUTHORIZED_RELAYER
}
