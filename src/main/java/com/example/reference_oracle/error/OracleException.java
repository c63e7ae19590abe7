package com.example.reference_oracle.error;

/**
 * Recoverable failure of a relay or query call. State is never modified when one is thrown.
 */
public class OracleException extends RuntimeException {

    private final ErrorCode code;

    public OracleException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public static OracleException mismatchedBatchLength(int symbols, int rates, int resolveTimes, int requestIds) {
        return new OracleException(ErrorCode.MISMATCHED_BATCH_LENGTH,
                String.format("Batch arrays differ in length: symbols=%d, rates=%d, resolveTimes=%d, requestIds=%d",
                        symbols, rates, resolveTimes, requestIds));
    }

    public static OracleException unknownSymbol(String symbol) {
        return new OracleException(ErrorCode.UNKNOWN_SYMBOL, "Unknown symbol: " + symbol);
    }

    public static OracleException refDataNotAvailable(String symbol) {
        return new OracleException(ErrorCode.REF_DATA_NOT_AVAILABLE, "Reference data not available for symbol: " + symbol);
    }

    public static OracleException divisionByZero(String quote) {
        return new OracleException(ErrorCode.DIVISION_BY_ZERO, "Quote symbol resolved to a zero rate: " + quote);
    }

    public static OracleException unauthorizedRelayer(String sender) {
        return new OracleException(ErrorCode.UNAUTHORIZED_RELAYER, "Sender is not an allowed relayer: " + sender);
    }
}
