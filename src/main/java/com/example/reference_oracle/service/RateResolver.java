package com.example.reference_oracle.service;

import com.example.reference_oracle.error.OracleException;
import com.example.reference_oracle.model.RateRecord;
import com.example.reference_oracle.model.ReferenceData;
import com.example.reference_oracle.model.ReferenceState;
import com.example.reference_oracle.model.ResolvedPair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;

/**
 * Stateless query logic over a loaded {@link ReferenceState}.
 * <p>
 * USD is the anchor: it is never stored and always resolves to 10^9 at the
 * current block time. Cross-rates are scaled by 10^18 and truncated.
 */
public class RateResolver {

    private static final Logger log = LoggerFactory.getLogger(RateResolver.class);

    public static final String ANCHOR_SYMBOL = "USD";
    public static final BigInteger ANCHOR_RATE = BigInteger.TEN.pow(9);
    public static final BigInteger CROSS_RATE_SCALE = BigInteger.TEN.pow(18);

    public ResolvedPair resolve(ReferenceState refs, String symbol, BigInteger currentTime) {
        if (ANCHOR_SYMBOL.equals(symbol)) {
            return new ResolvedPair(ANCHOR_RATE, currentTime);
        }
        RateRecord record = refs.get(symbol).orElseThrow(() -> OracleException.unknownSymbol(symbol));
        if (!record.isResolved()) {
            throw OracleException.refDataNotAvailable(symbol);
        }
        log.debug("Resolved {} to rate={} at {}", symbol, record.rate(), record.resolveTime());
        return new ResolvedPair(record.rate(), record.resolveTime());
    }

    /**
     * Price of {@code base} denominated in {@code quote}: {@code base.rate * 10^18 / quote.rate}.
     */
    public ReferenceData crossRate(ReferenceState refs, String base, String quote, BigInteger currentTime) {
        ResolvedPair basePair = resolve(refs, base, currentTime);
        ResolvedPair quotePair = resolve(refs, quote, currentTime);
        if (quotePair.rate().signum() == 0) {
            throw OracleException.divisionByZero(quote);
        }
        // BigInteger.divide truncates toward zero
        BigInteger rate = basePair.rate().multiply(CROSS_RATE_SCALE).divide(quotePair.rate());
        return new ReferenceData(rate, basePair.lastUpdate(), quotePair.lastUpdate());
    }
}
