package com.example.reference_oracle.service;

import com.example.reference_oracle.error.ErrorCode;
import com.example.reference_oracle.error.OracleException;
import com.example.reference_oracle.model.RateRecord;
import com.example.reference_oracle.model.ReferenceData;
import com.example.reference_oracle.model.ReferenceState;
import com.example.reference_oracle.model.ResolvedPair;
import com.example.reference_oracle.model.Uint64;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateResolverTest {

    private static final BigInteger BLOCK_TIME = new BigInteger("1571797419879305533");

    private final RateResolver resolver = new RateResolver();

    @Test
    @DisplayName("USD resolves to 1e9 at the current time regardless of store contents")
    void testResolve_Anchor() {
        ReferenceState refs = new ReferenceState(Map.of("USD", RateRecord.of(5, 0, 1)));

        assertThat(resolver.resolve(refs, "USD", BLOCK_TIME))
                .isEqualTo(new ResolvedPair(BigInteger.valueOf(1_000_000_000L), BLOCK_TIME));
        assertThat(resolver.resolve(ReferenceState.empty(), "USD", BigInteger.ZERO))
                .isEqualTo(new ResolvedPair(BigInteger.valueOf(1_000_000_000L), BigInteger.ZERO));
    }

    @Test
    @DisplayName("A stored symbol resolves to its rate and resolve time")
    void testResolve_Stored() {
        ReferenceState refs = new ReferenceState(Map.of("ETH", RateRecord.of(3_000_000_000_000L, 42, 7)));

        assertThat(resolver.resolve(refs, "ETH", BLOCK_TIME))
                .isEqualTo(new ResolvedPair(BigInteger.valueOf(3_000_000_000_000L), BigInteger.valueOf(42)));
    }

    @Test
    @DisplayName("A never registered symbol fails with UNKNOWN_SYMBOL")
    void testResolve_Unknown() {
        assertThatThrownBy(() -> resolver.resolve(ReferenceState.empty(), "DOGE", BLOCK_TIME))
                .isInstanceOf(OracleException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.UNKNOWN_SYMBOL)
                .hasMessageContaining("DOGE");
    }

    @Test
    @DisplayName("A registered symbol with resolve time 0 fails with REF_DATA_NOT_AVAILABLE")
    void testResolve_NotResolved() {
        ReferenceState refs = new ReferenceState(Map.of("ETH", RateRecord.of(100, 0, 7)));

        assertThatThrownBy(() -> resolver.resolve(refs, "ETH", BLOCK_TIME))
                .isInstanceOf(OracleException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.REF_DATA_NOT_AVAILABLE);
    }

    @Test
    @DisplayName("USD in MATIC matches the known relay scenario")
    void testCrossRate_UsdMatic() {
        ReferenceState refs = new ReferenceState(Map.of("MATIC", RateRecord.of(112, 1625108298000000000L, 124)));

        ReferenceData data = resolver.crossRate(refs, "USD", "MATIC", BLOCK_TIME);

        assertThat(data.rate()).isEqualTo(new BigInteger("8928571428571428571428571"));
        assertThat(data.lastUpdatedBase()).isEqualTo(BLOCK_TIME);
        assertThat(data.lastUpdatedQuote()).isEqualTo(new BigInteger("1625108298000000000"));
    }

    @Test
    @DisplayName("Near-maximum rates do not overflow")
    void testCrossRate_LargeOperands() {
        ReferenceState refs = new ReferenceState(Map.of(
                "BIG", new RateRecord(Uint64.MAX, BigInteger.ONE, BigInteger.ONE),
                "ONE", RateRecord.of(1, 1, 1)));

        ReferenceData data = resolver.crossRate(refs, "BIG", "ONE", BLOCK_TIME);

        assertThat(data.rate()).isEqualTo(Uint64.MAX.multiply(BigInteger.TEN.pow(18)));
    }

    @Test
    @DisplayName("Division truncates toward zero")
    void testCrossRate_Truncates() {
        ReferenceState refs = new ReferenceState(Map.of(
                "A", RateRecord.of(1, 1, 1),
                "B", RateRecord.of(3, 1, 1)));

        assertThat(resolver.crossRate(refs, "A", "B", BLOCK_TIME).rate())
                .isEqualTo(new BigInteger("333333333333333333"));
    }

    @Test
    @DisplayName("A zero quote rate fails with DIVISION_BY_ZERO")
    void testCrossRate_ZeroQuote() {
        ReferenceState refs = new ReferenceState(Map.of("ZERO", RateRecord.of(0, 10, 1)));

        assertThatThrownBy(() -> resolver.crossRate(refs, "USD", "ZERO", BLOCK_TIME))
                .isInstanceOf(OracleException.class)
                .hasFieldOrPropertyWithValue("code", ErrorCode.DIVISION_BY_ZERO);
    }

    @Test
    @DisplayName("A zero base rate is a valid zero cross-rate")
    void testCrossRate_ZeroBase() {
        ReferenceState refs = new ReferenceState(Map.of("ZERO", RateRecord.of(0, 10, 1)));

        assertThat(resolver.crossRate(refs, "ZERO", "USD", BLOCK_TIME).rate()).isZero();
    }

    @Test
    @DisplayName("A failing base side is reported even when the quote would also fail")
    void testCrossRate_PropagatesBaseFailure() {
        ReferenceState refs = new ReferenceState(Map.of("ETH", RateRecord.of(1, 0, 1)));

        assertThatThrownBy(() -> resolver.crossRate(refs, "ETH", "NOPE", BLOCK_TIME))
                .hasFieldOrPropertyWithValue("code", ErrorCode.REF_DATA_NOT_AVAILABLE);
        assertThatThrownBy(() -> resolver.crossRate(refs, "USD", "NOPE", BLOCK_TIME))
                .hasFieldOrPropertyWithValue("code", ErrorCode.UNKNOWN_SYMBOL);
    }

    @Test
    @DisplayName("Both directions multiply back to 1e36 within truncation error")
    void testCrossRate_ScaleConsistent() {
        ReferenceState refs = new ReferenceState(Map.of(
                "ETH", RateRecord.of(3_456_789_012_345L, 1, 1),
                "BAND", RateRecord.of(7_123_456_789L, 1, 1)));

        BigInteger forward = resolver.crossRate(refs, "ETH", "BAND", BLOCK_TIME).rate();
        BigInteger backward = resolver.crossRate(refs, "BAND", "ETH", BLOCK_TIME).rate();
        BigInteger product = forward.multiply(backward);
        BigInteger exact = BigInteger.TEN.pow(36);

        assertThat(product).isLessThanOrEqualTo(exact);
        assertThat(exact.subtract(product)).isLessThanOrEqualTo(forward.add(backward).add(BigInteger.TWO));
    }
}
