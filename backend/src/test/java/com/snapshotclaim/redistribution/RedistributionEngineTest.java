package com.snapshotclaim.redistribution;

import com.snapshotclaim.domain.Claim;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedistributionEngineTest {

    private static final BigInteger SCALE = BigInteger.TEN.pow(8);
    private static final long COIN = 100_000_000L;

    private final RedistributionEngine engine = new RedistributionEngine();

    @Test
    @DisplayName("single destination above cap receives exactly the cap")
    void singleDestination_receivesCap() {
        BigInteger cap = units(500);

        RedistributionResult result = engine.compute(List.of(claim("s1", "d1", 700 * COIN)), cap, SCALE);

        assertThat(result.allocations()).hasSize(1);
        assertThat(result.allocations().get(0).finalBalance()).isEqualTo(cap);
        assertThat(result.totalFinalUnits()).isEqualTo(cap);
        assertThat(result.isScaled()).isTrue();
    }

    @Test
    @DisplayName("300M + 700M against a 500M cap scales to 150M + 350M")
    void workedExample() {
        List<Claim> claims = List.of(
                claim("s1", "dA", 300_000_000L * COIN),
                claim("s2", "dB", 700_000_000L * COIN));

        RedistributionResult result = engine.compute(claims, units(500_000_000L), SCALE);

        assertThat(result.multiplier()).isEqualTo(BigInteger.valueOf(50_000_000L));
        assertThat(result.deductionPercentage()).isEqualByComparingTo(new BigDecimal("50.00"));
        assertThat(result.allocations()).extracting(DestinationAllocation::finalBalance)
                .containsExactly(units(150_000_000L), units(350_000_000L));
        assertThat(result.totalFinalUnits()).isEqualTo(units(500_000_000L));
    }

    @Test
    @DisplayName("equal balances conserve the cap; rounding loss goes to the sorted-last destination")
    void equalBalances_remainderToLast() {
        List<Claim> claims = List.of(
                claim("s1", "d1", 1),
                claim("s2", "d2", 1),
                claim("s3", "d3", 1));
        BigInteger cap = BigInteger.TWO;

        RedistributionResult result = engine.compute(claims, cap, SCALE);

        assertThat(result.multiplier()).isEqualTo(BigInteger.valueOf(66_666_666L));
        assertThat(result.allocations()).extracting(DestinationAllocation::finalBalance)
                .containsExactly(BigInteger.ZERO, BigInteger.ZERO, BigInteger.TWO);
        assertThat(result.totalFinalUnits()).isEqualTo(cap);
    }

    @Test
    @DisplayName("skewed balances conserve the cap exactly")
    void skewedBalances_conserve() {
        List<Claim> claims = new ArrayList<>();
        claims.add(claim("whale", "dWhale", 9_000_000_000L * COIN / 100));
        for (int i = 0; i < 50; i++) {
            claims.add(claim("s" + i, "d" + i, 1_234_567L + i * 7_919L));
        }
        BigInteger cap = units(1_000_000L).add(BigInteger.valueOf(12_345));

        RedistributionResult result = engine.compute(claims, cap, SCALE);

        assertThat(result.totalFinalUnits()).isEqualTo(cap);
        assertThat(result.allocations()).allSatisfy(a -> assertThat(a.finalBalance().signum()).isGreaterThanOrEqualTo(0));
    }

    @Test
    @DisplayName("total below cap leaves every balance unchanged")
    void belowCap_finalEqualsOriginal() {
        List<Claim> claims = List.of(
                claim("s1", "d1", 10 * COIN),
                claim("s2", "d2", 20 * COIN));

        RedistributionResult result = engine.compute(claims, units(1_000), SCALE);

        assertThat(result.multiplier()).isEqualTo(SCALE);
        assertThat(result.isScaled()).isFalse();
        assertThat(result.deductionPercentage()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(result.allocations()).allSatisfy(a -> assertThat(a.finalBalance()).isEqualTo(a.originalBalance()));
    }

    @Test
    @DisplayName("all-zero balances do not divide by zero")
    void allZero() {
        List<Claim> claims = List.of(claim("s1", "d1", 0), claim("s2", "d2", 0));

        RedistributionResult result = engine.compute(claims, units(10), SCALE);

        assertThat(result.totalOriginalUnits()).isZero();
        assertThat(result.allocations()).extracting(DestinationAllocation::finalBalance)
                .containsOnly(BigInteger.ZERO);
    }

    @Test
    @DisplayName("empty claim set yields no allocations")
    void emptySet() {
        RedistributionResult result = engine.compute(List.of(), units(10), SCALE);

        assertThat(result.allocations()).isEmpty();
        assertThat(result.totalFinalUnits()).isZero();
    }

    @Test
    @DisplayName("claims sharing a destination are consolidated and sorted by source")
    void consolidatesByDestination() {
        List<Claim> claims = List.of(
                claim("sB", "d1", 30 * COIN),
                claim("sA", "d1", 70 * COIN),
                claim("sC", "d2", 100 * COIN));

        RedistributionResult result = engine.compute(claims, units(100), SCALE);

        DestinationAllocation first = result.allocations().get(0);
        assertThat(first.destinationAddress()).isEqualTo("d1");
        assertThat(first.originalBalance()).isEqualTo(units(100));
        assertThat(first.claims()).extracting(Claim::getSourceAddress).containsExactly("sA", "sB");
        assertThat(first.finalBalance()).isEqualTo(units(50));
        assertThat(first.deductedAmount()).isEqualTo(units(50));
    }

    @Test
    @DisplayName("result does not depend on input order; remainder always lands on the address-sorted last entry")
    void deterministic() {
        List<Claim> claims = new ArrayList<>(List.of(
                claim("s1", "zeta", 3),
                claim("s2", "alpha", 3),
                claim("s3", "mid", 3)));
        RedistributionResult first = engine.compute(claims, BigInteger.valueOf(7), SCALE);
        Collections.reverse(claims);
        RedistributionResult second = engine.compute(claims, BigInteger.valueOf(7), SCALE);

        assertThat(second.allocations()).isEqualTo(first.allocations());
        assertThat(first.allocations()).extracting(DestinationAllocation::destinationAddress)
                .containsExactly("alpha", "mid", "zeta");
        assertThat(first.allocations()).extracting(DestinationAllocation::finalBalance)
                .containsExactly(BigInteger.TWO, BigInteger.TWO, BigInteger.valueOf(3));
    }

    @Test
    @DisplayName("sums beyond 64-bit range stay exact")
    void beyondLongRange() {
        List<Claim> claims = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            claims.add(claim("s" + i, "d" + i, Long.MAX_VALUE));
        }
        BigInteger total = BigInteger.valueOf(Long.MAX_VALUE).multiply(BigInteger.valueOf(4));
        BigInteger cap = total.divide(BigInteger.valueOf(3));

        RedistributionResult result = engine.compute(claims, cap, SCALE);

        assertThat(result.totalOriginalUnits()).isEqualTo(total);
        assertThat(result.totalFinalUnits()).isEqualTo(cap);
    }

    @Test
    void rejectsNonPositiveScale() {
        assertThatThrownBy(() -> engine.compute(List.of(), units(1), BigInteger.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeBalance() {
        assertThatThrownBy(() -> engine.compute(List.of(claim("s1", "d1", -1)), units(1), SCALE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static BigInteger units(long coins) {
        return BigInteger.valueOf(coins).multiply(SCALE);
    }

    private static Claim claim(String source, String destination, long balance) {
        return Claim.of(source, destination, balance, "sig-" + source,
                "{\"sourceAddress\":\"" + source + "\"}", Instant.parse("2025-01-01T00:00:00Z"));
    }
}
