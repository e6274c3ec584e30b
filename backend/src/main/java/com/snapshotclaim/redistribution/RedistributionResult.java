package com.snapshotclaim.redistribution;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.List;

/**
 * Outcome of one redistribution run. multiplier is fixed-point over scale; multiplier == scale means no reduction.
 */
public record RedistributionResult(
        BigInteger targetCapUnits,
        BigInteger totalOriginalUnits,
        BigInteger multiplier,
        BigInteger scale,
        List<DestinationAllocation> allocations
) {

    public BigInteger totalFinalUnits() {
        return allocations.stream()
                .map(DestinationAllocation::finalBalance)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public boolean isScaled() {
        return multiplier.compareTo(scale) < 0;
    }

    /** (1 - multiplier / scale) * 100, two decimals. */
    public BigDecimal deductionPercentage() {
        return new BigDecimal(scale.subtract(multiplier).multiply(BigInteger.valueOf(100)))
                .divide(new BigDecimal(scale), 2, RoundingMode.HALF_UP);
    }
}
