package com.snapshotclaim.common;

import java.math.BigInteger;

/**
 * Renders smallest-unit integers as whole-coin decimal strings using exact integer division.
 * 150000000 with 8 decimals is "1.50000000".
 */
public final class UnitAmountFormatter {

    private UnitAmountFormatter() {
    }

    public static String format(long units, int decimals) {
        return format(BigInteger.valueOf(units), decimals);
    }

    public static String format(BigInteger units, int decimals) {
        if (units == null) {
            throw new IllegalArgumentException("units must not be null");
        }
        if (decimals < 0) {
            throw new IllegalArgumentException("decimals must not be negative");
        }
        String sign = units.signum() < 0 ? "-" : "";
        if (decimals == 0) {
            return sign + units.abs();
        }
        BigInteger[] wholeAndFraction = units.abs().divideAndRemainder(BigInteger.TEN.pow(decimals));
        StringBuilder fraction = new StringBuilder(wholeAndFraction[1].toString());
        while (fraction.length() < decimals) {
            fraction.insert(0, '0');
        }
        return sign + wholeAndFraction[0] + "." + fraction;
    }
}
