// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.math;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Exact conversion between human-readable decimal strings and fixed-point integers.
 *
 * Parsing never rounds: a value carrying more significant fractional digits than the target
 * precision is rejected.
 */
public final class DecimalParser {

    private static final Pattern DECIMAL = Pattern.compile("-?(\\d+\\.?\\d*|\\.\\d+)");

    private DecimalParser() {
    }

    /**
     * Parse {@code value} into an integer scaled by 10^decimals.
     * <p>
     * Examples: ("1000", 6) -> 1000000000, ("0.003", 18) -> 3000000000000000, ("1.50", 1) -> 15.
     *
     * @throws NumberFormatException if the string is not a plain decimal number or does not fit
     *                               the requested precision
     */
    public static BigInteger parseFixed(String value, int decimals) {
        if (decimals < 0) {
            throw new NumberFormatException("negative precision: " + decimals);
        }
        if (value == null) {
            throw new NumberFormatException("missing value");
        }
        if (!DECIMAL.matcher(value).matches()) {
            throw new NumberFormatException("invalid decimal value: '" + value + "'");
        }
        BigDecimal scaled = new BigDecimal(value).movePointRight(decimals);
        try {
            return scaled.toBigIntegerExact();
        } catch (ArithmeticException e) {
            throw new NumberFormatException(
                "fractional component of '" + value + "' exceeds " + decimals + " decimals");
        }
    }

    /**
     * Render a fixed-point integer in human units, without trailing zeros.
     * <p>
     * Example: (3000000000000000, 18) -> "0.003".
     */
    public static String formatFixed(BigInteger value, int decimals) {
        return new BigDecimal(value, decimals).stripTrailingZeros().toPlainString();
    }
}
