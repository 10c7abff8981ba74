// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.math;

import com.digitalasset.poolinfo.constants.PoolInfoConstants;

import java.math.BigInteger;
import java.util.List;

/**
 * 18-decimal fixed-point arithmetic over {@link BigInteger}, rounding in the direction named by
 * each method. Mirrors the integer maths the pool contracts run on chain.
 */
public final class FixedPoint {

    public static final BigInteger ONE = PoolInfoConstants.ONE;

    private FixedPoint() {
    }

    /**
     * a * b / 1e18, rounded down.
     */
    public static BigInteger mulDown(BigInteger a, BigInteger b) {
        return a.multiply(b).divide(ONE);
    }

    /**
     * a * b / 1e18, rounded up.
     */
    public static BigInteger mulUp(BigInteger a, BigInteger b) {
        BigInteger product = a.multiply(b);
        if (product.signum() == 0) {
            return BigInteger.ZERO;
        }
        return product.subtract(BigInteger.ONE).divide(ONE).add(BigInteger.ONE);
    }

    /**
     * a * 1e18 / b, rounded down.
     *
     * @throws ArithmeticException if b is zero
     */
    public static BigInteger divDown(BigInteger a, BigInteger b) {
        requireNonZero(b);
        if (a.signum() == 0) {
            return BigInteger.ZERO;
        }
        return a.multiply(ONE).divide(b);
    }

    /**
     * a * 1e18 / b, rounded up.
     *
     * @throws ArithmeticException if b is zero
     */
    public static BigInteger divUp(BigInteger a, BigInteger b) {
        requireNonZero(b);
        if (a.signum() == 0) {
            return BigInteger.ZERO;
        }
        return a.multiply(ONE).subtract(BigInteger.ONE).divide(b).add(BigInteger.ONE);
    }

    /**
     * Largest value of a non-empty list.
     */
    public static BigInteger max(List<BigInteger> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("max of an empty list");
        }
        BigInteger best = values.get(0);
        for (BigInteger v : values) {
            if (v.compareTo(best) > 0) {
                best = v;
            }
        }
        return best;
    }

    /**
     * Index of the first occurrence of the largest value, or -1 for an empty list.
     */
    public static int argMax(List<BigInteger> values) {
        int index = PoolInfoConstants.NOT_FOUND;
        BigInteger best = null;
        for (int i = 0; i < values.size(); i++) {
            BigInteger v = values.get(i);
            if (best == null || v.compareTo(best) > 0) {
                best = v;
                index = i;
            }
        }
        return index;
    }

    private static void requireNonZero(BigInteger divisor) {
        if (divisor.signum() == 0) {
            throw new ArithmeticException("fixed-point division by zero");
        }
    }
}
