// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.constants;

import java.math.BigInteger;

/**
 * Centralized constants for pool info normalization.
 *
 * Precision values and sentinels defined here for easy auditing.
 */
public final class PoolInfoConstants {

    private PoolInfoConstants() {
        // Prevent instantiation
    }

    // ========================================
    // PRECISION & SCALE
    // ========================================

    /**
     * Decimal places of the common fixed-point basis.
     */
    public static final int FIXED_POINT_DECIMALS = 18;

    /**
     * Decimal places used for the amplification parameter (precision 1000).
     */
    public static final int AMP_PRECISION = 3;

    /**
     * Largest token decimal count that can be scaled up to the 18-decimal basis.
     */
    public static final int MAX_TOKEN_DECIMALS = 18;

    /**
     * 1.0 at 18-decimal fixed point (10^18).
     */
    public static final BigInteger ONE = BigInteger.TEN.pow(FIXED_POINT_DECIMALS);

    // ========================================
    // SENTINELS
    // ========================================

    /**
     * Address standing for the chain's native asset once it has been unwrapped.
     */
    public static final String NATIVE_ASSET_ADDRESS = "0x0000000000000000000000000000000000000000";

    /**
     * Index returned when a token is not present in a token list.
     */
    public static final int NOT_FOUND = -1;
}
