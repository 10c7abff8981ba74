// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.scaling;

import com.digitalasset.poolinfo.common.NormalizationException;
import com.digitalasset.poolinfo.common.errors.InvalidTokenDecimalsError;
import com.digitalasset.poolinfo.constants.PoolInfoConstants;
import com.digitalasset.poolinfo.math.FixedPoint;

import java.math.BigInteger;

/**
 * Derives the per-token multiplier that brings a native-precision balance onto the common
 * 18-decimal basis, price rate included.
 */
public class ScalingFactorComputer {

    /**
     * 1e18 * 10^(18 - decimals), exact.
     *
     * @throws NormalizationException carrying {@link InvalidTokenDecimalsError} when decimals is outside [0, 18]
     */
    public BigInteger baseScalingFactor(int decimals) {
        requireValidDecimals(decimals);
        return FixedPoint.ONE.multiply(BigInteger.TEN.pow(PoolInfoConstants.MAX_TOKEN_DECIMALS - decimals));
    }

    /**
     * Base factor combined with the price rate, rounded down so a normalized value is never overstated.
     *
     * @param priceRate 18-decimal rate, or null for 1.0
     */
    public BigInteger scalingFactor(int decimals, BigInteger priceRate) {
        BigInteger rate = priceRate != null ? priceRate : FixedPoint.ONE;
        return FixedPoint.mulDown(baseScalingFactor(decimals), rate);
    }

    public void requireValidDecimals(int decimals) {
        if (decimals < 0 || decimals > PoolInfoConstants.MAX_TOKEN_DECIMALS) {
            throw new NormalizationException(new InvalidTokenDecimalsError(decimals));
        }
    }
}
