// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.scaling;

import com.digitalasset.poolinfo.common.NormalizationException;
import com.digitalasset.poolinfo.common.errors.ArrayLengthMismatchError;
import com.digitalasset.poolinfo.math.FixedPoint;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BinaryOperator;

/**
 * Elementwise conversion between native token amounts and the 18-decimal basis.
 */
public class Upscaler {

    /**
     * balances[i] * scalingFactors[i], rounded down.
     */
    public List<BigInteger> upscale(List<BigInteger> balances, List<BigInteger> scalingFactors) {
        return zip("upscale", balances, scalingFactors, FixedPoint::mulDown);
    }

    /**
     * Back to native units, rounded down. Used for amounts the pool pays out.
     */
    public List<BigInteger> downscaleDown(List<BigInteger> amounts, List<BigInteger> scalingFactors) {
        return zip("downscaleDown", amounts, scalingFactors, FixedPoint::divDown);
    }

    /**
     * Back to native units, rounded up. Used for amounts the pool takes in.
     */
    public List<BigInteger> downscaleUp(List<BigInteger> amounts, List<BigInteger> scalingFactors) {
        return zip("downscaleUp", amounts, scalingFactors, FixedPoint::divUp);
    }

    private static List<BigInteger> zip(String operation,
                                        List<BigInteger> amounts,
                                        List<BigInteger> scalingFactors,
                                        BinaryOperator<BigInteger> op) {
        if (amounts.size() != scalingFactors.size()) {
            throw new NormalizationException(new ArrayLengthMismatchError(
                operation + ": " + amounts.size() + " amounts vs " + scalingFactors.size() + " scaling factors"));
        }
        List<BigInteger> out = new ArrayList<>(amounts.size());
        for (int i = 0; i < amounts.size(); i++) {
            out.add(op.apply(amounts.get(i), scalingFactors.get(i)));
        }
        return List.copyOf(out);
    }
}
