// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.ordering;

import com.digitalasset.poolinfo.common.NormalizationException;
import com.digitalasset.poolinfo.common.errors.ArrayLengthMismatchError;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The per-token values of one pool laid out as parallel lists. Index i refers to the same token
 * in every list; the constructor rejects lists of different length.
 */
public record TokenArrays(List<String> parsedTokens,
                          List<Integer> decimals,
                          List<BigInteger> scalingFactors,
                          List<BigInteger> balancesEvm,
                          List<BigInteger> upScaledBalances,
                          List<BigInteger> weights,
                          List<BigInteger> priceRates,
                          List<BigInteger> oldPriceRates,
                          List<Boolean> exemptedTokens) {

    public TokenArrays {
        parsedTokens = List.copyOf(parsedTokens);
        decimals = List.copyOf(decimals);
        scalingFactors = List.copyOf(scalingFactors);
        balancesEvm = List.copyOf(balancesEvm);
        upScaledBalances = List.copyOf(upScaledBalances);
        weights = List.copyOf(weights);
        priceRates = List.copyOf(priceRates);
        oldPriceRates = List.copyOf(oldPriceRates);
        exemptedTokens = List.copyOf(exemptedTokens);

        int n = parsedTokens.size();
        int[] sizes = {
            decimals.size(), scalingFactors.size(), balancesEvm.size(), upScaledBalances.size(),
            weights.size(), priceRates.size(), oldPriceRates.size(), exemptedTokens.size()
        };
        for (int size : sizes) {
            if (size != n) {
                throw new NormalizationException(new ArrayLengthMismatchError(
                    "parallel token arrays differ in length: tokens=" + n + " others=" + Arrays.toString(sizes)));
            }
        }
    }

    public int size() {
        return parsedTokens.size();
    }

    /**
     * New arrays where position i holds what this instance holds at {@code order[i]}.
     * The same permutation is applied to every list.
     */
    public TokenArrays permute(int[] order) {
        if (order.length != size()) {
            throw new NormalizationException(new ArrayLengthMismatchError(
                "permutation of length " + order.length + " applied to " + size() + " tokens"));
        }
        return new TokenArrays(
            pick(parsedTokens, order),
            pick(decimals, order),
            pick(scalingFactors, order),
            pick(balancesEvm, order),
            pick(upScaledBalances, order),
            pick(weights, order),
            pick(priceRates, order),
            pick(oldPriceRates, order),
            pick(exemptedTokens, order));
    }

    private static <T> List<T> pick(List<T> source, int[] order) {
        List<T> out = new ArrayList<>(order.length);
        for (int index : order) {
            out.add(source.get(index));
        }
        return out;
    }
}
