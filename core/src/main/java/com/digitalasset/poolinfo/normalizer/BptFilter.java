// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.normalizer;

import com.digitalasset.poolinfo.constants.PoolInfoConstants;
import com.digitalasset.poolinfo.ordering.TokenArrays;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes a pool's own liquidity token (BPT) from its token lists.
 */
public class BptFilter {

    /**
     * Position of {@code poolAddress} in {@code parsedTokens}, compared exactly (case-sensitive),
     * or -1 when absent.
     */
    public int locate(String poolAddress, List<String> parsedTokens) {
        if (poolAddress == null) {
            return PoolInfoConstants.NOT_FOUND;
        }
        for (int i = 0; i < parsedTokens.size(); i++) {
            if (poolAddress.equals(parsedTokens.get(i))) {
                return i;
            }
        }
        return PoolInfoConstants.NOT_FOUND;
    }

    public WithoutBpt exclude(int bptIndex, TokenArrays arrays) {
        if (bptIndex == PoolInfoConstants.NOT_FOUND) {
            return WithoutBpt.EMPTY;
        }
        if (bptIndex < 0 || bptIndex >= arrays.size()) {
            throw new IndexOutOfBoundsException("bptIndex " + bptIndex + " outside " + arrays.size() + " tokens");
        }
        return new WithoutBpt(
            without(arrays.scalingFactors(), bptIndex),
            without(arrays.parsedTokens(), bptIndex),
            without(arrays.balancesEvm(), bptIndex),
            without(arrays.priceRates(), bptIndex),
            without(arrays.upScaledBalances(), bptIndex));
    }

    private static <T> List<T> without(List<T> source, int index) {
        List<T> out = new ArrayList<>(source.size() - 1);
        for (int i = 0; i < source.size(); i++) {
            if (i != index) {
                out.add(source.get(i));
            }
        }
        return out;
    }
}
