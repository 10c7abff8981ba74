// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.normalizer;

import java.math.BigInteger;
import java.util.List;

/**
 * Per-token lists with the pool's own token removed. All empty when the pool token is not listed.
 */
public record WithoutBpt(List<BigInteger> scalingFactors,
                         List<String> parsedTokens,
                         List<BigInteger> balancesEvm,
                         List<BigInteger> priceRates,
                         List<BigInteger> upScaledBalances) {

    public static final WithoutBpt EMPTY = new WithoutBpt(List.of(), List.of(), List.of(), List.of(), List.of());

    public WithoutBpt {
        scalingFactors = List.copyOf(scalingFactors);
        parsedTokens = List.copyOf(parsedTokens);
        balancesEvm = List.copyOf(balancesEvm);
        priceRates = List.copyOf(priceRates);
        upScaledBalances = List.copyOf(upScaledBalances);
    }
}
