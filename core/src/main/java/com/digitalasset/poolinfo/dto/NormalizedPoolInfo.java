// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.dto;

import java.math.BigInteger;
import java.util.List;

/**
 * Pool data in fixed-point form, ready for invariant and pricing maths.
 *
 * Per-token lists share one order (the canonical one when reordering was requested).
 * 18-decimal values are integers scaled by 10^18; {@code ampWithPrecision} is scaled by 10^3.
 * The {@code *WithoutBpt} lists omit the pool's own token and are empty when it is not one of
 * the pool tokens ({@code bptIndex == -1}).
 */
public record NormalizedPoolInfo(
    List<String> parsedTokens,
    List<Integer> decimals,
    List<BigInteger> balancesEvm,
    List<BigInteger> weights,
    List<BigInteger> priceRates,
    List<BigInteger> oldPriceRates,
    List<BigInteger> scalingFactors,
    List<BigInteger> upScaledBalances,
    List<Boolean> exemptedTokens,
    BigInteger ampWithPrecision,
    BigInteger swapFeeEvm,
    int higherBalanceTokenIndex,
    String protocolSwapFeePct,
    String protocolYieldFeePct,
    int bptIndex,
    List<BigInteger> scalingFactorsWithoutBpt,
    List<String> parsedTokensWithoutBpt,
    List<BigInteger> balancesEvmWithoutBpt,
    List<BigInteger> priceRatesWithoutBpt,
    List<BigInteger> upScaledBalancesWithoutBpt,
    BigInteger totalSharesEvm,
    String lastJoinExitInvariant,
    String athRateProduct
) {
    public NormalizedPoolInfo {
        parsedTokens = List.copyOf(parsedTokens);
        decimals = List.copyOf(decimals);
        balancesEvm = List.copyOf(balancesEvm);
        weights = List.copyOf(weights);
        priceRates = List.copyOf(priceRates);
        oldPriceRates = List.copyOf(oldPriceRates);
        scalingFactors = List.copyOf(scalingFactors);
        upScaledBalances = List.copyOf(upScaledBalances);
        exemptedTokens = List.copyOf(exemptedTokens);
        scalingFactorsWithoutBpt = List.copyOf(scalingFactorsWithoutBpt);
        parsedTokensWithoutBpt = List.copyOf(parsedTokensWithoutBpt);
        balancesEvmWithoutBpt = List.copyOf(balancesEvmWithoutBpt);
        priceRatesWithoutBpt = List.copyOf(priceRatesWithoutBpt);
        upScaledBalancesWithoutBpt = List.copyOf(upScaledBalancesWithoutBpt);
    }
}
