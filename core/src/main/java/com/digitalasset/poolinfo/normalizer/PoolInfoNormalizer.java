// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.normalizer;

import com.digitalasset.poolinfo.common.NormalizationException;
import com.digitalasset.poolinfo.common.errors.FieldParseError;
import com.digitalasset.poolinfo.constants.PoolInfoConstants;
import com.digitalasset.poolinfo.dto.NormalizedPoolInfo;
import com.digitalasset.poolinfo.dto.RawPool;
import com.digitalasset.poolinfo.dto.RawToken;
import com.digitalasset.poolinfo.math.DecimalParser;
import com.digitalasset.poolinfo.math.FixedPoint;
import com.digitalasset.poolinfo.ordering.CanonicalReorderer;
import com.digitalasset.poolinfo.ordering.TokenArrays;
import com.digitalasset.poolinfo.scaling.ScalingFactorComputer;
import com.digitalasset.poolinfo.scaling.Upscaler;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a {@link RawPool} snapshot into {@link NormalizedPoolInfo}.
 *
 * Pipeline, in order:
 * 1. per-token entries: exemption, (unwrapped) address, decimals, balance, weight, rates, scaling factor
 * 2. upscaled balances
 * 3. canonical reordering of all per-token arrays at once (only when a wrapped native asset is given)
 * 4. pool scalars: amp, swap fee, highest balance index, protocol fees
 * 5. BPT exclusion, total shares, invariant and rate product
 *
 * Stateless; any parse or consistency failure aborts the whole pool with a {@link NormalizationException}.
 */
public class PoolInfoNormalizer {

    private final ScalingFactorComputer scalingFactorComputer;
    private final Upscaler upscaler;
    private final BptFilter bptFilter;

    public PoolInfoNormalizer() {
        this(new ScalingFactorComputer(), new Upscaler(), new BptFilter());
    }

    public PoolInfoNormalizer(final ScalingFactorComputer scalingFactorComputer,
                              final Upscaler upscaler,
                              final BptFilter bptFilter) {
        this.scalingFactorComputer = scalingFactorComputer;
        this.upscaler = upscaler;
        this.bptFilter = bptFilter;
    }

    public NormalizedPoolInfo normalize(RawPool pool) {
        return normalize(pool, null, false);
    }

    /**
     * @param wrappedNativeAsset wrapped native token address; null or blank keeps the pool's token order
     * @param unwrapNativeAsset  rewrite the wrapped native token to the zero address
     */
    public NormalizedPoolInfo normalize(RawPool pool, String wrappedNativeAsset, boolean unwrapNativeAsset) {
        Objects.requireNonNull(pool, "pool");
        CanonicalReorderer reorderer = wrappedNativeAsset == null || wrappedNativeAsset.isBlank()
            ? null
            : new CanonicalReorderer(wrappedNativeAsset);
        String poolAddress = pool.address != null ? pool.address : pool.id;

        List<TokenEntry> entries = new ArrayList<>(pool.tokens.size());
        for (int i = 0; i < pool.tokens.size(); i++) {
            entries.add(toEntry(pool.tokens.get(i), i, poolAddress, unwrapNativeAsset ? reorderer : null));
        }

        List<BigInteger> balancesEvm = entries.stream().map(TokenEntry::balanceEvm).toList();
        List<BigInteger> scalingFactors = entries.stream().map(TokenEntry::scalingFactor).toList();
        // balances are in human scale, so upscaling lands them on the 18-decimal basis
        List<BigInteger> upScaledBalances = upscaler.upscale(balancesEvm, scalingFactors);

        TokenArrays arrays = new TokenArrays(
            entries.stream().map(TokenEntry::parsedToken).toList(),
            entries.stream().map(TokenEntry::decimals).toList(),
            scalingFactors,
            balancesEvm,
            upScaledBalances,
            entries.stream().map(TokenEntry::weight).toList(),
            entries.stream().map(TokenEntry::priceRate).toList(),
            entries.stream().map(TokenEntry::oldPriceRate).toList(),
            entries.stream().map(TokenEntry::exempt).toList());
        if (reorderer != null) {
            arrays = reorderer.sort(arrays);
        }

        BigInteger ampWithPrecision = parseField(FieldDefaults.AMP, FieldDefaults.AMP, pool.amp,
            PoolInfoConstants.AMP_PRECISION, poolAddress);
        BigInteger swapFeeEvm = parseField(FieldDefaults.SWAP_FEE, FieldDefaults.SWAP_FEE, pool.swapFee,
            PoolInfoConstants.FIXED_POINT_DECIMALS, poolAddress);
        int higherBalanceTokenIndex = FixedPoint.argMax(arrays.upScaledBalances());
        String protocolSwapFeePct = reformat(FieldDefaults.PROTOCOL_SWAP_FEE_CACHE, pool.protocolSwapFeeCache, poolAddress);
        String protocolYieldFeePct = reformat(FieldDefaults.PROTOCOL_YIELD_FEE_CACHE, pool.protocolYieldFeeCache, poolAddress);

        int bptIndex = bptFilter.locate(pool.address, arrays.parsedTokens());
        WithoutBpt withoutBpt = bptFilter.exclude(bptIndex, arrays);

        BigInteger totalSharesEvm = parseField(FieldDefaults.TOTAL_SHARES, FieldDefaults.TOTAL_SHARES, pool.totalShares,
            PoolInfoConstants.FIXED_POINT_DECIMALS, poolAddress);
        String lastJoinExitInvariant = FieldDefaults.resolve(FieldDefaults.LAST_JOIN_EXIT_INVARIANT, pool.lastJoinExitInvariant)
            .orElseThrow();
        String athRateProduct = reformat(FieldDefaults.ATH_RATE_PRODUCT, pool.athRateProduct, poolAddress);

        return new NormalizedPoolInfo(
            arrays.parsedTokens(),
            arrays.decimals(),
            arrays.balancesEvm(),
            arrays.weights(),
            arrays.priceRates(),
            arrays.oldPriceRates(),
            arrays.scalingFactors(),
            arrays.upScaledBalances(),
            arrays.exemptedTokens(),
            ampWithPrecision,
            swapFeeEvm,
            higherBalanceTokenIndex,
            protocolSwapFeePct,
            protocolYieldFeePct,
            bptIndex,
            withoutBpt.scalingFactors(),
            withoutBpt.parsedTokens(),
            withoutBpt.balancesEvm(),
            withoutBpt.priceRates(),
            withoutBpt.upScaledBalances(),
            totalSharesEvm,
            lastJoinExitInvariant,
            athRateProduct);
    }

    private TokenEntry toEntry(RawToken token, int index, String poolAddress, CanonicalReorderer unwrapper) {
        String prefix = "tokens[" + index + "].";
        if (token == null) {
            throw new NormalizationException(new FieldParseError("tokens[" + index + "]", poolAddress, "is missing"));
        }
        if (token.address == null || token.address.isBlank()) {
            throw new NormalizationException(new FieldParseError(prefix + "address", poolAddress, "is required"));
        }
        boolean exempt = FieldDefaults.resolveExemption(token.isExemptFromYieldProtocolFee);
        String parsedToken = unwrapper != null ? unwrapper.unwrap(token.address) : token.address;
        int decimals = FieldDefaults.resolveDecimals(token.decimals);
        scalingFactorComputer.requireValidDecimals(decimals);

        BigInteger balanceEvm = parseField(FieldDefaults.BALANCE, prefix + FieldDefaults.BALANCE, token.balance,
            decimals, poolAddress);
        BigInteger weight = parseField(FieldDefaults.WEIGHT, prefix + FieldDefaults.WEIGHT, token.weight,
            PoolInfoConstants.FIXED_POINT_DECIMALS, poolAddress);
        BigInteger priceRate = parseField(FieldDefaults.PRICE_RATE, prefix + FieldDefaults.PRICE_RATE, token.priceRate,
            PoolInfoConstants.FIXED_POINT_DECIMALS, poolAddress);
        BigInteger oldPriceRate = parseField(FieldDefaults.OLD_PRICE_RATE, prefix + FieldDefaults.OLD_PRICE_RATE,
            token.oldPriceRate, PoolInfoConstants.FIXED_POINT_DECIMALS, poolAddress);
        BigInteger scalingFactor = scalingFactorComputer.scalingFactor(decimals, priceRate);

        return new TokenEntry(parsedToken, decimals, balanceEvm, weight, priceRate, oldPriceRate, exempt, scalingFactor);
    }

    private static BigInteger parseField(String key, String fieldName, String raw, int decimals, String poolAddress) {
        String value = FieldDefaults.resolve(key, raw)
            .orElseThrow(() -> new NormalizationException(new FieldParseError(fieldName, poolAddress, "is required")));
        BigInteger parsed;
        try {
            parsed = DecimalParser.parseFixed(value, decimals);
        } catch (NumberFormatException e) {
            throw new NormalizationException(new FieldParseError(fieldName, poolAddress, e.getMessage()), e);
        }
        // balances, rates, weights, fees and shares are all non-negative quantities
        if (parsed.signum() < 0) {
            throw new NormalizationException(
                new FieldParseError(fieldName, poolAddress, "is out of range: '" + value + "' is negative"));
        }
        return parsed;
    }

    // Parsed at 18 decimals for validation, returned in human units
    private static String reformat(String key, String raw, String poolAddress) {
        BigInteger fixed = parseField(key, key, raw, PoolInfoConstants.FIXED_POINT_DECIMALS, poolAddress);
        return DecimalParser.formatFixed(fixed, PoolInfoConstants.FIXED_POINT_DECIMALS);
    }

    private record TokenEntry(String parsedToken,
                              Integer decimals,
                              BigInteger balanceEvm,
                              BigInteger weight,
                              BigInteger priceRate,
                              BigInteger oldPriceRate,
                              Boolean exempt,
                              BigInteger scalingFactor) {}
}
