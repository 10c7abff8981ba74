// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.normalizer;

import com.digitalasset.poolinfo.common.NormalizationException;
import com.digitalasset.poolinfo.common.errors.FieldParseError;
import com.digitalasset.poolinfo.common.errors.InvalidTokenDecimalsError;
import com.digitalasset.poolinfo.constants.PoolInfoConstants;
import com.digitalasset.poolinfo.dto.NormalizedPoolInfo;
import com.digitalasset.poolinfo.dto.RawPool;
import com.digitalasset.poolinfo.dto.RawToken;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for the full normalization pipeline.
 *
 * Reference pool: USDC (6 decimals, 1000) / WETH (18 decimals, 2), swap fee 0.3%.
 * - USDC scaling factor: 1e18 * 1e12
 * - USDC upscaled: 1000e18, WETH upscaled: 2e18
 */
@DisplayName("Pool Info Normalizer Tests")
class PoolInfoNormalizerTest {

    private static final String WETH = "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2";
    private static final String USDC = "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48";
    private static final String DAI = "0x6B175474E89094C44Da98b954EedeAC495271d0F";
    private static final String BPT = "0x79c58F70905F734641735BC61e45c19dD9Ad60bC";
    private static final String ETH = PoolInfoConstants.NATIVE_ASSET_ADDRESS;
    private static final BigInteger ONE = PoolInfoConstants.ONE;

    private final PoolInfoNormalizer normalizer = new PoolInfoNormalizer();

    @Test
    @DisplayName("Two-token pool without reordering")
    void testEndToEndTwoTokenPool() {
        // Arrange
        RawPool pool = new RawPool("0x96646936b91d6b9d7d0c47c496afbf3d6ec7b6f8",
            List.of(new RawToken(USDC, "1000", 6), new RawToken(WETH, "2", 18)), "0.003");

        // Act
        NormalizedPoolInfo info = normalizer.normalize(pool);

        // Assert
        assertThat(info.parsedTokens()).containsExactly(USDC, WETH);
        assertThat(info.balancesEvm()).containsExactly(BigInteger.valueOf(1_000_000_000L), ONE.multiply(BigInteger.TWO));
        assertThat(info.scalingFactors()).containsExactly(BigInteger.TEN.pow(30), ONE);
        assertThat(info.upScaledBalances()).containsExactly(units(1000), units(2));
        assertThat(info.ampWithPrecision()).isEqualTo(BigInteger.valueOf(1000));
        assertThat(info.swapFeeEvm()).isEqualTo(new BigInteger("3000000000000000"));
        assertThat(info.higherBalanceTokenIndex()).isZero();
        assertThat(info.bptIndex()).isEqualTo(-1);
        assertThat(info.parsedTokensWithoutBpt()).isEmpty();
        assertThat(info.scalingFactorsWithoutBpt()).isEmpty();
        assertThat(info.balancesEvmWithoutBpt()).isEmpty();
        assertThat(info.priceRatesWithoutBpt()).isEmpty();
        assertThat(info.upScaledBalancesWithoutBpt()).isEmpty();
        assertThat(info.protocolSwapFeePct()).isEqualTo("0");
        assertThat(info.protocolYieldFeePct()).isEqualTo("0");
        assertThat(info.totalSharesEvm()).isZero();
        assertThat(info.lastJoinExitInvariant()).isEqualTo("0");
        assertThat(info.athRateProduct()).isEqualTo("0");
    }

    @Test
    @DisplayName("Missing weight, rates, amp and exemption take their defaults")
    void testDefaultSubstitution() {
        RawPool pool = new RawPool(BPT, List.of(new RawToken(DAI, "5", null)), "0.01");

        NormalizedPoolInfo info = normalizer.normalize(pool);

        assertThat(info.weights()).containsExactly(ONE);
        assertThat(info.priceRates()).containsExactly(ONE);
        assertThat(info.oldPriceRates()).containsExactly(ONE);
        assertThat(info.decimals()).containsExactly(18);
        assertThat(info.exemptedTokens()).containsExactly(false);
        assertThat(info.ampWithPrecision()).isEqualTo(BigInteger.valueOf(1000));
    }

    @Test
    @DisplayName("Every per-token list has one entry per token")
    void testLengthInvariant() {
        for (int n = 1; n <= 5; n++) {
            List<RawToken> tokens = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                tokens.add(new RawToken(String.format("0x%040x", i + 1), String.valueOf(i + 1), 18 - i));
            }

            NormalizedPoolInfo info = normalizer.normalize(new RawPool(BPT, tokens, "0.001"), WETH, false);

            assertThat(info.parsedTokens()).hasSize(n);
            assertThat(info.decimals()).hasSize(n);
            assertThat(info.balancesEvm()).hasSize(n);
            assertThat(info.weights()).hasSize(n);
            assertThat(info.priceRates()).hasSize(n);
            assertThat(info.oldPriceRates()).hasSize(n);
            assertThat(info.scalingFactors()).hasSize(n);
            assertThat(info.upScaledBalances()).hasSize(n);
            assertThat(info.exemptedTokens()).hasSize(n);
        }
    }

    @Test
    @DisplayName("Normalizing the same pool twice gives identical results")
    void testIdempotence() {
        RawPool pool = weightedPool();

        assertThat(normalizer.normalize(pool, WETH, true)).isEqualTo(normalizer.normalize(pool, WETH, true));
        assertThat(normalizer.normalize(pool)).isEqualTo(normalizer.normalize(pool));
    }

    @Test
    @DisplayName("Reordering moves per-token values without changing them")
    void testPermutationSoundness() {
        RawPool pool = weightedPool();

        NormalizedPoolInfo original = normalizer.normalize(pool);
        NormalizedPoolInfo sorted = normalizer.normalize(pool, WETH, false);

        assertThat(sorted.parsedTokens()).containsExactly(DAI, USDC, WETH);
        Map<String, List<Object>> before = tuplesByAddress(original);
        Map<String, List<Object>> after = tuplesByAddress(sorted);
        assertThat(after).isEqualTo(before);
        assertThat(sorted.higherBalanceTokenIndex())
            .isEqualTo(sorted.parsedTokens().indexOf(original.parsedTokens().get(original.higherBalanceTokenIndex())));
    }

    @Test
    @DisplayName("Unwrapping reports the native asset in the wrapped asset's sorted slot")
    void testUnwrapNativeAsset() {
        NormalizedPoolInfo info = normalizer.normalize(weightedPool(), WETH, true);

        assertThat(info.parsedTokens()).containsExactly(DAI, USDC, ETH);
        assertThat(info.weights()).containsExactly(
            new BigInteger("300000000000000000"),
            new BigInteger("200000000000000000"),
            new BigInteger("500000000000000000"));
    }

    @Test
    @DisplayName("Unwrap without a wrapped address leaves tokens as reported")
    void testUnwrapWithoutWrappedAddress() {
        NormalizedPoolInfo info = normalizer.normalize(weightedPool(), null, true);

        assertThat(info.parsedTokens()).containsExactly(WETH, USDC, DAI);
    }

    @Test
    @DisplayName("Pool token present: WithoutBpt lists drop exactly that position")
    void testBptPresent() {
        RawPool pool = new RawPool(null, BPT, List.of(
                new RawToken(DAI, "1500000.25", 18),
                new RawToken(BPT, "2596148429267413.814265248164610048", 18),
                new RawToken(USDC, "1250000.5", 6, null, "1.01", "1", true)),
            "1472", "0.0001", "0.5", "0.5", "3728401.123", "3728401.5", "1.0500");

        NormalizedPoolInfo info = normalizer.normalize(pool);

        assertThat(info.bptIndex()).isEqualTo(1);
        assertThat(info.parsedTokensWithoutBpt()).containsExactly(DAI, USDC);
        assertThat(info.balancesEvmWithoutBpt()).containsExactly(info.balancesEvm().get(0), info.balancesEvm().get(2));
        assertThat(info.scalingFactorsWithoutBpt()).containsExactly(info.scalingFactors().get(0), info.scalingFactors().get(2));
        assertThat(info.priceRatesWithoutBpt()).containsExactly(ONE, new BigInteger("1010000000000000000"));
        assertThat(info.upScaledBalancesWithoutBpt())
            .containsExactly(info.upScaledBalances().get(0), info.upScaledBalances().get(2));
        assertThat(info.higherBalanceTokenIndex()).isEqualTo(1);
        assertThat(info.ampWithPrecision()).isEqualTo(BigInteger.valueOf(1_472_000));
        assertThat(info.protocolSwapFeePct()).isEqualTo("0.5");
        assertThat(info.totalSharesEvm()).isEqualTo(new BigInteger("3728401123000000000000000"));
        assertThat(info.lastJoinExitInvariant()).isEqualTo("3728401.5");
        assertThat(info.athRateProduct()).isEqualTo("1.05");
        assertThat(info.exemptedTokens()).containsExactly(false, false, true);
    }

    @Test
    @DisplayName("Pool token index follows the canonical order")
    void testBptIndexAfterReordering() {
        RawPool pool = new RawPool(BPT, List.of(
            new RawToken(USDC, "10", 6),
            new RawToken(BPT, "100", 18),
            new RawToken(DAI, "10", 18)), "0.0001");

        NormalizedPoolInfo info = normalizer.normalize(pool, WETH, false);

        // 0x6b17 < 0x79c5 < 0xa0b8
        assertThat(info.parsedTokens()).containsExactly(DAI, BPT, USDC);
        assertThat(info.bptIndex()).isEqualTo(1);
        assertThat(info.parsedTokensWithoutBpt()).containsExactly(DAI, USDC);
    }

    @Test
    @DisplayName("Pool address differing only in case is not treated as the pool token")
    void testBptMatchIsCaseSensitive() {
        RawPool pool = new RawPool(BPT.toLowerCase(), List.of(
            new RawToken(BPT, "100", 18), new RawToken(DAI, "10", 18)), "0.0001");

        NormalizedPoolInfo info = normalizer.normalize(pool);

        assertThat(info.bptIndex()).isEqualTo(-1);
        assertThat(info.parsedTokensWithoutBpt()).isEmpty();
    }

    @Test
    @DisplayName("Price rate scales the upscaled balance")
    void testPriceRateApplied() {
        RawPool pool = new RawPool(BPT, List.of(
            new RawToken(DAI, "100", 18, null, "1.05", "1.04", null)), "0.0001");

        NormalizedPoolInfo info = normalizer.normalize(pool);

        assertThat(info.scalingFactors()).containsExactly(new BigInteger("1050000000000000000"));
        assertThat(info.upScaledBalances()).containsExactly(units(105));
        assertThat(info.oldPriceRates()).containsExactly(new BigInteger("1040000000000000000"));
    }

    @Test
    @DisplayName("Malformed balance aborts the pool with the field name")
    void testMalformedBalance() {
        RawPool pool = new RawPool(BPT, List.of(
            new RawToken(DAI, "10", 18), new RawToken(USDC, "12,5", 6)), "0.0001");

        FieldParseError error = parseError(pool);

        assertThat(error.field()).isEqualTo("tokens[1].balance");
        assertThat(error.poolAddress()).isEqualTo(BPT);
        assertThat(error.code()).isEqualTo("FIELD_PARSE_ERROR");
    }

    @Test
    @DisplayName("Balance more precise than the token is rejected")
    void testBalanceExceedsTokenDecimals() {
        RawPool pool = new RawPool(BPT, List.of(new RawToken(USDC, "1.0000001", 6)), "0.0001");

        assertThat(parseError(pool).field()).isEqualTo("tokens[0].balance");
    }

    @Test
    @DisplayName("Swap fee is required")
    void testMissingSwapFee() {
        RawPool pool = new RawPool(BPT, List.of(new RawToken(DAI, "10", 18)), null);

        FieldParseError error = parseError(pool);

        assertThat(error.field()).isEqualTo("swapFee");
        assertThat(error.message()).contains("is required");
    }

    @Test
    @DisplayName("Blank weight is a parse error, not the default")
    void testBlankWeight() {
        RawPool pool = new RawPool(BPT, List.of(new RawToken(DAI, "10", 18, "", null, null, null)), "0.0001");

        assertThat(parseError(pool).field()).isEqualTo("tokens[0].weight");
    }

    @Test
    @DisplayName("Blank price rate is a parse error, not the default")
    void testBlankPriceRate() {
        RawPool pool = new RawPool(BPT, List.of(new RawToken(DAI, "10", 18, null, "  ", null, null)), "0.0001");

        assertThat(parseError(pool).field()).isEqualTo("tokens[0].priceRate");
    }

    @Test
    @DisplayName("Blank amp is a parse error, blank caches fall back to zero")
    void testBlankAmpAndCaches() {
        RawPool blankAmp = new RawPool(null, BPT, List.of(new RawToken(DAI, "10", 18)),
            "", "0.0001", null, null, null, null, null);
        RawPool blankCaches = new RawPool(null, BPT, List.of(new RawToken(DAI, "10", 18)),
            null, "0.0001", "", " ", "", "", "");

        assertThat(parseError(blankAmp).field()).isEqualTo("amp");
        NormalizedPoolInfo info = normalizer.normalize(blankCaches);
        assertThat(info.protocolSwapFeePct()).isEqualTo("0");
        assertThat(info.protocolYieldFeePct()).isEqualTo("0");
        assertThat(info.totalSharesEvm()).isZero();
        assertThat(info.lastJoinExitInvariant()).isEqualTo("0");
        assertThat(info.athRateProduct()).isEqualTo("0");
    }

    @Test
    @DisplayName("Null token entry is reported by index")
    void testNullToken() {
        RawPool pool = new RawPool(BPT, Arrays.asList(new RawToken(DAI, "10", 18), null), "0.0001");

        FieldParseError error = parseError(pool);

        assertThat(error.field()).isEqualTo("tokens[1]");
        assertThat(error.message()).contains("is missing");
    }

    @Test
    @DisplayName("Negative balance is out of range")
    void testNegativeBalance() {
        RawPool pool = new RawPool(BPT, List.of(new RawToken(DAI, "-10", 18)), "0.0001");

        FieldParseError error = parseError(pool);

        assertThat(error.field()).isEqualTo("tokens[0].balance");
        assertThat(error.message()).contains("out of range");
    }

    @Test
    @DisplayName("Negative price rate and fees are out of range")
    void testNegativeRatesAndFees() {
        RawPool negativeRate = new RawPool(BPT, List.of(new RawToken(DAI, "10", 18, null, "-1", null, null)), "0.0001");
        RawPool negativeSwapFee = new RawPool(BPT, List.of(new RawToken(DAI, "10", 18)), "-0.0001");
        RawPool negativeYieldFee = new RawPool(null, BPT, List.of(new RawToken(DAI, "10", 18)),
            null, "0.0001", null, "-0.5", null, null, null);

        assertThat(parseError(negativeRate).field()).isEqualTo("tokens[0].priceRate");
        assertThat(parseError(negativeSwapFee).field()).isEqualTo("swapFee");
        assertThat(parseError(negativeYieldFee).field()).isEqualTo("protocolYieldFeeCache");
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "1e-3", "0.0000000000000000001"})
    @DisplayName("Malformed protocol fee cache is rejected")
    void testMalformedProtocolFee(String fee) {
        RawPool pool = new RawPool(null, BPT, List.of(new RawToken(DAI, "10", 18)),
            null, "0.0001", fee, null, null, null, null);

        assertThat(parseError(pool).field()).isEqualTo("protocolSwapFeeCache");
    }

    @Test
    @DisplayName("Token decimals above 18 are rejected")
    void testInvalidDecimals() {
        RawPool pool = new RawPool(BPT, List.of(new RawToken(DAI, "10", 24)), "0.0001");

        NormalizationException e = catchThrowableOfType(() -> normalizer.normalize(pool), NormalizationException.class);

        assertThat(e).isNotNull();
        assertThat(e.error()).isInstanceOf(InvalidTokenDecimalsError.class);
    }

    @Test
    @DisplayName("Pool without tokens normalizes to empty lists")
    void testEmptyPool() {
        NormalizedPoolInfo info = normalizer.normalize(new RawPool(BPT, List.of(), "0.0001"), WETH, true);

        assertThat(info.parsedTokens()).isEmpty();
        assertThat(info.higherBalanceTokenIndex()).isEqualTo(-1);
        assertThat(info.bptIndex()).isEqualTo(-1);
    }

    // WETH 50% / USDC 20% / DAI 30%, in non-canonical order
    private static RawPool weightedPool() {
        return new RawPool("0x0b09dea16768f0799065c475be02919503cb2a35", List.of(
            new RawToken(WETH, "12.5", 18, "0.5", null, null, true),
            new RawToken(USDC, "25000.123456", 6, "0.2", null, null, false),
            new RawToken(DAI, "37500", 18, "0.3", "1.02", "1.01", null)), "0.003");
    }

    private static Map<String, List<Object>> tuplesByAddress(NormalizedPoolInfo info) {
        Map<String, List<Object>> out = new HashMap<>();
        for (int i = 0; i < info.parsedTokens().size(); i++) {
            out.put(info.parsedTokens().get(i), List.of(
                info.balancesEvm().get(i),
                info.weights().get(i),
                info.priceRates().get(i),
                info.oldPriceRates().get(i),
                info.scalingFactors().get(i),
                info.upScaledBalances().get(i),
                info.decimals().get(i),
                info.exemptedTokens().get(i)));
        }
        return out;
    }

    private FieldParseError parseError(RawPool pool) {
        NormalizationException e = catchThrowableOfType(() -> normalizer.normalize(pool), NormalizationException.class);
        assertThat(e).isNotNull();
        assertThat(e.error()).isInstanceOf(FieldParseError.class);
        return (FieldParseError) e.error();
    }

    private static BigInteger units(long amount) {
        return ONE.multiply(BigInteger.valueOf(amount));
    }
}
