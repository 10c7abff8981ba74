// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.normalizer;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Default values for optional pool and token fields, keyed by field name.
 * Fields missing from the table (swapFee, balance, address) are required.
 * A null value is always absent. A blank value is absent only for required fields and for the
 * pool-level caches in {@link #BLANK_AS_ABSENT}; elsewhere it is kept and fails to parse.
 */
public final class FieldDefaults {

    public static final String DECIMALS = "decimals";
    public static final String BALANCE = "balance";
    public static final String WEIGHT = "weight";
    public static final String PRICE_RATE = "priceRate";
    public static final String OLD_PRICE_RATE = "oldPriceRate";
    public static final String EXEMPT_FROM_YIELD_FEE = "isExemptFromYieldProtocolFee";
    public static final String AMP = "amp";
    public static final String SWAP_FEE = "swapFee";
    public static final String PROTOCOL_SWAP_FEE_CACHE = "protocolSwapFeeCache";
    public static final String PROTOCOL_YIELD_FEE_CACHE = "protocolYieldFeeCache";
    public static final String TOTAL_SHARES = "totalShares";
    public static final String LAST_JOIN_EXIT_INVARIANT = "lastJoinExitInvariant";
    public static final String ATH_RATE_PRODUCT = "athRateProduct";

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
        Map.entry(DECIMALS, "18"),
        Map.entry(WEIGHT, "1"),
        Map.entry(PRICE_RATE, "1"),
        Map.entry(OLD_PRICE_RATE, "1"),
        Map.entry(EXEMPT_FROM_YIELD_FEE, "false"),
        Map.entry(AMP, "1"),
        Map.entry(PROTOCOL_SWAP_FEE_CACHE, "0"),
        Map.entry(PROTOCOL_YIELD_FEE_CACHE, "0"),
        Map.entry(TOTAL_SHARES, "0"),
        Map.entry(LAST_JOIN_EXIT_INVARIANT, "0"),
        Map.entry(ATH_RATE_PRODUCT, "0")
    );

    private static final Set<String> BLANK_AS_ABSENT = Set.of(
        PROTOCOL_SWAP_FEE_CACHE,
        PROTOCOL_YIELD_FEE_CACHE,
        TOTAL_SHARES,
        LAST_JOIN_EXIT_INVARIANT,
        ATH_RATE_PRODUCT
    );

    private FieldDefaults() {
    }

    public static Optional<String> defaultFor(String field) {
        return Optional.ofNullable(DEFAULTS.get(field));
    }

    public static Map<String, String> table() {
        return DEFAULTS;
    }

    /**
     * {@code value} when present, otherwise the field's default, otherwise empty (required field).
     */
    public static Optional<String> resolve(String field, String value) {
        if (value == null) {
            return defaultFor(field);
        }
        if (value.isBlank() && (BLANK_AS_ABSENT.contains(field) || !DEFAULTS.containsKey(field))) {
            return defaultFor(field);
        }
        return Optional.of(value);
    }

    public static int resolveDecimals(Integer decimals) {
        return decimals != null ? decimals : Integer.parseInt(DEFAULTS.get(DECIMALS));
    }

    public static boolean resolveExemption(Boolean exempt) {
        return exempt != null ? exempt : Boolean.parseBoolean(DEFAULTS.get(EXEMPT_FROM_YIELD_FEE));
    }
}
