// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.ordering;

import com.digitalasset.poolinfo.constants.PoolInfoConstants;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Canonical token ordering relative to a chain's wrapped native asset.
 * <p>
 * The native asset (zero address) sorts where its wrapped form would, so a pool listed with the
 * native asset and one listed with the wrapped token end up in the same order.
 */
public class CanonicalReorderer {

    private final String wrappedNativeAsset;

    public CanonicalReorderer(final String wrappedNativeAsset) {
        this.wrappedNativeAsset = Objects.requireNonNull(wrappedNativeAsset, "wrappedNativeAsset");
    }

    /**
     * The zero address if {@code address} is exactly the wrapped native asset, otherwise {@code address}.
     */
    public String unwrap(String address) {
        return wrappedNativeAsset.equals(address) ? PoolInfoConstants.NATIVE_ASSET_ADDRESS : address;
    }

    public boolean isNative(String address) {
        return PoolInfoConstants.NATIVE_ASSET_ADDRESS.equalsIgnoreCase(address);
    }

    /**
     * The address to sort by: the wrapped native asset in place of the native one.
     */
    public String translateToWrapped(String address) {
        return isNative(address) ? wrappedNativeAsset : address;
    }

    /**
     * Permutation that sorts {@code addresses} by their case-insensitive sort key.
     * Ties keep their original relative order.
     */
    public int[] sortOrder(List<String> addresses) {
        List<String> keys = addresses.stream()
            .map(a -> translateToWrapped(a).toLowerCase(Locale.ROOT))
            .toList();
        return IntStream.range(0, keys.size())
            .boxed()
            .sorted(Comparator.comparing(keys::get))
            .mapToInt(Integer::intValue)
            .toArray();
    }

    /**
     * Reorder every parallel array with the single permutation derived from the token addresses.
     */
    public TokenArrays sort(TokenArrays arrays) {
        return arrays.permute(sortOrder(arrays.parsedTokens()));
    }
}
