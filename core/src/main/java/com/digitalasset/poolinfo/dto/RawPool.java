// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Snapshot of a pool as reported by the indexer.
 * {@code address} is also the pool's own token when the pool issues one (BPT).
 * Null token entries are kept so the normalizer can report them by index.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawPool {
    public final String id;
    public final String address;
    public final List<RawToken> tokens;
    public final String amp;
    public final String swapFee;
    public final String protocolSwapFeeCache;
    public final String protocolYieldFeeCache;
    public final String totalShares;
    public final String lastJoinExitInvariant;
    public final String athRateProduct;

    @JsonCreator
    public RawPool(@JsonProperty("id") String id,
                   @JsonProperty("address") String address,
                   @JsonProperty("tokens") List<RawToken> tokens,
                   @JsonProperty("amp") String amp,
                   @JsonProperty("swapFee") String swapFee,
                   @JsonProperty("protocolSwapFeeCache") String protocolSwapFeeCache,
                   @JsonProperty("protocolYieldFeeCache") String protocolYieldFeeCache,
                   @JsonProperty("totalShares") String totalShares,
                   @JsonProperty("lastJoinExitInvariant") String lastJoinExitInvariant,
                   @JsonProperty("athRateProduct") String athRateProduct) {
        this.id = id;
        this.address = address;
        this.tokens = tokens == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tokens));
        this.amp = amp;
        this.swapFee = swapFee;
        this.protocolSwapFeeCache = protocolSwapFeeCache;
        this.protocolYieldFeeCache = protocolYieldFeeCache;
        this.totalShares = totalShares;
        this.lastJoinExitInvariant = lastJoinExitInvariant;
        this.athRateProduct = athRateProduct;
    }

    // Pool with only the required fields, everything else defaulted
    public RawPool(String address, List<RawToken> tokens, String swapFee) {
        this(null, address, tokens, null, swapFee, null, null, null, null, null);
    }
}
