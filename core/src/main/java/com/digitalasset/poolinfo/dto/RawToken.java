// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One pool token as reported by the indexer, amounts in human units.
 * Optional fields are null when the source omits them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawToken {
    public final String address;
    public final String balance;
    public final Integer decimals;
    public final String weight;
    public final String priceRate;
    public final String oldPriceRate;
    public final Boolean isExemptFromYieldProtocolFee;

    @JsonCreator
    public RawToken(@JsonProperty("address") String address,
                    @JsonProperty("balance") String balance,
                    @JsonProperty("decimals") Integer decimals,
                    @JsonProperty("weight") String weight,
                    @JsonProperty("priceRate") String priceRate,
                    @JsonProperty("oldPriceRate") String oldPriceRate,
                    @JsonProperty("isExemptFromYieldProtocolFee") Boolean isExemptFromYieldProtocolFee) {
        this.address = address;
        this.balance = balance;
        this.decimals = decimals;
        this.weight = weight;
        this.priceRate = priceRate;
        this.oldPriceRate = oldPriceRate;
        this.isExemptFromYieldProtocolFee = isExemptFromYieldProtocolFee;
    }

    // Token without weight, rates or fee exemption
    public RawToken(String address, String balance, Integer decimals) {
        this(address, balance, decimals, null, null, null, null);
    }
}
