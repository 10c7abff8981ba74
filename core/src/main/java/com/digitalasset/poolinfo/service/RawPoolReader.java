// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.service;

import com.digitalasset.poolinfo.common.DomainError;
import com.digitalasset.poolinfo.common.Result;
import com.digitalasset.poolinfo.common.errors.ValidationError;
import com.digitalasset.poolinfo.dto.RawPool;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Decodes indexer-shaped pool JSON. Fields this project does not use are ignored.
 */
public class RawPoolReader {

    private static final TypeReference<List<RawPool>> POOL_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public RawPoolReader() {
        this(new ObjectMapper());
    }

    public RawPoolReader(final ObjectMapper mapper) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public Result<RawPool, DomainError> readPool(String json) {
        try {
            RawPool pool = mapper.readValue(json, RawPool.class);
            if (pool == null) {
                return Result.err(new ValidationError("pool JSON is empty"));
            }
            return Result.ok(pool);
        } catch (JsonProcessingException e) {
            return Result.err(new ValidationError("malformed pool JSON: " + e.getOriginalMessage()));
        }
    }

    public Result<List<RawPool>, DomainError> readPools(String json) {
        try {
            List<RawPool> pools = mapper.readValue(json, POOL_LIST);
            if (pools == null) {
                return Result.ok(List.of());
            }
            int nullAt = pools.indexOf(null);
            if (nullAt >= 0) {
                return Result.err(new ValidationError("pool list JSON has a null entry at index " + nullAt));
            }
            return Result.ok(List.copyOf(pools));
        } catch (JsonProcessingException e) {
            return Result.err(new ValidationError("malformed pool list JSON: " + e.getOriginalMessage()));
        }
    }
}
