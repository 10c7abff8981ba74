// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.service;

import com.digitalasset.poolinfo.common.DomainError;
import com.digitalasset.poolinfo.common.NormalizationException;
import com.digitalasset.poolinfo.common.Result;
import com.digitalasset.poolinfo.common.errors.ValidationError;
import com.digitalasset.poolinfo.dto.NormalizedPoolInfo;
import com.digitalasset.poolinfo.dto.RawPool;
import com.digitalasset.poolinfo.metrics.NormalizationMetrics;
import com.digitalasset.poolinfo.normalizer.PoolInfoNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point for callers holding raw pool snapshots.
 *
 * Applies the configured native-asset settings, reports failures through {@link Result} and
 * records metrics. A pool that fails is unusable for this round only; nothing is shared between calls.
 */
public class PoolInfoService {

    private static final Logger LOG = LoggerFactory.getLogger(PoolInfoService.class);

    private final PoolInfoNormalizer normalizer;
    private final NormalizationMetrics metrics;
    private final String wrappedNativeAsset;
    private final boolean unwrapNativeAsset;

    public PoolInfoService(final PoolInfoNormalizer normalizer,
                           final NormalizationMetrics metrics,
                           final String wrappedNativeAsset,
                           final boolean unwrapNativeAsset) {
        this.normalizer = normalizer;
        this.metrics = metrics;
        this.wrappedNativeAsset = wrappedNativeAsset;
        this.unwrapNativeAsset = unwrapNativeAsset;
    }

    public Result<NormalizedPoolInfo, DomainError> normalize(RawPool pool) {
        return normalize(pool, wrappedNativeAsset, unwrapNativeAsset);
    }

    public Result<NormalizedPoolInfo, DomainError> normalize(RawPool pool,
                                                             String wrappedNativeAsset,
                                                             boolean unwrapNativeAsset) {
        if (pool == null) {
            return fail(null, new ValidationError("pool is required"));
        }
        long start = System.nanoTime();
        try {
            NormalizedPoolInfo info = normalizer.normalize(pool, wrappedNativeAsset, unwrapNativeAsset);
            metrics.recordSuccess(Duration.ofNanos(System.nanoTime() - start));
            LOG.debug("[PoolInfo] pool={} tokens={} bptIndex={} reordered={}",
                pool.address,
                info.parsedTokens().size(),
                info.bptIndex(),
                wrappedNativeAsset != null && !wrappedNativeAsset.isBlank());
            return Result.ok(info);
        } catch (NormalizationException e) {
            return fail(pool.address, e.error());
        }
    }

    /**
     * Normalize each pool independently, skipping the ones whose data is unusable.
     *
     * A pool address seen twice keeps the later snapshot.
     *
     * @return normalized pools keyed by pool address, in first-seen order
     */
    public Map<String, NormalizedPoolInfo> normalizeAll(Collection<RawPool> pools) {
        Map<String, NormalizedPoolInfo> out = new LinkedHashMap<>();
        int skipped = 0;
        int duplicates = 0;
        for (RawPool pool : pools) {
            Result<NormalizedPoolInfo, DomainError> result = normalize(pool);
            if (result.isOk()) {
                if (out.put(pool.address, result.getValueUnsafe()) != null) {
                    duplicates++;
                    LOG.warn("[PoolInfo] pool={} duplicate in batch, keeping the later snapshot", pool.address);
                }
            } else {
                skipped++;
            }
        }
        LOG.info("[PoolInfo] batch normalized={} skipped={} duplicates={}", out.size(), skipped, duplicates);
        return Collections.unmodifiableMap(out);
    }

    private Result<NormalizedPoolInfo, DomainError> fail(String poolAddress, DomainError error) {
        metrics.recordFailure(error.code());
        LOG.warn("[PoolInfo] pool={} skipped code={} message={}", poolAddress, error.code(), error.message());
        return Result.err(error);
    }
}
