// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer metrics for pool normalizations.
 *
 * CARDINALITY SAFETY: failures are tagged by error code only, never by pool address.
 */
public class NormalizationMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter normalized;
    private final Timer duration;

    public NormalizationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.normalized = Counter.builder("poolinfo.normalize.success.total")
            .description("Pools normalized successfully")
            .register(meterRegistry);

        this.duration = Timer.builder("poolinfo.normalize.duration")
            .description("Time spent normalizing one pool")
            .register(meterRegistry);
    }

    public void recordSuccess(Duration elapsed) {
        normalized.increment();
        duration.record(elapsed);
    }

    public void recordFailure(String errorCode) {
        Counter.builder("poolinfo.normalize.failed.total")
            .description("Pools whose data could not be normalized")
            .tag("code", errorCode)
            .register(meterRegistry)
            .increment();
    }
}
