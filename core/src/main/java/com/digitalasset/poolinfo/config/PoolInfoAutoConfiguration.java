// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.poolinfo.config;

import com.digitalasset.poolinfo.metrics.NormalizationMetrics;
import com.digitalasset.poolinfo.normalizer.PoolInfoNormalizer;
import com.digitalasset.poolinfo.service.PoolInfoService;
import com.digitalasset.poolinfo.service.RawPoolReader;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

/**
 * Wires the normalizer and its service facade.
 *
 * Properties:
 * - poolinfo.wrapped-native-asset: wrapped native token address; empty disables canonical reordering
 * - poolinfo.unwrap-native-asset: report the wrapped native token as the zero address
 */
@AutoConfiguration
public class PoolInfoAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(PoolInfoAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public PoolInfoNormalizer poolInfoNormalizer() {
        return new PoolInfoNormalizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public NormalizationMetrics normalizationMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        return new NormalizationMetrics(meterRegistry.getIfAvailable(SimpleMeterRegistry::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public PoolInfoService poolInfoService(PoolInfoNormalizer normalizer,
                                           NormalizationMetrics metrics,
                                           @Value("${poolinfo.wrapped-native-asset:}") String wrappedNativeAsset,
                                           @Value("${poolinfo.unwrap-native-asset:false}") boolean unwrapNativeAsset) {
        if (wrappedNativeAsset.isBlank()) {
            logger.info("PoolInfo: no wrapped native asset configured, token order is kept as reported");
        } else {
            logger.info("PoolInfo: wrapped native asset={} unwrap={}", wrappedNativeAsset, unwrapNativeAsset);
        }
        return new PoolInfoService(normalizer, metrics, wrappedNativeAsset, unwrapNativeAsset);
    }

    @Bean
    @ConditionalOnMissingBean
    public RawPoolReader rawPoolReader(ObjectProvider<ObjectMapper> objectMapper) {
        return new RawPoolReader(objectMapper.getIfAvailable(ObjectMapper::new));
    }
}
