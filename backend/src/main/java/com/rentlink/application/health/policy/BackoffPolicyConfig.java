/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health.policy;

import com.rentlink.config.HealthMonitorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BackoffPolicyConfig {
    private static final Logger log = LoggerFactory.getLogger(BackoffPolicyConfig.class);

    @Bean
    public BackoffPolicy backoffPolicy(HealthMonitorProperties properties) {
        BackoffPolicy policy = create(properties);
        log.info("Source health monitor enabled={} policy={} slowThresholdMs={}",
                properties.enabled(), policy.mode(), properties.slowThresholdMs());
        return policy;
    }

    public static BackoffPolicy create(HealthMonitorProperties properties) {
        return switch (properties.policy()) {
            case STRIKES -> new StrikeBackoffPolicy(properties.strikes());
            case SLOW_RATE -> new SlowRateBackoffPolicy(properties.slowRate());
        };
    }
}
