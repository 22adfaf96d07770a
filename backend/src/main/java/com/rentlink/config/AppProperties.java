/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public record AppProperties(Admin admin) {
    public AppProperties {
        if (admin == null) admin = new Admin(null);
    }

    /**
     * @param apiKey shared operator key; blank disables admin access entirely
     */
    public record Admin(String apiKey) {}
}
