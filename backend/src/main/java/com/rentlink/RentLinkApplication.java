/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RentLinkApplication {
    public static void main(String[] args) {
        SpringApplication.run(RentLinkApplication.class, args);
    }
}
