/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.api.health;

import com.rentlink.api.ApiException;
import com.rentlink.application.health.SourceHealthService;
import com.rentlink.application.health.SourceHealthSnapshot;
import com.rentlink.domain.security.SourcePrincipal;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets a Source see its own health row.
 */
@RestController
@RequestMapping("/api/health")
public class SourceHealthController {
    private final SourceHealthService sourceHealthService;

    public SourceHealthController(SourceHealthService sourceHealthService) {
        this.sourceHealthService = sourceHealthService;
    }

    @GetMapping("/my-source")
    public SourceHealthSnapshot mySource(@AuthenticationPrincipal SourcePrincipal source) {
        if (source == null) {
            throw new ApiException(HttpStatus.UNAUTHORIZED, "Missing/Invalid X-Api-Key");
        }
        return sourceHealthService.getSourceHealth(source.sourceId());
    }
}
