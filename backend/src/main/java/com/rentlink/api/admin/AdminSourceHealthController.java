/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.api.admin;

import com.rentlink.api.ApiException;
import com.rentlink.application.health.SourceHealthListing;
import com.rentlink.application.health.SourceHealthService;
import com.rentlink.application.health.SourceHealthSnapshot;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@Validated
@RequestMapping("/api/admin/health")
public class AdminSourceHealthController {
    private final SourceHealthService sourceHealthService;

    public AdminSourceHealthController(SourceHealthService sourceHealthService) {
        this.sourceHealthService = sourceHealthService;
    }

    @GetMapping("/sources")
    public SourcesResponse sources() {
        return new SourcesResponse(sourceHealthService.getAllSourceHealth());
    }

    @GetMapping("/sources/{sourceId}")
    public SourceHealthSnapshot source(@PathVariable @NotBlank @Size(max = 64) String sourceId) {
        return sourceHealthService.getSourceHealth(sourceId);
    }

    @PostMapping("/reset/{sourceId}")
    public ResetResponse reset(@PathVariable @NotBlank @Size(max = 64) String sourceId, Authentication authentication) {
        if (!sourceHealthService.isKnownSource(sourceId)) {
            throw new ApiException(HttpStatus.NOT_FOUND, "SOURCE_NOT_FOUND", "Source not found or invalid type");
        }
        sourceHealthService.resetSourceHealth(sourceId, authentication.getName());
        return new ResetResponse("Source health reset successfully", sourceId);
    }

    @PostMapping("/reset")
    public ResetAllResponse resetAll(Authentication authentication) {
        int count = sourceHealthService.resetAllSourceHealth(authentication.getName());
        return new ResetAllResponse("All source health reset successfully", count);
    }

    public record SourcesResponse(List<SourceHealthListing> sources) {}

    public record ResetResponse(String message, String sourceId) {}

    public record ResetAllResponse(String message, int resetCount) {}
}
