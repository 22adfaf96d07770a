/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application;

import com.rentlink.domain.model.CompanyType;
import com.rentlink.domain.security.SourcePrincipal;
import com.rentlink.infrastructure.crypto.Sha256;
import com.rentlink.infrastructure.persistence.repository.CompanyRepository;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class SourceAuthService {
    private final CompanyRepository companyRepository;

    public SourceAuthService(CompanyRepository companyRepository) {
        this.companyRepository = companyRepository;
    }

    public Optional<SourcePrincipal> authenticate(String apiKey) {
        return companyRepository.findByApiKeyHashAndType(Sha256.hex(apiKey), CompanyType.SOURCE)
                .map(c -> new SourcePrincipal(c.getId(), c.getCompanyName()));
    }
}
