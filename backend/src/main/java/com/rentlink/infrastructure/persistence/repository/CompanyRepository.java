/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.infrastructure.persistence.repository;

import com.rentlink.domain.model.CompanyType;
import com.rentlink.infrastructure.persistence.entity.CompanyEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CompanyRepository extends JpaRepository<CompanyEntity, String> {
    List<CompanyEntity> findByType(CompanyType type);

    Optional<CompanyEntity> findByApiKeyHashAndType(String apiKeyHash, CompanyType type);

    boolean existsByIdAndType(String id, CompanyType type);
}
