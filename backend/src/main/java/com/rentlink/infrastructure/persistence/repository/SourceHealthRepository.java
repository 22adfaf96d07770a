/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.infrastructure.persistence.repository;

import com.rentlink.infrastructure.persistence.entity.SourceHealthEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface SourceHealthRepository extends JpaRepository<SourceHealthEntity, UUID> {
    Optional<SourceHealthEntity> findBySourceId(String sourceId);

    List<SourceHealthEntity> findAllByOrderByUpdatedAtDesc();
}
