/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import java.util.Collection;
import java.util.List;

/**
 * What routing code asks before sending work to a Source.
 */
public interface SourceExclusionGate {
    boolean isSourceExcluded(String sourceId);

    /**
     * The given Sources, in order, without the ones currently excluded.
     */
    default List<String> filterEligible(Collection<String> sourceIds) {
        return sourceIds.stream().filter(id -> !isSourceExcluded(id)).toList();
    }
}
