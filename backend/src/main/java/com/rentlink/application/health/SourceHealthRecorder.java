/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import com.rentlink.application.health.policy.BackoffDecision;
import com.rentlink.application.health.policy.BackoffPolicy;
import com.rentlink.config.HealthMonitorProperties;
import com.rentlink.infrastructure.persistence.entity.SourceHealthEntity;
import com.rentlink.infrastructure.persistence.repository.SourceHealthRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * All writes to {@code source_health}. Each write takes the Source's lock first and then runs
 * in its own transaction, committed before the lock is released. Callers must not already be
 * inside a transaction.
 */
@Component
public class SourceHealthRecorder {
    private final SourceHealthRepository repository;
    private final BackoffPolicy backoffPolicy;
    private final SourceLockRegistry locks;
    private final TransactionTemplate tx;
    private final HealthMonitorProperties properties;
    private final Clock clock;

    public SourceHealthRecorder(
            SourceHealthRepository repository,
            BackoffPolicy backoffPolicy,
            SourceLockRegistry locks,
            PlatformTransactionManager transactionManager,
            HealthMonitorProperties properties,
            Clock clock
    ) {
        this.repository = repository;
        this.backoffPolicy = backoffPolicy;
        this.locks = locks;
        this.tx = new TransactionTemplate(transactionManager);
        this.properties = properties;
        this.clock = clock;
    }

    public SampleOutcome record(HealthSample sample) {
        return locks.withLock(sample.sourceId(), () -> tx.execute(status -> apply(sample)));
    }

    private SampleOutcome apply(HealthSample sample) {
        Instant now = clock.instant();
        boolean slow = sample.latencyMs() > properties.slowThresholdMs();

        SourceHealthEntity entity = repository.findBySourceId(sample.sourceId())
                .orElseGet(() -> SourceHealthEntity.baseline(sample.sourceId()));
        entity.recordSample(slow, now);

        BackoffDecision decision = backoffPolicy.onSample(entity.counters(), slow, now);
        entity.setStrikeCount(decision.strikeCount());
        entity.setBackoffLevel(decision.backoffLevel());
        entity.setExcludedUntil(decision.excludedUntil());
        entity.setUpdatedAt(now);
        repository.save(entity);

        return new SampleOutcome(
                sample,
                slow,
                entity.counters(),
                decision,
                backoffPolicy.isHealthy(entity.counters(), now)
        );
    }

    /**
     * Nulls {@code excludedUntil} if it is still set and no longer in the future.
     * Re-checked under the lock, so an exclusion applied concurrently is left alone.
     *
     * @return whether a stale exclusion was cleared
     */
    public boolean clearExpiredExclusion(String sourceId) {
        return Boolean.TRUE.equals(locks.withLock(sourceId, () -> tx.execute(status -> {
            Instant now = clock.instant();
            SourceHealthEntity entity = repository.findBySourceId(sourceId).orElse(null);
            if (entity == null || entity.getExcludedUntil() == null || entity.getExcludedUntil().isAfter(now)) {
                return false;
            }
            entity.setExcludedUntil(null);
            entity.setUpdatedAt(now);
            repository.save(entity);
            return true;
        })));
    }

    public SourceHealthEntity reset(String sourceId, String resetBy) {
        return locks.withLock(sourceId, () -> tx.execute(status -> {
            Instant now = clock.instant();
            SourceHealthEntity entity = repository.findBySourceId(sourceId)
                    .orElseGet(() -> SourceHealthEntity.baseline(sourceId));
            entity.clearCounters();
            entity.setLastResetBy(resetBy);
            entity.setLastResetAt(now);
            entity.setUpdatedAt(now);
            return repository.save(entity);
        }));
    }
}
