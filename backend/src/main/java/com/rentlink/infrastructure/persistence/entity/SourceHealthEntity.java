/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.infrastructure.persistence.entity;

import com.rentlink.domain.model.HealthCounters;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "source_health")
public class SourceHealthEntity {
    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "id", nullable = false, length = 36)
    private UUID id;

    @Column(name = "source_id", nullable = false, unique = true, length = 64)
    private String sourceId;

    @Column(name = "sample_count", nullable = false)
    private long sampleCount;

    @Column(name = "slow_count", nullable = false)
    private long slowCount;

    @Column(name = "slow_rate", nullable = false)
    private double slowRate;

    @Column(name = "strike_count", nullable = false)
    private int strikeCount;

    @Column(name = "last_strike_at")
    private Instant lastStrikeAt;

    @Column(name = "backoff_level", nullable = false)
    private int backoffLevel;

    @Column(name = "excluded_until")
    private Instant excludedUntil;

    @Column(name = "last_reset_by", length = 64)
    private String lastResetBy;

    @Column(name = "last_reset_at")
    private Instant lastResetAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * A fresh row in the zero state: no samples, no strikes, not excluded.
     */
    public static SourceHealthEntity baseline(String sourceId) {
        SourceHealthEntity e = new SourceHealthEntity();
        e.setSourceId(sourceId);
        e.clearCounters();
        return e;
    }

    public void clearCounters() {
        sampleCount = 0;
        slowCount = 0;
        slowRate = 0;
        strikeCount = 0;
        lastStrikeAt = null;
        backoffLevel = 0;
        excludedUntil = null;
    }

    public void recordSample(boolean slow, Instant now) {
        sampleCount++;
        if (slow) {
            slowCount++;
            lastStrikeAt = now;
        }
        slowRate = sampleCount == 0 ? 0 : (double) slowCount / (double) sampleCount;
    }

    public HealthCounters counters() {
        return new HealthCounters(sampleCount, slowCount, slowRate, strikeCount, backoffLevel, excludedUntil);
    }

    @PrePersist
    void prePersist() {
        if (id == null) id = UUID.randomUUID();
        if (updatedAt == null) updatedAt = Instant.now();
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getSourceId() {
        return sourceId;
    }

    public void setSourceId(String sourceId) {
        this.sourceId = sourceId;
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public void setSampleCount(long sampleCount) {
        this.sampleCount = sampleCount;
    }

    public long getSlowCount() {
        return slowCount;
    }

    public void setSlowCount(long slowCount) {
        this.slowCount = slowCount;
    }

    public double getSlowRate() {
        return slowRate;
    }

    public void setSlowRate(double slowRate) {
        this.slowRate = slowRate;
    }

    public int getStrikeCount() {
        return strikeCount;
    }

    public void setStrikeCount(int strikeCount) {
        this.strikeCount = strikeCount;
    }

    public Instant getLastStrikeAt() {
        return lastStrikeAt;
    }

    public void setLastStrikeAt(Instant lastStrikeAt) {
        this.lastStrikeAt = lastStrikeAt;
    }

    public int getBackoffLevel() {
        return backoffLevel;
    }

    public void setBackoffLevel(int backoffLevel) {
        this.backoffLevel = backoffLevel;
    }

    public Instant getExcludedUntil() {
        return excludedUntil;
    }

    public void setExcludedUntil(Instant excludedUntil) {
        this.excludedUntil = excludedUntil;
    }

    public String getLastResetBy() {
        return lastResetBy;
    }

    public void setLastResetBy(String lastResetBy) {
        this.lastResetBy = lastResetBy;
    }

    public Instant getLastResetAt() {
        return lastResetAt;
    }

    public void setLastResetAt(Instant lastResetAt) {
        this.lastResetAt = lastResetAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
