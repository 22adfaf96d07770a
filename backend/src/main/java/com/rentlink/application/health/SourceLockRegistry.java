/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per Source id. Every write to a health row runs under its Source's lock,
 * so read-modify-write updates from concurrent calls never interleave.
 * Locks are never evicted; the set of Sources is small and long-lived.
 */
@Component
public class SourceLockRegistry {
    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String sourceId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(sourceId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
