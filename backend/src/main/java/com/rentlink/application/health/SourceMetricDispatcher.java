/*
 * Copyright (C) 2025 RentLink Middleware
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.rentlink.application.health;

import com.rentlink.config.HealthMonitorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands samples to worker threads so recording never blocks the upstream call path.
 * The queue is bounded: when it is full the oldest queued sample is dropped and counted.
 */
@Component
public class SourceMetricDispatcher implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(SourceMetricDispatcher.class);

    private final SourceMetricProcessor processor;
    private final SourceHealthMetrics metrics;
    private final ThreadPoolExecutor executor;
    private final Duration shutdownTimeout;
    private final AtomicLong pending = new AtomicLong();

    public SourceMetricDispatcher(SourceMetricProcessor processor, SourceHealthMetrics metrics, HealthMonitorProperties properties) {
        this.processor = processor;
        this.metrics = metrics;
        HealthMonitorProperties.Dispatcher settings = properties.dispatcher();
        this.shutdownTimeout = settings.shutdownTimeout();
        this.executor = new ThreadPoolExecutor(
                settings.workerThreads(),
                settings.workerThreads(),
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(settings.queueCapacity()),
                new CustomizableThreadFactory("source-health-"),
                new DropOldestSample()
        );
    }

    public void submit(HealthSample sample) {
        pending.incrementAndGet();
        executor.execute(new SampleTask(sample));
    }

    /**
     * Samples accepted but not yet processed or dropped.
     */
    public long pending() {
        return pending.get();
    }

    /**
     * Waits until every accepted sample has been processed or dropped.
     *
     * @return false if the timeout elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pending.get() > 0) {
            if (System.nanoTime() >= deadline) return false;
            Thread.sleep(5);
        }
        return true;
    }

    @Override
    public void destroy() throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
            int abandoned = executor.shutdownNow().size();
            log.warn("Source health dispatcher stopped with {} samples unprocessed", abandoned);
        }
    }

    private final class SampleTask implements Runnable {
        private final HealthSample sample;

        private SampleTask(HealthSample sample) {
            this.sample = sample;
        }

        @Override
        public void run() {
            try {
                processor.process(sample);
            } finally {
                pending.decrementAndGet();
            }
        }
    }

    private final class DropOldestSample implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor pool) {
            if (pool.isShutdown()) {
                drop(task);
                return;
            }
            Runnable oldest = pool.getQueue().poll();
            if (oldest != null) {
                drop(oldest);
            }
            pool.execute(task);
        }

        private void drop(Runnable task) {
            pending.decrementAndGet();
            metrics.recordSampleDropped();
            if (task instanceof SampleTask sampleTask) {
                log.warn("Dropped health sample sourceId={} latencyMs={}",
                        sampleTask.sample.sourceId(), sampleTask.sample.latencyMs());
            }
        }
    }
}
