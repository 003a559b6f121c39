/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.leadmind.memory.consolidation;

import com.google.common.base.Preconditions;
import com.phonepe.leadmind.core.errors.OperationCancelledError;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs consolidation periodically and on demand. At most one pass runs at a time; a trigger that finds a pass in
 * progress is skipped, not queued.
 */
@Slf4j
public class ConsolidationScheduler implements AutoCloseable {
    private final Supplier<ConsolidationSummary> consolidation;
    private final SchedulerSetup setup;
    private final ScheduledExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedRuns = new AtomicLong();
    private final AtomicLong skippedRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private ScheduledFuture<?> periodicTask;

    public ConsolidationScheduler(Supplier<ConsolidationSummary> consolidation, SchedulerSetup setup) {
        this(consolidation, setup, Executors.newSingleThreadScheduledExecutor(runnable -> {
            final var thread = new Thread(runnable, "leadmind-consolidation");
            thread.setDaemon(true);
            return thread;
        }));
    }

    public ConsolidationScheduler(
            Supplier<ConsolidationSummary> consolidation,
            SchedulerSetup setup,
            ScheduledExecutorService executorService) {
        this.consolidation = consolidation;
        this.setup = setup;
        this.executorService = executorService;
    }

    public synchronized void start() {
        Preconditions.checkState(periodicTask == null, "Consolidation scheduler already started");
        final var interval = setup.getInterval().toMillis();
        periodicTask = executorService.scheduleAtFixedRate(this::runPeriodic,
                                                           setup.effectiveInitialDelay().toMillis(),
                                                           interval,
                                                           TimeUnit.MILLISECONDS);
        log.info("Consolidation scheduled every {}", setup.getInterval());
    }

    /**
     * Run a consolidation pass on the calling thread
     *
     * @return Summary of the pass, or empty if another pass was already in progress
     */
    public Optional<ConsolidationSummary> trigger() {
        if (!running.compareAndSet(false, true)) {
            skippedRuns.incrementAndGet();
            log.info("Consolidation already in progress. Skipping this run");
            return Optional.empty();
        }
        try {
            final var summary = consolidation.get();
            completedRuns.incrementAndGet();
            log.info("Consolidation finished. Migrated: {}, skipped: {}, failed: {}",
                     summary.getMigrated(), summary.getSkipped(), summary.getFailed());
            summary.getErrors().forEach(error -> log.warn("Consolidation error: {}", error));
            return Optional.of(summary);
        }
        catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            throw e;
        }
        finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long completedRuns() {
        return completedRuns.get();
    }

    public long skippedRuns() {
        return skippedRuns.get();
    }

    public long failedRuns() {
        return failedRuns.get();
    }

    @Override
    public synchronized void close() {
        if (periodicTask != null) {
            periodicTask.cancel(false);
        }
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(setup.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Consolidation did not finish within {}. Forcing shutdown", setup.getShutdownTimeout());
                executorService.shutdownNow();
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
        log.info("Consolidation scheduler stopped");
    }

    private void runPeriodic() {
        try {
            trigger();
        }
        catch (OperationCancelledError e) {
            log.info("Periodic consolidation cancelled");
        }
        catch (RuntimeException e) {
            //Keep the periodic task alive for the next run
            log.error("Periodic consolidation failed: {}", e.getMessage(), e);
        }
    }
}
