/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.archivist.auto;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.model.SweepType;
import me.golemcore.archivist.domain.service.SweepCoordinator;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Optional in-process timer for maintenance sweeps.
 *
 * <p>
 * Disabled by default; sweeps are normally triggered by an external scheduler
 * through the HTTP API. When enabled, a single daemon thread runs the aging,
 * archive and index retry sweeps in that order at a fixed delay. Overlap with
 * API-triggered sweeps is resolved by {@link SweepCoordinator}.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class SweepScheduler {

    private static final List<SweepType> TICK_SWEEPS = List.of(SweepType.AGING, SweepType.ARCHIVE,
            SweepType.INDEX_RETRY);

    private final SweepCoordinator sweepCoordinator;
    private final ArchivistProperties properties;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    public SweepScheduler(SweepCoordinator sweepCoordinator, ArchivistProperties properties) {
        this.sweepCoordinator = sweepCoordinator;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        ArchivistProperties.SweepsProperties sweeps = properties.getSweeps();
        if (!sweeps.isEnabled()) {
            log.info("[SweepScheduler] Disabled, sweeps run on request only");
            return;
        }
        Duration interval = sweeps.getInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            log.warn("[SweepScheduler] Invalid interval {}, timer not started", interval);
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "archivist-sweeps");
            t.setDaemon(true);
            return t;
        });
        long intervalMillis = interval.toMillis();
        tickTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMillis, intervalMillis,
                TimeUnit.MILLISECONDS);
        log.info("[SweepScheduler] Started with interval: {}", interval);
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(true);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[SweepScheduler] Shut down");
    }

    void tick() {
        for (SweepType type : TICK_SWEEPS) {
            if (Thread.currentThread().isInterrupted()) {
                log.debug("[SweepScheduler] Tick interrupted before {}", type);
                return;
            }
            try {
                sweepCoordinator.run(type);
            } catch (RuntimeException e) {
                log.error("[SweepScheduler] {} sweep failed: {}", type, e.getMessage(), e);
            }
        }
    }
}
