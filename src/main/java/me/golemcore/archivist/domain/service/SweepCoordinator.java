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

package me.golemcore.archivist.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.model.SweepReport;
import me.golemcore.archivist.domain.model.SweepType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Single entry point for maintenance sweeps, used both by the HTTP API and the
 * optional timer.
 *
 * <p>
 * At most one sweep of each type runs at a time. A second request for a type
 * that is already running returns a skipped report instead of waiting. Sweeps
 * stop at the next file boundary once the calling thread is interrupted.
 */
@Service
@Slf4j
public class SweepCoordinator {

    private final Clock clock;
    private final Map<SweepType, AtomicBoolean> running = new EnumMap<>(SweepType.class);
    private final Map<SweepType, Function<BooleanSupplier, SweepReport>> sweeps = new EnumMap<>(SweepType.class);

    public SweepCoordinator(LifecycleService lifecycleService, ArchiveSearchService archiveSearchService,
            Clock clock) {
        this.clock = clock;
        sweeps.put(SweepType.AGING, lifecycleService::runAgingSweep);
        sweeps.put(SweepType.ARCHIVE, lifecycleService::runArchiveSweep);
        sweeps.put(SweepType.INDEX_RETRY, archiveSearchService::retryPending);
        sweeps.put(SweepType.REINDEX, archiveSearchService::reindex);
        for (SweepType type : SweepType.values()) {
            running.put(type, new AtomicBoolean(false));
        }
    }

    public SweepReport run(SweepType type) {
        AtomicBoolean flag = running.get(type);
        if (!flag.compareAndSet(false, true)) {
            log.info("[Sweep] {} sweep already running, skipped", type);
            return SweepReport.skipped(type, clock.instant());
        }
        try {
            SweepReport report = sweeps.get(type).apply(() -> Thread.currentThread().isInterrupted());
            log.info("[Sweep] {} sweep: examined={}, transitioned={}, archived={}, failures={}, interrupted={}",
                    type, report.getExamined(), report.getTransitioned(), report.getArchived(),
                    report.getFailures().size(), report.isInterrupted());
            return report;
        } finally {
            flag.set(false);
        }
    }

    public boolean isRunning(SweepType type) {
        return running.get(type).get();
    }
}
