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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.exception.FileNotTrackedException;
import me.golemcore.archivist.domain.exception.RegistrationConflictException;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.GenerationMode;
import me.golemcore.archivist.domain.model.LifecycleState;
import me.golemcore.archivist.domain.model.LifecycleStatus;
import me.golemcore.archivist.domain.model.RetentionHints;
import me.golemcore.archivist.domain.model.SweepReport;
import me.golemcore.archivist.domain.model.SweepType;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Owns the lifecycle state machine of tracked files.
 *
 * <pre>
 * ACTIVE ──idle &gt; aging-after──▶ AGING ──idle &gt; archive-eligible-after──▶ ARCHIVE_ELIGIBLE ──sweep──▶ ARCHIVED
 * </pre>
 *
 * <p>
 * Idle thresholds are stretched by {@code 1 + score * score-aging-stretch}, so
 * valuable files age more slowly. Files scoring at or above
 * {@code protect-score} never leave ACTIVE on their own. Any access resets a
 * file to ACTIVE.
 *
 * <p>
 * Every transition of a path runs under that path's lock. Archival writes the
 * archive record durably before the tracked file is removed; index ingestion
 * happens last and its failure is queued instead of reverting the archive.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleService {

    private static final String WORKSPACE = "";

    private final MetadataStoreService metadataStore;
    private final RetentionScorer retentionScorer;
    private final ContentAnalyzer contentAnalyzer;
    private final ArchiveLogService archiveLogService;
    private final ArchiveSearchService archiveSearchService;
    private final PathLockManager pathLockManager;
    private final StoragePort storagePort;
    private final ArchivistProperties properties;
    private final Clock clock;

    /**
     * Writes the content into the workspace and starts tracking it as ACTIVE.
     * Re-registering identical content counts as an access.
     *
     * @throws RegistrationConflictException
     *             if the path is tracked with different content and the hints
     *             carry no update intent
     */
    public TrackedFile register(String rawPath, String content, RetentionHints hints) {
        String path = normalizePath(rawPath);
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Content is required: " + path);
        }
        RetentionHints effectiveHints = hints != null ? hints : new RetentionHints();

        try (PathLockManager.PathLock ignored = pathLockManager.lock(path)) {
            String hash = contentAnalyzer.hash(content);
            TrackedFile existing = metadataStore.find(path).orElse(null);
            if (existing != null && hash.equals(existing.getContentHash())) {
                log.debug("[Lifecycle] Re-registration of unchanged {} counts as access", path);
                return recordAccess(existing);
            }
            if (existing != null && !effectiveHints.isUpdateIntent()) {
                throw new RegistrationConflictException(path, existing.getContentHash(), hash);
            }

            Instant now = clock.instant();
            GenerationMode mode = resolveMode(effectiveHints, existing);
            TrackedFile candidate = TrackedFile.builder()
                    .path(path)
                    .contentHash(hash)
                    .contentLength(content.length())
                    .createdAt(existing != null ? existing.getCreatedAt() : now)
                    .lastAccessedAt(now)
                    .lastModifiedAt(now)
                    .stateChangedAt(now)
                    .retentionScore(retentionScorer.score(content, mode, effectiveHints))
                    .state(LifecycleState.ACTIVE)
                    .generationMode(mode)
                    .tags(mergeTags(existing, effectiveHints))
                    .sessionId(effectiveHints.getSessionId() != null ? effectiveHints.getSessionId()
                            : existing != null ? existing.getSessionId() : null)
                    .retentionDays(effectiveHints.getRetentionDays())
                    .stakeholders(effectiveHints.getStakeholders() != null
                            ? new ArrayList<>(effectiveHints.getStakeholders())
                            : new ArrayList<>())
                    .frameworks(effectiveHints.getFrameworks() != null
                            ? new ArrayList<>(effectiveHints.getFrameworks())
                            : new ArrayList<>())
                    .build();

            String previousContent = readWorkspaceFile(path);
            writeWorkspaceFile(path, content);
            TrackedFile stored;
            try {
                stored = metadataStore.register(candidate, effectiveHints.isUpdateIntent());
            } catch (RuntimeException e) {
                restoreWorkspaceFile(path, previousContent);
                throw e;
            }
            log.info("[Lifecycle] {} {} (mode={}, score={}, hash={})",
                    existing == null ? "Registered" : "Updated", path, mode.getValue(),
                    stored.getRetentionScore(), abbreviate(hash));
            return stored;
        }
    }

    /**
     * Records an access: updates last-access and resets the state to ACTIVE.
     *
     * @throws FileNotTrackedException
     *             if the path is not tracked (or was archived meanwhile)
     */
    public TrackedFile touch(String rawPath) {
        String path = normalizePath(rawPath);
        try (PathLockManager.PathLock ignored = pathLockManager.lock(path)) {
            return recordAccess(metadataStore.get(path));
        }
    }

    /**
     * Archives a tracked file immediately, regardless of its state.
     *
     * @throws FileNotTrackedException
     *             if the path is not tracked, including when a concurrent call
     *             archived it first
     */
    public ArchiveRecord archive(String rawPath) {
        String path = normalizePath(rawPath);
        try (PathLockManager.PathLock ignored = pathLockManager.lock(path)) {
            TrackedFile file = metadataStore.get(path);
            return archiveLocked(file, "manual");
        }
    }

    public LifecycleStatus getStatus(String rawPath) {
        String path = normalizePath(rawPath);
        TrackedFile file = metadataStore.get(path);
        Instant now = clock.instant();
        boolean protectedFile = isProtected(file);
        LifecycleState nextState = null;
        Instant estimate = null;
        Instant lastAccess = file.getLastAccessedAt() != null ? file.getLastAccessedAt() : now;
        switch (file.getState()) {
        case ACTIVE -> {
            if (!protectedFile) {
                nextState = LifecycleState.AGING;
                estimate = lastAccess.plus(stretched(properties.getLifecycle().getAgingAfter(), file));
            }
        }
        case AGING -> {
            nextState = LifecycleState.ARCHIVE_ELIGIBLE;
            estimate = lastAccess.plus(stretched(properties.getLifecycle().getArchiveEligibleAfter(), file));
        }
        case ARCHIVE_ELIGIBLE -> {
            nextState = LifecycleState.ARCHIVED;
            estimate = now;
        }
        default -> {
            // archived files are no longer tracked
        }
        }
        return LifecycleStatus.builder()
                .path(path)
                .retentionScore(file.getRetentionScore())
                .state(file.getState())
                .lastAccessedAt(file.getLastAccessedAt())
                .nextState(nextState)
                .nextTransitionEstimate(estimate != null && estimate.isBefore(now) ? now : estimate)
                .protectedFile(protectedFile)
                .build();
    }

    public List<TrackedFile> list(LifecycleState state) {
        return state != null ? metadataStore.findByState(state) : metadataStore.listAll();
    }

    /**
     * Moves idle files towards ARCHIVE_ELIGIBLE. A file idle past both
     * thresholds moves two steps in one sweep. Checkpointed per file.
     */
    public SweepReport runAgingSweep(BooleanSupplier interrupted) {
        Instant startedAt = clock.instant();
        SweepReport report = SweepReport.builder().type(SweepType.AGING).startedAt(startedAt).build();
        for (TrackedFile candidate : metadataStore.listAll()) {
            if (interrupted.getAsBoolean()) {
                report.setInterrupted(true);
                log.warn("[Lifecycle] Aging sweep interrupted after {} files", report.getExamined());
                break;
            }
            report.setExamined(report.getExamined() + 1);
            try (PathLockManager.PathLock ignored = pathLockManager.lock(candidate.getPath())) {
                TrackedFile file = metadataStore.find(candidate.getPath()).orElse(null);
                if (file == null) {
                    continue;
                }
                LifecycleState target = agedState(file, startedAt);
                if (target != file.getState()) {
                    LifecycleState from = file.getState();
                    file.setState(target);
                    file.setStateChangedAt(startedAt);
                    metadataStore.update(file);
                    report.setTransitioned(report.getTransitioned() + 1);
                    log.info("[Lifecycle] {}: {} -> {} (score={}, idle since {})",
                            file.getPath(), from.getValue(), target.getValue(),
                            file.getRetentionScore(), file.getLastAccessedAt());
                }
            } catch (StorageFailureException e) {
                log.error("[Lifecycle] Aging of {} failed at {}, state left unchanged: {}",
                        candidate.getPath(), startedAt, e.getMessage());
                report.getFailures().add(candidate.getPath() + ": " + e.getMessage());
            }
        }
        report.setFinishedAt(clock.instant());
        return report;
    }

    /**
     * Archives every ARCHIVE_ELIGIBLE file. Checkpointed per file: an
     * interrupted sweep leaves each file either fully archived or untouched.
     */
    public SweepReport runArchiveSweep(BooleanSupplier interrupted) {
        Instant startedAt = clock.instant();
        SweepReport report = SweepReport.builder().type(SweepType.ARCHIVE).startedAt(startedAt).build();
        for (TrackedFile candidate : metadataStore.findByState(LifecycleState.ARCHIVE_ELIGIBLE)) {
            if (interrupted.getAsBoolean()) {
                report.setInterrupted(true);
                log.warn("[Lifecycle] Archive sweep interrupted after {} files", report.getExamined());
                break;
            }
            report.setExamined(report.getExamined() + 1);
            try (PathLockManager.PathLock ignored = pathLockManager.lock(candidate.getPath())) {
                TrackedFile file = metadataStore.find(candidate.getPath()).orElse(null);
                if (file == null || file.getState() != LifecycleState.ARCHIVE_ELIGIBLE) {
                    continue;
                }
                archiveLocked(file, "sweep");
                report.setArchived(report.getArchived() + 1);
                report.setTransitioned(report.getTransitioned() + 1);
            } catch (StorageFailureException e) {
                report.getFailures().add(candidate.getPath() + ": " + e.getMessage());
            }
        }
        report.setFinishedAt(clock.instant());
        return report;
    }

    LifecycleState agedState(TrackedFile file, Instant now) {
        if (file.getLastAccessedAt() == null) {
            return file.getState();
        }
        Duration idle = Duration.between(file.getLastAccessedAt(), now);
        Duration agingAfter = stretched(properties.getLifecycle().getAgingAfter(), file);
        Duration eligibleAfter = stretched(properties.getLifecycle().getArchiveEligibleAfter(), file);
        LifecycleState state = file.getState();
        if (state == LifecycleState.ACTIVE && !isProtected(file) && idle.compareTo(agingAfter) > 0) {
            state = LifecycleState.AGING;
        }
        if (state == LifecycleState.AGING && idle.compareTo(eligibleAfter) > 0) {
            state = LifecycleState.ARCHIVE_ELIGIBLE;
        }
        return state;
    }

    private ArchiveRecord archiveLocked(TrackedFile file, String trigger) {
        String path = file.getPath();
        Instant now = clock.instant();
        String content = readWorkspaceFile(path);
        if (content == null) {
            log.warn("[Lifecycle] Workspace file {} is missing, archiving its metadata with empty content", path);
            content = "";
        }
        String hash = contentAnalyzer.hash(content);
        if (file.getContentHash() != null && !file.getContentHash().equals(hash)) {
            log.warn("[Lifecycle] {} changed outside the archivist (tracked {}, on disk {}), archiving disk content",
                    path, abbreviate(file.getContentHash()), abbreviate(hash));
        }

        ArchiveRecord record = ArchiveRecord.builder()
                .archiveId(newArchiveId())
                .originalPath(path)
                .contentHash(hash)
                .contentLength(content.length())
                .tags(file.getTags() != null ? new LinkedHashSet<>(file.getTags()) : new LinkedHashSet<>())
                .category(contentAnalyzer.category(content))
                .keywords(contentAnalyzer.keywords(content))
                .summary(contentAnalyzer.summary(content))
                .generationMode(file.getGenerationMode())
                .sessionId(file.getSessionId())
                .createdAt(file.getCreatedAt())
                .archivedAt(now)
                .retentionScore(file.getRetentionScore())
                .build();

        ArchiveRecord stored = archiveLogService.append(record, content);
        try {
            metadataStore.remove(path);
        } catch (StorageFailureException e) {
            log.error("[Lifecycle] Archive of {} aborted at {}: metadata removal failed, rolling back {}",
                    path, now, stored.getArchiveId());
            archiveLogService.purge(stored.getArchiveId(), "rollback: metadata removal failed for " + path);
            throw e;
        }
        try {
            storagePort.deleteObject(WORKSPACE, path).join();
        } catch (RuntimeException e) {
            log.warn("[Lifecycle] Archived {} but the workspace file could not be deleted: {}", path, e.getMessage());
        }
        log.info("[Lifecycle] Archived {} as {} ({}, score={}, hash={})", path, stored.getArchiveId(), trigger,
                stored.getRetentionScore(), abbreviate(hash));

        archiveSearchService.ingest(stored, content);
        return stored;
    }

    private TrackedFile recordAccess(TrackedFile file) {
        Instant now = clock.instant();
        LifecycleState previous = file.getState();
        file.setLastAccessedAt(now);
        if (previous != LifecycleState.ACTIVE) {
            file.setState(LifecycleState.ACTIVE);
            file.setStateChangedAt(now);
        }
        TrackedFile updated = metadataStore.update(file);
        if (previous != LifecycleState.ACTIVE) {
            log.info("[Lifecycle] {}: {} -> active (accessed)", file.getPath(), previous.getValue());
        }
        return updated;
    }

    private boolean isProtected(TrackedFile file) {
        return file.getRetentionScore() >= properties.getLifecycle().getProtectScore();
    }

    private Duration stretched(Duration threshold, TrackedFile file) {
        double stretch = 1.0 + file.getRetentionScore() * properties.getLifecycle().getScoreAgingStretch();
        return Duration.ofMillis(Math.round(threshold.toMillis() * stretch));
    }

    private GenerationMode resolveMode(RetentionHints hints, TrackedFile existing) {
        if (hints.getGenerationMode() != null) {
            return hints.getGenerationMode();
        }
        if (existing != null && existing.getGenerationMode() != null) {
            return existing.getGenerationMode();
        }
        return properties.getLifecycle().getDefaultGenerationMode();
    }

    private Set<String> mergeTags(TrackedFile existing, RetentionHints hints) {
        Set<String> tags = new LinkedHashSet<>();
        if (existing != null && existing.getTags() != null) {
            tags.addAll(existing.getTags());
        }
        if (hints.getTags() != null) {
            for (String tag : hints.getTags()) {
                if (tag != null && !tag.isBlank()) {
                    tags.add(tag.trim());
                }
            }
        }
        return tags;
    }

    private String readWorkspaceFile(String path) {
        try {
            return storagePort.getText(WORKSPACE, path).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Reading " + path, e);
        }
    }

    private void writeWorkspaceFile(String path, String content) {
        try {
            storagePort.putTextAtomic(WORKSPACE, path, content).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Writing " + path, e);
        }
    }

    private void restoreWorkspaceFile(String path, String previousContent) {
        try {
            if (previousContent != null) {
                storagePort.putTextAtomic(WORKSPACE, path, previousContent).join();
            } else {
                storagePort.deleteObject(WORKSPACE, path).join();
            }
        } catch (RuntimeException e) {
            log.error("[Lifecycle] Failed to restore workspace file {} after a failed registration: {}",
                    path, e.getMessage());
        }
    }

    private String normalizePath(String rawPath) {
        return WorkspacePathSupport.normalize(rawPath, properties.getWorkspace().getStateDirectory());
    }

    private static String newArchiveId() {
        return "arc-" + UUID.randomUUID();
    }

    private static String abbreviate(String hash) {
        return hash != null && hash.length() > 12 ? hash.substring(0, 12) : hash;
    }
}
