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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.ArchiveSearchQuery;
import me.golemcore.archivist.domain.model.ArchiveStats;
import me.golemcore.archivist.domain.model.IndexDocument;
import me.golemcore.archivist.domain.model.PendingIngestion;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.domain.model.SegmentHealth;
import me.golemcore.archivist.domain.model.SweepReport;
import me.golemcore.archivist.domain.model.SweepType;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.ArchiveIndexPort;
import me.golemcore.archivist.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.TreeMap;
import java.util.function.BooleanSupplier;

/**
 * Search side of the archive: feeds archive records into the index, retries
 * failed ingestions with exponential backoff, rebuilds the index from the
 * archive log and answers filtered full-text queries.
 *
 * <p>
 * Index failures never propagate into archival. A failed ingestion is
 * recorded in {@code index/pending-ingest.json} and picked up by the
 * {@link SweepType#INDEX_RETRY} sweep.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveSearchService {

    private static final String PENDING_FILE = "pending-ingest.json";
    private static final int TOP_RETENTION = 10;
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("yyyy-MM").withZone(ZoneOffset.UTC);

    private final ArchiveLogService archiveLogService;
    private final ArchiveIndexPort archiveIndexPort;
    private final StoragePort storagePort;
    private final ArchivistProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, PendingIngestion> pending = new LinkedHashMap<>();

    @PostConstruct
    public synchronized void init() {
        pending.clear();
        try {
            String json = storagePort.getText(directory(), PENDING_FILE).join();
            if (json != null && !json.isBlank()) {
                List<PendingIngestion> entries = objectMapper.readValue(json,
                        new TypeReference<List<PendingIngestion>>() {
                        });
                for (PendingIngestion entry : entries) {
                    pending.put(entry.getArchiveId(), entry);
                }
            }
        } catch (IOException | RuntimeException e) {
            log.warn("[ArchiveIndex] Ingestion retry queue unreadable, starting empty: {}", e.getMessage());
        }
        if (!pending.isEmpty()) {
            log.info("[ArchiveIndex] {} archive records waiting for index ingestion", pending.size());
        }
    }

    /**
     * Indexes a freshly archived record. Failures are queued, never thrown.
     *
     * @return true if the record is searchable now
     */
    public boolean ingest(ArchiveRecord record, String content) {
        try {
            return ingestLive(record, content);
        } catch (RuntimeException e) {
            log.warn("[ArchiveIndex] Ingestion of {} ({}) failed, queued for retry: {}",
                    record.getArchiveId(), record.getOriginalPath(), e.getMessage());
            enqueue(record.getArchiveId(), e);
            return false;
        }
    }

    /**
     * Retries due ingestions. Entries whose record was purged are dropped.
     */
    public SweepReport retryPending(BooleanSupplier interrupted) {
        Instant startedAt = clock.instant();
        SweepReport report = SweepReport.builder()
                .type(SweepType.INDEX_RETRY)
                .startedAt(startedAt)
                .build();
        for (PendingIngestion entry : dueEntries(startedAt)) {
            if (interrupted.getAsBoolean()) {
                report.setInterrupted(true);
                break;
            }
            report.setExamined(report.getExamined() + 1);
            ArchiveRecord record = archiveLogService.find(entry.getArchiveId()).orElse(null);
            if (record == null) {
                dequeue(entry.getArchiveId());
                continue;
            }
            try {
                String content = archiveLogService.readSnapshot(record);
                boolean live = ingestLive(record, content != null ? content : "");
                dequeue(record.getArchiveId());
                if (live) {
                    report.setTransitioned(report.getTransitioned() + 1);
                    log.info("[ArchiveIndex] Retried ingestion of {} succeeded", record.getArchiveId());
                }
            } catch (RuntimeException e) {
                enqueue(record.getArchiveId(), e);
                report.getFailures().add(record.getArchiveId() + ": " + e.getMessage());
            }
        }
        report.setFinishedAt(clock.instant());
        return report;
    }

    /**
     * Searches the index. Archived records still waiting for ingestion cannot
     * appear in the hits, so their presence marks the result as partial too.
     */
    public SearchResult search(ArchiveSearchQuery query) {
        ArchiveSearchQuery normalized = normalize(query);
        SearchResult result = archiveIndexPort.search(normalized);
        int unindexed = pendingCount();
        result.setPendingIngestions(unindexed);
        if (unindexed > 0) {
            result.setPartialResult(true);
        }
        if (result.isPartialResult()) {
            log.warn("[ArchiveIndex] Partial result for '{}', degraded segments: {}, pending ingestions: {}",
                    normalized.getText(), result.getDegradedSegments(), unindexed);
        }
        return result;
    }

    /**
     * Wipes the index and rebuilds it from the archive log alone. Records the
     * rebuild did not reach are queued for the retry sweep, which resumes the
     * work.
     */
    public SweepReport reindex(BooleanSupplier interrupted) {
        Instant startedAt = clock.instant();
        SnapshotDocuments documents = new SnapshotDocuments();
        int indexed;
        try {
            indexed = archiveIndexPort.rebuild(documents::load, interrupted);
        } catch (RuntimeException e) {
            requeue(documents.records(), "reindex failed: " + e.getMessage());
            throw e;
        }
        List<ArchiveRecord> records = documents.records();
        Instant finishedAt = clock.instant();
        for (int i = 0; i < indexed && i < records.size(); i++) {
            String archiveId = records.get(i).getArchiveId();
            archiveLogService.markIndexed(archiveId, finishedAt);
            dequeue(archiveId);
        }
        boolean wasInterrupted = indexed < records.size();
        if (wasInterrupted) {
            requeue(records.subList(indexed, records.size()), "reindex interrupted");
        }
        log.info("[ArchiveIndex] Reindexed {} of {} archive records", indexed, records.size());
        return SweepReport.builder()
                .type(SweepType.REINDEX)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .examined(records.size())
                .transitioned(indexed)
                .failures(documents.failures())
                .interrupted(wasInterrupted)
                .build();
    }

    public ArchiveRecord getRecord(String archiveId) {
        return archiveLogService.get(archiveId);
    }

    /**
     * Explicit removal of an archived record from the log and the index.
     */
    public ArchiveRecord purge(String archiveId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A purge reason is required");
        }
        ArchiveRecord purged = archiveLogService.purge(archiveId, reason.trim());
        dequeue(archiveId);
        try {
            archiveIndexPort.delete(archiveId);
        } catch (RuntimeException e) {
            log.warn("[ArchiveIndex] Purged {} is still indexed until the next reindex: {}",
                    archiveId, e.getMessage());
        }
        return purged;
    }

    public List<SegmentHealth> segmentHealth() {
        return archiveIndexPort.segmentHealth();
    }

    public ArchiveStats stats() {
        List<ArchiveRecord> records = archiveLogService.listRecords();
        Map<String, Integer> byCategory = new TreeMap<>();
        Map<String, Integer> byMonth = new TreeMap<>();
        long totalBytes = 0;
        double scoreSum = 0.0;
        for (ArchiveRecord record : records) {
            String category = record.getCategory() != null ? record.getCategory() : ContentAnalyzer.GENERAL_CATEGORY;
            byCategory.merge(category, 1, Integer::sum);
            if (record.getArchivedAt() != null) {
                byMonth.merge(MONTH.format(record.getArchivedAt()), 1, Integer::sum);
            }
            totalBytes += record.getContentLength();
            scoreSum += record.getRetentionScore();
        }
        List<String> topRetention = records.stream()
                .sorted(Comparator.comparingDouble(ArchiveRecord::getRetentionScore).reversed()
                        .thenComparing(ArchiveRecord::getArchiveId))
                .limit(TOP_RETENTION)
                .map(ArchiveRecord::getArchiveId)
                .toList();
        double average = records.isEmpty() ? 0.0 : Math.round(scoreSum / records.size() * 100.0) / 100.0;
        return ArchiveStats.builder()
                .totalRecords(records.size())
                .purgedRecords(archiveLogService.purgedCount())
                .totalBytes(totalBytes)
                .averageRetentionScore(average)
                .pendingIngestions(pendingCount())
                .byCategory(new LinkedHashMap<>(byCategory))
                .byMonth(new LinkedHashMap<>(byMonth))
                .topRetention(new ArrayList<>(topRetention))
                .build();
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public synchronized List<PendingIngestion> pendingIngestions() {
        List<PendingIngestion> copies = new ArrayList<>();
        for (PendingIngestion entry : pending.values()) {
            copies.add(PendingIngestion.builder()
                    .archiveId(entry.getArchiveId())
                    .attempts(entry.getAttempts())
                    .nextAttemptAt(entry.getNextAttemptAt())
                    .lastError(entry.getLastError())
                    .build());
        }
        return copies;
    }

    private ArchiveSearchQuery normalize(ArchiveSearchQuery query) {
        ArchivistProperties.IndexProperties index = properties.getIndex();
        ArchiveSearchQuery source = query != null ? query : new ArchiveSearchQuery();
        if (source.getFrom() != null && source.getTo() != null && source.getFrom().isAfter(source.getTo())) {
            throw new IllegalArgumentException("Search range start is after its end");
        }
        int limit = source.getLimit() > 0 ? Math.min(source.getLimit(), index.getMaxResults())
                : index.getDefaultResults();
        LinkedHashSet<String> tags = new LinkedHashSet<>();
        if (source.getTags() != null) {
            for (String tag : source.getTags()) {
                if (tag != null && !tag.isBlank()) {
                    tags.add(tag.trim());
                }
            }
        }
        return ArchiveSearchQuery.builder()
                .text(source.getText() != null ? source.getText().trim() : null)
                .tags(tags)
                .category(source.getCategory() != null && !source.getCategory().isBlank()
                        ? source.getCategory().trim()
                        : null)
                .from(source.getFrom())
                .to(source.getTo())
                .limit(limit)
                .build();
    }

    private synchronized List<PendingIngestion> dueEntries(Instant now) {
        return pending.values().stream()
                .filter(entry -> entry.getNextAttemptAt() == null || !entry.getNextAttemptAt().isAfter(now))
                .map(entry -> PendingIngestion.builder()
                        .archiveId(entry.getArchiveId())
                        .attempts(entry.getAttempts())
                        .nextAttemptAt(entry.getNextAttemptAt())
                        .lastError(entry.getLastError())
                        .build())
                .toList();
    }

    private synchronized void enqueue(String archiveId, RuntimeException error) {
        PendingIngestion entry = pending.computeIfAbsent(archiveId,
                id -> PendingIngestion.builder().archiveId(id).build());
        entry.setAttempts(entry.getAttempts() + 1);
        entry.setLastError(error.getMessage());
        entry.setNextAttemptAt(clock.instant().plus(backoff(entry.getAttempts())));
        persistQueue();
    }

    /**
     * Queues records for immediate retry, as left behind by an incomplete
     * rebuild.
     */
    private synchronized void requeue(List<ArchiveRecord> records, String reason) {
        if (records.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        for (ArchiveRecord record : records) {
            PendingIngestion entry = pending.computeIfAbsent(record.getArchiveId(),
                    id -> PendingIngestion.builder().archiveId(id).build());
            entry.setLastError(reason);
            entry.setNextAttemptAt(now);
        }
        persistQueue();
        log.warn("[ArchiveIndex] {} archive records queued for ingestion after {}", records.size(), reason);
    }

    /**
     * Ingests a record and confirms it was not purged meanwhile. A purge that
     * ran between the caller's lookup and the ingestion removes the document
     * again here.
     */
    private boolean ingestLive(ArchiveRecord record, String content) {
        archiveIndexPort.ingest(new IndexDocument(record, content));
        if (archiveLogService.find(record.getArchiveId()).isEmpty()) {
            archiveIndexPort.delete(record.getArchiveId());
            log.info("[ArchiveIndex] {} was purged during ingestion, removed from the index",
                    record.getArchiveId());
            return false;
        }
        archiveLogService.markIndexed(record.getArchiveId(), clock.instant());
        return true;
    }

    private synchronized void dequeue(String archiveId) {
        if (pending.remove(archiveId) != null) {
            persistQueue();
        }
    }

    Duration backoff(int attempts) {
        ArchivistProperties.IndexProperties index = properties.getIndex();
        Duration delay = index.getRetryInitialBackoff();
        for (int i = 1; i < attempts && delay.compareTo(index.getRetryMaxBackoff()) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(index.getRetryMaxBackoff()) > 0 ? index.getRetryMaxBackoff() : delay;
    }

    private void persistQueue() {
        try {
            String json = objectMapper.writeValueAsString(new ArrayList<>(pending.values()));
            storagePort.putTextAtomic(directory(), PENDING_FILE, json).join();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize ingestion retry queue", e);
        } catch (RuntimeException e) {
            log.error("[ArchiveIndex] Failed to persist ingestion retry queue ({} entries) at {}, "
                    + "a reindex restores searchability: {}", pending.size(), clock.instant(), e.getMessage());
        }
    }

    private String directory() {
        return properties.getWorkspace().stateDirectory(properties.getIndex().getDirectory());
    }

    /**
     * Lazily loads snapshots so a rebuild does not hold every archived file in
     * memory at once.
     */
    private final class SnapshotDocuments implements Iterable<IndexDocument> {

        private List<ArchiveRecord> records = List.of();
        private final List<String> failures = new ArrayList<>();

        SnapshotDocuments load() {
            records = archiveLogService.listRecords();
            return this;
        }

        List<ArchiveRecord> records() {
            return records;
        }

        List<String> failures() {
            return failures;
        }

        @Override
        public Iterator<IndexDocument> iterator() {
            Iterator<ArchiveRecord> source = records.iterator();
            return new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return source.hasNext();
                }

                @Override
                public IndexDocument next() {
                    if (!source.hasNext()) {
                        throw new NoSuchElementException();
                    }
                    ArchiveRecord record = source.next();
                    String content = null;
                    try {
                        content = archiveLogService.readSnapshot(record);
                    } catch (StorageFailureException e) {
                        failures.add(record.getArchiveId() + ": " + e.getMessage());
                    }
                    if (content == null) {
                        log.warn("[ArchiveIndex] Snapshot of {} missing, indexing metadata only",
                                record.getArchiveId());
                    }
                    return new IndexDocument(record, content != null ? content : "");
                }
            };
        }
    }
}
