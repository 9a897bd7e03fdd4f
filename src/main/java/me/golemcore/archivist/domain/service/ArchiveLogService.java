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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.exception.ArchiveRecordNotFoundException;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import me.golemcore.archivist.domain.model.ArchiveLogEntry;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only archive log ({@code archive/records.jsonl}) and content
 * snapshots ({@code archive/snapshots/<archiveId>.snapshot}).
 *
 * <p>
 * The snapshot is written before the log line, so a record that appears in
 * the log always has its content on disk. Records are never rewritten; an
 * explicit purge appends a {@code PURGED} line and is the only way a record
 * disappears.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArchiveLogService {

    private static final String LOG_FILE = "records.jsonl";
    private static final String SNAPSHOT_PREFIX = "snapshots/";
    private static final String SNAPSHOT_SUFFIX = ".snapshot";

    private final StoragePort storagePort;
    private final ArchivistProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, ArchiveRecord> liveRecords = new LinkedHashMap<>();
    private final Set<String> purgedIds = new LinkedHashSet<>();
    private boolean tornTail;

    @PostConstruct
    public synchronized void init() {
        liveRecords.clear();
        purgedIds.clear();
        String content;
        try {
            content = storagePort.getText(directory(), LOG_FILE).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Loading archive log", e);
        }
        tornTail = JsonlSupport.endsTorn(content);
        for (ArchiveLogEntry entry : JsonlSupport.parse(objectMapper, content, ArchiveLogEntry.class, "Archive")) {
            apply(entry);
        }
        if (tornTail) {
            log.warn("[Archive] Archive log ends with a torn line, it was skipped");
        }
        log.info("[Archive] Loaded {} archive records ({} purged)", liveRecords.size(), purgedIds.size());
    }

    public String snapshotPath(String archiveId) {
        return SNAPSHOT_PREFIX + archiveId + SNAPSHOT_SUFFIX;
    }

    /**
     * Durably records an archived file: snapshot first, then the log line.
     *
     * @throws StorageFailureException
     *             if either write fails; the record then does not exist
     */
    public synchronized ArchiveRecord append(ArchiveRecord record, String content) {
        String snapshot = snapshotPath(record.getArchiveId());
        ArchiveRecord stored = record.toBuilder().snapshotPath(snapshot).build();
        try {
            storagePort.putTextAtomic(directory(), snapshot, content).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Writing snapshot of " + record.getOriginalPath(), e);
        }
        ArchiveLogEntry entry = ArchiveLogEntry.builder()
                .type(ArchiveLogEntry.Type.ARCHIVED)
                .archiveId(stored.getArchiveId())
                .timestamp(stored.getArchivedAt())
                .record(stored)
                .build();
        try {
            appendLine(entry, "Appending archive record for " + record.getOriginalPath());
        } catch (StorageFailureException e) {
            deleteSnapshotQuietly(stored.getArchiveId());
            throw e;
        }
        liveRecords.put(stored.getArchiveId(), stored);
        return stored.toBuilder().build();
    }

    public synchronized Optional<ArchiveRecord> find(String archiveId) {
        ArchiveRecord record = liveRecords.get(archiveId);
        return record != null ? Optional.of(record.toBuilder().build()) : Optional.empty();
    }

    public ArchiveRecord get(String archiveId) {
        return find(archiveId).orElseThrow(() -> new ArchiveRecordNotFoundException(archiveId));
    }

    public synchronized List<ArchiveRecord> listRecords() {
        List<ArchiveRecord> copies = new ArrayList<>();
        for (ArchiveRecord record : liveRecords.values()) {
            copies.add(record.toBuilder().build());
        }
        return copies;
    }

    public synchronized int purgedCount() {
        return purgedIds.size();
    }

    public String readSnapshot(ArchiveRecord record) {
        try {
            return storagePort.getText(directory(), snapshotPath(record.getArchiveId())).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Reading snapshot of " + record.getArchiveId(), e);
        }
    }

    /**
     * Updates index maintenance metadata, kept in memory only.
     */
    public synchronized void markIndexed(String archiveId, Instant indexedAt) {
        ArchiveRecord record = liveRecords.get(archiveId);
        if (record != null) {
            record.setIndexedAt(indexedAt);
        }
    }

    /**
     * Explicit, logged removal of an archive record and its snapshot.
     */
    public synchronized ArchiveRecord purge(String archiveId, String reason) {
        ArchiveRecord record = liveRecords.get(archiveId);
        if (record == null) {
            throw new ArchiveRecordNotFoundException(archiveId);
        }
        ArchiveLogEntry entry = ArchiveLogEntry.builder()
                .type(ArchiveLogEntry.Type.PURGED)
                .archiveId(archiveId)
                .timestamp(clock.instant())
                .reason(reason)
                .build();
        appendLine(entry, "Appending purge of " + archiveId);
        liveRecords.remove(archiveId);
        purgedIds.add(archiveId);
        deleteSnapshotQuietly(archiveId);
        log.info("[Archive] Purged {} ({}), reason: {}", archiveId, record.getOriginalPath(), reason);
        return record;
    }

    private void apply(ArchiveLogEntry entry) {
        if (entry.getType() == null || entry.getArchiveId() == null) {
            return;
        }
        switch (entry.getType()) {
        case ARCHIVED -> {
            if (entry.getRecord() != null && !purgedIds.contains(entry.getArchiveId())) {
                liveRecords.put(entry.getArchiveId(), entry.getRecord());
            }
        }
        case PURGED -> {
            liveRecords.remove(entry.getArchiveId());
            purgedIds.add(entry.getArchiveId());
        }
        default -> log.debug("[Archive] Ignoring entry of type {}", entry.getType());
        }
    }

    private void appendLine(ArchiveLogEntry entry, String operation) {
        String line = JsonlSupport.line(objectMapper, entry);
        String payload = tornTail ? "\n" + line : line;
        try {
            storagePort.appendText(directory(), LOG_FILE, payload).join();
            tornTail = false;
        } catch (RuntimeException e) {
            tornTail = true;
            throw StorageFailureException.wrap(operation, e);
        }
    }

    private void deleteSnapshotQuietly(String archiveId) {
        try {
            storagePort.deleteObject(directory(), snapshotPath(archiveId)).join();
        } catch (RuntimeException e) {
            log.warn("[Archive] Snapshot of {} could not be deleted: {}", archiveId, e.getMessage());
        }
    }

    private String directory() {
        return properties.getWorkspace().stateDirectory("archive");
    }
}
