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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.archivist.domain.exception.FileNotTrackedException;
import me.golemcore.archivist.domain.exception.RegistrationConflictException;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import me.golemcore.archivist.domain.model.LifecycleState;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import me.golemcore.archivist.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Durable table of tracked file metadata, keyed by workspace-relative path.
 *
 * <p>
 * Each record is one JSON document under {@code metadata/active/}, written
 * with a crash-safe atomic replace, and mirrored in a concurrent in-memory
 * table loaded at startup. Every write for a path runs inside that path's
 * {@link ConcurrentHashMap#compute} call and persists before the table
 * changes, so a failed write leaves both the disk and the table as they were.
 * Reads return copies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MetadataStoreService {

    private static final String ACTIVE_PREFIX = "active";
    private static final String RECORD_SUFFIX = ".json";

    private final StoragePort storagePort;
    private final ArchivistProperties properties;
    private final ContentAnalyzer contentAnalyzer;
    private final ObjectMapper objectMapper;

    private final Map<String, TrackedFile> records = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        records.clear();
        List<String> files;
        try {
            files = storagePort.listObjects(directory(), ACTIVE_PREFIX).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Loading tracked file metadata", e);
        }
        for (String file : files) {
            if (!file.endsWith(RECORD_SUFFIX)) {
                continue;
            }
            try {
                String json = storagePort.getText(directory(), file).join();
                if (json == null || json.isBlank()) {
                    continue;
                }
                TrackedFile record = objectMapper.readValue(json, TrackedFile.class);
                if (record.getPath() != null) {
                    records.put(record.getPath(), record);
                }
            } catch (IOException | RuntimeException e) {
                log.warn("[MetadataStore] Skipping unreadable record {}: {}", file, e.getMessage());
            }
        }
        log.info("[MetadataStore] Loaded {} tracked files", records.size());
    }

    /**
     * Registers a new record. An existing record with the same content hash is
     * returned unchanged; one with a different hash is replaced only with an
     * explicit update intent, keeping its creation timestamp.
     *
     * @throws RegistrationConflictException
     *             on divergent content without update intent
     */
    public TrackedFile register(TrackedFile file, boolean updateIntent) {
        AtomicReference<TrackedFile> result = new AtomicReference<>();
        records.compute(file.getPath(), (path, existing) -> {
            if (existing == null) {
                TrackedFile created = file.copy();
                persist(created);
                result.set(created.copy());
                return created;
            }
            if (existing.getContentHash() != null && existing.getContentHash().equals(file.getContentHash())) {
                result.set(existing.copy());
                return existing;
            }
            if (!updateIntent) {
                throw new RegistrationConflictException(path, existing.getContentHash(), file.getContentHash());
            }
            TrackedFile replaced = file.copy();
            replaced.setCreatedAt(existing.getCreatedAt());
            persist(replaced);
            result.set(replaced.copy());
            return replaced;
        });
        return result.get();
    }

    /**
     * Replaces an existing record.
     *
     * @throws FileNotTrackedException
     *             if the path has no record
     */
    public TrackedFile update(TrackedFile file) {
        AtomicReference<TrackedFile> result = new AtomicReference<>();
        records.compute(file.getPath(), (path, existing) -> {
            if (existing == null) {
                throw new FileNotTrackedException(path);
            }
            TrackedFile updated = file.copy();
            persist(updated);
            result.set(updated.copy());
            return updated;
        });
        return result.get();
    }

    public Optional<TrackedFile> find(String path) {
        TrackedFile record = records.get(path);
        return record != null ? Optional.of(record.copy()) : Optional.empty();
    }

    public TrackedFile get(String path) {
        return find(path).orElseThrow(() -> new FileNotTrackedException(path));
    }

    public boolean contains(String path) {
        return records.containsKey(path);
    }

    /**
     * Removes a record, deleting its document first.
     *
     * @return the removed record, empty if the path was not tracked
     */
    public Optional<TrackedFile> remove(String path) {
        AtomicReference<TrackedFile> removed = new AtomicReference<>();
        records.computeIfPresent(path, (key, existing) -> {
            try {
                storagePort.deleteObject(directory(), recordFile(key)).join();
            } catch (RuntimeException e) {
                throw StorageFailureException.wrap("Removing metadata of " + key, e);
            }
            removed.set(existing.copy());
            return null;
        });
        return Optional.ofNullable(removed.get());
    }

    public List<TrackedFile> findByState(LifecycleState state) {
        return select(record -> record.getState() == state);
    }

    public List<TrackedFile> findLastAccessedBefore(Instant instant) {
        return select(record -> record.getLastAccessedAt() != null && record.getLastAccessedAt().isBefore(instant));
    }

    /**
     * Records created in {@code [from, to)}.
     */
    public List<TrackedFile> findCreatedBetween(Instant from, Instant to) {
        return select(record -> record.getCreatedAt() != null
                && !record.getCreatedAt().isBefore(from)
                && record.getCreatedAt().isBefore(to));
    }

    public List<TrackedFile> listAll() {
        return select(record -> true);
    }

    public int count() {
        return records.size();
    }

    private List<TrackedFile> select(Predicate<TrackedFile> predicate) {
        return records.values().stream()
                .filter(predicate)
                .map(TrackedFile::copy)
                .sorted(Comparator.comparing(TrackedFile::getPath))
                .toList();
    }

    private void persist(TrackedFile record) {
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize metadata of " + record.getPath(), e);
        }
        try {
            storagePort.putTextAtomic(directory(), recordFile(record.getPath()), json).join();
        } catch (RuntimeException e) {
            throw StorageFailureException.wrap("Writing metadata of " + record.getPath(), e);
        }
    }

    private String recordFile(String path) {
        return ACTIVE_PREFIX + "/" + contentAnalyzer.hash(path) + RECORD_SUFFIX;
    }

    private String directory() {
        return properties.getWorkspace().stateDirectory("metadata");
    }
}
