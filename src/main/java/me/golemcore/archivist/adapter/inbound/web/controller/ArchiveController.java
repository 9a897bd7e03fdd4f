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

package me.golemcore.archivist.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.ArchiveSearchQuery;
import me.golemcore.archivist.domain.model.ArchiveStats;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.domain.model.SegmentHealth;
import me.golemcore.archivist.domain.service.ArchiveSearchService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Archive search, lookup, purge and statistics endpoints.
 */
@RestController
@RequestMapping("/api/archive")
@RequiredArgsConstructor
public class ArchiveController {

    private final ArchiveSearchService archiveSearchService;

    @GetMapping("/search")
    public Mono<ResponseEntity<SearchResult>> search(
            @RequestParam(name = "q", required = false) String text,
            @RequestParam(name = "tag", required = false) List<String> tags,
            @RequestParam(required = false) String category,
            @RequestParam(required = false) String from,
            @RequestParam(required = false) String to,
            @RequestParam(required = false, defaultValue = "0") int limit) {
        ArchiveSearchQuery query = ArchiveSearchQuery.builder()
                .text(text)
                .tags(tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>())
                .category(category)
                .from(parseInstant(from, false))
                .to(parseInstant(to, true))
                .limit(limit)
                .build();
        return Mono.just(ResponseEntity.ok(archiveSearchService.search(query)));
    }

    @GetMapping("/records/{archiveId}")
    public Mono<ResponseEntity<ArchiveRecord>> getRecord(@PathVariable String archiveId) {
        return Mono.just(ResponseEntity.ok(archiveSearchService.getRecord(archiveId)));
    }

    @DeleteMapping("/records/{archiveId}")
    public Mono<ResponseEntity<ArchiveRecord>> purge(@PathVariable String archiveId,
            @RequestParam(required = false) String reason) {
        return Mono.just(ResponseEntity.ok(archiveSearchService.purge(archiveId, reason)));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<ArchiveStats>> stats() {
        return Mono.just(ResponseEntity.ok(archiveSearchService.stats()));
    }

    @GetMapping("/segments")
    public Mono<ResponseEntity<List<SegmentHealth>>> segments() {
        return Mono.just(ResponseEntity.ok(archiveSearchService.segmentHealth()));
    }

    /**
     * Accepts an ISO instant or a plain date. A date used as upper bound means
     * the end of that day.
     */
    static Instant parseInstant(String value, boolean endOfDay) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException e) {
            try {
                LocalDate date = LocalDate.parse(trimmed);
                return endOfDay
                        ? date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC).minusMillis(1)
                        : date.atStartOfDay().toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException nested) {
                throw new IllegalArgumentException("Invalid date: " + value, nested);
            }
        }
    }
}
