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
import me.golemcore.archivist.adapter.inbound.web.dto.FilePathRequest;
import me.golemcore.archivist.adapter.inbound.web.dto.FileRegisterRequest;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.GenerationMode;
import me.golemcore.archivist.domain.model.LifecycleState;
import me.golemcore.archivist.domain.model.LifecycleStatus;
import me.golemcore.archivist.domain.model.RetentionHints;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.domain.service.LifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Tracked file registration and lifecycle endpoints.
 */
@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class FilesController {

    private final LifecycleService lifecycleService;

    @PostMapping
    public Mono<ResponseEntity<TrackedFile>> register(@RequestBody FileRegisterRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Request body is required");
        }
        RetentionHints hints = RetentionHints.builder()
                .retentionDays(request.getRetentionDays())
                .tags(request.getTags() != null ? new LinkedHashSet<>(request.getTags()) : new LinkedHashSet<>())
                .stakeholders(request.getStakeholders() != null ? request.getStakeholders() : new ArrayList<>())
                .frameworks(request.getFrameworks() != null ? request.getFrameworks() : new ArrayList<>())
                .generationMode(request.getGenerationMode() != null
                        ? GenerationMode.fromValue(request.getGenerationMode())
                        : null)
                .sessionId(request.getSessionId())
                .updateIntent(request.isUpdate())
                .build();
        TrackedFile file = lifecycleService.register(request.getPath(), request.getContent(), hints);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(file));
    }

    @PostMapping("/touch")
    public Mono<ResponseEntity<TrackedFile>> touch(@RequestBody FilePathRequest request) {
        return Mono.just(ResponseEntity.ok(lifecycleService.touch(requirePath(request))));
    }

    @PostMapping("/archive")
    public Mono<ResponseEntity<ArchiveRecord>> archive(@RequestBody FilePathRequest request) {
        return Mono.just(ResponseEntity.ok(lifecycleService.archive(requirePath(request))));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<LifecycleStatus>> getStatus(@RequestParam String path) {
        return Mono.just(ResponseEntity.ok(lifecycleService.getStatus(path)));
    }

    @GetMapping
    public Mono<ResponseEntity<List<TrackedFile>>> list(@RequestParam(required = false) String state) {
        LifecycleState filter = LifecycleState.fromValue(state);
        return Mono.just(ResponseEntity.ok(lifecycleService.list(filter)));
    }

    private static String requirePath(FilePathRequest request) {
        if (request == null || request.getPath() == null || request.getPath().isBlank()) {
            throw new IllegalArgumentException("path is required");
        }
        return request.getPath();
    }
}
