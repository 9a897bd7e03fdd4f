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
import me.golemcore.archivist.adapter.inbound.web.dto.SessionRecordRequest;
import me.golemcore.archivist.domain.model.InsightGeneration;
import me.golemcore.archivist.domain.model.PatternInsight;
import me.golemcore.archivist.domain.model.SessionRecord;
import me.golemcore.archivist.domain.model.TuningParameters;
import me.golemcore.archivist.domain.service.PatternRecognitionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Session history and learned insight endpoints.
 */
@RestController
@RequestMapping("/api/patterns")
@RequiredArgsConstructor
public class PatternsController {

    private final PatternRecognitionService patternRecognitionService;

    @PostMapping("/sessions")
    public Mono<ResponseEntity<SessionRecord>> recordSession(@RequestBody SessionRecordRequest request) {
        if (request == null || request.getDurationMinutes() == null) {
            throw new IllegalArgumentException("durationMinutes is required");
        }
        SessionRecord session = patternRecognitionService.recordSession(request.getSessionId(), request.getFiles(),
                request.getOutcome(), request.getDurationMinutes());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(session));
    }

    @GetMapping("/insights")
    public Mono<ResponseEntity<List<PatternInsight>>> insights() {
        return Mono.just(ResponseEntity.ok(patternRecognitionService.computeInsights()));
    }

    @PostMapping("/insights/refresh")
    public Mono<ResponseEntity<InsightGeneration>> refresh() {
        return Mono.just(ResponseEntity.ok(patternRecognitionService.refreshInsights()));
    }

    @GetMapping("/tuning")
    public Mono<ResponseEntity<TuningParameters>> tuning() {
        return Mono.just(ResponseEntity.ok(patternRecognitionService.currentTuning()));
    }
}
