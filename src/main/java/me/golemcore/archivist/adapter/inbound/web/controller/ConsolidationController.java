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
import me.golemcore.archivist.domain.model.ConsolidationOpportunity;
import me.golemcore.archivist.domain.model.ConsolidationResult;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.domain.service.ConsolidationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/consolidation")
@RequiredArgsConstructor
public class ConsolidationController {

    private final ConsolidationService consolidationService;

    @GetMapping("/opportunities")
    public Mono<ResponseEntity<List<ConsolidationOpportunity>>> opportunities() {
        return Mono.just(ResponseEntity.ok(consolidationService.identifyOpportunities()));
    }

    @PostMapping("/apply")
    public Mono<ResponseEntity<ConsolidationResult>> apply(@RequestBody ConsolidationOpportunity opportunity) {
        return Mono.just(ResponseEntity.ok(consolidationService.apply(opportunity)));
    }

    @PostMapping("/merges/{mergeId}/revert")
    public Mono<ResponseEntity<List<TrackedFile>>> revert(@PathVariable String mergeId) {
        return Mono.just(ResponseEntity.ok(consolidationService.revert(mergeId)));
    }
}
