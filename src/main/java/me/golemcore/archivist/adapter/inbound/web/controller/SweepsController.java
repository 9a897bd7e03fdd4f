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
import me.golemcore.archivist.domain.model.SweepReport;
import me.golemcore.archivist.domain.model.SweepType;
import me.golemcore.archivist.domain.service.SweepCoordinator;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Trigger for maintenance sweeps, meant for an external scheduler. A sweep
 * that is already running is answered with 202 and a skipped report.
 */
@RestController
@RequestMapping("/api/sweeps")
@RequiredArgsConstructor
public class SweepsController {

    private final SweepCoordinator sweepCoordinator;

    @PostMapping("/{type}")
    public Mono<ResponseEntity<SweepReport>> run(@PathVariable String type) {
        SweepReport report = sweepCoordinator.run(SweepType.fromValue(type));
        HttpStatus status = report.isSkipped() ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return Mono.just(ResponseEntity.status(status).body(report));
    }
}
