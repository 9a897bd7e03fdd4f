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

package me.golemcore.archivist.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one sweep run. Sweeps checkpoint per file, so an interrupted
 * report still describes a valid, resumable state.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SweepReport {

    private SweepType type;
    private Instant startedAt;
    private Instant finishedAt;
    private int examined;
    private int transitioned;
    private int archived;

    @Builder.Default
    private List<String> failures = new ArrayList<>();

    private boolean interrupted;

    /**
     * Another sweep of the same type was already running.
     */
    private boolean skipped;

    public static SweepReport skipped(SweepType type, Instant now) {
        return SweepReport.builder()
                .type(type)
                .startedAt(now)
                .finishedAt(now)
                .skipped(true)
                .build();
    }
}
