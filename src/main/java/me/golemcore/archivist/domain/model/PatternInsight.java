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

/**
 * Aggregate statistic derived from recorded sessions only. Recomputing from the
 * same history yields an equal insight.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatternInsight {

    private InsightKind kind;

    /**
     * Short machine-readable name, e.g. {@code median_session_minutes}.
     */
    private String name;

    private int sampleCount;
    private double value;

    /**
     * Human-readable form of the value, e.g. {@code md -> json}.
     */
    private String description;

    private double confidence;
    private Instant generatedAt;
}
