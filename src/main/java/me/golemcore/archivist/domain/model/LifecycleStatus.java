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
 * Lifecycle view of one tracked file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleStatus {

    private String path;
    private double retentionScore;
    private LifecycleState state;
    private Instant lastAccessedAt;

    /**
     * {@code null} for protected files, which only leave ACTIVE on explicit
     * archival.
     */
    private LifecycleState nextState;

    /**
     * Earliest instant the next transition can happen if the file stays idle.
     * For archive-eligible files this is the next archive sweep, so it is
     * reported as now.
     */
    private Instant nextTransitionEstimate;

    private boolean protectedFile;
}
