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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lifecycle metadata of one non-archived workspace file. The path is relative
 * to the workspace root and unique among tracked files.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackedFile {

    private String path;
    private String contentHash;
    private long contentLength;
    private Instant createdAt;
    private Instant lastAccessedAt;
    private Instant lastModifiedAt;
    private Instant stateChangedAt;
    private double retentionScore;

    @Builder.Default
    private LifecycleState state = LifecycleState.ACTIVE;

    @Builder.Default
    private GenerationMode generationMode = GenerationMode.PROFESSIONAL;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private String sessionId;

    /**
     * Importance hints kept so that the score can be recomputed on content
     * updates.
     */
    private Integer retentionDays;

    @Builder.Default
    private List<String> stakeholders = new ArrayList<>();

    @Builder.Default
    private List<String> frameworks = new ArrayList<>();

    /**
     * Deep enough copy for callers that must not mutate the stored record.
     */
    public TrackedFile copy() {
        return toBuilder()
                .tags(tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>())
                .stakeholders(stakeholders != null ? new ArrayList<>(stakeholders) : new ArrayList<>())
                .frameworks(frameworks != null ? new ArrayList<>(frameworks) : new ArrayList<>())
                .build();
    }
}
