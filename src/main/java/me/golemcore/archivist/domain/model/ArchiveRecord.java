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
 * A file after archival. Immutable once written to the archive log; the content
 * itself lives in a snapshot file referenced by {@link #snapshotPath}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveRecord {

    private String archiveId;
    private String originalPath;
    private String contentHash;
    private long contentLength;
    private String snapshotPath;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private String category;

    @Builder.Default
    private List<String> keywords = new ArrayList<>();

    private String summary;
    private GenerationMode generationMode;
    private String sessionId;
    private Instant createdAt;
    private Instant archivedAt;
    private double retentionScore;

    /**
     * Index maintenance metadata, the only part that changes after archival.
     */
    private Instant indexedAt;
}
