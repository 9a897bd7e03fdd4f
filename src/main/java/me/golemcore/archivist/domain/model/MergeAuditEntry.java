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
 * Line of the consolidation audit log. Carries enough of every source to
 * rebuild it when the merge is reverted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergeAuditEntry {

    public enum Action {
        MERGED, REVERTED
    }

    private String mergeId;
    private Action action;
    private Instant timestamp;
    private String destinationPath;
    private String destinationHash;
    private double confidence;
    private OpportunityKind kind;

    @Builder.Default
    private List<MergedSource> sources = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MergedSource {
        private TrackedFile file;
        private String content;
    }
}
