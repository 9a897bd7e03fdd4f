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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over the live archive records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveStats {

    private int totalRecords;
    private int purgedRecords;
    private long totalBytes;
    private double averageRetentionScore;
    private int pendingIngestions;

    @Builder.Default
    private Map<String, Integer> byCategory = new LinkedHashMap<>();

    /**
     * Keyed by {@code yyyy-MM} of the archived-at timestamp.
     */
    @Builder.Default
    private Map<String, Integer> byMonth = new LinkedHashMap<>();

    @Builder.Default
    private List<String> topRetention = new ArrayList<>();
}
