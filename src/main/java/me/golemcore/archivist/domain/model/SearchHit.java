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
 * Ranked archive search hit with a human-inspectable snippet.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHit {

    private String archiveId;
    private String originalPath;
    private String category;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant archivedAt;
    private double retentionScore;
    private double relevance;
    private String snippet;
    private int segment;
}
