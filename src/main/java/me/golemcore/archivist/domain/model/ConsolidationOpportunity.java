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
import java.util.List;

/**
 * Proposed merge of two or more active files into one destination.
 *
 * <p>
 * {@link #confidence} is the minimum pairwise similarity among the sources, so
 * a group held together by a weak chain reports the weak link.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConsolidationOpportunity {

    /**
     * Source paths ordered by path.
     */
    @Builder.Default
    private List<String> sourcePaths = new ArrayList<>();

    private String destinationPath;
    private double confidence;
    private String rationale;
    private OpportunityKind kind;
}
