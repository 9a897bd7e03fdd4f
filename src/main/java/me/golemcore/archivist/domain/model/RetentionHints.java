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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Importance hints supplied with file content at registration time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetentionHints {

    /**
     * Explicit retention override, e.g. "strategic decision, retain 90 days".
     */
    private Integer retentionDays;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    @Builder.Default
    private List<String> stakeholders = new ArrayList<>();

    @Builder.Default
    private List<String> frameworks = new ArrayList<>();

    private GenerationMode generationMode;
    private String sessionId;

    /**
     * Allows replacing the content of an already tracked path.
     */
    private boolean updateIntent;
}
