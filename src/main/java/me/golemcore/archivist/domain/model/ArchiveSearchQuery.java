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
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Free-text query plus structured filters. Every requested tag must be present
 * on a hit; the date range applies to the archived-at timestamp, both ends
 * inclusive.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArchiveSearchQuery {

    private String text;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private String category;
    private Instant from;
    private Instant to;
    private int limit;
}
