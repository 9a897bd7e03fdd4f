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

package me.golemcore.archivist.domain.component;

import java.util.List;
import java.util.Set;

/**
 * Pluggable content-topic signal used by consolidation. Implementations must be
 * deterministic and symmetric, returning values in [0, 1].
 */
public interface TopicSimilarityScorer {

    /**
     * Builds the comparable topic profile of one file's content. Profiles are
     * computed once per scan and compared pairwise.
     */
    TopicProfile profile(String content);

    /**
     * Topic overlap of two profiles.
     *
     * @return similarity in [0, 1], 1 meaning the same topic
     */
    double similarity(TopicProfile first, TopicProfile second);

    /**
     * Topic characteristics of one file.
     *
     * @param terms most significant content terms
     * @param contexts business context indicators
     * @param dominantTopic short label used to name consolidated files
     */
    record TopicProfile(
            Set<String> terms,
            List<String> contexts,
            String dominantTopic
    ) {
    }
}
