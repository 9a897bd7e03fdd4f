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

package me.golemcore.archivist.domain.service;

import lombok.RequiredArgsConstructor;
import me.golemcore.archivist.domain.component.TopicSimilarityScorer;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Default topic signal: Jaccard overlap of the significant terms, blended with
 * the overlap of detected business contexts when either file has any.
 */
@Service
@RequiredArgsConstructor
public class KeywordTopicSimilarityScorer implements TopicSimilarityScorer {

    private static final double TERM_WEIGHT = 0.7;
    private static final double CONTEXT_WEIGHT = 0.3;

    private final ContentAnalyzer contentAnalyzer;

    @Override
    public TopicProfile profile(String content) {
        Set<String> terms = contentAnalyzer.topicTerms(content);
        List<String> contexts = contentAnalyzer.businessContexts(content);
        String category = contentAnalyzer.category(content);
        String dominant;
        if (!ContentAnalyzer.GENERAL_CATEGORY.equals(category)) {
            dominant = category;
        } else if (!terms.isEmpty()) {
            dominant = terms.iterator().next();
        } else {
            dominant = ContentAnalyzer.GENERAL_CATEGORY;
        }
        return new TopicProfile(terms, contexts, dominant);
    }

    @Override
    public double similarity(TopicProfile first, TopicProfile second) {
        double termSimilarity = jaccard(first.terms(), second.terms());
        if (first.contexts().isEmpty() && second.contexts().isEmpty()) {
            return termSimilarity;
        }
        double contextSimilarity = jaccard(new LinkedHashSet<>(first.contexts()),
                new LinkedHashSet<>(second.contexts()));
        return TERM_WEIGHT * termSimilarity + CONTEXT_WEIGHT * contextSimilarity;
    }

    static double jaccard(Set<String> first, Set<String> second) {
        if (first.isEmpty() && second.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(first);
        intersection.retainAll(second);
        Set<String> union = new HashSet<>(first);
        union.addAll(second);
        return (double) intersection.size() / union.size();
    }
}
