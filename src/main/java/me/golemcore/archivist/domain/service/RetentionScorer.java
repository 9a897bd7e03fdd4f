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
import me.golemcore.archivist.domain.model.ContentFeatures;
import me.golemcore.archivist.domain.model.GenerationMode;
import me.golemcore.archivist.domain.model.RetentionHints;
import org.springframework.stereotype.Service;

/**
 * Computes retention scores in [0.0, 10.0].
 *
 * <p>
 * The generation mode fixes the band, content richness places the score inside
 * it:
 *
 * <pre>
 * r     = 0.35 * length + 0.25 * structure + 0.25 * keywords + 0.15 * hints   (each in [0, 1])
 * score = low + r * (high - low)
 * </pre>
 *
 * An explicit retention-days override raises the score to at least
 * {@code high + (days - 30) / 30}, so 30 days means the top of the band and 90
 * days two points above it, capped at 10. The scorer reads neither clocks nor
 * storage: equal inputs always give equal scores.
 */
@Service
@RequiredArgsConstructor
public class RetentionScorer {

    public static final double MAX_SCORE = 10.0;

    private static final double LENGTH_WEIGHT = 0.35;
    private static final double STRUCTURE_WEIGHT = 0.25;
    private static final double KEYWORD_WEIGHT = 0.25;
    private static final double HINT_WEIGHT = 0.15;

    private static final double LENGTH_SATURATION = 6000.0;
    private static final double STRUCTURE_SATURATION = 20.0;
    private static final double KEYWORD_SATURATION = 5.0;
    private static final double HINT_SATURATION = 4.0;
    private static final double OVERRIDE_BASELINE_DAYS = 30.0;

    private final ContentAnalyzer contentAnalyzer;

    public double score(String content, GenerationMode mode, RetentionHints hints) {
        return score(contentAnalyzer.features(content), mode, hints);
    }

    public double score(ContentFeatures features, GenerationMode mode, RetentionHints hints) {
        GenerationMode effectiveMode = mode != null ? mode : GenerationMode.PROFESSIONAL;
        double low = effectiveMode.getBandLow();
        double high = effectiveMode.getBandHigh();

        double richness = LENGTH_WEIGHT * saturate(features.length(), LENGTH_SATURATION)
                + STRUCTURE_WEIGHT * saturate(features.structuralElements(), STRUCTURE_SATURATION)
                + KEYWORD_WEIGHT * saturate(features.strategicKeywordHits(), KEYWORD_SATURATION)
                + HINT_WEIGHT * saturate(hintCount(hints), HINT_SATURATION);
        double score = low + richness * (high - low);

        if (hints != null && hints.getRetentionDays() != null && hints.getRetentionDays() > 0) {
            double floor = high + (hints.getRetentionDays() - OVERRIDE_BASELINE_DAYS) / OVERRIDE_BASELINE_DAYS;
            score = Math.max(score, floor);
        }
        return round(Math.max(0.0, Math.min(MAX_SCORE, score)));
    }

    private static int hintCount(RetentionHints hints) {
        if (hints == null) {
            return 0;
        }
        int stakeholders = hints.getStakeholders() != null ? hints.getStakeholders().size() : 0;
        int frameworks = hints.getFrameworks() != null ? hints.getFrameworks().size() : 0;
        return stakeholders + frameworks;
    }

    private static double saturate(double value, double saturation) {
        if (value <= 0) {
            return 0.0;
        }
        return Math.min(1.0, value / saturation);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
