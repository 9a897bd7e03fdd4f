package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.model.ContentFeatures;
import me.golemcore.archivist.domain.model.GenerationMode;
import me.golemcore.archivist.domain.model.RetentionHints;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RetentionScorerTest {

    private static final String STRATEGY_DOC = """
            # Q3 Strategy Review

            ## Budget
            - ROI of the platform migration
            - Quarterly roadmap for the executive board

            | Item | Cost |
            |------|------|
            | Infra | 120k |

            See [the architecture notes](arch.md) for stakeholder details.
            """;

    private RetentionScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new RetentionScorer(new ContentAnalyzer());
    }

    @Test
    void minimalModeWithoutHintsStaysInLowBand() {
        double score = scorer.score("Some notes about the day.", GenerationMode.MINIMAL, new RetentionHints());

        assertTrue(score >= 0.0 && score <= 4.0, "score " + score);
    }

    @ParameterizedTest
    @EnumSource(GenerationMode.class)
    void scoreStaysInsideModeBand(GenerationMode mode) {
        double empty = scorer.score(new ContentFeatures(0, 0, 0), mode, null);
        double rich = scorer.score(STRATEGY_DOC, mode, RetentionHints.builder()
                .stakeholders(List.of("cfo", "cto"))
                .frameworks(List.of("okr"))
                .build());

        assertEquals(mode.getBandLow(), empty, 1e-9);
        assertTrue(rich > empty);
        assertTrue(rich <= mode.getBandHigh());
    }

    @Test
    void saturatedFeaturesReachTopOfBand() {
        RetentionHints hints = RetentionHints.builder()
                .stakeholders(List.of("a", "b"))
                .frameworks(List.of("c", "d"))
                .build();

        double score = scorer.score(new ContentFeatures(6000, 20, 5), GenerationMode.PROFESSIONAL, hints);

        assertEquals(7.0, score, 1e-9);
    }

    @Test
    void richnessIsWeightedAcrossFeatures() {
        double score = scorer.score(new ContentFeatures(3000, 10, 0), GenerationMode.PROFESSIONAL, null);

        assertEquals(4.2, score, 1e-9);
    }

    @Test
    void retentionOverrideRaisesScoreAboveBand() {
        RetentionHints hints = RetentionHints.builder().retentionDays(90).build();

        double score = scorer.score(new ContentFeatures(10, 0, 0), GenerationMode.PROFESSIONAL, hints);

        assertEquals(9.0, score, 1e-9);
    }

    @Test
    void retentionOverrideIsCappedAtTen() {
        RetentionHints hints = RetentionHints.builder().retentionDays(365).build();

        assertEquals(10.0, scorer.score(STRATEGY_DOC, GenerationMode.RESEARCH, hints), 1e-9);
    }

    @Test
    void scoringIsDeterministic() {
        RetentionHints hints = RetentionHints.builder().stakeholders(List.of("board")).build();

        double first = scorer.score(STRATEGY_DOC, GenerationMode.RESEARCH, hints);
        for (int i = 0; i < 10; i++) {
            assertEquals(first, scorer.score(STRATEGY_DOC, GenerationMode.RESEARCH, hints));
        }
    }

    @Test
    void scoreIsRoundedToTwoDecimals() {
        double score = scorer.score(STRATEGY_DOC, GenerationMode.PROFESSIONAL, null);

        assertEquals(score, Math.round(score * 100.0) / 100.0);
    }
}
