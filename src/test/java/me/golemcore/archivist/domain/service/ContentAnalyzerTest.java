package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.model.ContentFeatures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ContentAnalyzerTest {

    private final ContentAnalyzer analyzer = new ContentAnalyzer();

    @Test
    void hashIsSha256Hex() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", analyzer.hash("abc"));
    }

    @Test
    void countsStructuralElements() {
        String content = "# Title\n\n- item one\n- item two\n| a | b |\n```\ncode\n```\nSee [docs](http://x)";

        ContentFeatures features = analyzer.features(content);

        assertEquals(content.length(), features.length());
        assertEquals(7, features.structuralElements());
        assertEquals(0, features.strategicKeywordHits());
    }

    @Test
    void countsStrategicKeywordsOnce() {
        ContentFeatures features = analyzer.features("Budget and roadmap for the board. Budget again.");

        assertEquals(3, features.strategicKeywordHits());
    }

    @Test
    void emptyContentHasNoFeatures() {
        assertEquals(new ContentFeatures(0, 0, 0), analyzer.features(""));
    }

    @Test
    void detectsBusinessContextsInFamilyOrder() {
        assertEquals(List.of("strategic-roadmap", "budget-planning"),
                analyzer.businessContexts("The budget follows the roadmap"));
        assertTrue(analyzer.businessContexts("lunch menu").isEmpty());
    }

    @Test
    void categoryIsFamilyWithMostIndicators() {
        assertEquals("platform", analyzer.category("Platform migration and scaling plan, architecture review"));
        assertEquals(ContentAnalyzer.GENERAL_CATEGORY, analyzer.category("lunch menu"));
    }

    @Test
    void keywordsIncludeProperNouns() {
        assertEquals(List.of("Alice Smith", "budget", "platform"),
                analyzer.keywords("the budget review with Alice Smith on the platform"));
    }

    @Test
    void summaryKeepsHeadingsAndSubstantialLines() {
        assertEquals("Title This line is definitely long enough.",
                analyzer.summary("# Title\nshort\nThis line is definitely long enough."));
    }

    @Test
    void extractsDeclaredOutcome() {
        assertEquals(Optional.of("ship it"), analyzer.outcome("Notes\n**Decision:** Ship It\n"));
        assertEquals(Optional.empty(), analyzer.outcome("No conclusion yet"));
    }

    @Test
    void topicTermsRankByFrequency() {
        assertEquals(List.of("beta", "alpha", "gamma"),
                List.copyOf(analyzer.topicTerms("alpha beta beta gamma the 2024 go")));
    }
}
