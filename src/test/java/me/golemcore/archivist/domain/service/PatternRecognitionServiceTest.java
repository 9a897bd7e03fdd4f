package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.model.InsightGeneration;
import me.golemcore.archivist.domain.model.InsightKind;
import me.golemcore.archivist.domain.model.PatternInsight;
import me.golemcore.archivist.domain.model.SessionRecord;
import me.golemcore.archivist.domain.model.TuningParameters;
import me.golemcore.archivist.testsupport.ArchivistFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PatternRecognitionServiceTest {

    @TempDir
    Path tempDir;

    private ArchivistFixture fixture;
    private PatternRecognitionService service;

    @BeforeEach
    void setUp() {
        fixture = ArchivistFixture.create(tempDir);
        service = fixture.patterns;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void rejectsInvalidDurations() {
        assertThrows(IllegalArgumentException.class, () -> service.recordSession("s", List.of(), null, -1));
        assertThrows(IllegalArgumentException.class, () -> service.recordSession("s", List.of(), null, Double.NaN));
        assertTrue(service.history().isEmpty());
    }

    @Test
    void recordSessionNormalizesInput() {
        SessionRecord session = service.recordSession(" ", List.of("notes\\a.md", " ", "b.md"), " ", 12);

        assertTrue(session.getSessionId().startsWith("session-"));
        assertEquals(List.of("notes/a.md", "b.md"), session.getFiles());
        assertNull(session.getOutcome());
        assertEquals(ArchivistFixture.START, session.getRecordedAt());
        assertEquals(1, service.history().size());
    }

    @Test
    void noInsightsWithoutHistory() {
        assertTrue(service.computeInsights().isEmpty());
        assertEquals(TuningParameters.none(), service.currentTuning());
    }

    @Test
    void timingInsightIsMedianDuration() {
        session(10, "shipped", "a.md");
        session(30, "shipped", "a.md");
        session(20, "shipped", "a.md");

        assertEquals(20.0, insight(InsightKind.TIMING).orElseThrow().getValue(), 1e-9);

        session(40, "shipped", "a.md");

        PatternInsight timing = insight(InsightKind.TIMING).orElseThrow();
        assertEquals(25.0, timing.getValue(), 1e-9);
        assertEquals(4, timing.getSampleCount());
        assertEquals(0.4444, timing.getConfidence(), 1e-9);
    }

    @Test
    void workflowInsightNeedsRepeatedTransitions() {
        session(10, null, "design.md", "Main.java");
        session(10, null, "design.md", "Main.java");

        assertTrue(insight(InsightKind.WORKFLOW).isEmpty());

        session(10, null, "notes.md", "Util.java");

        PatternInsight workflow = insight(InsightKind.WORKFLOW).orElseThrow();
        assertEquals("md -> java", workflow.getDescription());
        assertEquals(3, workflow.getSampleCount());
    }

    @Test
    void outcomeAndContentInsights() {
        session(10, "shipped", "a.md", "b.md");
        session(10, "Shipped", "c.md");
        session(10, "blocked", "d.json");

        PatternInsight outcome = insight(InsightKind.OUTCOME).orElseThrow();
        assertEquals("shipped", outcome.getDescription());
        assertEquals(0.6667, outcome.getValue(), 1e-9);

        PatternInsight content = insight(InsightKind.CONTENT).orElseThrow();
        assertEquals(1.3333, content.getValue(), 1e-9);
        assertEquals("dominant file type: md", content.getDescription());
    }

    @Test
    void insightsAreDeterministicAcrossRestarts() {
        for (int i = 0; i < 6; i++) {
            session(10 + i, i % 2 == 0 ? "shipped" : "blocked", "plan.md", "impl.java");
        }
        List<PatternInsight> first = service.computeInsights();

        fixture.clock.advance(Duration.ofDays(3));
        ArchivistFixture restarted = fixture.restart();
        try {
            assertEquals(first, restarted.patterns.computeInsights());
            assertEquals(ArchivistFixture.START.plus(Duration.ofMinutes(50)), first.get(0).getGeneratedAt());
        } finally {
            restarted.close();
        }
    }

    @Test
    void refreshAppendsOnlyWhenHistoryGrows() throws IOException {
        session(10, null, "a.md");

        InsightGeneration first = service.refreshInsights();
        InsightGeneration unchanged = service.refreshInsights();
        session(20, null, "b.md");
        InsightGeneration second = service.refreshInsights();

        assertEquals(1, first.getGeneration());
        assertEquals(1, unchanged.getGeneration());
        assertEquals(2, second.getGeneration());
        assertEquals(2, second.getSessionCount());
        List<String> lines = Files.readAllLines(tempDir.resolve(".archivist/patterns/insights.jsonl"));
        assertEquals(2, lines.size());
    }

    @Test
    void tuningComesFromPersistedConfidentGeneration() {
        for (int i = 0; i < 4; i++) {
            session(120, null, "a.md");
        }
        service.refreshInsights();
        assertNull(service.currentTuning().temporalWindow());

        session(120, null, "a.md");
        assertNull(service.currentTuning().temporalWindow());

        service.refreshInsights();
        TuningParameters tuning = service.currentTuning();
        assertEquals(Duration.ofMinutes(120), tuning.temporalWindow());
        assertEquals(120.0, tuning.typicalSessionMinutes(), 1e-9);
        assertEquals(0.5, tuning.confidence(), 1e-9);
    }

    @Test
    void tuningWindowIsClamped() {
        for (int i = 0; i < 5; i++) {
            session(2, null, "a.md");
        }
        service.refreshInsights();
        assertEquals(Duration.ofMinutes(15), service.currentTuning().temporalWindow());

        for (int i = 0; i < 20; i++) {
            session(2000, null, "a.md");
        }
        service.refreshInsights();
        assertEquals(Duration.ofHours(8), service.currentTuning().temporalWindow());
    }

    private void session(double minutes, String outcome, String... files) {
        service.recordSession(null, List.of(files), outcome, minutes);
        fixture.clock.advance(Duration.ofMinutes(10));
    }

    private Optional<PatternInsight> insight(InsightKind kind) {
        return service.computeInsights().stream().filter(insight -> insight.getKind() == kind).findFirst();
    }
}
