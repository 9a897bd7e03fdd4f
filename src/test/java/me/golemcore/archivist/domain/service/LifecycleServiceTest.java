package me.golemcore.archivist.domain.service;

import me.golemcore.archivist.domain.exception.FileNotTrackedException;
import me.golemcore.archivist.domain.exception.RegistrationConflictException;
import me.golemcore.archivist.domain.exception.StorageFailureException;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.ArchiveSearchQuery;
import me.golemcore.archivist.domain.model.GenerationMode;
import me.golemcore.archivist.domain.model.LifecycleState;
import me.golemcore.archivist.domain.model.LifecycleStatus;
import me.golemcore.archivist.domain.model.RetentionHints;
import me.golemcore.archivist.domain.model.SweepReport;
import me.golemcore.archivist.domain.model.SweepType;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.port.outbound.ArchiveIndexPort;
import me.golemcore.archivist.port.outbound.StoragePort;
import me.golemcore.archivist.testsupport.ArchivistFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class LifecycleServiceTest {

    private static final String NOTES = "notes.md";
    private static final String SHORT_CONTENT = "Some notes";
    private static final String BUDGET_REPORT = "# Budget report\n\nThe quarterly budget was approved by the board.";

    @TempDir
    Path tempDir;

    private ArchivistFixture fixture;
    private LifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        fixture = ArchivistFixture.create(tempDir);
        lifecycle = fixture.lifecycle;
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    @Test
    void minimalModeRegistrationIsActiveAndLowScored() throws IOException {
        TrackedFile file = lifecycle.register(NOTES, SHORT_CONTENT, minimal());

        assertEquals(LifecycleState.ACTIVE, file.getState());
        assertTrue(file.getRetentionScore() >= 0.0 && file.getRetentionScore() <= 4.0);
        assertEquals(SHORT_CONTENT, Files.readString(tempDir.resolve(NOTES)));
        assertEquals(fixture.contentAnalyzer.hash(SHORT_CONTENT), file.getContentHash());
        assertEquals(ArchivistFixture.START, file.getCreatedAt());
    }

    @Test
    void touchAfterAgingResetsToActiveWithoutArchiving() {
        lifecycle.register(NOTES, SHORT_CONTENT, minimal());
        fixture.clock.advance(Duration.ofDays(15));
        lifecycle.runAgingSweep(() -> false);
        assertEquals(LifecycleState.AGING, fixture.metadataStore.get(NOTES).getState());

        fixture.clock.advance(Duration.ofHours(1));
        TrackedFile touched = lifecycle.touch(NOTES);

        assertEquals(LifecycleState.ACTIVE, touched.getState());
        assertEquals(fixture.clock.instant(), touched.getLastAccessedAt());
        assertTrue(fixture.archiveLog.listRecords().isEmpty());
    }

    @Test
    void idleExactlyAtThresholdDoesNotAge() {
        lifecycle.register(NOTES, SHORT_CONTENT, minimal());
        fixture.clock.advance(Duration.ofDays(14));

        SweepReport report = lifecycle.runAgingSweep(() -> false);

        assertEquals(0, report.getTransitioned());
        assertEquals(LifecycleState.ACTIVE, fixture.metadataStore.get(NOTES).getState());
    }

    @Test
    void longIdleFileMovesTwoStepsInOneSweep() {
        lifecycle.register(NOTES, SHORT_CONTENT, minimal());
        fixture.clock.advance(Duration.ofDays(31));

        SweepReport report = lifecycle.runAgingSweep(() -> false);

        assertEquals(1, report.getExamined());
        assertEquals(1, report.getTransitioned());
        assertEquals(LifecycleState.ARCHIVE_ELIGIBLE, fixture.metadataStore.get(NOTES).getState());
    }

    @Test
    void higherScoreAgesMoreSlowly() {
        lifecycle.register(NOTES, SHORT_CONTENT, minimal());
        TrackedFile valued = lifecycle.register("valued.md", BUDGET_REPORT, RetentionHints.builder()
                .generationMode(GenerationMode.RESEARCH)
                .build());
        assertTrue(valued.getRetentionScore() >= 6.0 && valued.getRetentionScore() < 8.5);
        fixture.clock.advance(Duration.ofDays(15));

        lifecycle.runAgingSweep(() -> false);

        assertEquals(LifecycleState.AGING, fixture.metadataStore.get(NOTES).getState());
        assertEquals(LifecycleState.ACTIVE, fixture.metadataStore.get("valued.md").getState());
    }

    @Test
    void protectedFileNeverAges() {
        TrackedFile file = lifecycle.register("decision.md", BUDGET_REPORT, RetentionHints.builder()
                .retentionDays(90)
                .build());
        assertTrue(file.getRetentionScore() >= 8.5);
        fixture.clock.advance(Duration.ofDays(400));

        lifecycle.runAgingSweep(() -> false);

        assertEquals(LifecycleState.ACTIVE, fixture.metadataStore.get("decision.md").getState());
        assertTrue(lifecycle.getStatus("decision.md").isProtectedFile());
        assertNull(lifecycle.getStatus("decision.md").getNextState());
    }

    @Test
    void statusEstimatesNextTransition() {
        TrackedFile file = lifecycle.register(NOTES, SHORT_CONTENT, minimal());

        LifecycleStatus status = lifecycle.getStatus(NOTES);

        assertEquals(LifecycleState.ACTIVE, status.getState());
        assertEquals(LifecycleState.AGING, status.getNextState());
        long stretchedMillis = Math.round(Duration.ofDays(14).toMillis() * (1.0 + file.getRetentionScore() * 0.1));
        assertEquals(file.getLastAccessedAt().plusMillis(stretchedMillis), status.getNextTransitionEstimate());
        assertFalse(status.isProtectedFile());
    }

    @Test
    void archiveSweepArchivesEligibleFilesWithMatchingHash() {
        lifecycle.register("reports/budget.md", BUDGET_REPORT, minimal());
        fixture.clock.advance(Duration.ofDays(31));
        lifecycle.runAgingSweep(() -> false);

        SweepReport report = lifecycle.runArchiveSweep(() -> false);

        assertEquals(1, report.getArchived());
        assertFalse(fixture.metadataStore.contains("reports/budget.md"));
        assertFalse(Files.exists(tempDir.resolve("reports/budget.md")));
        List<ArchiveRecord> records = fixture.archiveLog.listRecords();
        assertEquals(1, records.size());
        ArchiveRecord record = records.get(0);
        assertEquals(fixture.contentAnalyzer.hash(BUDGET_REPORT), record.getContentHash());
        assertEquals(BUDGET_REPORT, fixture.archiveLog.readSnapshot(record));
        assertEquals(1, fixture.archiveSearch.search(ArchiveSearchQuery.builder().text("budget").build())
                .getTotalHits());
    }

    @Test
    void archiveRecordSurvivesRestart() {
        lifecycle.register(NOTES, BUDGET_REPORT, minimal());
        ArchiveRecord record = lifecycle.archive(NOTES);

        ArchivistFixture restarted = fixture.restart();
        try {
            assertEquals(record.getContentHash(), restarted.archiveLog.get(record.getArchiveId()).getContentHash());
        } finally {
            restarted.close();
        }
    }

    @Test
    void concurrentArchiveCreatesExactlyOneRecord() throws Exception {
        lifecycle.register("report.md", BUDGET_REPORT, minimal());
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        Callable<ArchiveRecord> archive = () -> {
            start.await();
            return lifecycle.archive("report.md");
        };
        List<Future<ArchiveRecord>> futures = new ArrayList<>();
        try {
            futures.add(executor.submit(archive));
            futures.add(executor.submit(archive));
            start.countDown();

            int succeeded = 0;
            int notFound = 0;
            for (Future<ArchiveRecord> future : futures) {
                try {
                    assertNotNull(future.get(10, TimeUnit.SECONDS));
                    succeeded++;
                } catch (ExecutionException e) {
                    assertInstanceOf(FileNotTrackedException.class, e.getCause());
                    notFound++;
                }
            }
            assertEquals(1, succeeded);
            assertEquals(1, notFound);
        } finally {
            executor.shutdownNow();
        }
        assertEquals(1, fixture.archiveLog.listRecords().size());
    }

    @Test
    void touchOfArchivedFileIsNotFound() {
        lifecycle.register(NOTES, SHORT_CONTENT, minimal());
        lifecycle.archive(NOTES);

        assertThrows(FileNotTrackedException.class, () -> lifecycle.touch(NOTES));
    }

    @Test
    void divergentContentWithoutUpdateIntentConflicts() throws IOException {
        lifecycle.register(NOTES, SHORT_CONTENT, minimal());

        assertThrows(RegistrationConflictException.class,
                () -> lifecycle.register(NOTES, "Other content", minimal()));
        assertEquals(SHORT_CONTENT, Files.readString(tempDir.resolve(NOTES)));
    }

    @Test
    void updateIntentReplacesContentAndKeepsTags() throws IOException {
        lifecycle.register(NOTES, SHORT_CONTENT, RetentionHints.builder()
                .tags(new LinkedHashSet<>(List.of("q3")))
                .build());
        fixture.clock.advance(Duration.ofMinutes(5));

        TrackedFile updated = lifecycle.register(NOTES, "Revised notes", RetentionHints.builder()
                .tags(new LinkedHashSet<>(List.of("finance")))
                .updateIntent(true)
                .build());

        assertEquals("Revised notes", Files.readString(tempDir.resolve(NOTES)));
        assertEquals(ArchivistFixture.START, updated.getCreatedAt());
        assertTrue(updated.getTags().containsAll(List.of("q3", "finance")));
    }

    @Test
    void identicalReRegistrationCountsAsAccess() {
        lifecycle.register(NOTES, SHORT_CONTENT, minimal());
        fixture.clock.advance(Duration.ofDays(15));
        lifecycle.runAgingSweep(() -> false);

        TrackedFile again = lifecycle.register(NOTES, SHORT_CONTENT, minimal());

        assertEquals(LifecycleState.ACTIVE, again.getState());
        assertEquals(fixture.clock.instant(), again.getLastAccessedAt());
    }

    @Test
    void rejectsInvalidRegistrations() {
        assertThrows(IllegalArgumentException.class, () -> lifecycle.register(NOTES, "  ", minimal()));
        assertThrows(IllegalArgumentException.class,
                () -> lifecycle.register(".archivist/metadata/x.json", SHORT_CONTENT, minimal()));
        assertThrows(IllegalArgumentException.class, () -> lifecycle.register("../x.md", SHORT_CONTENT, minimal()));
    }

    @Test
    void interruptedSweepStopsBeforeNextFile() {
        lifecycle.register("a.md", SHORT_CONTENT, minimal());
        lifecycle.register("b.md", "More notes", minimal());
        fixture.clock.advance(Duration.ofDays(15));

        SweepReport report = lifecycle.runAgingSweep(() -> true);

        assertTrue(report.isInterrupted());
        assertEquals(0, report.getExamined());
        assertEquals(SweepType.AGING, report.getType());
        assertEquals(LifecycleState.ACTIVE, fixture.metadataStore.get("a.md").getState());
    }

    @Test
    void indexFailureStillArchivesAndQueuesRetry(@TempDir Path otherDir) {
        UnaryOperator<ArchiveIndexPort> failingOnce = index -> {
            ArchiveIndexPort spied = spy(index);
            doThrow(new UncheckedIOException(new IOException("index offline")))
                    .doCallRealMethod()
                    .when(spied).ingest(any());
            return spied;
        };
        ArchivistFixture failing = ArchivistFixture.create(otherDir, UnaryOperator.identity(), failingOnce);
        try {
            failing.lifecycle.register("report.md", BUDGET_REPORT, minimal());

            ArchiveRecord record = failing.lifecycle.archive("report.md");

            assertEquals(1, failing.archiveLog.listRecords().size());
            assertEquals(1, failing.archiveSearch.pendingCount());
            assertEquals(0, failing.archiveSearch.search(ArchiveSearchQuery.builder().text("budget").build())
                    .getTotalHits());

            SweepReport early = failing.sweeps.run(SweepType.INDEX_RETRY);
            assertEquals(0, early.getExamined());

            failing.clock.advance(Duration.ofSeconds(31));
            SweepReport retried = failing.sweeps.run(SweepType.INDEX_RETRY);

            assertEquals(1, retried.getTransitioned());
            assertEquals(0, failing.archiveSearch.pendingCount());
            assertEquals(record.getArchiveId(), failing.archiveSearch.search(
                    ArchiveSearchQuery.builder().text("budget").build()).getHits().get(0).getArchiveId());
        } finally {
            failing.close();
        }
    }

    @Test
    void failedMetadataRemovalRollsBackArchive(@TempDir Path otherDir) {
        UnaryOperator<StoragePort> failingMetadataDelete = storage -> {
            StoragePort spied = spy(storage);
            doReturn(CompletableFuture.failedFuture(new UncheckedIOException(new IOException("read-only"))))
                    .when(spied).deleteObject(eq(".archivist/metadata"), anyString());
            return spied;
        };
        ArchivistFixture failing = ArchivistFixture.create(otherDir, failingMetadataDelete, UnaryOperator.identity());
        try {
            failing.lifecycle.register("report.md", BUDGET_REPORT, minimal());

            assertThrows(StorageFailureException.class, () -> failing.lifecycle.archive("report.md"));

            assertTrue(failing.metadataStore.contains("report.md"));
            assertTrue(Files.exists(otherDir.resolve("report.md")));
            assertTrue(failing.archiveLog.listRecords().isEmpty());
            assertEquals(1, failing.archiveLog.purgedCount());
        } finally {
            failing.close();
        }
    }

    private static RetentionHints minimal() {
        return RetentionHints.builder().generationMode(GenerationMode.MINIMAL).build();
    }
}
