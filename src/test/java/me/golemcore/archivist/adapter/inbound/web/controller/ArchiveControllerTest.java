package me.golemcore.archivist.adapter.inbound.web.controller;

import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.ArchiveSearchQuery;
import me.golemcore.archivist.domain.model.ArchiveStats;
import me.golemcore.archivist.domain.model.SearchResult;
import me.golemcore.archivist.domain.service.ArchiveSearchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ArchiveControllerTest {

    private ArchiveSearchService archiveSearchService;
    private ArchiveController controller;

    @BeforeEach
    void setUp() {
        archiveSearchService = mock(ArchiveSearchService.class);
        controller = new ArchiveController(archiveSearchService);
    }

    @Test
    void shouldBuildQueryFromParameters() {
        when(archiveSearchService.search(any(ArchiveSearchQuery.class)))
                .thenReturn(SearchResult.builder().totalHits(0).build());

        StepVerifier.create(controller.search("budget", List.of("finance", "q3"), "report",
                "2026-03-01", "2026-03-31", 5))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();

        ArgumentCaptor<ArchiveSearchQuery> query = ArgumentCaptor.forClass(ArchiveSearchQuery.class);
        verify(archiveSearchService).search(query.capture());
        assertEquals("budget", query.getValue().getText());
        assertEquals(Set.of("finance", "q3"), query.getValue().getTags());
        assertEquals("report", query.getValue().getCategory());
        assertEquals(Instant.parse("2026-03-01T00:00:00Z"), query.getValue().getFrom());
        assertEquals(Instant.parse("2026-03-31T23:59:59.999Z"), query.getValue().getTo());
        assertEquals(5, query.getValue().getLimit());
    }

    @Test
    void shouldRejectMalformedDates() {
        assertThrows(IllegalArgumentException.class,
                () -> controller.search("budget", null, null, "last week", null, 0));
        verifyNoInteractions(archiveSearchService);
    }

    @Test
    void shouldParseInstantsAndDates() {
        assertEquals(Instant.parse("2026-03-02T10:15:30Z"),
                ArchiveController.parseInstant("2026-03-02T10:15:30Z", true));
        assertEquals(Instant.parse("2026-03-02T00:00:00Z"), ArchiveController.parseInstant("2026-03-02", false));
        assertNull(ArchiveController.parseInstant(" ", false));
    }

    @Test
    void shouldReturnAndPurgeRecords() {
        ArchiveRecord record = ArchiveRecord.builder().archiveId("arc-1").originalPath("a.md").build();
        when(archiveSearchService.getRecord("arc-1")).thenReturn(record);
        when(archiveSearchService.purge("arc-1", "duplicate")).thenReturn(record);

        StepVerifier.create(controller.getRecord("arc-1"))
                .assertNext(response -> assertEquals("a.md", response.getBody().getOriginalPath()))
                .verifyComplete();
        StepVerifier.create(controller.purge("arc-1", "duplicate"))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
        verify(archiveSearchService).purge("arc-1", "duplicate");
    }

    @Test
    void shouldReturnStatsAndSegments() {
        when(archiveSearchService.stats()).thenReturn(ArchiveStats.builder().totalRecords(3).build());
        when(archiveSearchService.segmentHealth()).thenReturn(List.of());

        StepVerifier.create(controller.stats())
                .assertNext(response -> assertEquals(3, response.getBody().getTotalRecords()))
                .verifyComplete();
        StepVerifier.create(controller.segments())
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
    }
}
