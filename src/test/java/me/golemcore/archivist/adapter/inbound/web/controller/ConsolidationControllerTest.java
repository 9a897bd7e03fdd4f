package me.golemcore.archivist.adapter.inbound.web.controller;

import me.golemcore.archivist.domain.exception.ConsolidationValidationException;
import me.golemcore.archivist.domain.model.ConsolidationOpportunity;
import me.golemcore.archivist.domain.model.ConsolidationResult;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.domain.service.ConsolidationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConsolidationControllerTest {

    private ConsolidationService consolidationService;
    private ConsolidationController controller;

    @BeforeEach
    void setUp() {
        consolidationService = mock(ConsolidationService.class);
        controller = new ConsolidationController(consolidationService);
    }

    @Test
    void shouldListOpportunities() {
        ConsolidationOpportunity opportunity = ConsolidationOpportunity.builder()
                .sourcePaths(List.of("a.md", "b.md"))
                .destinationPath("consolidated/topic-20260302.md")
                .confidence(0.82)
                .build();
        when(consolidationService.identifyOpportunities()).thenReturn(List.of(opportunity));

        StepVerifier.create(controller.opportunities())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(0.82, response.getBody().get(0).getConfidence());
                })
                .verifyComplete();
    }

    @Test
    void shouldApplyAndRevert() {
        ConsolidationOpportunity opportunity = ConsolidationOpportunity.builder()
                .sourcePaths(List.of("a.md", "b.md"))
                .destinationPath("consolidated/x.md")
                .build();
        when(consolidationService.apply(opportunity)).thenReturn(ConsolidationResult.builder()
                .mergeId("merge-1")
                .destination(TrackedFile.builder().path("consolidated/x.md").build())
                .removedSources(List.of("a.md", "b.md"))
                .build());
        when(consolidationService.revert("merge-1")).thenReturn(List.of(
                TrackedFile.builder().path("a.md").build(), TrackedFile.builder().path("b.md").build()));

        StepVerifier.create(controller.apply(opportunity))
                .assertNext(response -> assertEquals("merge-1", response.getBody().getMergeId()))
                .verifyComplete();
        StepVerifier.create(controller.revert("merge-1"))
                .assertNext(response -> assertEquals(2, response.getBody().size()))
                .verifyComplete();
    }

    @Test
    void shouldPropagateValidationFailure() {
        ConsolidationOpportunity opportunity = ConsolidationOpportunity.builder()
                .sourcePaths(List.of("a.md", "b.md"))
                .destinationPath("consolidated/x.md")
                .build();
        when(consolidationService.apply(opportunity))
                .thenThrow(new ConsolidationValidationException("Merged content has an unclosed code fence"));

        assertThrows(ConsolidationValidationException.class, () -> controller.apply(opportunity));
    }
}
