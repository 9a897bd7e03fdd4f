package me.golemcore.archivist.adapter.inbound.web.controller;

import me.golemcore.archivist.adapter.inbound.web.dto.SessionRecordRequest;
import me.golemcore.archivist.domain.model.InsightGeneration;
import me.golemcore.archivist.domain.model.SessionRecord;
import me.golemcore.archivist.domain.model.TuningParameters;
import me.golemcore.archivist.domain.service.PatternRecognitionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PatternsControllerTest {

    private PatternRecognitionService patternRecognitionService;
    private PatternsController controller;

    @BeforeEach
    void setUp() {
        patternRecognitionService = mock(PatternRecognitionService.class);
        controller = new PatternsController(patternRecognitionService);
    }

    @Test
    void shouldRecordSession() {
        SessionRecord session = SessionRecord.builder().sessionId("s-1").durationMinutes(42).build();
        when(patternRecognitionService.recordSession("s-1", List.of("a.md"), "shipped", 42.0)).thenReturn(session);
        SessionRecordRequest request = SessionRecordRequest.builder()
                .sessionId("s-1")
                .files(List.of("a.md"))
                .outcome("shipped")
                .durationMinutes(42.0)
                .build();

        StepVerifier.create(controller.recordSession(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("s-1", response.getBody().getSessionId());
                })
                .verifyComplete();
    }

    @Test
    void shouldRequireDuration() {
        SessionRecordRequest request = SessionRecordRequest.builder().sessionId("s-1").build();

        assertThrows(IllegalArgumentException.class, () -> controller.recordSession(request));
        verify(patternRecognitionService, never()).recordSession(anyString(), any(), any(), anyDouble());
    }

    @Test
    void shouldRefreshAndExposeTuning() {
        when(patternRecognitionService.refreshInsights())
                .thenReturn(InsightGeneration.builder().generation(3).sessionCount(12).build());
        when(patternRecognitionService.currentTuning())
                .thenReturn(new TuningParameters(Duration.ofMinutes(45), 45.0, 0.7));
        when(patternRecognitionService.computeInsights()).thenReturn(List.of());

        StepVerifier.create(controller.refresh())
                .assertNext(response -> assertEquals(3, response.getBody().getGeneration()))
                .verifyComplete();
        StepVerifier.create(controller.tuning())
                .assertNext(response -> assertEquals(Duration.ofMinutes(45), response.getBody().temporalWindow()))
                .verifyComplete();
        StepVerifier.create(controller.insights())
                .assertNext(response -> assertEquals(0, response.getBody().size()))
                .verifyComplete();
    }
}
