package me.golemcore.archivist.adapter.inbound.web.controller;

import me.golemcore.archivist.domain.model.SweepReport;
import me.golemcore.archivist.domain.model.SweepType;
import me.golemcore.archivist.domain.service.SweepCoordinator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SweepsControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private SweepCoordinator sweepCoordinator;
    private SweepsController controller;

    @BeforeEach
    void setUp() {
        sweepCoordinator = mock(SweepCoordinator.class);
        controller = new SweepsController(sweepCoordinator);
    }

    @Test
    void shouldRunSweepByName() {
        when(sweepCoordinator.run(SweepType.INDEX_RETRY)).thenReturn(SweepReport.builder()
                .type(SweepType.INDEX_RETRY)
                .examined(2)
                .transitioned(2)
                .build());

        StepVerifier.create(controller.run("index-retry"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(2, response.getBody().getTransitioned());
                })
                .verifyComplete();
    }

    @Test
    void shouldAnswerAcceptedWhenSweepAlreadyRunning() {
        when(sweepCoordinator.run(SweepType.AGING)).thenReturn(SweepReport.skipped(SweepType.AGING, NOW));

        StepVerifier.create(controller.run("aging"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertTrue(response.getBody().isSkipped());
                })
                .verifyComplete();
    }

    @Test
    void shouldRejectUnknownSweep() {
        assertThrows(IllegalArgumentException.class, () -> controller.run("defrag"));
        verifyNoInteractions(sweepCoordinator);
    }
}
