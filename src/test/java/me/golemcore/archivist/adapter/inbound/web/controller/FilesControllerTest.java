package me.golemcore.archivist.adapter.inbound.web.controller;

import me.golemcore.archivist.adapter.inbound.web.dto.FilePathRequest;
import me.golemcore.archivist.adapter.inbound.web.dto.FileRegisterRequest;
import me.golemcore.archivist.domain.model.ArchiveRecord;
import me.golemcore.archivist.domain.model.GenerationMode;
import me.golemcore.archivist.domain.model.LifecycleState;
import me.golemcore.archivist.domain.model.LifecycleStatus;
import me.golemcore.archivist.domain.model.RetentionHints;
import me.golemcore.archivist.domain.model.TrackedFile;
import me.golemcore.archivist.domain.service.LifecycleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FilesControllerTest {

    private LifecycleService lifecycleService;
    private FilesController controller;

    @BeforeEach
    void setUp() {
        lifecycleService = mock(LifecycleService.class);
        controller = new FilesController(lifecycleService);
    }

    @Test
    void shouldRegisterFileWithHints() {
        TrackedFile file = TrackedFile.builder().path("notes/plan.md").state(LifecycleState.ACTIVE).build();
        when(lifecycleService.register(eq("notes/plan.md"), eq("# Plan"), any(RetentionHints.class)))
                .thenReturn(file);
        FileRegisterRequest request = FileRegisterRequest.builder()
                .path("notes/plan.md")
                .content("# Plan")
                .retentionDays(90)
                .tags(List.of("strategy", "q3"))
                .generationMode("research")
                .sessionId("session-7")
                .update(true)
                .build();

        StepVerifier.create(controller.register(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("notes/plan.md", response.getBody().getPath());
                })
                .verifyComplete();

        ArgumentCaptor<RetentionHints> hints = ArgumentCaptor.forClass(RetentionHints.class);
        verify(lifecycleService).register(eq("notes/plan.md"), eq("# Plan"), hints.capture());
        assertEquals(90, hints.getValue().getRetentionDays());
        assertEquals(Set.of("strategy", "q3"), hints.getValue().getTags());
        assertEquals(GenerationMode.RESEARCH, hints.getValue().getGenerationMode());
        assertEquals("session-7", hints.getValue().getSessionId());
        assertTrue(hints.getValue().isUpdateIntent());
    }

    @Test
    void shouldRejectUnknownGenerationMode() {
        FileRegisterRequest request = FileRegisterRequest.builder()
                .path("a.md")
                .content("x")
                .generationMode("poetic")
                .build();

        assertThrows(IllegalArgumentException.class, () -> controller.register(request));
        verifyNoInteractions(lifecycleService);
    }

    @Test
    void shouldTouchAndArchiveByPath() {
        when(lifecycleService.touch("a.md")).thenReturn(TrackedFile.builder().path("a.md").build());
        when(lifecycleService.archive("a.md")).thenReturn(ArchiveRecord.builder().archiveId("arc-1").build());

        StepVerifier.create(controller.touch(FilePathRequest.builder().path("a.md").build()))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();
        StepVerifier.create(controller.archive(FilePathRequest.builder().path("a.md").build()))
                .assertNext(response -> assertEquals("arc-1", response.getBody().getArchiveId()))
                .verifyComplete();
    }

    @Test
    void shouldRequirePathForTouch() {
        assertThrows(IllegalArgumentException.class,
                () -> controller.touch(FilePathRequest.builder().path(" ").build()));
        assertThrows(IllegalArgumentException.class, () -> controller.archive(null));
    }

    @Test
    void shouldReturnStatus() {
        LifecycleStatus status = LifecycleStatus.builder()
                .path("a.md")
                .state(LifecycleState.ACTIVE)
                .nextState(LifecycleState.AGING)
                .build();
        when(lifecycleService.getStatus("a.md")).thenReturn(status);

        StepVerifier.create(controller.getStatus("a.md"))
                .assertNext(response -> assertEquals(LifecycleState.AGING, response.getBody().getNextState()))
                .verifyComplete();
    }

    @Test
    void shouldListByState() {
        when(lifecycleService.list(LifecycleState.AGING))
                .thenReturn(List.of(TrackedFile.builder().path("old.md").build()));
        when(lifecycleService.list(null)).thenReturn(List.of());

        StepVerifier.create(controller.list("aging"))
                .assertNext(response -> assertEquals(1, response.getBody().size()))
                .verifyComplete();
        StepVerifier.create(controller.list(null))
                .assertNext(response -> assertTrue(response.getBody().isEmpty()))
                .verifyComplete();
    }
}
