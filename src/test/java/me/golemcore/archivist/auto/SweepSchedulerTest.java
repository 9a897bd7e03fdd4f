package me.golemcore.archivist.auto;

import me.golemcore.archivist.domain.model.SweepReport;
import me.golemcore.archivist.domain.model.SweepType;
import me.golemcore.archivist.domain.service.SweepCoordinator;
import me.golemcore.archivist.infrastructure.config.ArchivistProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SweepSchedulerTest {

    private SweepCoordinator sweepCoordinator;
    private ArchivistProperties properties;
    private SweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        sweepCoordinator = mock(SweepCoordinator.class);
        when(sweepCoordinator.run(any())).thenReturn(new SweepReport());
        properties = new ArchivistProperties();
        scheduler = new SweepScheduler(sweepCoordinator, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void shouldStayIdleWhenDisabled() {
        scheduler.init();

        verifyNoInteractions(sweepCoordinator);
    }

    @Test
    void shouldNotStartWithInvalidInterval() {
        properties.getSweeps().setEnabled(true);
        properties.getSweeps().setInterval(Duration.ZERO);

        scheduler.init();

        verifyNoInteractions(sweepCoordinator);
    }

    @Test
    void shouldRunSweepsInOrderOnTick() {
        scheduler.tick();

        InOrder order = inOrder(sweepCoordinator);
        order.verify(sweepCoordinator).run(SweepType.AGING);
        order.verify(sweepCoordinator).run(SweepType.ARCHIVE);
        order.verify(sweepCoordinator).run(SweepType.INDEX_RETRY);
        verify(sweepCoordinator, never()).run(SweepType.REINDEX);
    }

    @Test
    void shouldContinueTickAfterFailedSweep() {
        when(sweepCoordinator.run(SweepType.AGING)).thenThrow(new IllegalStateException("boom"));

        scheduler.tick();

        verify(sweepCoordinator).run(SweepType.ARCHIVE);
        verify(sweepCoordinator).run(SweepType.INDEX_RETRY);
    }

    @Test
    void shouldTickPeriodicallyWhenEnabled() {
        properties.getSweeps().setEnabled(true);
        properties.getSweeps().setInterval(Duration.ofMillis(20));

        scheduler.init();

        verify(sweepCoordinator, timeout(2000).atLeastOnce()).run(SweepType.INDEX_RETRY);
    }
}
