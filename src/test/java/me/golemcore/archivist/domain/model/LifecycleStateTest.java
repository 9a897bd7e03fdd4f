package me.golemcore.archivist.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LifecycleStateTest {

    @Test
    void parsesValuesLeniently() {
        assertEquals(LifecycleState.ARCHIVE_ELIGIBLE, LifecycleState.fromValue("Archive-Eligible"));
        assertEquals(LifecycleState.AGING, LifecycleState.fromValue(" aging "));
        assertNull(LifecycleState.fromValue(""));
        assertThrows(IllegalArgumentException.class, () -> LifecycleState.fromValue("deleted"));
    }

    @Test
    void generationModeBandsDoNotInvert() {
        for (GenerationMode mode : GenerationMode.values()) {
            assertTrue(mode.getBandLow() < mode.getBandHigh());
        }
        assertEquals(GenerationMode.RESEARCH, GenerationMode.fromValue("RESEARCH"));
        assertThrows(IllegalArgumentException.class, () -> GenerationMode.fromValue("poetic"));
    }

    @Test
    void sweepTypeAcceptsDashedNames() {
        assertEquals(SweepType.INDEX_RETRY, SweepType.fromValue("index-retry"));
        assertThrows(IllegalArgumentException.class, () -> SweepType.fromValue(" "));
    }
}
