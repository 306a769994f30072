package com.ryuqq.solar.core.schedule;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SelectedActionTest {

    @Test
    void override_UsesDockTargetAndActions() {
        ScheduleTask task = new ScheduleTask(ExactTime.of(10, 0), TaskCategory.NAVIGATION, "Garden", List.of("water"));

        SelectedAction action = SelectedAction.override(new DockPolicy(), OverrideReason.OUT_OF_RANGE, task);

        assertEquals("Dock", action.target());
        assertEquals(List.of("charge"), action.actions());
        assertTrue(action.isOverride());
        assertEquals(OverrideReason.OUT_OF_RANGE, action.overrideReason());
        assertSame(task, action.source().orElseThrow());
    }

    @Test
    void idle_HasNoTargetAndNoActions() {
        SelectedAction action = SelectedAction.idle();

        assertEquals(SelectionKind.IDLE, action.kind());
        assertTrue(action.targetLocation().isEmpty());
        assertTrue(action.actions().isEmpty());
        assertFalse(action.isOverride());
    }

    @Test
    void overrideWithoutReason_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new SelectedAction("Dock", List.of("charge"), SelectionKind.OVERRIDE, null, null)
        );
    }

    @Test
    void scheduledWithReason_ThrowsException() {
        assertThrows(
            IllegalArgumentException.class,
            () -> new SelectedAction("A", List.of(), SelectionKind.SCHEDULED, null, OverrideReason.LOW_BATTERY)
        );
    }

    @Test
    void equalSelections_AreEqual() {
        ScheduleTask task = new ScheduleTask(ExactTime.of(10, 0), TaskCategory.NAVIGATION, "Garden", List.of("water"));

        assertEquals(SelectedAction.scheduled(task), SelectedAction.scheduled(task));
        assertEquals(SelectedAction.idle(), SelectedAction.idle());
    }
}
