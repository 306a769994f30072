package com.ryuqq.solar.testkit.contract;

import com.ryuqq.solar.application.control.ControlLoop;
import com.ryuqq.solar.application.runner.RunnerManager;
import com.ryuqq.solar.application.runner.RunnerTypeRegistry;
import com.ryuqq.solar.application.safety.BatterySafetyMonitor;
import com.ryuqq.solar.application.schedule.LocationMapDistanceEstimator;
import com.ryuqq.solar.application.schedule.ScheduleEngine;
import com.ryuqq.solar.core.config.ControlSettings;
import com.ryuqq.solar.core.model.Position;
import com.ryuqq.solar.core.safety.SafetyPolicy;
import com.ryuqq.solar.core.schedule.DailySchedule;
import com.ryuqq.solar.core.schedule.DockPolicy;
import com.ryuqq.solar.core.schedule.OverrideReason;
import com.ryuqq.solar.core.schedule.ScheduleTask;
import com.ryuqq.solar.core.schedule.SelectedAction;
import com.ryuqq.solar.core.schedule.SelectionKind;
import com.ryuqq.solar.core.schedule.TaskCategory;
import com.ryuqq.solar.core.schedule.TimeWindow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for battery-driven safety overrides.
 *
 * <p>Drives the full control loop (monitor, engine, sink) with an in-memory battery
 * and a controllable clock.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Low battery → task replaced by the dock, then resumed after charging</li>
 *   <li>Sensor stops reporting → reading goes stale → dock</li>
 *   <li>Target beyond the allowed distance → dock</li>
 *   <li>Target missing from the location map → dock</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
class SafetyOverrideContractTest {

    private static final Instant MORNING = Instant.parse("2026-06-01T08:00:00Z");
    private static final Duration RESAMPLE = Duration.ofSeconds(2);

    private static final ScheduleTask WATER_NEAR = new ScheduleTask(
            TimeWindow.of(LocalTime.of(7, 0), LocalTime.of(9, 0)), TaskCategory.NAVIGATION, "PlantA", List.of("water"));
    private static final ScheduleTask INSPECT_FAR = new ScheduleTask(
            TimeWindow.of(LocalTime.of(9, 0), LocalTime.of(10, 0)), TaskCategory.NAVIGATION, "PlantB", List.of("inspect"));
    private static final ScheduleTask VISIT_UNMAPPED = new ScheduleTask(
            TimeWindow.of(LocalTime.of(10, 0), LocalTime.of(11, 0)), TaskCategory.NAVIGATION, "Greenhouse", List.of("vent"));

    private MutableClock clock;
    private MutableBatterySource battery;
    private RecordingActionSink sink;
    private RunnerManager manager;
    private ControlLoop loop;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(MORNING);
        battery = new MutableBatterySource(80.0);
        sink = new RecordingActionSink();
        manager = new RunnerManager(RunnerTypeRegistry.builder().build(), Duration.ofSeconds(1));
        manager.start(List.of());

        // PlantA 10, PlantB 50 from the dock
        LocationMapDistanceEstimator distances = new LocationMapDistanceEstimator(Map.of(
                "Dock", new Position(0, 0),
                "PlantA", new Position(6, 8),
                "PlantB", new Position(30, 40)), "Dock");
        ScheduleEngine engine = new ScheduleEngine(
                DailySchedule.of(WATER_NEAR, INSPECT_FAR, VISIT_UNMAPPED), new DockPolicy(), distances);
        BatterySafetyMonitor monitor = new BatterySafetyMonitor(battery, new SafetyPolicy(), clock);
        loop = new ControlLoop(manager, monitor, engine, sink, new ControlSettings(), clock);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
        manager.shutdown(Duration.ofSeconds(1));
    }

    @Test
    void testLowBattery_TaskReplacedByDock_ResumesAfterCharging() {
        // Given
        loop.tick();
        assertLastAction(SelectionKind.SCHEDULED, "PlantA");

        // When: battery drops below the threshold
        battery.set(15.0);
        clock.advance(RESAMPLE);
        loop.tick();

        // Then
        SelectedAction override = sink.last().orElseThrow();
        assertEquals(SelectionKind.OVERRIDE, override.kind());
        assertEquals(OverrideReason.LOW_BATTERY, override.overrideReason());
        assertEquals("Dock", override.target());
        assertEquals(List.of("charge"), override.actions());
        assertEquals(WATER_NEAR, override.source().orElseThrow());

        // When: charged again
        battery.set(90.0);
        clock.advance(RESAMPLE);
        loop.tick();

        // Then
        assertLastAction(SelectionKind.SCHEDULED, "PlantA");
        assertEquals(3, sink.actions().size(), "Each change is delivered exactly once");
    }

    @Test
    void testSensorSilent_ReadingGoesStale_DockSelected() {
        // Given
        loop.tick();
        battery.clear();

        // When: still inside the stale window
        clock.advance(Duration.ofSeconds(5));
        loop.tick();

        // Then: previous sample still trusted
        assertEquals(1, sink.actions().size());

        // When: past staleAfter
        clock.advance(Duration.ofSeconds(6));
        loop.tick();

        // Then
        SelectedAction override = sink.last().orElseThrow();
        assertEquals(OverrideReason.STALE_BATTERY, override.overrideReason());
        assertEquals("Dock", override.target());
    }

    @Test
    void testSensorFailing_KeepsPreviousSample_UntilStale() {
        // Given
        loop.tick();
        battery.failWith(new IllegalStateException("i2c bus error"));

        // When
        clock.advance(RESAMPLE);
        loop.tick();

        // Then
        assertLastAction(SelectionKind.SCHEDULED, "PlantA");
        assertTrue(battery.readCount() >= 2, "Failing source should still be polled");

        // When
        clock.advance(Duration.ofSeconds(10));
        loop.tick();

        // Then
        assertEquals(OverrideReason.STALE_BATTERY, sink.last().orElseThrow().overrideReason());
    }

    @Test
    void testTargetBeyondRange_DockSelected() {
        // Given: 60% allows 30 units, PlantB is 50 away
        battery.set(60.0);
        clock.set(Instant.parse("2026-06-01T09:30:00Z"));

        // When
        loop.tick();

        // Then
        SelectedAction action = sink.last().orElseThrow();
        assertEquals(OverrideReason.OUT_OF_RANGE, action.overrideReason());
        assertEquals(INSPECT_FAR, action.source().orElseThrow());
    }

    @Test
    void testUnmappedTarget_DockSelected() {
        // Given
        battery.set(100.0);
        clock.set(Instant.parse("2026-06-01T10:15:00Z"));

        // When
        loop.tick();

        // Then
        assertEquals(OverrideReason.UNKNOWN_DISTANCE, sink.last().orElseThrow().overrideReason());
    }

    @Test
    void testNoMatchingTask_IdleDelivered() {
        // Given
        clock.set(Instant.parse("2026-06-01T13:00:00Z"));

        // When
        loop.tick();

        // Then
        assertEquals(SelectedAction.idle(), sink.last().orElseThrow());
    }

    private void assertLastAction(SelectionKind kind, String target) {
        SelectedAction action = sink.last().orElseThrow(() -> new AssertionError("No action delivered"));
        assertEquals(kind, action.kind(),
                String.format("Expected %s action but was %s", kind, action));
        assertEquals(target, action.target());
    }
}
