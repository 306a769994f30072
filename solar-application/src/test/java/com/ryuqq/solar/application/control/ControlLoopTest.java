package com.ryuqq.solar.application.control;

import com.ryuqq.solar.application.runner.Runner;
import com.ryuqq.solar.application.runner.RunnerManager;
import com.ryuqq.solar.application.safety.BatterySafetyMonitor;
import com.ryuqq.solar.application.schedule.ScheduleEngine;
import com.ryuqq.solar.core.config.ConfigurationException;
import com.ryuqq.solar.core.config.ControlSettings;
import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.safety.SafetyPolicy;
import com.ryuqq.solar.core.schedule.DailySchedule;
import com.ryuqq.solar.core.schedule.DockPolicy;
import com.ryuqq.solar.core.schedule.OverrideReason;
import com.ryuqq.solar.core.schedule.ScheduleTask;
import com.ryuqq.solar.core.schedule.SelectedAction;
import com.ryuqq.solar.core.schedule.SelectionKind;
import com.ryuqq.solar.core.schedule.TaskCategory;
import com.ryuqq.solar.core.schedule.TimeWindow;
import com.ryuqq.solar.core.spi.ActionSink;
import com.ryuqq.solar.core.spi.BatterySource;
import com.ryuqq.solar.core.spi.DistanceEstimator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ControlLoop 유닛 테스트.
 *
 * <ul>
 *   <li>선택이 바뀔 때만 ActionSink 호출</li>
 *   <li>updateInterval에 따른 배터리 샘플링</li>
 *   <li>Runner 설정 차이 적용 (재구성 스레드, 틱은 기다리지 않음)</li>
 *   <li>스케줄러 스레드에서의 실행</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ControlLoopTest {

    private static final Instant T0 = Instant.parse("2026-06-01T08:00:00Z");

    private static final ScheduleTask MORNING_PATROL = new ScheduleTask(
        TimeWindow.of(LocalTime.of(7, 0), LocalTime.of(10, 0)), TaskCategory.NAVIGATION, "PlantA", List.of("water"));

    @Mock
    private RunnerManager runnerManager;

    @Mock
    private BatterySource batterySource;

    @Mock
    private DistanceEstimator distanceEstimator;

    @Mock
    private ActionSink actionSink;

    @Mock
    private Clock clock;

    private final AtomicReference<Instant> now = new AtomicReference<>(T0);
    private final ControlSettings settings = new ControlSettings()
        .withMainLoopInterval(Duration.ofMillis(50))
        .withUpdateInterval(Duration.ofSeconds(1))
        .withShutdownTimeout(Duration.ofMillis(200));

    private ControlLoop loop;

    @BeforeEach
    void setUp() {
        when(clock.instant()).thenAnswer(invocation -> now.get());
        when(clock.getZone()).thenReturn(ZoneOffset.UTC);
        when(batterySource.readPercentage()).thenReturn(OptionalDouble.of(80.0));
        when(distanceEstimator.distanceFromDock("PlantA")).thenReturn(OptionalDouble.of(10.0));

        BatterySafetyMonitor monitor = new BatterySafetyMonitor(batterySource, new SafetyPolicy(), clock);
        ScheduleEngine engine = new ScheduleEngine(DailySchedule.of(MORNING_PATROL), new DockPolicy(), distanceEstimator);
        loop = new ControlLoop(runnerManager, monitor, engine, actionSink, settings, clock);
    }

    @AfterEach
    void tearDown() {
        loop.stop();
    }

    // ============================================================
    // 1. 행동 전달
    // ============================================================

    @Test
    void tick_선택이_바뀔_때만_ActionSink_호출() {
        // when
        loop.tick();
        loop.tick();

        // then
        ArgumentCaptor<SelectedAction> captor = ArgumentCaptor.forClass(SelectedAction.class);
        verify(actionSink, times(1)).accept(captor.capture());
        assertThat(captor.getValue().kind()).isEqualTo(SelectionKind.SCHEDULED);
        assertThat(captor.getValue().target()).isEqualTo("PlantA");
        assertThat(loop.currentAction()).contains(captor.getValue());
    }

    @Test
    void tick_배터리가_떨어지면_오버라이드_전달() {
        loop.tick();

        when(batterySource.readPercentage()).thenReturn(OptionalDouble.of(15.0));
        now.set(T0.plusSeconds(2));
        loop.tick();

        ArgumentCaptor<SelectedAction> captor = ArgumentCaptor.forClass(SelectedAction.class);
        verify(actionSink, times(2)).accept(captor.capture());
        SelectedAction latest = captor.getAllValues().get(1);
        assertThat(latest.isOverride()).isTrue();
        assertThat(latest.overrideReason()).isEqualTo(OverrideReason.LOW_BATTERY);
        assertThat(latest.target()).isEqualTo("Dock");
    }

    @Test
    void tick_시간대를_벗어나면_IDLE_전달() {
        loop.tick();

        now.set(Instant.parse("2026-06-01T10:00:00Z"));
        loop.tick();

        ArgumentCaptor<SelectedAction> captor = ArgumentCaptor.forClass(SelectedAction.class);
        verify(actionSink, times(2)).accept(captor.capture());
        assertThat(captor.getAllValues().get(1).kind()).isEqualTo(SelectionKind.IDLE);
    }

    @Test
    void tick_ActionSink_실패하면_다음_틱에_재전달() {
        doThrow(new IllegalStateException("executor busy")).doNothing().when(actionSink).accept(any());

        assertThatThrownBy(() -> loop.tick()).isInstanceOf(IllegalStateException.class);
        assertThat(loop.currentAction()).isEmpty();

        loop.tick();

        verify(actionSink, times(2)).accept(any());
        assertThat(loop.currentAction()).isPresent();
    }

    // ============================================================
    // 2. 배터리 샘플링 주기
    // ============================================================

    @Test
    void tick_updateInterval_이내에는_재샘플링하지_않음() {
        loop.tick();
        now.set(T0.plusMillis(500));
        loop.tick();

        verify(batterySource, times(1)).readPercentage();

        now.set(T0.plusSeconds(1));
        loop.tick();

        verify(batterySource, times(2)).readPercentage();
    }

    @Test
    void tick_매번_건강_점검() {
        loop.tick();
        loop.tick();

        verify(runnerManager, times(2)).logHealth();
    }

    // ============================================================
    // 3. Runner 설정 차이 적용
    // ============================================================

    @Test
    void tick_제출된_Runner_설정_차이를_적용() {
        RunnerSettings unchanged = RunnerSettings.of("ups", "ups_monitor");
        RunnerSettings changedOld = RunnerSettings.of("solar", "power_monitor");
        RunnerSettings changedNew = changedOld.withInterval(Duration.ofSeconds(5));
        RunnerSettings added = RunnerSettings.of("audio", "audio");

        when(runnerManager.runnerKeys()).thenReturn(
            List.of(RunnerKey.of("ups"), RunnerKey.of("solar"), RunnerKey.of("docked")));
        when(runnerManager.getRunner(RunnerKey.of("ups"))).thenReturn(Optional.of(runner(unchanged)));
        when(runnerManager.getRunner(RunnerKey.of("solar"))).thenReturn(Optional.of(runner(changedOld)));
        when(runnerManager.getRunner(RunnerKey.of("audio"))).thenReturn(Optional.empty());

        // when
        loop.submitRunnerConfiguration(List.of(
            unchanged,
            changedNew,
            added,
            RunnerSettings.of("docked", "power_monitor").withEnabled(false)
        ));
        loop.tick();

        // then
        verify(runnerManager, timeout(2_000)).startRunner(added);
        Duration timeout = settings.shutdownTimeout();
        verify(runnerManager).stopRunner(RunnerKey.of("docked"), timeout);
        InOrder ordered = inOrder(runnerManager);
        ordered.verify(runnerManager).stopRunner(RunnerKey.of("solar"), timeout);
        ordered.verify(runnerManager).startRunner(changedNew);
        verify(runnerManager, never()).startRunner(unchanged);
        verify(runnerManager, never()).stopRunner(RunnerKey.of("ups"), timeout);
    }

    @Test
    void tick_검증_실패한_설정은_적용하지_않음() {
        doThrow(new ConfigurationException("Invalid runner configuration", List.of("duplicate runner key: a")))
            .when(runnerManager).validate(anyList());

        loop.submitRunnerConfiguration(List.of(RunnerSettings.of("a", "audio"), RunnerSettings.of("a", "audio")));
        loop.tick();

        verify(runnerManager, timeout(2_000)).validate(anyList());
        loop.stop();
        verify(runnerManager, never()).startRunner(any());
        verify(runnerManager, never()).stopRunner(any(), any());
    }

    @Test
    void tick_제출된_설정은_한번만_적용() {
        when(runnerManager.runnerKeys()).thenReturn(List.of());
        when(runnerManager.getRunner(any())).thenReturn(Optional.empty());
        RunnerSettings added = RunnerSettings.of("audio", "audio");

        loop.submitRunnerConfiguration(List.of(added));
        loop.tick();
        loop.tick();

        verify(runnerManager, timeout(2_000)).startRunner(added);
        verify(runnerManager, after(200).times(1)).startRunner(added);
    }

    @Test
    void tick_Runner_종료를_기다리지_않고_안전_판단_계속() throws InterruptedException {
        CountDownLatch stuck = new CountDownLatch(1);
        CountDownLatch stopping = new CountDownLatch(1);
        when(runnerManager.runnerKeys()).thenReturn(List.of(RunnerKey.of("spinner")));
        when(runnerManager.stopRunner(any(), any())).thenAnswer(invocation -> {
            stopping.countDown();
            stuck.await();
            return false;
        });

        try {
            // when: 멈추지 않는 Runner 제거
            loop.submitRunnerConfiguration(List.of());
            long startedAt = System.nanoTime();
            loop.tick();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startedAt);

            // then
            assertThat(elapsed).isLessThan(settings.shutdownTimeout());
            assertThat(stopping.await(2, TimeUnit.SECONDS)).isTrue();

            when(batterySource.readPercentage()).thenReturn(OptionalDouble.of(15.0));
            now.set(T0.plusSeconds(2));
            assertTimeoutPreemptively(Duration.ofSeconds(1), () -> loop.tick());

            assertThat(loop.currentAction()).hasValueSatisfying(action ->
                assertThat(action.overrideReason()).isEqualTo(OverrideReason.LOW_BATTERY));
        } finally {
            stuck.countDown();
        }
    }

    @Test
    void tick_RunnerManager_종료_후_설정_변경_무시() {
        when(runnerManager.isShutdown()).thenReturn(true);

        loop.submitRunnerConfiguration(List.of(RunnerSettings.of("audio", "audio")));
        loop.tick();

        verify(runnerManager, timeout(2_000)).isShutdown();
        loop.stop();
        verify(runnerManager, never()).validate(anyList());
        verify(runnerManager, never()).startRunner(any());
    }

    // ============================================================
    // 4. 스케줄러
    // ============================================================

    @Test
    void start_스케줄러_스레드에서_틱_실행() {
        assertThat(loop.start()).isTrue();
        assertThat(loop.start()).isFalse();

        verify(actionSink, timeout(2_000)).accept(any());
        verify(runnerManager, timeout(2_000).atLeast(2)).logHealth();

        loop.stop();
        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void start_틱_예외가_나도_루프는_계속() {
        doThrow(new IllegalStateException("boom")).when(actionSink).accept(any());

        loop.start();

        // 실패한 전달은 매 틱 재시도됨
        verify(actionSink, timeout(2_000).atLeast(3)).accept(any());
        verify(batterySource, atLeastOnce()).readPercentage();
    }

    private static Runner runner(RunnerSettings settings) {
        Runner runner = mock(Runner.class);
        when(runner.settings()).thenReturn(settings);
        return runner;
    }
}
