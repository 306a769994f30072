package com.ryuqq.solar.bootstrap;

import com.ryuqq.solar.adapter.config.SolarConfiguration;
import com.ryuqq.solar.adapter.runner.DefaultRunnerTypes;
import com.ryuqq.solar.adapter.runner.ups.UpsBatterySource;
import com.ryuqq.solar.application.control.ControlLoop;
import com.ryuqq.solar.application.runner.RunnerManager;
import com.ryuqq.solar.application.runner.RunnerTypeRegistry;
import com.ryuqq.solar.application.safety.BatterySafetyMonitor;
import com.ryuqq.solar.application.schedule.LocationMapDistanceEstimator;
import com.ryuqq.solar.application.schedule.ScheduleEngine;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.runner.SystemStatus;
import com.ryuqq.solar.core.spi.ActionSink;
import com.ryuqq.solar.core.spi.BatterySource;
import com.ryuqq.solar.core.statemachine.RunnerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 설정으로부터 전체 컴포넌트를 조립하고 수명주기를 관리.
 *
 * <pre>
 * RunnerManager ─┬─ UpsBatterySource ─ BatterySafetyMonitor ─┐
 *                └──────────────────────────────────────────── ControlLoop ─ ActionSink
 * LocationMapDistanceEstimator ─ ScheduleEngine ──────────────┘
 * </pre>
 *
 * <p>{@link #stop()}은 여러 번 호출해도 한 번만 종료를 수행합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class SolarApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SolarApplication.class);

    private final SolarConfiguration configuration;
    private final RunnerManager manager;
    private final BatterySafetyMonitor batteryMonitor;
    private final ControlLoop controlLoop;
    private final CountDownLatch stopped = new CountDownLatch(1);
    private final Object lifecycleLock = new Object();

    private SystemStatus finalStatus;

    private SolarApplication(
        SolarConfiguration configuration,
        RunnerManager manager,
        BatterySafetyMonitor batteryMonitor,
        ControlLoop controlLoop
    ) {
        this.configuration = configuration;
        this.manager = manager;
        this.batteryMonitor = batteryMonitor;
        this.controlLoop = controlLoop;
    }

    /**
     * 컴포넌트 조립 (스레드는 시작하지 않음).
     *
     * @param configuration 검증된 설정
     * @param registry Runner 타입 레지스트리
     * @param actionSink 선택 결과 전달 대상
     * @param clock 시계
     * @return 조립된 애플리케이션
     */
    public static SolarApplication create(
        SolarConfiguration configuration,
        RunnerTypeRegistry registry,
        ActionSink actionSink,
        Clock clock
    ) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration cannot be null");
        }
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        RunnerManager manager = new RunnerManager(registry, configuration.control().startupTimeout());
        BatterySource battery = batterySource(configuration, manager, clock);
        BatterySafetyMonitor monitor = new BatterySafetyMonitor(battery, configuration.safety(), clock);
        ScheduleEngine engine = new ScheduleEngine(
            configuration.schedule(),
            configuration.dock(),
            new LocationMapDistanceEstimator(configuration.locations(), configuration.dock().target())
        );
        ControlLoop loop = new ControlLoop(manager, monitor, engine, actionSink, configuration.control(), clock);
        return new SolarApplication(configuration, manager, monitor, loop);
    }

    /**
     * Runner와 제어 루프 시작.
     *
     * @return 이번 호출로 시작했으면 true
     * @throws com.ryuqq.solar.core.config.ConfigurationException Runner 설정이 잘못된 경우 (아무것도 시작하지 않음)
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (finalStatus != null) {
                return false;
            }
            if (!manager.start(configuration.runners())) {
                return false;
            }
            SystemStatus status = manager.getSystemStatus();
            log.info("Started {} runners ({} running, {} in error)",
                status.totalCount(), status.runningCount(), status.count(RunnerState.ERROR));
            controlLoop.start();
            return true;
        }
    }

    /**
     * 제어 루프를 멈추고 Runner를 종료.
     *
     * @return 최종 상태 (두 번째 호출부터는 같은 값)
     */
    public SystemStatus stop() {
        synchronized (lifecycleLock) {
            if (finalStatus != null) {
                return finalStatus;
            }
            log.info("Shutting down");
            controlLoop.stop();
            Duration timeout = configuration.control().shutdownTimeout();
            finalStatus = manager.shutdown(timeout);
            if (finalStatus.runners().stream().anyMatch(status -> status.forcedStop())) {
                log.warn("Some runners did not stop within {}", timeout);
            }
            log.info("Shutdown complete: {} runners stopped", finalStatus.count(RunnerState.STOPPED));
            stopped.countDown();
            return finalStatus;
        }
    }

    /**
     * {@link #stop()}이 끝날 때까지 대기.
     */
    public void awaitStop() throws InterruptedException {
        stopped.await();
    }

    /**
     * @return 시간 안에 종료되었으면 true
     */
    public boolean awaitStop(Duration timeout) throws InterruptedException {
        return stopped.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * 새 Runner 설정 제출 (다음 틱에 적용).
     */
    public void submitRunnerConfiguration(List<RunnerSettings> runners) {
        controlLoop.submitRunnerConfiguration(runners);
    }

    @Override
    public void close() {
        stop();
    }

    public RunnerManager manager() {
        return manager;
    }

    public ControlLoop controlLoop() {
        return controlLoop;
    }

    public BatterySafetyMonitor batteryMonitor() {
        return batteryMonitor;
    }

    public SolarConfiguration configuration() {
        return configuration;
    }

    /**
     * 첫 번째 활성 UPS Runner를 배터리 소스로 사용.
     *
     * <p>UPS Runner가 없으면 항상 empty를 반환하는 소스를 사용하므로 엔벨로프는 stale로 유지됩니다.</p>
     */
    static BatterySource batterySource(SolarConfiguration configuration, RunnerManager manager, Clock clock) {
        Optional<RunnerSettings> ups = configuration.runners().stream()
            .filter(RunnerSettings::enabled)
            .filter(settings -> DefaultRunnerTypes.isUpsMonitor(settings.type()))
            .findFirst();
        if (ups.isEmpty()) {
            log.warn("No enabled UPS runner configured; battery level is unknown and every task will be overridden");
            return OptionalDouble::empty;
        }
        log.info("Battery level source: runner '{}'", ups.get().key());
        return UpsBatterySource.fromRunner(manager, ups.get().key(), clock, configuration.safety().staleAfter());
    }
}
