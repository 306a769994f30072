package com.ryuqq.solar.application.control;

import com.ryuqq.solar.application.runner.Runner;
import com.ryuqq.solar.application.runner.RunnerManager;
import com.ryuqq.solar.application.safety.BatterySafetyMonitor;
import com.ryuqq.solar.application.schedule.ScheduleEngine;
import com.ryuqq.solar.core.config.ConfigurationException;
import com.ryuqq.solar.core.config.ControlSettings;
import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.safety.SafetyEnvelope;
import com.ryuqq.solar.core.schedule.SelectedAction;
import com.ryuqq.solar.core.spi.ActionSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 단일 스레드 제어 루프.
 *
 * <p><strong>틱 처리 흐름:</strong></p>
 * <pre>
 * 1. updateInterval이 지났으면 배터리 샘플링
 * 2. 엔벨로프 계산
 * 3. ScheduleEngine.tick(LocalTime.now(clock), envelope)
 * 4. 선택이 바뀌었으면 ActionSink에 전달 (오버라이드는 WARN)
 * 5. 대기 중인 Runner 설정 변경을 재구성 스레드에 넘김
 * 6. RunnerManager 건강 점검
 * </pre>
 *
 * <p>설정 변경 적용(삭제/비활성 → stop, 신규 → start, 변경 → stop 후 start)은 Runner 종료와
 * 초기화를 기다리므로 별도의 단일 스레드 "runner-reconfiguration"에서 제출 순서대로 실행됩니다.
 * 틱은 이를 기다리지 않습니다.</p>
 *
 * <p>틱에서 예외가 나도 루프는 계속됩니다. RunnerManager 종료는 호출자 책임입니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class ControlLoop {

    private static final Logger log = LoggerFactory.getLogger(ControlLoop.class);

    private final RunnerManager runnerManager;
    private final BatterySafetyMonitor batteryMonitor;
    private final ScheduleEngine scheduleEngine;
    private final ActionSink actionSink;
    private final ControlSettings settings;
    private final Clock clock;

    private final AtomicReference<List<RunnerSettings>> pendingRunners = new AtomicReference<>();
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService scheduler;
    private ExecutorService reconfigurer;
    private Instant lastSampleAt;
    private volatile SelectedAction currentAction;

    public ControlLoop(
        RunnerManager runnerManager,
        BatterySafetyMonitor batteryMonitor,
        ScheduleEngine scheduleEngine,
        ActionSink actionSink,
        ControlSettings settings,
        Clock clock
    ) {
        if (runnerManager == null) {
            throw new IllegalArgumentException("runnerManager cannot be null");
        }
        if (batteryMonitor == null) {
            throw new IllegalArgumentException("batteryMonitor cannot be null");
        }
        if (scheduleEngine == null) {
            throw new IllegalArgumentException("scheduleEngine cannot be null");
        }
        if (actionSink == null) {
            throw new IllegalArgumentException("actionSink cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.runnerManager = runnerManager;
        this.batteryMonitor = batteryMonitor;
        this.scheduleEngine = scheduleEngine;
        this.actionSink = actionSink;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * 스케줄러 시작 (이미 시작되었으면 무시).
     *
     * @return 이번 호출로 시작했으면 true
     */
    public boolean start() {
        synchronized (lifecycleLock) {
            if (scheduler != null) {
                return false;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(task -> {
                Thread thread = new Thread(task, "control-loop");
                thread.setDaemon(true);
                return thread;
            });
            long periodMillis = settings.mainLoopInterval().toMillis();
            scheduler.scheduleWithFixedDelay(this::tickSafely, 0L, Math.max(1L, periodMillis), TimeUnit.MILLISECONDS);
            log.info("Control loop started (interval: {})", settings.mainLoopInterval());
            return true;
        }
    }

    /**
     * 스케줄러 중지 (진행 중인 틱은 mainLoopInterval까지, 진행 중인 재구성은 shutdownTimeout까지 대기).
     *
     * <p>대기열에 남은 재구성은 적용되지 않습니다.</p>
     */
    public void stop() {
        ScheduledExecutorService running;
        ExecutorService reconfiguring;
        synchronized (lifecycleLock) {
            running = scheduler;
            scheduler = null;
            reconfiguring = reconfigurer;
            reconfigurer = null;
        }
        if (running != null) {
            terminate(running, settings.mainLoopInterval(), "tick");
            log.info("Control loop stopped");
        }
        if (reconfiguring != null) {
            terminate(reconfiguring, settings.shutdownTimeout(), "runner reconfiguration");
        }
    }

    private static void terminate(ExecutorService executor, Duration grace, String work) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
                log.warn("Control loop did not finish its {} in time, interrupted", work);
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        synchronized (lifecycleLock) {
            return scheduler != null;
        }
    }

    /**
     * 다음 틱에 적용할 Runner 설정 제출 (이전에 제출된 미적용 설정은 대체됨).
     *
     * @param runners 원하는 전체 Runner 설정 목록
     */
    public void submitRunnerConfiguration(List<RunnerSettings> runners) {
        if (runners == null) {
            throw new IllegalArgumentException("runners cannot be null");
        }
        pendingRunners.set(List.copyOf(runners));
    }

    /**
     * 마지막으로 ActionSink에 전달된 행동.
     */
    public Optional<SelectedAction> currentAction() {
        return Optional.ofNullable(currentAction);
    }

    /**
     * 1회 틱 실행 (스케줄러 스레드 또는 테스트에서 호출).
     */
    public void tick() {
        Instant now = clock.instant();
        if (lastSampleAt == null || Duration.between(lastSampleAt, now).compareTo(settings.updateInterval()) >= 0) {
            batteryMonitor.sample();
            lastSampleAt = now;
        }

        SafetyEnvelope envelope = batteryMonitor.envelope();
        SelectedAction selection = scheduleEngine.tick(LocalTime.now(clock), envelope);
        if (!selection.equals(currentAction)) {
            if (selection.isOverride()) {
                log.warn("Safety override ({}): heading to {} instead of {}",
                    selection.overrideReason(), selection.target(),
                    selection.source().map(Object::toString).orElse("idle"));
            } else {
                log.info("Selected action: {} {} ({})", selection.target(), selection.actions(), selection.kind());
            }
            actionSink.accept(selection);
            currentAction = selection;
        }

        List<RunnerSettings> pending = pendingRunners.getAndSet(null);
        if (pending != null) {
            scheduleReconfiguration(pending);
        }

        runnerManager.logHealth();
    }

    private void scheduleReconfiguration(List<RunnerSettings> desired) {
        ExecutorService executor;
        synchronized (lifecycleLock) {
            if (reconfigurer == null) {
                reconfigurer = Executors.newSingleThreadExecutor(task -> {
                    Thread thread = new Thread(task, "runner-reconfiguration");
                    thread.setDaemon(true);
                    return thread;
                });
            }
            executor = reconfigurer;
        }
        executor.execute(() -> {
            if (executor.isShutdown()) {
                log.info("Control loop stopped, dropping pending runner configuration");
                return;
            }
            try {
                applyRunnerConfiguration(desired);
            } catch (RuntimeException e) {
                log.error("Runner configuration update failed", e);
            }
        });
    }

    /**
     * 원하는 Runner 설정과 현재 레지스트리의 차이를 적용 (재구성 스레드에서 호출).
     *
     * <p>검증에 실패하거나 RunnerManager가 이미 종료되었으면 아무것도 바꾸지 않습니다.</p>
     *
     * @param desired 원하는 전체 설정 목록
     */
    void applyRunnerConfiguration(List<RunnerSettings> desired) {
        if (runnerManager.isShutdown()) {
            log.warn("RunnerManager shut down, ignoring runner configuration update");
            return;
        }
        try {
            runnerManager.validate(desired);
        } catch (ConfigurationException e) {
            log.error("Rejected runner configuration update: {}", e.getProblems());
            return;
        }

        Map<RunnerKey, RunnerSettings> wanted = new LinkedHashMap<>();
        for (RunnerSettings entry : desired) {
            if (entry.enabled()) {
                wanted.put(entry.key(), entry);
            }
        }

        Duration timeout = settings.shutdownTimeout();
        for (RunnerKey key : runnerManager.runnerKeys()) {
            if (!wanted.containsKey(key)) {
                log.info("Runner '{}' removed or disabled by configuration update", key);
                runnerManager.stopRunner(key, timeout);
            }
        }

        for (RunnerSettings entry : wanted.values()) {
            Optional<Runner> existing = runnerManager.getRunner(entry.key());
            if (existing.isPresent()) {
                if (existing.get().settings().equals(entry)) {
                    continue;
                }
                log.info("Runner '{}' settings changed, restarting", entry.key());
                runnerManager.stopRunner(entry.key(), timeout);
            }
            try {
                runnerManager.startRunner(entry);
            } catch (ConfigurationException e) {
                log.error("Runner '{}' could not be started: {}", entry.key(), e.getMessage());
            }
        }
    }

    private void tickSafely() {
        try {
            tick();
        } catch (RuntimeException e) {
            log.error("Control loop tick failed", e);
        }
    }
}
