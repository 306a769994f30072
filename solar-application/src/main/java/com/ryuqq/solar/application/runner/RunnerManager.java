package com.ryuqq.solar.application.runner;

import com.ryuqq.solar.core.config.ConfigurationException;
import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.runner.RunnerStatus;
import com.ryuqq.solar.core.runner.SystemStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Runner 레지스트리 및 생명주기 관리자.
 *
 * <p>설정 목록으로 Runner를 생성하고, Runner마다 전용 워커 스레드를 띄우며,
 * 상태를 집계하고, 기한 내 종료를 조율합니다.</p>
 *
 * <p><strong>시작 흐름:</strong></p>
 * <pre>
 * start(settings)
 *   1. 전체 검증 (중복 키, 알 수 없는 타입 → ConfigurationException, 아무것도 시작 안 함)
 *   2. 비활성 항목 건너뜀
 *   3. 선언 순서대로 생성 → 등록 → 워커 스레드 "runner-&lt;key&gt;" 시작
 *   4. startupTimeout까지 초기화 결과 대기 (늦은 Runner는 INITIALIZING으로 남음)
 * </pre>
 *
 * <p><strong>종료 흐름:</strong></p>
 * <pre>
 * shutdown(timeout)
 *   1. 모든 토큰 취소
 *   2. 공유 기한까지 각 워커 join
 *   3. 남은 워커: interrupt → 포기 (데몬 스레드) → STOPPED + forcedStop
 *   4. 최종 SystemStatus 반환 (재호출 시 동일 결과)
 * </pre>
 *
 * <p><strong>Thread Safety:</strong> 레지스트리는 내부 락으로 보호되며, 상태 조회는
 * Runner별 스냅샷을 모아서 만듭니다. 워커 join은 락 밖에서 수행합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class RunnerManager {

    private static final Logger log = LoggerFactory.getLogger(RunnerManager.class);

    private final RunnerTypeRegistry registry;
    private final Duration startupTimeout;

    private final Object lock = new Object();
    private final Object shutdownLock = new Object();
    private final Map<RunnerKey, Worker> workers = new LinkedHashMap<>();

    private boolean started;
    private volatile boolean shutdown;
    private volatile SystemStatus finalStatus;

    /**
     * 생성자.
     *
     * @param registry 타입 태그 레지스트리
     * @param startupTimeout 초기화 결과 대기 시간 (0 이상)
     * @throws IllegalArgumentException 인자가 잘못된 경우
     */
    public RunnerManager(RunnerTypeRegistry registry, Duration startupTimeout) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (startupTimeout == null || startupTimeout.isNegative()) {
            throw new IllegalArgumentException("startupTimeout cannot be null or negative (current: " + startupTimeout + ")");
        }
        this.registry = registry;
        this.startupTimeout = startupTimeout;
    }

    /**
     * 설정 목록 검증.
     *
     * @param settings Runner 설정 목록
     * @throws ConfigurationException 중복 키 또는 알 수 없는 타입이 있는 경우 (모든 문제를 모아서)
     */
    public void validate(List<RunnerSettings> settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        List<String> problems = new ArrayList<>();
        Set<RunnerKey> seen = new HashSet<>();
        for (RunnerSettings entry : settings) {
            if (entry == null) {
                problems.add("runner settings entry cannot be null");
                continue;
            }
            if (!seen.add(entry.key())) {
                problems.add("duplicate runner key: " + entry.key());
            }
            if (!registry.supports(entry.type())) {
                problems.add("unknown runner type '" + entry.type() + "' for runner " + entry.key()
                    + " (known: " + registry.types() + ")");
            }
        }
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid runner configuration", problems);
        }
    }

    /**
     * 모든 활성 Runner 시작.
     *
     * @param settings Runner 설정 목록 (선언 순서)
     * @return 이미 시작되었거나 종료된 경우에만 false
     * @throws ConfigurationException 검증 실패 (아무것도 시작되지 않음)
     */
    public boolean start(List<RunnerSettings> settings) {
        validate(settings);

        List<Worker> launched = new ArrayList<>();
        synchronized (lock) {
            if (shutdown) {
                log.warn("RunnerManager already shut down, ignoring start");
                return false;
            }
            if (started) {
                log.warn("RunnerManager already started, ignoring start");
                return false;
            }

            // 모든 인스턴스를 만든 뒤에 스레드 시작
            List<AbstractRunner> created = new ArrayList<>();
            List<String> problems = new ArrayList<>();
            for (RunnerSettings entry : settings) {
                if (!entry.enabled()) {
                    log.info("Runner '{}' is disabled, skipping", entry.key());
                    continue;
                }
                try {
                    created.add(create(entry));
                } catch (IllegalArgumentException e) {
                    problems.add("runner " + entry.key() + ": " + e.getMessage());
                }
            }
            if (!problems.isEmpty()) {
                throw new ConfigurationException("Invalid runner configuration", problems);
            }

            started = true;
            for (AbstractRunner runner : created) {
                launched.add(launchLocked(runner));
            }
        }

        awaitInitialization(launched);
        SystemStatus status = getSystemStatus();
        log.info("RunnerManager started {} of {} configured runners ({} running)",
            status.totalCount(), settings.size(), status.runningCount());
        return true;
    }

    /**
     * Runner 하나 시작 (런타임 설정 변경용).
     *
     * <p>같은 키의 Runner가 이미 활성 상태면 시작하지 않습니다. 중지된 키는 새 인스턴스로 대체됩니다.</p>
     *
     * @param settings Runner 설정
     * @return 시작했으면 true
     * @throws ConfigurationException 알 수 없는 타입인 경우
     */
    public boolean startRunner(RunnerSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (!registry.supports(settings.type())) {
            throw new ConfigurationException(
                "unknown runner type '" + settings.type() + "' for runner " + settings.key());
        }
        if (!settings.enabled()) {
            log.info("Runner '{}' is disabled, not starting", settings.key());
            return false;
        }

        Worker worker;
        synchronized (lock) {
            if (shutdown) {
                log.warn("RunnerManager shut down, not starting runner '{}'", settings.key());
                return false;
            }
            Worker existing = workers.get(settings.key());
            if (existing != null && !existing.runner.state().isTerminal()) {
                log.warn("Runner '{}' is already active ({}), not starting", settings.key(), existing.runner.state());
                return false;
            }
            AbstractRunner runner;
            try {
                runner = create(settings);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("runner " + settings.key() + ": " + e.getMessage(), e);
            }
            worker = launchLocked(runner);
        }
        awaitInitialization(List.of(worker));
        return true;
    }

    /**
     * Runner 하나 중지 후 레지스트리에서 제거.
     *
     * @param key Runner 키
     * @param timeout 정상 종료 대기 시간
     * @return 기한 내 정상 종료되었으면 true, 강제 종료되었거나 없는 키면 false
     */
    public boolean stopRunner(RunnerKey key, Duration timeout) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }
        Worker worker;
        synchronized (lock) {
            worker = workers.remove(key);
        }
        if (worker == null) {
            log.warn("Runner '{}' is not registered", key);
            return false;
        }
        worker.token.cancel();
        boolean graceful = join(worker, System.nanoTime() + timeout.toNanos());
        if (!graceful) {
            forceStop(worker);
        } else {
            worker.runner.markStopped(false);
        }
        log.info("Runner '{}' stopped{}", key, graceful ? "" : " (forced)");
        return graceful;
    }

    /**
     * 키로 Runner 조회.
     */
    public Optional<Runner> getRunner(RunnerKey key) {
        synchronized (lock) {
            Worker worker = workers.get(key);
            return worker == null ? Optional.empty() : Optional.of(worker.runner);
        }
    }

    /**
     * 등록된 키 목록 (등록 순서).
     */
    public List<RunnerKey> runnerKeys() {
        synchronized (lock) {
            return List.copyOf(workers.keySet());
        }
    }

    /**
     * 전체 상태 집계.
     *
     * <p>종료 후에는 shutdown()이 반환한 최종 상태를 돌려줍니다.</p>
     */
    public SystemStatus getSystemStatus() {
        SystemStatus last = finalStatus;
        if (last != null) {
            return last;
        }
        List<Worker> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(workers.values());
        }
        List<RunnerStatus> statuses = new ArrayList<>(snapshot.size());
        for (Worker worker : snapshot) {
            statuses.add(worker.runner.status());
        }
        return SystemStatus.of(statuses);
    }

    /**
     * 주기적 건강 점검: unhealthy Runner를 WARN으로 기록.
     *
     * @return 집계된 상태
     */
    public SystemStatus logHealth() {
        SystemStatus status = getSystemStatus();
        for (RunnerStatus runner : status.runners()) {
            if (!runner.healthy()) {
                log.warn("Runner '{}' unhealthy: state={}, consecutiveErrors={}/{}, lastError={}",
                    runner.key(), runner.state(), runner.consecutiveErrors(), runner.errorCeiling(), runner.lastError());
            }
        }
        log.debug("Health check: {}/{} running, overallHealthy={}",
            status.runningCount(), status.totalCount(), status.overallHealthy());
        return status;
    }

    /**
     * 모든 Runner 종료.
     *
     * <p>timeout + ε 안에 반환합니다. 멱등이며, 두 번째 호출은 부수 효과 없이 같은 최종 상태를 반환합니다.</p>
     *
     * @param timeout 전체 종료 기한
     * @return 최종 상태
     */
    public SystemStatus shutdown(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative (current: " + timeout + ")");
        }
        synchronized (shutdownLock) {
            if (finalStatus != null) {
                return finalStatus;
            }
            List<Worker> snapshot;
            synchronized (lock) {
                shutdown = true;
                snapshot = new ArrayList<>(workers.values());
            }
            log.info("Shutting down {} runners (timeout: {})", snapshot.size(), timeout);

            for (Worker worker : snapshot) {
                worker.token.cancel();
            }

            long deadline = System.nanoTime() + timeout.toNanos();
            int forced = 0;
            for (Worker worker : snapshot) {
                if (join(worker, deadline)) {
                    worker.runner.markStopped(false);
                } else {
                    forceStop(worker);
                    forced++;
                }
            }

            List<RunnerStatus> statuses = new ArrayList<>(snapshot.size());
            for (Worker worker : snapshot) {
                statuses.add(worker.runner.status());
            }
            SystemStatus status = SystemStatus.of(statuses);
            finalStatus = status;
            if (forced > 0) {
                log.warn("RunnerManager shutdown complete: {} runners forced to stop", forced);
            } else {
                log.info("RunnerManager shutdown complete");
            }
            return status;
        }
    }

    /**
     * 종료 여부.
     */
    public boolean isShutdown() {
        return shutdown;
    }

    // ========== 내부 ==========

    private AbstractRunner create(RunnerSettings settings) {
        RunnerFactory factory = registry.find(settings.type())
            .orElseThrow(() -> new ConfigurationException(
                "unknown runner type '" + settings.type() + "' for runner " + settings.key()));
        AbstractRunner runner = factory.create(settings);
        if (runner == null) {
            throw new IllegalStateException("RunnerFactory returned null for type " + settings.type());
        }
        if (!runner.key().equals(settings.key())) {
            throw new IllegalStateException(
                "RunnerFactory returned runner '" + runner.key() + "' for key '" + settings.key() + "'");
        }
        return runner;
    }

    private Worker launchLocked(AbstractRunner runner) {
        RunnerKey key = runner.key();
        CancellationToken token = new CancellationToken();
        CountDownLatch initialized = new CountDownLatch(1);
        Thread thread = new Thread(() -> runner.execute(token, initialized), "runner-" + key);
        thread.setDaemon(true);

        Worker worker = new Worker(runner, token, thread, initialized);
        workers.put(key, worker);
        thread.start();
        log.debug("Runner '{}' launched on thread {}", key, thread.getName());
        return worker;
    }

    private void awaitInitialization(List<Worker> launched) {
        long deadline = System.nanoTime() + startupTimeout.toNanos();
        for (Worker worker : launched) {
            long remaining = deadline - System.nanoTime();
            try {
                if (remaining <= 0 || !worker.initialized.await(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Runner '{}' still initializing after {}", worker.runner.key(), startupTimeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for runner initialization");
                return;
            }
        }
    }

    private static boolean join(Worker worker, long deadlineNanos) {
        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
        try {
            if (remainingMillis > 0) {
                worker.thread.join(remainingMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return !worker.thread.isAlive();
    }

    private static void forceStop(Worker worker) {
        worker.thread.interrupt();
        worker.runner.markStopped(true);
        log.warn("Runner '{}' did not stop in time, interrupted and abandoned", worker.runner.key());
    }

    /**
     * Runner + 취소 토큰 + 워커 스레드 묶음.
     */
    private static final class Worker {
        private final AbstractRunner runner;
        private final CancellationToken token;
        private final Thread thread;
        private final CountDownLatch initialized;

        private Worker(AbstractRunner runner, CancellationToken token, Thread thread, CountDownLatch initialized) {
            this.runner = runner;
            this.token = token;
            this.thread = thread;
            this.initialized = initialized;
        }
    }
}
