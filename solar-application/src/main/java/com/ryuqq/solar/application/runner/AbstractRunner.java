package com.ryuqq.solar.application.runner;

import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.runner.RunnerStatus;
import com.ryuqq.solar.core.statemachine.RunnerState;
import com.ryuqq.solar.core.statemachine.RunnerStateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runner 기본 구현.
 *
 * <p>하위 클래스는 {@link #initialize()}와 {@link #workCycle()}만 구현하면 되며,
 * 상태 전이, 오류 집계, 건강 판정, 워커 루프는 이 클래스가 담당합니다.</p>
 *
 * <p><strong>워커 스레드 흐름:</strong></p>
 * <pre>
 * CREATED → INITIALIZING
 *   initialize() 성공 → RUNNING → 루프 시작
 *   initialize() 실패/예외 → ERROR (루프 없음)
 *
 * while (!token.isCancelled()):
 *   runCycle()  (성공: 카운터 리셋, ERROR → RUNNING / 실패: 카운터 증가, RUNNING → ERROR)
 *   token.await(interval)
 *
 * 종료 시: cleanup() → STOPPED
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>runCycle()은 Runner별 락으로 직렬화 (같은 Runner의 사이클이 겹치지 않음)</li>
 *   <li>상태 필드는 stateLock 아래에서 함께 갱신/조회되어 스냅샷이 일관됨</li>
 *   <li>다른 Runner와 공유하는 락 없음</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public abstract class AbstractRunner implements Runner {

    /**
     * 마지막 성공 사이클 이후 이 배수의 interval이 지나면 unhealthy.
     */
    static final int HEALTHY_SUCCESS_WINDOW = 3;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final RunnerSettings settings;
    private final Clock clock;
    private final ReentrantLock cycleLock = new ReentrantLock();
    private final Object stateLock = new Object();

    private RunnerState state = RunnerState.CREATED;
    private int consecutiveErrors;
    private String lastError;
    private Instant lastSuccessAt;
    private boolean forcedStop;

    /**
     * 시스템 UTC 시계로 생성.
     *
     * @param settings Runner 설정
     */
    protected AbstractRunner(RunnerSettings settings) {
        this(settings, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param settings Runner 설정
     * @param clock 건강 판정 및 성공 시각 기록용 시계
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    protected AbstractRunner(RunnerSettings settings, Clock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.settings = settings;
        this.clock = clock;
    }

    // ========== 하위 클래스 구현 지점 ==========

    /**
     * 1회성 초기화 (센서 연결 등).
     *
     * @return 성공 여부
     * @throws Exception 초기화 실패 (false 반환과 동일하게 처리)
     */
    protected abstract boolean initialize() throws Exception;

    /**
     * 주기 작업 한 단위.
     *
     * @throws Exception 사이클 실패 (프레임워크가 집계)
     */
    protected abstract void workCycle() throws Exception;

    /**
     * 구현체별 추가 건강 조건 (기본 true).
     *
     * <p>부수 효과가 없어야 합니다.</p>
     */
    protected boolean checkHealth() {
        return true;
    }

    /**
     * 워커 스레드 종료 직전 호출되는 정리 훅 (기본 no-op).
     */
    protected void cleanup() {
    }

    // ========== Runner ==========

    @Override
    public RunnerKey key() {
        return settings.key();
    }

    @Override
    public RunnerSettings settings() {
        return settings;
    }

    @Override
    public RunnerState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    @Override
    public boolean isHealthy() {
        synchronized (stateLock) {
            return isHealthyLocked();
        }
    }

    @Override
    public RunnerStatus status() {
        synchronized (stateLock) {
            return new RunnerStatus(
                settings.key(),
                settings.label(),
                settings.type(),
                state,
                isHealthyLocked(),
                consecutiveErrors,
                settings.errorCeiling(),
                lastError,
                lastSuccessAt,
                forcedStop
            );
        }
    }

    protected final Clock clock() {
        return clock;
    }

    // ========== 프레임워크 (RunnerManager 및 테스트에서 사용) ==========

    /**
     * 초기화 단계 실행 (CREATED → INITIALIZING → RUNNING | ERROR).
     *
     * @return 초기화 성공 여부
     * @throws IllegalStateException CREATED 상태가 아닌 경우
     */
    public final boolean runInitialize() {
        synchronized (stateLock) {
            state = RunnerStateTransition.transition(state, RunnerState.INITIALIZING);
        }
        boolean initialized;
        String failure;
        try {
            initialized = initialize();
            failure = initialized ? null : "initialize() returned false";
        } catch (Exception e) {
            initialized = false;
            failure = "Initialization failed: " + describe(e);
            log.error("Runner '{}' initialization threw", key(), e);
        }

        synchronized (stateLock) {
            if (state.isTerminal()) {
                // 초기화 중 강제 종료됨
                return false;
            }
            if (initialized) {
                state = RunnerStateTransition.transition(state, RunnerState.RUNNING);
            } else {
                state = RunnerStateTransition.transition(state, RunnerState.ERROR);
                lastError = failure;
            }
        }

        if (initialized) {
            log.info("Runner '{}' ({}) initialized", key(), settings.type());
        } else {
            log.error("Runner '{}' failed to initialize: {}", key(), failure);
        }
        return initialized;
    }

    /**
     * 워크 사이클 1회 실행.
     *
     * <p>성공하면 연속 오류를 0으로 리셋하고 ERROR에서 RUNNING으로 복귀합니다.
     * 실패하면 연속 오류를 증가시키고 마지막 오류를 기록하며 RUNNING에서 ERROR로 전이합니다.
     * 상한 초과 후에도 사이클은 계속됩니다.</p>
     *
     * <p>사이클이 InterruptedException으로 끝나면 인터럽트 플래그를 복원합니다.</p>
     *
     * @return 사이클 성공 여부
     */
    public final boolean runCycle() {
        cycleLock.lock();
        try {
            try {
                workCycle();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                recordFailure(e);
                return false;
            } catch (Exception e) {
                recordFailure(e);
                return false;
            }
            recordSuccess();
            return true;
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * 워커 스레드 본체.
     *
     * @param token 취소 토큰
     * @param initialized 초기화 결과가 나오면 카운트다운되는 래치
     */
    public final void execute(CancellationToken token, CountDownLatch initialized) {
        if (token == null) {
            throw new IllegalArgumentException("token cannot be null");
        }
        if (initialized == null) {
            throw new IllegalArgumentException("initialized cannot be null");
        }
        boolean loop = false;
        try {
            if (token.isCancelled()) {
                return;
            }
            loop = runInitialize();
            initialized.countDown();
            if (!loop) {
                return;
            }
            while (!token.isCancelled()) {
                runCycle();
                if (token.await(settings.interval())) {
                    break;
                }
            }
        } finally {
            initialized.countDown();
            runCleanup();
            if (loop || token.isCancelled()) {
                markStopped(false);
            }
            log.debug("Runner '{}' worker exiting (state: {})", key(), state());
        }
    }

    /**
     * STOPPED로 전이 (이미 STOPPED면 무시).
     *
     * @param forced 종료 기한 초과로 강제 종료되었는지 여부
     * @return 이번 호출로 전이되었으면 true
     */
    public final boolean markStopped(boolean forced) {
        synchronized (stateLock) {
            if (state.isTerminal()) {
                return false;
            }
            state = RunnerStateTransition.transition(state, RunnerState.STOPPED);
            forcedStop = forced;
            return true;
        }
    }

    // ========== 내부 ==========

    private boolean isHealthyLocked() {
        if (state != RunnerState.RUNNING) {
            return false;
        }
        if (consecutiveErrors > settings.errorCeiling()) {
            return false;
        }
        if (lastSuccessAt == null) {
            return false;
        }
        Duration window = settings.interval().multipliedBy(HEALTHY_SUCCESS_WINDOW);
        if (Duration.between(lastSuccessAt, clock.instant()).compareTo(window) > 0) {
            return false;
        }
        try {
            return checkHealth();
        } catch (RuntimeException e) {
            log.debug("Runner '{}' health hook threw: {}", key(), e.toString());
            return false;
        }
    }

    private void recordSuccess() {
        Instant now = clock.instant();
        boolean recovered = false;
        synchronized (stateLock) {
            consecutiveErrors = 0;
            lastSuccessAt = now;
            if (state == RunnerState.ERROR) {
                state = RunnerStateTransition.transition(state, RunnerState.RUNNING);
                recovered = true;
            }
        }
        if (recovered) {
            log.info("Runner '{}' recovered", key());
        }
    }

    private void recordFailure(Exception e) {
        int errors;
        synchronized (stateLock) {
            consecutiveErrors++;
            errors = consecutiveErrors;
            lastError = describe(e);
            if (state == RunnerState.RUNNING) {
                state = RunnerStateTransition.transition(state, RunnerState.ERROR);
            }
        }
        if (errors == settings.errorCeiling() + 1) {
            log.error("Runner '{}' exceeded error ceiling ({}): {}", key(), settings.errorCeiling(), describe(e), e);
        } else {
            log.warn("Runner '{}' cycle failed ({} consecutive): {}", key(), errors, describe(e));
        }
    }

    private void runCleanup() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("Runner '{}' cleanup failed", key(), e);
        }
    }

    private static String describe(Exception e) {
        String message = e.getMessage();
        return message == null ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
    }
}
