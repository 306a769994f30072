package com.ryuqq.solar.application.runner;

import com.ryuqq.solar.core.config.ConfigurationException;
import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.runner.RunnerStatus;
import com.ryuqq.solar.core.runner.SystemStatus;
import com.ryuqq.solar.core.statemachine.RunnerState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RunnerManager 통합 테스트 (실제 워커 스레드 사용).
 *
 * <ul>
 *   <li>시작: 검증 우선, 비활성 건너뜀, 초기화 실패 격리</li>
 *   <li>상태 집계</li>
 *   <li>종료: 정상 종료, 강제 종료, 멱등성</li>
 *   <li>런타임 startRunner/stopRunner</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
class RunnerManagerTest {

    private static final Duration INTERVAL = Duration.ofMillis(100);

    private final Map<RunnerKey, TestRunner> created = new ConcurrentHashMap<>();
    private final AtomicInteger createCount = new AtomicInteger();
    private volatile Consumer<TestRunner> customizer = runner -> { };
    private final CountDownLatch release = new CountDownLatch(1);

    private RunnerManager manager;

    @BeforeEach
    void setUp() {
        RunnerTypeRegistry registry = RunnerTypeRegistry.builder()
            .register("test", settings -> {
                createCount.incrementAndGet();
                TestRunner runner = new TestRunner(settings);
                customizer.accept(runner);
                created.put(settings.key(), runner);
                return runner;
            })
            .alias("test_alias", "test")
            .build();
        manager = new RunnerManager(registry, Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        manager.shutdown(Duration.ofSeconds(1));
    }

    // ============================================================
    // 1. 시작
    // ============================================================

    @Test
    void start_활성_Runner를_모두_RUNNING으로_시작() throws InterruptedException {
        // when
        boolean started = manager.start(List.of(settings("a"), settings("b")));

        // then
        assertThat(started).isTrue();
        assertThat(manager.runnerKeys()).containsExactly(RunnerKey.of("a"), RunnerKey.of("b"));
        awaitFirstCycle("a");
        awaitFirstCycle("b");

        SystemStatus status = manager.getSystemStatus();
        assertThat(status.runningCount()).isEqualTo(2);
        assertThat(status.totalCount()).isEqualTo(2);
        assertThat(status.overallHealthy()).isTrue();
    }

    @Test
    void start_비활성_항목은_인스턴스화하지_않음() {
        manager.start(List.of(settings("a"), settings("b").withEnabled(false)));

        assertThat(manager.getRunner(RunnerKey.of("b"))).isEmpty();
        assertThat(createCount.get()).isEqualTo(1);
        assertThat(manager.getSystemStatus().totalCount()).isEqualTo(1);
    }

    @Test
    void start_중복_키면_아무것도_시작하지_않음() {
        assertThatThrownBy(() -> manager.start(List.of(settings("a"), settings("b"), settings("a"))))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("duplicate runner key: a");

        assertThat(createCount.get()).isZero();
        assertThat(manager.runnerKeys()).isEmpty();
    }

    @Test
    void start_알_수_없는_타입이면_아무것도_시작하지_않음() {
        RunnerSettings unknown = RunnerSettings.of("cam", "webcam");

        assertThatThrownBy(() -> manager.start(List.of(settings("a"), unknown)))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("webcam");

        assertThat(createCount.get()).isZero();
    }

    @Test
    void start_별칭_타입도_해석됨() {
        manager.start(List.of(RunnerSettings.of("a", "TEST_ALIAS").withInterval(INTERVAL)));

        assertThat(manager.getRunner(RunnerKey.of("a"))).isPresent();
    }

    @Test
    void start_생성자_오류면_스레드를_띄우지_않음() {
        RunnerTypeRegistry registry = RunnerTypeRegistry.builder()
            .register("test", settings -> new TestRunner(settings))
            .register("broken", settings -> {
                throw new IllegalArgumentException("queue_capacity must be positive");
            })
            .build();
        RunnerManager other = new RunnerManager(registry, Duration.ofSeconds(1));

        assertThatThrownBy(() -> other.start(List.of(settings("a"), RunnerSettings.of("b", "broken"))))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("queue_capacity");
        assertThat(other.runnerKeys()).isEmpty();
    }

    @Test
    void start_초기화_실패는_해당_Runner만_ERROR() throws InterruptedException {
        customizer = runner -> {
            if (runner.key().getValue().equals("bad")) {
                runner.initResult.set(false);
            }
        };

        manager.start(List.of(settings("good"), settings("bad")));
        awaitFirstCycle("good");

        SystemStatus status = manager.getSystemStatus();
        assertThat(status.runner(RunnerKey.of("bad")).orElseThrow().state()).isEqualTo(RunnerState.ERROR);
        assertThat(status.runner(RunnerKey.of("good")).orElseThrow().state()).isEqualTo(RunnerState.RUNNING);
        assertThat(status.count(RunnerState.ERROR)).isEqualTo(1);
        assertThat(status.overallHealthy()).isFalse();
        // 초기화 실패한 Runner는 사이클을 돌지 않음
        assertThat(created.get(RunnerKey.of("bad")).cycles.get()).isZero();
    }

    @Test
    void start_두번째_호출은_false() {
        assertThat(manager.start(List.of(settings("a")))).isTrue();
        assertThat(manager.start(List.of(settings("b")))).isFalse();
        assertThat(manager.getRunner(RunnerKey.of("b"))).isEmpty();
    }

    @Test
    void start_빈_목록이면_healthy() {
        assertThat(manager.start(List.of())).isTrue();
        assertThat(manager.getSystemStatus().overallHealthy()).isTrue();
    }

    // ============================================================
    // 2. 종료
    // ============================================================

    @Test
    void shutdown_모든_Runner를_STOPPED로_정상_종료() throws InterruptedException {
        manager.start(List.of(settings("a"), settings("b")));
        awaitFirstCycle("a");

        SystemStatus status = manager.shutdown(Duration.ofSeconds(2));

        assertThat(status.count(RunnerState.STOPPED)).isEqualTo(2);
        assertThat(status.runners()).noneMatch(RunnerStatus::forcedStop);
        assertThat(created.get(RunnerKey.of("a")).cleanups.get()).isEqualTo(1);
    }

    @Test
    void shutdown_멱등() {
        manager.start(List.of(settings("a")));

        SystemStatus first = manager.shutdown(Duration.ofSeconds(1));
        SystemStatus second = manager.shutdown(Duration.ofSeconds(1));

        assertThat(second).isSameAs(first);
        assertThat(manager.getSystemStatus()).isSameAs(first);
        assertThat(manager.start(List.of(settings("b")))).isFalse();
        assertThat(manager.startRunner(settings("c"))).isFalse();
    }

    @Test
    void shutdown_기한_초과_Runner는_강제_종료() throws InterruptedException {
        customizer = runner -> runner.blockUntil = release;
        manager.start(List.of(settings("stuck"), settings("also-stuck")));
        // 사이클이 시작되어 블로킹될 때까지 대기
        TestRunner stuck = created.get(RunnerKey.of("stuck"));
        awaitCondition(() -> stuck.cycles.get() > 0);

        long startNanos = System.nanoTime();
        SystemStatus status = manager.shutdown(Duration.ofMillis(300));
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        // timeout + ε 안에 반환
        assertThat(elapsedMillis).isLessThan(300 + 1_000);
        RunnerStatus stuckStatus = status.runner(RunnerKey.of("stuck")).orElseThrow();
        assertThat(stuckStatus.state()).isEqualTo(RunnerState.STOPPED);
        assertThat(stuckStatus.forcedStop()).isTrue();
    }

    // ============================================================
    // 3. 런타임 변경
    // ============================================================

    @Test
    void stopRunner_제거_후_startRunner로_새_인스턴스_생성() throws InterruptedException {
        manager.start(List.of(settings("a")));
        awaitFirstCycle("a");
        Runner first = manager.getRunner(RunnerKey.of("a")).orElseThrow();

        assertThat(manager.stopRunner(RunnerKey.of("a"), Duration.ofSeconds(1))).isTrue();
        assertThat(first.state()).isEqualTo(RunnerState.STOPPED);
        assertThat(manager.getRunner(RunnerKey.of("a"))).isEmpty();

        assertThat(manager.startRunner(settings("a"))).isTrue();
        Runner second = manager.getRunner(RunnerKey.of("a")).orElseThrow();
        assertThat(second).isNotSameAs(first);
        assertThat(second.state()).isEqualTo(RunnerState.RUNNING);
    }

    @Test
    void startRunner_이미_활성이면_false() {
        manager.start(List.of(settings("a")));

        assertThat(manager.startRunner(settings("a"))).isFalse();
        assertThat(createCount.get()).isEqualTo(1);
    }

    @Test
    void startRunner_알_수_없는_타입이면_ConfigurationException() {
        assertThatThrownBy(() -> manager.startRunner(RunnerSettings.of("x", "nope")))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void stopRunner_없는_키면_false() {
        assertThat(manager.stopRunner(RunnerKey.of("ghost"), Duration.ofMillis(10))).isFalse();
    }

    @Test
    void getRunner_없는_키면_empty() {
        assertThat(manager.getRunner(RunnerKey.of("ghost"))).isEmpty();
    }

    // ============================================================
    // Helper Methods
    // ============================================================

    private static RunnerSettings settings(String key) {
        return RunnerSettings.of(key, "test").withInterval(INTERVAL);
    }

    private void awaitFirstCycle(String key) throws InterruptedException {
        TestRunner runner = created.get(RunnerKey.of(key));
        assertThat(runner.firstCycle.await(5, TimeUnit.SECONDS)).isTrue();
    }

    private static void awaitCondition(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }
}
