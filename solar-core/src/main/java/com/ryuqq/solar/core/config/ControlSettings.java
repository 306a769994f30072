package com.ryuqq.solar.core.config;

import java.time.Duration;

/**
 * 제어 루프 및 RunnerManager 타이밍 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>mainLoopInterval: 제어 루프 틱 간격 (기본 2초)</li>
 *   <li>updateInterval: 배터리 샘플링 간격 (기본 1초)</li>
 *   <li>shutdownTimeout: Runner 종료 대기 시간 (기본 5초)</li>
 *   <li>startupTimeout: 시작 시 초기화 결과 대기 시간 (기본 5초)</li>
 * </ul>
 *
 * @param mainLoopInterval 제어 루프 틱 간격 (양수)
 * @param updateInterval 배터리 샘플링 간격 (양수)
 * @param shutdownTimeout 종료 대기 시간 (0 이상)
 * @param startupTimeout 초기화 대기 시간 (0 이상)
 * @author Solar Team
 * @since 1.0.0
 */
public record ControlSettings(
    Duration mainLoopInterval,
    Duration updateInterval,
    Duration shutdownTimeout,
    Duration startupTimeout
) {

    /**
     * 기본 설정 생성자.
     */
    public ControlSettings() {
        this(Duration.ofSeconds(2), Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(5));
    }

    public ControlSettings {
        requirePositive("mainLoopInterval", mainLoopInterval);
        requirePositive("updateInterval", updateInterval);
        requireNonNegative("shutdownTimeout", shutdownTimeout);
        requireNonNegative("startupTimeout", startupTimeout);
    }

    public ControlSettings withMainLoopInterval(Duration mainLoopInterval) {
        return new ControlSettings(mainLoopInterval, updateInterval, shutdownTimeout, startupTimeout);
    }

    public ControlSettings withUpdateInterval(Duration updateInterval) {
        return new ControlSettings(mainLoopInterval, updateInterval, shutdownTimeout, startupTimeout);
    }

    public ControlSettings withShutdownTimeout(Duration shutdownTimeout) {
        return new ControlSettings(mainLoopInterval, updateInterval, shutdownTimeout, startupTimeout);
    }

    public ControlSettings withStartupTimeout(Duration startupTimeout) {
        return new ControlSettings(mainLoopInterval, updateInterval, shutdownTimeout, startupTimeout);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive (current: " + value + ")");
        }
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " cannot be negative (current: " + value + ")");
        }
    }
}
