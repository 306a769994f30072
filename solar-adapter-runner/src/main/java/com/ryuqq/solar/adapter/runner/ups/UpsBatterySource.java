package com.ryuqq.solar.adapter.runner.ups;

import com.ryuqq.solar.application.runner.RunnerManager;
import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.spi.BatterySource;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Supplier;

/**
 * UPS 측정 전압을 배터리 퍼센트로 변환하는 BatterySource.
 *
 * <pre>
 * percentage = (voltage - 6.0) / (8.4 - 6.0) × 100   (0~100으로 클램프)
 * </pre>
 *
 * <p>측정값이 없거나, 전압을 모르거나, maxReadingAge보다 오래된 측정이면 empty를 반환합니다.
 * empty는 BatterySafetyMonitor에서 stale로 이어집니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class UpsBatterySource implements BatterySource {

    public static final double EMPTY_VOLTAGE = 6.0;
    public static final double FULL_VOLTAGE = 8.4;

    private final Supplier<Optional<UpsReading>> readings;
    private final Clock clock;
    private final Duration maxReadingAge;

    public UpsBatterySource(Supplier<Optional<UpsReading>> readings, Clock clock, Duration maxReadingAge) {
        if (readings == null) {
            throw new IllegalArgumentException("readings cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (maxReadingAge == null || maxReadingAge.isNegative() || maxReadingAge.isZero()) {
            throw new IllegalArgumentException("maxReadingAge must be positive (current: " + maxReadingAge + ")");
        }
        this.readings = readings;
        this.clock = clock;
        this.maxReadingAge = maxReadingAge;
    }

    /**
     * RunnerManager에 등록된 UPS Runner의 최신 측정값을 읽는 소스.
     *
     * <p>Runner가 재시작되어도 매 호출마다 키로 다시 조회합니다.</p>
     */
    public static UpsBatterySource fromRunner(
        RunnerManager manager, RunnerKey key, Clock clock, Duration maxReadingAge
    ) {
        if (manager == null) {
            throw new IllegalArgumentException("manager cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return new UpsBatterySource(
            () -> manager.getRunner(key)
                .filter(UpsMonitorRunner.class::isInstance)
                .map(UpsMonitorRunner.class::cast)
                .flatMap(UpsMonitorRunner::lastReading),
            clock,
            maxReadingAge
        );
    }

    /**
     * 전압 → 퍼센트 변환.
     */
    public static double toPercentage(double voltage) {
        double ratio = (voltage - EMPTY_VOLTAGE) / (FULL_VOLTAGE - EMPTY_VOLTAGE);
        return Math.max(0.0, Math.min(100.0, ratio * 100.0));
    }

    @Override
    public OptionalDouble readPercentage() {
        Optional<UpsReading> reading = readings.get();
        if (reading.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (Duration.between(reading.get().timestamp(), clock.instant()).compareTo(maxReadingAge) > 0) {
            return OptionalDouble.empty();
        }
        OptionalDouble voltage = reading.get().voltage();
        if (voltage.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(toPercentage(voltage.getAsDouble()));
    }
}
