package com.ryuqq.solar.application.safety;

import com.ryuqq.solar.core.safety.BatteryState;
import com.ryuqq.solar.core.safety.SafetyEnvelope;
import com.ryuqq.solar.core.safety.SafetyPolicy;
import com.ryuqq.solar.core.spi.BatterySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 배터리 샘플을 유지하고 안전 엔벨로프를 계산합니다.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>샘플은 [0, 100]으로 클램프되어 저장됨</li>
 *   <li>BatterySource 실패 시 이전 샘플 유지 (이후 staleness가 적용됨)</li>
 *   <li>샘플이 없거나 staleAfter보다 오래되면 stale 엔벨로프 (저전압, 허용 거리 0)</li>
 * </ul>
 *
 * <p>샘플은 제어 루프 스레드에서만 쓰지만, 엔벨로프 조회는 어느 스레드에서나 가능합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class BatterySafetyMonitor {

    private static final Logger log = LoggerFactory.getLogger(BatterySafetyMonitor.class);

    private final BatterySource source;
    private final SafetyPolicy policy;
    private final Clock clock;
    private final AtomicReference<BatteryState> latest = new AtomicReference<>();

    public BatterySafetyMonitor(BatterySource source, SafetyPolicy policy, Clock clock) {
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.source = source;
        this.policy = policy;
        this.clock = clock;
    }

    /**
     * BatterySource를 읽어 샘플 갱신.
     *
     * @return 갱신 후 최신 샘플 (읽기 실패 시 이전 샘플)
     */
    public Optional<BatteryState> sample() {
        OptionalDouble reading;
        try {
            reading = source.readPercentage();
        } catch (RuntimeException e) {
            log.warn("Battery source failed, keeping previous sample: {}", e.toString());
            return latest();
        }
        if (reading == null || reading.isEmpty() || Double.isNaN(reading.getAsDouble())) {
            log.warn("Battery source returned no reading, keeping previous sample");
            return latest();
        }
        return Optional.of(record(reading.getAsDouble()));
    }

    /**
     * 배터리 퍼센트 기록 (클램프 후 현재 시각으로 저장).
     *
     * @param percentage 배터리 퍼센트
     * @return 저장된 샘플
     * @throws IllegalArgumentException NaN인 경우
     */
    public BatteryState record(double percentage) {
        if (Double.isNaN(percentage)) {
            throw new IllegalArgumentException("percentage cannot be NaN");
        }
        double clamped = Math.max(0.0, Math.min(100.0, percentage));
        if (clamped != percentage) {
            log.debug("Battery reading {} clamped to {}", percentage, clamped);
        }
        BatteryState state = new BatteryState(clamped, clock.instant());
        latest.set(state);
        return state;
    }

    /**
     * 최신 샘플로부터 엔벨로프 계산 (캐시하지 않음).
     */
    public SafetyEnvelope envelope() {
        BatteryState state = latest.get();
        if (state == null) {
            return SafetyEnvelope.stale(0.0);
        }
        if (isStale(state)) {
            return SafetyEnvelope.stale(state.percentage());
        }
        return SafetyEnvelope.of(policy, state.percentage());
    }

    public Optional<BatteryState> latest() {
        return Optional.ofNullable(latest.get());
    }

    public SafetyPolicy policy() {
        return policy;
    }

    private boolean isStale(BatteryState state) {
        Duration age = Duration.between(state.sampledAt(), clock.instant());
        return age.compareTo(policy.staleAfter()) > 0;
    }
}
