package com.ryuqq.solar.core.safety;

import java.time.Instant;

/**
 * 배터리 샘플 (불변 record).
 *
 * <p>BatterySafetyMonitor만 새 값을 만들며, ScheduleEngine은 읽기만 합니다.</p>
 *
 * @param percentage 잔량 퍼센트 [0, 100]
 * @param sampledAt 샘플 시각
 * @author Solar Team
 * @since 1.0.0
 */
public record BatteryState(double percentage, Instant sampledAt) {

    public BatteryState {
        if (Double.isNaN(percentage) || percentage < 0.0 || percentage > 100.0) {
            throw new IllegalArgumentException("percentage must be between 0 and 100 (current: " + percentage + ")");
        }
        if (sampledAt == null) {
            throw new IllegalArgumentException("sampledAt cannot be null");
        }
    }
}
