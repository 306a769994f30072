package com.ryuqq.solar.core.safety;

import java.time.Duration;

/**
 * 배터리 안전 정책 (불변 record).
 *
 * <p><strong>계산식:</strong></p>
 * <pre>
 * allowedDistance = maxDistanceFactor × (percentage / 100) × totalRange
 * lowBattery      = percentage &lt; minBatteryThreshold
 * </pre>
 *
 * <p>예: factor=0.5, range=100일 때 배터리 50%에서 허용 거리는 25입니다.</p>
 *
 * @param minBatteryThreshold 최소 배터리 퍼센트 [0, 100] (기본 20)
 * @param maxDistanceFactor 거리 계수 (양수, 기본 0.5)
 * @param totalRange 완충 시 총 주행 거리 (양수, 기본 100)
 * @param staleAfter 샘플 유효 기간 (양수, 기본 10초)
 * @author Solar Team
 * @since 1.0.0
 */
public record SafetyPolicy(
    double minBatteryThreshold,
    double maxDistanceFactor,
    double totalRange,
    Duration staleAfter
) {

    /**
     * 기본 설정 생성자.
     */
    public SafetyPolicy() {
        this(20.0, 0.5, 100.0, Duration.ofSeconds(10));
    }

    public SafetyPolicy {
        if (Double.isNaN(minBatteryThreshold) || minBatteryThreshold < 0.0 || minBatteryThreshold > 100.0) {
            throw new IllegalArgumentException(
                "minBatteryThreshold must be between 0 and 100 (current: " + minBatteryThreshold + ")"
            );
        }
        if (Double.isNaN(maxDistanceFactor) || Double.isInfinite(maxDistanceFactor) || maxDistanceFactor <= 0.0) {
            throw new IllegalArgumentException(
                "maxDistanceFactor must be positive (current: " + maxDistanceFactor + ")"
            );
        }
        if (Double.isNaN(totalRange) || Double.isInfinite(totalRange) || totalRange <= 0.0) {
            throw new IllegalArgumentException(
                "totalRange must be positive (current: " + totalRange + ")"
            );
        }
        if (staleAfter == null) {
            throw new IllegalArgumentException("staleAfter cannot be null");
        }
        if (staleAfter.isZero() || staleAfter.isNegative()) {
            throw new IllegalArgumentException("staleAfter must be positive (current: " + staleAfter + ")");
        }
    }

    /**
     * 배터리 퍼센트에 대한 허용 거리 (퍼센트에 대해 단조 비감소).
     *
     * @param percentage 배터리 퍼센트
     * @return 허용 거리
     */
    public double allowedDistance(double percentage) {
        return maxDistanceFactor * (percentage / 100.0) * totalRange;
    }

    /**
     * 저전압 여부 (임계값 자체는 저전압이 아님).
     *
     * @param percentage 배터리 퍼센트
     * @return percentage &lt; minBatteryThreshold이면 true
     */
    public boolean isLow(double percentage) {
        return percentage < minBatteryThreshold;
    }

    public SafetyPolicy withMinBatteryThreshold(double minBatteryThreshold) {
        return new SafetyPolicy(minBatteryThreshold, maxDistanceFactor, totalRange, staleAfter);
    }

    public SafetyPolicy withMaxDistanceFactor(double maxDistanceFactor) {
        return new SafetyPolicy(minBatteryThreshold, maxDistanceFactor, totalRange, staleAfter);
    }

    public SafetyPolicy withTotalRange(double totalRange) {
        return new SafetyPolicy(minBatteryThreshold, maxDistanceFactor, totalRange, staleAfter);
    }

    public SafetyPolicy withStaleAfter(Duration staleAfter) {
        return new SafetyPolicy(minBatteryThreshold, maxDistanceFactor, totalRange, staleAfter);
    }
}
