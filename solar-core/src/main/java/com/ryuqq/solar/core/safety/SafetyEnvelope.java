package com.ryuqq.solar.core.safety;

/**
 * 배터리로부터 유도된 안전 범위 (저장하지 않음, 매 평가마다 재계산).
 *
 * @param batteryPercentage 계산에 사용된 배터리 퍼센트 (stale이면 마지막 값 또는 0)
 * @param allowedDistance Dock으로부터 허용되는 최대 거리
 * @param lowBattery 저전압 여부 (stale이면 항상 true)
 * @param stale 샘플이 없거나 유예 기간을 초과했는지 여부
 * @author Solar Team
 * @since 1.0.0
 */
public record SafetyEnvelope(
    double batteryPercentage,
    double allowedDistance,
    boolean lowBattery,
    boolean stale
) {

    public SafetyEnvelope {
        if (Double.isNaN(allowedDistance) || allowedDistance < 0.0) {
            throw new IllegalArgumentException("allowedDistance cannot be negative (current: " + allowedDistance + ")");
        }
        if (stale && !lowBattery) {
            throw new IllegalArgumentException("stale envelope must report lowBattery");
        }
    }

    /**
     * 최신 샘플로부터 엔벨로프 계산.
     *
     * @param policy 안전 정책
     * @param percentage 배터리 퍼센트
     * @return 엔벨로프
     */
    public static SafetyEnvelope of(SafetyPolicy policy, double percentage) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        return new SafetyEnvelope(percentage, policy.allowedDistance(percentage), policy.isLow(percentage), false);
    }

    /**
     * 데이터 부재 시 보수적 엔벨로프 (저전압, 허용 거리 0).
     *
     * @param lastKnownPercentage 마지막으로 알려진 퍼센트 (없으면 0)
     * @return stale 엔벨로프
     */
    public static SafetyEnvelope stale(double lastKnownPercentage) {
        return new SafetyEnvelope(lastKnownPercentage, 0.0, true, true);
    }

    /**
     * 주어진 거리의 대상이 안전 범위 안인지 확인.
     *
     * @param distance Dock으로부터의 거리
     * @return 저전압이 아니고 거리가 허용 범위 이내이면 true
     */
    public boolean permits(double distance) {
        return !lowBattery && distance <= allowedDistance;
    }
}
