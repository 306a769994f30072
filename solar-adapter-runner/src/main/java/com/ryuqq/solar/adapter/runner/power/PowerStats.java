package com.ryuqq.solar.adapter.runner.power;

/**
 * 보관 중인 측정 이력의 통계.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public record PowerStats(
    int sampleCount,
    double averageVoltage,
    double averageCurrent,
    double averagePower,
    double minPower,
    double maxPower
) {
}
