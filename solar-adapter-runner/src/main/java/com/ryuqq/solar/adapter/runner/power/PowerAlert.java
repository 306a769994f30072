package com.ryuqq.solar.adapter.runner.power;

/**
 * 연속 측정으로 발생한 전력 경보.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public enum PowerAlert {
    LOW_POWER,
    HIGH_POWER
}
