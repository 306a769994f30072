package com.ryuqq.solar.adapter.runner.power;

import java.time.Instant;

/**
 * 전력 측정값 (V, A, W).
 *
 * @author Solar Team
 * @since 1.0.0
 */
public record PowerReading(double voltage, double current, double power, Instant timestamp) {

    public PowerReading {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        if (Double.isNaN(voltage) || Double.isNaN(current) || Double.isNaN(power)) {
            throw new IllegalArgumentException("reading values must be numbers");
        }
    }
}
