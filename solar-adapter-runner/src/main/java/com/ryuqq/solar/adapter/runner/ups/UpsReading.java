package com.ryuqq.solar.adapter.runner.ups;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * UPS(PiPower 계열) 상태 측정값.
 *
 * @param batteryVoltage 배터리 전압 (ADC가 없으면 NaN)
 * @param usbPowerInput USB 입력 전원 감지 여부
 * @param charging 충전 중 여부
 * @param lowBattery 저전압 핀 신호
 * @param timestamp 측정 시각
 * @author Solar Team
 * @since 1.0.0
 */
public record UpsReading(
    double batteryVoltage,
    boolean usbPowerInput,
    boolean charging,
    boolean lowBattery,
    Instant timestamp
) {

    public UpsReading {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
    }

    public OptionalDouble voltage() {
        return Double.isNaN(batteryVoltage) ? OptionalDouble.empty() : OptionalDouble.of(batteryVoltage);
    }
}
