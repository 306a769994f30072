package com.ryuqq.solar.adapter.runner.power;

import com.ryuqq.solar.core.runner.RunnerSettings;

/**
 * PowerMonitorRunner 속성.
 *
 * <ul>
 *   <li>i2cAddress: 센서 주소 (기본 0x40, 0x03~0x77)</li>
 *   <li>lowPowerThreshold: 저전력 경계 W (기본 0.5)</li>
 *   <li>highPowerThreshold: 고전력 경계 W (기본 10.0)</li>
 *   <li>alertAfter: 경보까지 연속 측정 수 (기본 3)</li>
 *   <li>historySize: 보관 이력 수 (기본 100)</li>
 *   <li>logMeasurements: 측정값 DEBUG 로그 (기본 true)</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public record PowerMonitorConfig(
    int i2cAddress,
    double lowPowerThreshold,
    double highPowerThreshold,
    int alertAfter,
    int historySize,
    boolean logMeasurements
) {

    public PowerMonitorConfig() {
        this(0x40, 0.5, 10.0, 3, 100, true);
    }

    public PowerMonitorConfig {
        if (i2cAddress < 0x03 || i2cAddress > 0x77) {
            throw new IllegalArgumentException(
                "i2c_address must be between 0x03 and 0x77 (current: 0x" + Integer.toHexString(i2cAddress) + ")"
            );
        }
        if (lowPowerThreshold < 0) {
            throw new IllegalArgumentException(
                "low_power_threshold cannot be negative (current: " + lowPowerThreshold + ")"
            );
        }
        if (highPowerThreshold <= lowPowerThreshold) {
            throw new IllegalArgumentException(
                "high_power_threshold must be greater than low_power_threshold (current: "
                    + highPowerThreshold + " <= " + lowPowerThreshold + ")"
            );
        }
        if (alertAfter <= 0) {
            throw new IllegalArgumentException("alert_after must be positive (current: " + alertAfter + ")");
        }
        if (historySize <= 0) {
            throw new IllegalArgumentException("history_size must be positive (current: " + historySize + ")");
        }
    }

    /**
     * Runner 속성에서 생성.
     *
     * @throws IllegalArgumentException 값이 범위를 벗어나거나 형식이 잘못된 경우
     */
    public static PowerMonitorConfig from(RunnerSettings settings) {
        PowerMonitorConfig defaults = new PowerMonitorConfig();
        return new PowerMonitorConfig(
            settings.intProperty("i2c_address", defaults.i2cAddress()),
            settings.doubleProperty("low_power_threshold", defaults.lowPowerThreshold()),
            settings.doubleProperty("high_power_threshold", defaults.highPowerThreshold()),
            settings.intProperty("alert_after", defaults.alertAfter()),
            settings.intProperty("history_size", defaults.historySize()),
            settings.booleanProperty("log_measurements", defaults.logMeasurements())
        );
    }
}
