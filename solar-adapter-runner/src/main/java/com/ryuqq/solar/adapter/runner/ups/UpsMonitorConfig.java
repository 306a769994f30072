package com.ryuqq.solar.adapter.runner.ups;

import com.ryuqq.solar.core.runner.RunnerSettings;

/**
 * UpsMonitorRunner 속성.
 *
 * @param lowBatteryAlertThreshold 저전압 경보까지 연속 측정 수 (기본 3)
 * @param noUsbAlertThreshold USB 전원 상실 경보까지 연속 측정 수 (기본 3)
 * @author Solar Team
 * @since 1.0.0
 */
public record UpsMonitorConfig(int lowBatteryAlertThreshold, int noUsbAlertThreshold) {

    public UpsMonitorConfig() {
        this(3, 3);
    }

    public UpsMonitorConfig {
        if (lowBatteryAlertThreshold <= 0) {
            throw new IllegalArgumentException(
                "low_battery_alert_threshold must be positive (current: " + lowBatteryAlertThreshold + ")"
            );
        }
        if (noUsbAlertThreshold <= 0) {
            throw new IllegalArgumentException(
                "no_usb_alert_threshold must be positive (current: " + noUsbAlertThreshold + ")"
            );
        }
    }

    public static UpsMonitorConfig from(RunnerSettings settings) {
        UpsMonitorConfig defaults = new UpsMonitorConfig();
        return new UpsMonitorConfig(
            settings.intProperty("low_battery_alert_threshold", defaults.lowBatteryAlertThreshold()),
            settings.intProperty("no_usb_alert_threshold", defaults.noUsbAlertThreshold())
        );
    }
}
