package com.ryuqq.solar.adapter.runner.ups;

import com.ryuqq.solar.adapter.runner.SensorReadException;
import com.ryuqq.solar.application.runner.AbstractRunner;
import com.ryuqq.solar.core.runner.RunnerSettings;

import java.time.Clock;
import java.util.Optional;

/**
 * UPS 배터리 모니터 Runner ({@code ups_monitor}, 별칭 {@code pipower}).
 *
 * <p>연속 저전압/USB 전원 상실 측정 수가 경보 기준에 도달하면 WARN을 1회 남기고,
 * 경보 이후 USB 전원이 돌아오면 INFO를 남깁니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class UpsMonitorRunner extends AbstractRunner {

    private final UpsSensor sensor;
    private final UpsMonitorConfig config;

    private volatile UpsReading lastReading;
    private volatile int consecutiveLowBattery;
    private volatile int consecutiveNoUsb;

    public UpsMonitorRunner(RunnerSettings settings, UpsSensor sensor) {
        this(settings, sensor, Clock.systemUTC());
    }

    public UpsMonitorRunner(RunnerSettings settings, UpsSensor sensor, Clock clock) {
        super(settings, clock);
        if (sensor == null) {
            throw new IllegalArgumentException("sensor cannot be null");
        }
        this.sensor = sensor;
        this.config = UpsMonitorConfig.from(settings);
    }

    @Override
    protected boolean initialize() throws SensorReadException {
        sensor.open();
        lastReading = sensor.read(clock().instant());
        return true;
    }

    @Override
    protected void workCycle() throws SensorReadException {
        UpsReading reading = sensor.read(clock().instant());
        lastReading = reading;
        checkAlerts(reading);
        log.debug("{} - battery {}V, usb {}, charging {}, low {}", settings().label(),
            reading.voltage().isPresent() ? String.format("%.2f", reading.batteryVoltage()) : "n/a",
            reading.usbPowerInput(), reading.charging(), reading.lowBattery());
    }

    @Override
    protected void cleanup() {
        sensor.close();
    }

    public Optional<UpsReading> lastReading() {
        return Optional.ofNullable(lastReading);
    }

    public UpsMonitorConfig config() {
        return config;
    }

    public boolean isLowBatteryAlert() {
        return consecutiveLowBattery >= config.lowBatteryAlertThreshold();
    }

    public boolean isUsbPowerLost() {
        return consecutiveNoUsb >= config.noUsbAlertThreshold();
    }

    private void checkAlerts(UpsReading reading) {
        if (reading.lowBattery()) {
            consecutiveLowBattery++;
            if (consecutiveLowBattery == config.lowBatteryAlertThreshold()) {
                log.warn("{} - LOW BATTERY{} for {} consecutive readings", settings().label(),
                    reading.voltage().isPresent() ? String.format(" (%.2fV)", reading.batteryVoltage()) : "",
                    consecutiveLowBattery);
            }
        } else {
            consecutiveLowBattery = 0;
        }

        if (!reading.usbPowerInput()) {
            consecutiveNoUsb++;
            if (consecutiveNoUsb == config.noUsbAlertThreshold()) {
                log.warn("{} - USB POWER LOST for {} consecutive readings", settings().label(), consecutiveNoUsb);
            }
        } else {
            if (consecutiveNoUsb >= config.noUsbAlertThreshold()) {
                log.info("{} - USB power restored", settings().label());
            }
            consecutiveNoUsb = 0;
        }
    }
}
