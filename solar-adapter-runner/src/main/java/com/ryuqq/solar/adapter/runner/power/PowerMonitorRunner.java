package com.ryuqq.solar.adapter.runner.power;

import com.ryuqq.solar.adapter.runner.SensorReadException;
import com.ryuqq.solar.application.runner.AbstractRunner;
import com.ryuqq.solar.core.runner.RunnerSettings;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 전력 모니터 Runner ({@code power_monitor}, 별칭 {@code ina219}).
 *
 * <p><strong>사이클:</strong></p>
 * <pre>
 * 1. PowerSensor.read()  (실패 시 SensorReadException → 프레임워크가 집계)
 * 2. 이력에 추가 (historySize 초과분은 오래된 것부터 제거)
 * 3. 경보 판정:
 *    power &lt; lowPowerThreshold  → 저전력 연속 카운트 증가, 고전력 카운트 리셋
 *    power &gt; highPowerThreshold → 고전력 연속 카운트 증가, 저전력 카운트 리셋
 *    그 외                       → 두 카운트 모두 리셋
 *    카운트가 alertAfter에 도달한 순간 WARN 1회
 * </pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class PowerMonitorRunner extends AbstractRunner {

    private final PowerSensor sensor;
    private final PowerMonitorConfig config;

    private final Deque<PowerReading> history = new ArrayDeque<>();
    private int consecutiveLow;
    private int consecutiveHigh;

    public PowerMonitorRunner(RunnerSettings settings, PowerSensor sensor) {
        this(settings, sensor, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @throws IllegalArgumentException 속성 값이 잘못되었거나 sensor가 null인 경우
     */
    public PowerMonitorRunner(RunnerSettings settings, PowerSensor sensor, Clock clock) {
        super(settings, clock);
        if (sensor == null) {
            throw new IllegalArgumentException("sensor cannot be null");
        }
        this.sensor = sensor;
        this.config = PowerMonitorConfig.from(settings);
    }

    @Override
    protected boolean initialize() throws SensorReadException {
        sensor.open();
        PowerReading probe = sensor.read(clock().instant());
        log.debug("{} sensor at 0x{} responded: {}V",
            settings().label(), Integer.toHexString(config.i2cAddress()), probe.voltage());
        return true;
    }

    @Override
    protected void workCycle() throws SensorReadException {
        PowerReading reading = sensor.read(clock().instant());
        synchronized (history) {
            history.addLast(reading);
            while (history.size() > config.historySize()) {
                history.removeFirst();
            }
            checkAlerts(reading);
        }
        if (config.logMeasurements()) {
            log.debug("{} - {}V, {}A, {}W", settings().label(),
                String.format("%.3f", reading.voltage()),
                String.format("%.3f", reading.current()),
                String.format("%.3f", reading.power()));
        }
    }

    @Override
    protected void cleanup() {
        sensor.close();
    }

    public PowerMonitorConfig config() {
        return config;
    }

    public Optional<PowerReading> lastReading() {
        synchronized (history) {
            return Optional.ofNullable(history.peekLast());
        }
    }

    /**
     * 최근 측정 이력 (오래된 것부터).
     */
    public List<PowerReading> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }

    /**
     * 보관 중인 이력의 통계.
     *
     * @return 통계, 측정값이 없으면 empty
     */
    public Optional<PowerStats> stats() {
        List<PowerReading> snapshot = history();
        if (snapshot.isEmpty()) {
            return Optional.empty();
        }
        double voltage = 0;
        double current = 0;
        double power = 0;
        double minPower = Double.MAX_VALUE;
        double maxPower = -Double.MAX_VALUE;
        for (PowerReading reading : snapshot) {
            voltage += reading.voltage();
            current += reading.current();
            power += reading.power();
            minPower = Math.min(minPower, reading.power());
            maxPower = Math.max(maxPower, reading.power());
        }
        int count = snapshot.size();
        return Optional.of(new PowerStats(count, voltage / count, current / count, power / count, minPower, maxPower));
    }

    /**
     * 현재 유지 중인 경보.
     *
     * @return 연속 카운트가 alertAfter 이상이면 해당 경보
     */
    public Optional<PowerAlert> activeAlert() {
        synchronized (history) {
            if (consecutiveLow >= config.alertAfter()) {
                return Optional.of(PowerAlert.LOW_POWER);
            }
            if (consecutiveHigh >= config.alertAfter()) {
                return Optional.of(PowerAlert.HIGH_POWER);
            }
            return Optional.empty();
        }
    }

    private void checkAlerts(PowerReading reading) {
        if (reading.power() < config.lowPowerThreshold()) {
            consecutiveHigh = 0;
            consecutiveLow++;
            if (consecutiveLow == config.alertAfter()) {
                log.warn("{} - LOW POWER: {}W for {} consecutive readings (threshold: {}W)",
                    settings().label(), reading.power(), consecutiveLow, config.lowPowerThreshold());
            }
        } else if (reading.power() > config.highPowerThreshold()) {
            consecutiveLow = 0;
            consecutiveHigh++;
            if (consecutiveHigh == config.alertAfter()) {
                log.warn("{} - HIGH POWER: {}W for {} consecutive readings (threshold: {}W)",
                    settings().label(), reading.power(), consecutiveHigh, config.highPowerThreshold());
            }
        } else {
            consecutiveLow = 0;
            consecutiveHigh = 0;
        }
    }
}
