package com.ryuqq.solar.adapter.runner.power;

import com.ryuqq.solar.adapter.runner.SensorReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Random;

/**
 * 시뮬레이션 전력 센서.
 *
 * <p>12V ± 0.3V, 평상시 0.2~0.8A. 10% 확률로 0.8~1.2A 고부하 구간이 30~120회 측정 동안 이어집니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class SimulatedPowerSensor implements PowerSensor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPowerSensor.class);

    private static final double BASE_VOLTAGE = 12.0;

    private final Random random;
    private boolean open;
    private boolean highLoad;
    private int readingsUntilStateChange;

    public SimulatedPowerSensor(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
        this.readingsUntilStateChange = nextStateDuration();
    }

    @Override
    public synchronized void open() {
        open = true;
        log.debug("Simulated power sensor opened");
    }

    @Override
    public synchronized PowerReading read(Instant at) throws SensorReadException {
        if (!open) {
            throw new SensorReadException("Simulated power sensor is not open");
        }
        if (--readingsUntilStateChange <= 0) {
            highLoad = random.nextDouble() >= 0.9;
            readingsUntilStateChange = nextStateDuration();
        }
        double voltage = BASE_VOLTAGE + uniform(-0.3, 0.3);
        double current = highLoad ? uniform(0.8, 1.2) : uniform(0.2, 0.8);
        return new PowerReading(voltage, current, voltage * current, at);
    }

    @Override
    public synchronized void close() {
        open = false;
    }

    private int nextStateDuration() {
        return 30 + random.nextInt(91);
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
