package com.ryuqq.solar.adapter.runner.ups;

import com.ryuqq.solar.adapter.runner.SensorReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Random;

/**
 * 시뮬레이션 UPS 센서.
 *
 * <ul>
 *   <li>충전 중 +0.01~0.05V, 방전 중 -0.01~0.05V (6.0~8.4V로 클램프)</li>
 *   <li>6.8V 미만이면 저전압</li>
 *   <li>USB 연결 중이고 8.35V 미만이면 충전, 8.4V에서 충전 종료</li>
 *   <li>측정마다 5% 확률로 USB 연결 상태 전환</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class SimulatedUpsSensor implements UpsSensor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedUpsSensor.class);

    static final double MIN_VOLTAGE = 6.0;
    static final double MAX_VOLTAGE = 8.4;
    static final double LOW_VOLTAGE = 6.8;
    private static final double CHARGE_CUTOFF = 8.35;

    private final Random random;
    private boolean open;
    private double voltage = 8.0;
    private boolean usbConnected = true;
    private boolean charging = true;

    public SimulatedUpsSensor(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        this.random = random;
    }

    @Override
    public synchronized void open() {
        open = true;
        log.debug("Simulated UPS sensor opened");
    }

    @Override
    public synchronized UpsReading read(Instant at) throws SensorReadException {
        if (!open) {
            throw new SensorReadException("Simulated UPS sensor is not open");
        }
        double step = 0.01 + random.nextDouble() * 0.04;
        voltage += (usbConnected && charging) ? step : -step;
        voltage = Math.max(MIN_VOLTAGE, Math.min(MAX_VOLTAGE, voltage));

        if (usbConnected && voltage < CHARGE_CUTOFF) {
            charging = true;
        } else if (voltage >= MAX_VOLTAGE || !usbConnected) {
            charging = false;
        }

        if (random.nextDouble() < 0.05) {
            usbConnected = !usbConnected;
            log.debug("Simulated USB power {}", usbConnected ? "connected" : "disconnected");
        }
        return new UpsReading(voltage, usbConnected, charging, voltage < LOW_VOLTAGE, at);
    }

    @Override
    public synchronized void close() {
        open = false;
    }
}
