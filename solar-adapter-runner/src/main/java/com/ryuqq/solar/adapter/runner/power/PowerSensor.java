package com.ryuqq.solar.adapter.runner.power;

import com.ryuqq.solar.adapter.runner.SensorReadException;

import java.time.Instant;

/**
 * 전압/전류 센서 어댑터 (INA219 계열).
 *
 * @author Solar Team
 * @since 1.0.0
 */
public interface PowerSensor extends AutoCloseable {

    /**
     * 센서 연결.
     *
     * @throws SensorReadException 연결 실패
     */
    void open() throws SensorReadException;

    /**
     * 1회 측정.
     *
     * @param at 측정 시각
     * @return 측정값
     * @throws SensorReadException 읽기 실패
     */
    PowerReading read(Instant at) throws SensorReadException;

    @Override
    void close();
}
