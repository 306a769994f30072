package com.ryuqq.solar.adapter.runner.ups;

import com.ryuqq.solar.adapter.runner.SensorReadException;

import java.time.Instant;

/**
 * UPS 상태 센서 어댑터.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public interface UpsSensor extends AutoCloseable {

    void open() throws SensorReadException;

    UpsReading read(Instant at) throws SensorReadException;

    @Override
    void close();
}
