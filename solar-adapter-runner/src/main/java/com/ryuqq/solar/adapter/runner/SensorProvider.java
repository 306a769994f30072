package com.ryuqq.solar.adapter.runner;

import com.ryuqq.solar.adapter.runner.audio.AudioDevice;
import com.ryuqq.solar.adapter.runner.power.PowerSensor;
import com.ryuqq.solar.adapter.runner.ups.UpsSensor;
import com.ryuqq.solar.core.runner.RunnerSettings;

/**
 * Runner 인스턴스별 센서/장치 어댑터 공급자.
 *
 * <p>하드웨어 드라이버 구현은 {@link java.util.ServiceLoader}로 등록합니다.
 * 기본 제공 구현은 {@link SimulatedSensorProvider}뿐입니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public interface SensorProvider {

    PowerSensor powerSensor(RunnerSettings settings);

    UpsSensor upsSensor(RunnerSettings settings);

    AudioDevice audioDevice(RunnerSettings settings);
}
