package com.ryuqq.solar.adapter.runner;

import com.ryuqq.solar.adapter.runner.audio.AudioDevice;
import com.ryuqq.solar.adapter.runner.audio.SimulatedAudioDevice;
import com.ryuqq.solar.adapter.runner.power.PowerSensor;
import com.ryuqq.solar.adapter.runner.power.SimulatedPowerSensor;
import com.ryuqq.solar.adapter.runner.ups.SimulatedUpsSensor;
import com.ryuqq.solar.adapter.runner.ups.UpsSensor;
import com.ryuqq.solar.core.runner.RunnerSettings;

import java.util.Random;

/**
 * 시뮬레이션 센서 공급자.
 *
 * <p>{@code simulation_seed} 속성이 있으면 해당 시드로 난수를 고정합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class SimulatedSensorProvider implements SensorProvider {

    static final String SEED_PROPERTY = "simulation_seed";

    @Override
    public PowerSensor powerSensor(RunnerSettings settings) {
        return new SimulatedPowerSensor(random(settings));
    }

    @Override
    public UpsSensor upsSensor(RunnerSettings settings) {
        return new SimulatedUpsSensor(random(settings));
    }

    @Override
    public AudioDevice audioDevice(RunnerSettings settings) {
        return new SimulatedAudioDevice();
    }

    private static Random random(RunnerSettings settings) {
        Object seed = settings.properties().get(SEED_PROPERTY);
        if (seed == null) {
            return new Random();
        }
        return new Random(settings.intProperty(SEED_PROPERTY, 0));
    }
}
