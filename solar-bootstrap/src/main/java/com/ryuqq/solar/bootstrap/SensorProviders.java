package com.ryuqq.solar.bootstrap;

import com.ryuqq.solar.adapter.runner.SensorProvider;
import com.ryuqq.solar.adapter.runner.SimulatedSensorProvider;
import com.ryuqq.solar.core.config.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * 센서 공급자 선택.
 *
 * <p>시뮬레이션 모드가 아니면 {@link ServiceLoader}로 등록된 하드웨어 공급자를 사용합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class SensorProviders {

    private SensorProviders() {
    }

    /**
     * @param simulated 시뮬레이션 모드 여부
     * @return 사용할 공급자
     * @throws ConfigurationException 하드웨어 공급자가 없거나 둘 이상인 경우
     */
    public static SensorProvider resolve(boolean simulated) {
        if (simulated) {
            return new SimulatedSensorProvider();
        }
        return resolve(ServiceLoader.load(SensorProvider.class));
    }

    static SensorProvider resolve(Iterable<SensorProvider> candidates) {
        List<SensorProvider> found = new ArrayList<>();
        for (SensorProvider provider : candidates) {
            found.add(provider);
        }
        if (found.isEmpty()) {
            throw new ConfigurationException("No hardware sensor provider available",
                List.of("register a " + SensorProvider.class.getName()
                    + " implementation via META-INF/services or run with --simulated"));
        }
        if (found.size() > 1) {
            List<String> names = new ArrayList<>();
            for (SensorProvider provider : found) {
                names.add("multiple sensor providers: " + provider.getClass().getName());
            }
            throw new ConfigurationException("Ambiguous hardware sensor provider", names);
        }
        return found.get(0);
    }
}
