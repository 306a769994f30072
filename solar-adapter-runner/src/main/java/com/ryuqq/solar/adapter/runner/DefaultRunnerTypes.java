package com.ryuqq.solar.adapter.runner;

import com.ryuqq.solar.adapter.runner.audio.AudioNotificationRunner;
import com.ryuqq.solar.adapter.runner.power.PowerMonitorRunner;
import com.ryuqq.solar.adapter.runner.ups.UpsMonitorRunner;
import com.ryuqq.solar.application.runner.RunnerTypeRegistry;

import java.time.Clock;

/**
 * 기본 Runner 타입 등록.
 *
 * <pre>
 * power_monitor (별칭 ina219) → PowerMonitorRunner
 * ups_monitor   (별칭 pipower) → UpsMonitorRunner
 * audio                        → AudioNotificationRunner
 * </pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class DefaultRunnerTypes {

    public static final String POWER_MONITOR = "power_monitor";
    public static final String UPS_MONITOR = "ups_monitor";
    public static final String AUDIO = "audio";

    private static final String POWER_MONITOR_ALIAS = "ina219";
    private static final String UPS_MONITOR_ALIAS = "pipower";

    private DefaultRunnerTypes() {
    }

    public static RunnerTypeRegistry registry(SensorProvider sensors) {
        return builder(sensors, Clock.systemUTC()).build();
    }

    /**
     * UPS 모니터 타입 태그인지 확인 (별칭 포함, 대소문자 무시).
     */
    public static boolean isUpsMonitor(String type) {
        if (type == null) {
            return false;
        }
        String tag = type.trim();
        return tag.equalsIgnoreCase(UPS_MONITOR) || tag.equalsIgnoreCase(UPS_MONITOR_ALIAS);
    }

    /**
     * 추가 타입을 등록할 수 있도록 빌더를 반환.
     *
     * @param sensors 센서 공급자
     * @param clock Runner 시계
     * @return 기본 타입이 등록된 빌더
     */
    public static RunnerTypeRegistry.Builder builder(SensorProvider sensors, Clock clock) {
        if (sensors == null) {
            throw new IllegalArgumentException("sensors cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        return RunnerTypeRegistry.builder()
            .register(POWER_MONITOR,
                settings -> new PowerMonitorRunner(settings, sensors.powerSensor(settings), clock))
            .alias(POWER_MONITOR_ALIAS, POWER_MONITOR)
            .register(UPS_MONITOR,
                settings -> new UpsMonitorRunner(settings, sensors.upsSensor(settings), clock))
            .alias(UPS_MONITOR_ALIAS, UPS_MONITOR)
            .register(AUDIO,
                settings -> new AudioNotificationRunner(settings, sensors.audioDevice(settings), clock));
    }
}
