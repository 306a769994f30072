package com.ryuqq.solar.core.spi;

import java.util.OptionalDouble;

/**
 * 외부 배터리 잔량 공급자.
 *
 * <p>BatterySafetyMonitor가 샘플링 시점마다 호출합니다. 구현체는 thread-safe해야 하며
 * 블로킹하지 않아야 합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface BatterySource {

    /**
     * 현재 배터리 잔량 조회.
     *
     * @return 퍼센트 값, 읽을 수 없으면 empty
     */
    OptionalDouble readPercentage();
}
