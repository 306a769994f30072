package com.ryuqq.solar.core.spi;

import java.util.OptionalDouble;

/**
 * 대상 위치의 Dock 기준 거리 추정기.
 *
 * @author Solar Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DistanceEstimator {

    /**
     * Dock에서 대상까지의 추정 거리.
     *
     * @param target 위치 이름
     * @return 거리, 알 수 없는 위치면 empty
     */
    OptionalDouble distanceFromDock(String target);
}
