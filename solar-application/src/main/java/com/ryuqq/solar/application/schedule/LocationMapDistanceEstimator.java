package com.ryuqq.solar.application.schedule;

import com.ryuqq.solar.core.model.Position;
import com.ryuqq.solar.core.spi.DistanceEstimator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * 이름 → 좌표 맵 기반 직선 거리 추정기.
 *
 * <p>Dock 좌표가 맵에 없으면 원점을 Dock으로 간주합니다. 맵에 없는 대상은 거리를 알 수 없습니다(empty).</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class LocationMapDistanceEstimator implements DistanceEstimator {

    private final Map<String, Position> locations;
    private final String dockName;
    private final Position dock;

    public LocationMapDistanceEstimator(Map<String, Position> locations, String dockName) {
        if (locations == null) {
            throw new IllegalArgumentException("locations cannot be null");
        }
        if (dockName == null || dockName.isBlank()) {
            throw new IllegalArgumentException("dockName cannot be null or blank");
        }
        this.locations = Collections.unmodifiableMap(new LinkedHashMap<>(locations));
        this.dockName = dockName;
        this.dock = locations.getOrDefault(dockName, Position.ORIGIN);
    }

    @Override
    public OptionalDouble distanceFromDock(String target) {
        if (target == null) {
            return OptionalDouble.empty();
        }
        if (dockName.equals(target)) {
            return OptionalDouble.of(0.0);
        }
        Position position = locations.get(target);
        if (position == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(dock.distanceTo(position));
    }

    public Map<String, Position> locations() {
        return locations;
    }
}
