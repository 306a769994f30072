package com.ryuqq.solar.adapter.config;

import com.ryuqq.solar.core.config.ControlSettings;
import com.ryuqq.solar.core.model.Position;
import com.ryuqq.solar.core.runner.RunnerSettings;
import com.ryuqq.solar.core.safety.SafetyPolicy;
import com.ryuqq.solar.core.schedule.DailySchedule;
import com.ryuqq.solar.core.schedule.DockPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 검증을 통과한 전체 설정.
 *
 * @param control 제어 루프/종료 설정
 * @param safety 배터리 안전 정책
 * @param dock Dock 대상과 충전 행동
 * @param runners Runner 설정 (선언 순서)
 * @param schedule 일일 스케줄
 * @param locations 이름 → 좌표 (선언 순서)
 * @author Solar Team
 * @since 1.0.0
 */
public record SolarConfiguration(
    ControlSettings control,
    SafetyPolicy safety,
    DockPolicy dock,
    List<RunnerSettings> runners,
    DailySchedule schedule,
    Map<String, Position> locations
) {

    public SolarConfiguration {
        if (control == null) {
            throw new IllegalArgumentException("control cannot be null");
        }
        if (safety == null) {
            throw new IllegalArgumentException("safety cannot be null");
        }
        if (dock == null) {
            throw new IllegalArgumentException("dock cannot be null");
        }
        if (schedule == null) {
            throw new IllegalArgumentException("schedule cannot be null");
        }
        runners = runners == null ? List.of() : List.copyOf(runners);
        locations = locations == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(locations));
    }
}
