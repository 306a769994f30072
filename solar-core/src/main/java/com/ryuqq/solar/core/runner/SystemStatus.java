package com.ryuqq.solar.core.runner;

import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.statemachine.RunnerState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 전체 Runner 상태 집계 (불변 record).
 *
 * <p>overallHealthy = 모든 Runner가 healthy이고, 어떤 Runner도 오류 상한을 초과하지 않음.
 * 등록된 Runner가 없으면 healthy로 간주합니다.</p>
 *
 * @param runningCount RUNNING 상태 Runner 수
 * @param totalCount 등록된 Runner 수
 * @param countsByState 상태별 Runner 수 (모든 상태 포함, 0 가능)
 * @param runners Runner별 스냅샷 (등록 순서)
 * @param overallHealthy 전체 건강 여부
 * @author Solar Team
 * @since 1.0.0
 */
public record SystemStatus(
    int runningCount,
    int totalCount,
    Map<RunnerState, Integer> countsByState,
    List<RunnerStatus> runners,
    boolean overallHealthy
) {

    public SystemStatus {
        if (countsByState == null) {
            throw new IllegalArgumentException("countsByState cannot be null");
        }
        if (runners == null) {
            throw new IllegalArgumentException("runners cannot be null");
        }
        countsByState = Collections.unmodifiableMap(new EnumMap<>(countsByState));
        runners = List.copyOf(runners);
    }

    /**
     * Runner 스냅샷 목록으로부터 집계.
     *
     * @param runners Runner별 스냅샷 (등록 순서)
     * @return 집계된 SystemStatus
     */
    public static SystemStatus of(List<RunnerStatus> runners) {
        if (runners == null) {
            throw new IllegalArgumentException("runners cannot be null");
        }
        Map<RunnerState, Integer> counts = new EnumMap<>(RunnerState.class);
        for (RunnerState state : RunnerState.values()) {
            counts.put(state, 0);
        }
        boolean healthy = true;
        for (RunnerStatus status : runners) {
            counts.merge(status.state(), 1, Integer::sum);
            if (!status.healthy() || status.ceilingExceeded()) {
                healthy = false;
            }
        }
        return new SystemStatus(counts.get(RunnerState.RUNNING), runners.size(), counts, runners, healthy);
    }

    /**
     * 빈 상태 (등록된 Runner 없음).
     */
    public static SystemStatus empty() {
        return of(List.of());
    }

    /**
     * 특정 상태의 Runner 수.
     */
    public int count(RunnerState state) {
        return countsByState.getOrDefault(state, 0);
    }

    /**
     * Runner별 건강 여부 (등록 순서).
     */
    public Map<RunnerKey, Boolean> perRunnerHealth() {
        Map<RunnerKey, Boolean> health = new LinkedHashMap<>();
        for (RunnerStatus status : runners) {
            health.put(status.key(), status.healthy());
        }
        return Collections.unmodifiableMap(health);
    }

    /**
     * 키로 Runner 스냅샷 조회.
     */
    public Optional<RunnerStatus> runner(RunnerKey key) {
        return runners.stream().filter(status -> status.key().equals(key)).findFirst();
    }
}
