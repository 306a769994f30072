package com.ryuqq.solar.core.runner;

import com.ryuqq.solar.core.model.RunnerKey;
import com.ryuqq.solar.core.statemachine.RunnerState;

import java.time.Instant;

/**
 * Runner 한 개의 상태 스냅샷 (불변 record).
 *
 * <p>Runner가 원자적으로 게시한 필드로부터 만들어지며, 읽는 쪽에서 torn read가 발생하지 않습니다.</p>
 *
 * @param key Runner 키
 * @param label 표시 이름
 * @param type 타입 태그
 * @param state 생명주기 상태
 * @param healthy isHealthy() 결과
 * @param consecutiveErrors 연속 오류 횟수
 * @param errorCeiling 연속 오류 상한
 * @param lastError 마지막 오류 내용 (없으면 null)
 * @param lastSuccessAt 마지막 성공 사이클 시각 (없으면 null)
 * @param forcedStop 종료 기한 초과로 강제 종료되었는지 여부
 * @author Solar Team
 * @since 1.0.0
 */
public record RunnerStatus(
    RunnerKey key,
    String label,
    String type,
    RunnerState state,
    boolean healthy,
    int consecutiveErrors,
    int errorCeiling,
    String lastError,
    Instant lastSuccessAt,
    boolean forcedStop
) {

    public RunnerStatus {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (consecutiveErrors < 0) {
            throw new IllegalArgumentException("consecutiveErrors cannot be negative (current: " + consecutiveErrors + ")");
        }
    }

    /**
     * 연속 오류가 상한을 초과했는지 확인.
     *
     * @return consecutiveErrors &gt; errorCeiling이면 true
     */
    public boolean ceilingExceeded() {
        return consecutiveErrors > errorCeiling;
    }
}
