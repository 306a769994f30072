package com.ryuqq.solar.core.statemachine;

/**
 * Runner의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>CREATED → INITIALIZING (워커 시작)</li>
 *   <li>INITIALIZING → RUNNING (초기화 성공)</li>
 *   <li>INITIALIZING → ERROR (초기화 실패)</li>
 *   <li>RUNNING ⇄ ERROR (사이클 실패 / 다음 사이클 성공)</li>
 *   <li>* → STOPPED (종료, STOPPED 자신 제외)</li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ▼
 * INITIALIZING ──► ERROR
 *    │               ▲ │
 *    ▼               │ ▼
 * RUNNING ◄──────────┘
 *    │
 *    ▼
 * STOPPED (terminal)
 * </pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public enum RunnerState {

    /**
     * 생성됨 (워커 미시작).
     */
    CREATED,

    /**
     * 일회성 초기화 진행 중.
     */
    INITIALIZING,

    /**
     * 정상 사이클 수행 중.
     */
    RUNNING,

    /**
     * 초기화 실패 또는 직전 사이클 실패.
     */
    ERROR,

    /**
     * 종료 (되돌릴 수 없음).
     */
    STOPPED;

    /**
     * 종료 상태인지 확인.
     *
     * @return STOPPED인 경우 true
     */
    public boolean isTerminal() {
        return this == STOPPED;
    }
}
