package com.ryuqq.solar.core.statemachine;

/**
 * ScheduleEngine의 틱 단위 상태.
 *
 * <pre>
 * IDLE ──tick()──► EVALUATING ──► SELECTED
 *                      ▲              │
 *                      └───tick()─────┘
 * </pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public enum EvaluationState {

    /**
     * 아직 한 번도 평가하지 않음.
     */
    IDLE,

    /**
     * 틱 평가 중.
     */
    EVALUATING,

    /**
     * 직전 틱의 선택 결과가 확정됨.
     */
    SELECTED
}
