package com.ryuqq.solar.core.schedule;

/**
 * 선택 결과의 출처.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public enum SelectionKind {

    /**
     * 스케줄의 정상 선택.
     */
    SCHEDULED,

    /**
     * 안전 엔벨로프 위반으로 Dock 복귀가 강제됨.
     */
    OVERRIDE,

    /**
     * 일치하는 작업이 없고 안전 조건도 만족함.
     */
    IDLE
}
