package com.ryuqq.solar.core.schedule;

import java.time.LocalTime;

/**
 * 스케줄 작업의 발동 조건.
 *
 * <p>두 가지 경우만 존재합니다:</p>
 * <ul>
 *   <li>{@link ExactTime}: 정확한 분(minute)에만 일치</li>
 *   <li>{@link TimeWindow}: 반열린 구간 [start, end) 안에서 일치 (자정을 넘어갈 수 있음)</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public sealed interface TimeTrigger permits ExactTime, TimeWindow {

    /**
     * 주어진 시각(분 단위로 절삭됨)에 발동하는지 확인.
     *
     * @param minuteOfDay 분 단위로 절삭된 현재 시각
     * @return 일치 여부
     */
    boolean matches(LocalTime minuteOfDay);

    /**
     * 정확한 시각 트리거인지 확인 (동률 처리에서 윈도우보다 우선).
     *
     * @return ExactTime이면 true
     */
    default boolean isExact() {
        return this instanceof ExactTime;
    }

    /**
     * 설정 파일 형식의 표현 ("HH:MM" 또는 "HH:MM-HH:MM").
     *
     * @return 표시 문자열
     */
    String describe();
}
