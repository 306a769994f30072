package com.ryuqq.solar.core.schedule;

/**
 * 안전 오버라이드 사유.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public enum OverrideReason {

    /**
     * 배터리가 최소 임계값 미만.
     */
    LOW_BATTERY,

    /**
     * 배터리 샘플이 없거나 유예 기간을 초과함.
     */
    STALE_BATTERY,

    /**
     * 대상까지의 거리가 허용 거리를 초과함.
     */
    OUT_OF_RANGE,

    /**
     * 대상까지의 거리를 추정할 수 없음.
     */
    UNKNOWN_DISTANCE
}
