package com.ryuqq.solar.adapter.runner;

/**
 * 센서 읽기 실패.
 *
 * <p>Runner의 workCycle()에서 던지면 프레임워크가 연속 오류로 집계합니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class SensorReadException extends Exception {

    private static final long serialVersionUID = 1L;

    public SensorReadException(String message) {
        super(message);
    }

    public SensorReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
