package com.ryuqq.solar.adapter.config;

/**
 * 설정 문제 1건.
 *
 * @param path 점으로 구분된 위치 (예: {@code runners.solar_power.measurement_interval})
 * @param message 문제 설명
 * @author Solar Team
 * @since 1.0.0
 */
public record ValidationError(String path, String message) {

    public ValidationError {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("path cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
