package com.ryuqq.solar.core.runner;

import com.ryuqq.solar.core.model.RunnerKey;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runner 한 개의 설정 (불변 record).
 *
 * <p>프레임워크는 key, type, enabled, label, interval, errorCeiling만 해석하며,
 * properties는 Runner 구현체가 해석하는 타입별 필드입니다.</p>
 *
 * @param key 고유 키
 * @param type 타입 태그 (RunnerTypeRegistry에서 생성자로 해석됨)
 * @param enabled 활성화 여부 (false면 인스턴스화하지 않음)
 * @param label 사람이 읽는 이름 (null이면 key 사용)
 * @param interval 워크 사이클 간격 (양수)
 * @param errorCeiling 연속 오류 상한 (이를 초과하면 unhealthy)
 * @param properties 타입별 필드 (불변)
 * @author Solar Team
 * @since 1.0.0
 */
public record RunnerSettings(
    RunnerKey key,
    String type,
    boolean enabled,
    String label,
    Duration interval,
    int errorCeiling,
    Map<String, Object> properties
) {

    public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(1);
    public static final int DEFAULT_ERROR_CEILING = 5;

    public RunnerSettings {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank (runner: " + key + ")");
        }
        if (interval == null) {
            throw new IllegalArgumentException("interval cannot be null (runner: " + key + ")");
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive (current: " + interval + ")");
        }
        if (errorCeiling <= 0) {
            throw new IllegalArgumentException("errorCeiling must be positive (current: " + errorCeiling + ")");
        }
        if (label == null || label.isBlank()) {
            label = key.getValue();
        }
        properties = properties == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * 기본값으로 생성 (enabled, interval=1초, errorCeiling=5, properties 없음).
     *
     * @param key 키 값
     * @param type 타입 태그
     * @return RunnerSettings
     */
    public static RunnerSettings of(String key, String type) {
        return new RunnerSettings(RunnerKey.of(key), type, true, null, DEFAULT_INTERVAL, DEFAULT_ERROR_CEILING, Map.of());
    }

    public RunnerSettings withEnabled(boolean enabled) {
        return new RunnerSettings(key, type, enabled, label, interval, errorCeiling, properties);
    }

    public RunnerSettings withLabel(String label) {
        return new RunnerSettings(key, type, enabled, label, interval, errorCeiling, properties);
    }

    public RunnerSettings withInterval(Duration interval) {
        return new RunnerSettings(key, type, enabled, label, interval, errorCeiling, properties);
    }

    public RunnerSettings withErrorCeiling(int errorCeiling) {
        return new RunnerSettings(key, type, enabled, label, interval, errorCeiling, properties);
    }

    public RunnerSettings withProperties(Map<String, Object> properties) {
        return new RunnerSettings(key, type, enabled, label, interval, errorCeiling, properties);
    }

    /**
     * 속성 하나를 추가한 새 인스턴스 생성.
     */
    public RunnerSettings withProperty(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(properties);
        copy.put(name, value);
        return withProperties(copy);
    }

    /**
     * 문자열 속성 조회.
     *
     * @param name 속성 이름
     * @param defaultValue 없을 때 기본값
     * @return 속성 값
     */
    public String stringProperty(String name, String defaultValue) {
        Object value = properties.get(name);
        return value == null ? defaultValue : value.toString();
    }

    /**
     * 정수 속성 조회.
     *
     * @throws IllegalArgumentException 숫자가 아닌 경우
     */
    public int intProperty(String name, int defaultValue) {
        Object value = properties.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.decode(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Property '" + name + "' of runner " + key + " must be an integer (current: " + value + ")", e);
        }
    }

    /**
     * 실수 속성 조회.
     *
     * @throws IllegalArgumentException 숫자가 아닌 경우
     */
    public double doubleProperty(String name, double defaultValue) {
        Object value = properties.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Property '" + name + "' of runner " + key + " must be a number (current: " + value + ")", e);
        }
    }

    /**
     * 불리언 속성 조회.
     */
    public boolean booleanProperty(String name, boolean defaultValue) {
        Object value = properties.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }
}
