package com.ryuqq.solar.core.model;

/**
 * Runner의 고유 식별자.
 *
 * <p>RunnerKey는 RunnerManager 레지스트리의 키이자 워커 스레드 이름의 일부로 사용됩니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class RunnerKey {

    private static final int MAX_LENGTH = 64;

    private final String value;

    private RunnerKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("RunnerKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("RunnerKey length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException(
                "RunnerKey contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * RunnerKey 생성.
     *
     * @param value 키 값
     * @return RunnerKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static RunnerKey of(String value) {
        return new RunnerKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RunnerKey that = (RunnerKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
