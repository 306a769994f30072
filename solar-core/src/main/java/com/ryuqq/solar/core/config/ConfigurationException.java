package com.ryuqq.solar.core.config;

import java.util.List;

/**
 * 설정 오류 (시작 시 치명적).
 *
 * <p>중복 Runner 키, 알 수 없는 Runner 타입, 잘못된 스케줄 항목 등
 * 프레임워크가 어떤 Runner도 시작하기 전에 중단해야 하는 오류를 나타냅니다.</p>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public class ConfigurationException extends RuntimeException {

    private final List<String> problems;

    /**
     * 단일 메시지로 생성.
     *
     * @param message 오류 메시지
     */
    public ConfigurationException(String message) {
        super(message);
        this.problems = List.of(message);
    }

    /**
     * 원인 포함 생성.
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.problems = List.of(message);
    }

    /**
     * 여러 검증 오류를 묶어서 생성.
     *
     * @param summary 요약 메시지
     * @param problems 개별 오류 목록
     */
    public ConfigurationException(String summary, List<String> problems) {
        super(summary + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    /**
     * 개별 오류 목록 조회.
     *
     * @return 불변 오류 목록
     */
    public List<String> getProblems() {
        return problems;
    }
}
