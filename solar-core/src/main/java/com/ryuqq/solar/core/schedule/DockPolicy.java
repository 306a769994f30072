package com.ryuqq.solar.core.schedule;

import java.util.List;

/**
 * 안전 오버라이드 시 대체할 Dock 행동.
 *
 * @param target Dock 위치 이름 (기본 "Dock")
 * @param actions Dock 도착 후 동작 목록 (기본 [charge])
 * @author Solar Team
 * @since 1.0.0
 */
public record DockPolicy(String target, List<String> actions) {

    public static final String DEFAULT_TARGET = "Dock";

    public DockPolicy() {
        this(DEFAULT_TARGET, List.of("charge"));
    }

    public DockPolicy {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target cannot be null or blank");
        }
        if (actions == null || actions.isEmpty()) {
            throw new IllegalArgumentException("actions cannot be null or empty");
        }
        actions = List.copyOf(actions);
    }

    /**
     * 대상 이름이 Dock인지 확인.
     */
    public boolean isDock(String candidate) {
        return target.equals(candidate);
    }
}
