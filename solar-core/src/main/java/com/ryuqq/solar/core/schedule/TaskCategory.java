package com.ryuqq.solar.core.schedule;

import java.util.Locale;

/**
 * 스케줄 작업 분류.
 *
 * @author Solar Team
 * @since 1.0.0
 */
public enum TaskCategory {

    /**
     * 대상 위치로 이동한 뒤 동작 수행 (target 필수).
     */
    NAVIGATION("navigation"),

    /**
     * 제자리에서 수행하는 점검 작업.
     */
    SYSTEM_CHECK("system_check");

    private final String tag;

    TaskCategory(String tag) {
        this.tag = tag;
    }

    /**
     * 설정 파일 태그.
     */
    public String tag() {
        return tag;
    }

    /**
     * 태그로 분류 조회 (대소문자 무시).
     *
     * @param tag 설정 파일 태그 (예: "navigation")
     * @return TaskCategory
     * @throws IllegalArgumentException 알 수 없는 태그인 경우
     */
    public static TaskCategory fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            throw new IllegalArgumentException("tag cannot be null or blank");
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (TaskCategory category : values()) {
            if (category.tag.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown task category: " + tag);
    }
}
