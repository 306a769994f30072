package com.ryuqq.solar.core.schedule;

import java.util.List;
import java.util.Optional;

/**
 * 하루 스케줄의 작업 한 개 (불변).
 *
 * <p>선언 순서는 {@link DailySchedule}의 목록 위치로 표현되며, 동률 처리에 사용됩니다.</p>
 *
 * @param trigger 발동 조건
 * @param category 작업 분류
 * @param target 대상 위치 이름 (없으면 null, NAVIGATION은 필수)
 * @param actions 동작 식별자 목록 (순서 유지)
 * @author Solar Team
 * @since 1.0.0
 */
public record ScheduleTask(
    TimeTrigger trigger,
    TaskCategory category,
    String target,
    List<String> actions
) {

    public ScheduleTask {
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (target != null && target.isBlank()) {
            target = null;
        }
        if (category == TaskCategory.NAVIGATION && target == null) {
            throw new IllegalArgumentException("navigation task requires a target (trigger: " + trigger.describe() + ")");
        }
        if (actions == null) {
            throw new IllegalArgumentException("actions cannot be null");
        }
        for (String action : actions) {
            if (action == null || action.isBlank()) {
                throw new IllegalArgumentException("action cannot be null or blank (trigger: " + trigger.describe() + ")");
            }
        }
        actions = List.copyOf(actions);
    }

    /**
     * 대상 위치 조회.
     */
    public Optional<String> targetLocation() {
        return Optional.ofNullable(target);
    }

    @Override
    public String toString() {
        return category.tag() + "@" + trigger.describe() + (target == null ? "" : "->" + target) + actions;
    }
}
