package com.ryuqq.solar.core.schedule;

import java.util.List;
import java.util.Optional;

/**
 * ScheduleEngine의 틱별 출력 (불변, 식별자 없음).
 *
 * <p><strong>생성 방법:</strong></p>
 * <ul>
 *   <li>{@link #scheduled(ScheduleTask)}: 스케줄 작업을 그대로 선택</li>
 *   <li>{@link #override(DockPolicy, OverrideReason, ScheduleTask)}: Dock 복귀로 대체</li>
 *   <li>{@link #idle()}: 선택할 작업 없음</li>
 * </ul>
 *
 * @param target 대상 위치 (IDLE 또는 대상 없는 작업이면 null)
 * @param actions 동작 목록
 * @param kind 선택 출처
 * @param sourceTask 스케줄이 고른 작업 (없으면 null)
 * @param overrideReason 오버라이드 사유 (OVERRIDE가 아니면 null)
 * @author Solar Team
 * @since 1.0.0
 */
public record SelectedAction(
    String target,
    List<String> actions,
    SelectionKind kind,
    ScheduleTask sourceTask,
    OverrideReason overrideReason
) {

    public SelectedAction {
        if (actions == null) {
            throw new IllegalArgumentException("actions cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == SelectionKind.OVERRIDE && overrideReason == null) {
            throw new IllegalArgumentException("overrideReason is required for OVERRIDE");
        }
        if (kind != SelectionKind.OVERRIDE && overrideReason != null) {
            throw new IllegalArgumentException("overrideReason is only allowed for OVERRIDE (kind: " + kind + ")");
        }
        actions = List.copyOf(actions);
    }

    public static SelectedAction scheduled(ScheduleTask task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        return new SelectedAction(task.target(), task.actions(), SelectionKind.SCHEDULED, task, null);
    }

    public static SelectedAction override(DockPolicy dock, OverrideReason reason, ScheduleTask replaced) {
        if (dock == null) {
            throw new IllegalArgumentException("dock cannot be null");
        }
        return new SelectedAction(dock.target(), dock.actions(), SelectionKind.OVERRIDE, replaced, reason);
    }

    public static SelectedAction idle() {
        return new SelectedAction(null, List.of(), SelectionKind.IDLE, null, null);
    }

    /**
     * 안전 오버라이드인지 확인.
     */
    public boolean isOverride() {
        return kind == SelectionKind.OVERRIDE;
    }

    public Optional<String> targetLocation() {
        return Optional.ofNullable(target);
    }

    public Optional<ScheduleTask> source() {
        return Optional.ofNullable(sourceTask);
    }
}
