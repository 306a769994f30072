package com.ryuqq.solar.core.schedule;

import java.util.List;

/**
 * 선언 순서가 유지된 하루 작업 목록 (불변).
 *
 * @param tasks 작업 목록 (선언 순서)
 * @author Solar Team
 * @since 1.0.0
 */
public record DailySchedule(List<ScheduleTask> tasks) {

    public DailySchedule {
        if (tasks == null) {
            throw new IllegalArgumentException("tasks cannot be null");
        }
        tasks = List.copyOf(tasks);
    }

    public static DailySchedule of(ScheduleTask... tasks) {
        return new DailySchedule(List.of(tasks));
    }

    public static DailySchedule empty() {
        return new DailySchedule(List.of());
    }

    public int size() {
        return tasks.size();
    }
}
