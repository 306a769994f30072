/**
 * Daily schedule model and selection result types.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.solar.core.schedule.TimeTrigger} - exact-time or half-open window trigger (sealed)</li>
 *   <li>{@link com.ryuqq.solar.core.schedule.ScheduleTask} - one declared task</li>
 *   <li>{@link com.ryuqq.solar.core.schedule.DailySchedule} - ordered task list, declaration order is the tie-break</li>
 *   <li>{@link com.ryuqq.solar.core.schedule.SelectedAction} - per-tick output, tagged SCHEDULED / OVERRIDE / IDLE</li>
 * </ul>
 *
 * @author Solar Team
 * @since 1.0.0
 */
package com.ryuqq.solar.core.schedule;
