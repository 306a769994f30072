package com.ryuqq.solar.core.schedule;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * 반열린 시간 구간 트리거 [start, end).
 *
 * <p><strong>일치 규칙:</strong></p>
 * <ul>
 *   <li>start &lt; end: start &lt;= t &lt; end</li>
 *   <li>end &lt; start (자정 통과): t &gt;= start 또는 t &lt; end</li>
 *   <li>start == end: 빈 구간, 일치하지 않음</li>
 * </ul>
 *
 * <p>예: 22:00-04:00은 23:30과 02:00에 일치하고, 12:00과 04:00에는 일치하지 않습니다.</p>
 *
 * @param start 시작 시각 (포함)
 * @param end 종료 시각 (제외)
 * @author Solar Team
 * @since 1.0.0
 */
public record TimeWindow(LocalTime start, LocalTime end) implements TimeTrigger {

    public TimeWindow {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        if (end == null) {
            throw new IllegalArgumentException("end cannot be null");
        }
        start = start.truncatedTo(ChronoUnit.MINUTES);
        end = end.truncatedTo(ChronoUnit.MINUTES);
    }

    public static TimeWindow of(LocalTime start, LocalTime end) {
        return new TimeWindow(start, end);
    }

    /**
     * 자정을 넘어가는 구간인지 확인.
     */
    public boolean wrapsMidnight() {
        return end.isBefore(start);
    }

    @Override
    public boolean matches(LocalTime minuteOfDay) {
        if (minuteOfDay == null) {
            throw new IllegalArgumentException("minuteOfDay cannot be null");
        }
        LocalTime t = minuteOfDay.truncatedTo(ChronoUnit.MINUTES);
        if (wrapsMidnight()) {
            return !t.isBefore(start) || t.isBefore(end);
        }
        return !t.isBefore(start) && t.isBefore(end);
    }

    @Override
    public String describe() {
        return start + "-" + end;
    }
}
