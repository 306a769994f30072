package com.ryuqq.solar.adapter.config;

import com.ryuqq.solar.core.schedule.ExactTime;
import com.ryuqq.solar.core.schedule.TimeWindow;

import java.time.LocalTime;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 스케줄 시각 표기 파서.
 *
 * <pre>
 * time:       "HH:MM"          → ExactTime
 * time_range: "HH:MM-HH:MM"    → TimeWindow [start, end)  (end &lt; start면 자정 넘김)
 * </pre>
 *
 * @author Solar Team
 * @since 1.0.0
 */
public final class ScheduleEntryParser {

    private static final Pattern TIME = Pattern.compile("(\\d{1,2}):(\\d{2})");
    private static final Pattern RANGE = Pattern.compile("\\s*(\\d{1,2}:\\d{2})\\s*-\\s*(\\d{1,2}:\\d{2})\\s*");

    private ScheduleEntryParser() {
    }

    /**
     * "HH:MM" 파싱.
     *
     * @throws IllegalArgumentException 형식이 틀리거나 범위를 벗어난 경우
     */
    public static ExactTime parseTime(String text) {
        LocalTime at = parseMinute(text);
        return new ExactTime(at);
    }

    /**
     * "HH:MM-HH:MM" 파싱.
     *
     * @throws IllegalArgumentException 형식이 틀리거나 start와 end가 같은 경우
     */
    public static TimeWindow parseRange(String text) {
        if (text == null) {
            throw new IllegalArgumentException("time_range cannot be null");
        }
        Matcher matcher = RANGE.matcher(text);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("time_range must look like HH:MM-HH:MM (current: " + text + ")");
        }
        LocalTime start = parseMinute(matcher.group(1));
        LocalTime end = parseMinute(matcher.group(2));
        if (start.equals(end)) {
            throw new IllegalArgumentException("time_range start and end cannot be equal (current: " + text + ")");
        }
        return TimeWindow.of(start, end);
    }

    static LocalTime parseMinute(String text) {
        if (text == null) {
            throw new IllegalArgumentException("time cannot be null");
        }
        Matcher matcher = TIME.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("time must look like HH:MM (current: " + text + ")");
        }
        int hour = Integer.parseInt(matcher.group(1));
        int minute = Integer.parseInt(matcher.group(2));
        if (hour > 23 || minute > 59) {
            throw new IllegalArgumentException("time out of range (current: " + text + ")");
        }
        return LocalTime.of(hour, minute);
    }
}
