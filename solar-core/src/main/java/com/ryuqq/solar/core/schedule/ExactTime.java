package com.ryuqq.solar.core.schedule;

import java.time.LocalTime;
import java.time.temporal.ChronoUnit;

/**
 * 정확한 시각 트리거.
 *
 * <p>지정된 분(minute) 동안에만 일치합니다. 초 이하 단위는 생성 시 절삭됩니다.</p>
 *
 * @param at 발동 시각 (분 단위)
 * @author Solar Team
 * @since 1.0.0
 */
public record ExactTime(LocalTime at) implements TimeTrigger {

    public ExactTime {
        if (at == null) {
            throw new IllegalArgumentException("at cannot be null");
        }
        at = at.truncatedTo(ChronoUnit.MINUTES);
    }

    public static ExactTime of(int hour, int minute) {
        return new ExactTime(LocalTime.of(hour, minute));
    }

    @Override
    public boolean matches(LocalTime minuteOfDay) {
        if (minuteOfDay == null) {
            throw new IllegalArgumentException("minuteOfDay cannot be null");
        }
        return at.equals(minuteOfDay.truncatedTo(ChronoUnit.MINUTES));
    }

    @Override
    public String describe() {
        return at.toString();
    }
}
