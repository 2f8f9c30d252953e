package com.punchwheel.core.engine;

import com.punchwheel.model.Trigger;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * 计算触发点的下一次触发时间
 * 结果严格晚于参考时间；仅工作日时逐日跳过周六/周日
 */
public class FireTimeCalculator {

    private final ZoneId zone;

    public FireTimeCalculator(ZoneId zone) {
        this.zone = zone;
    }

    public ZonedDateTime next(Trigger trigger, Instant after) {
        return next(trigger, after.atZone(zone));
    }

    public ZonedDateTime next(Trigger trigger, ZonedDateTime after) {
        ZonedDateTime ref = after.withZoneSameInstant(zone);
        ZonedDateTime candidate = at(ref.toLocalDate(), trigger);
        if (!candidate.isAfter(ref)) {
            candidate = at(ref.toLocalDate().plusDays(1), trigger);
        }
        while (trigger.isWeekdayOnly() && isWeekend(candidate.getDayOfWeek())) {
            candidate = at(candidate.toLocalDate().plusDays(1), trigger);
        }
        return candidate;
    }

    public ZoneId getZone() {
        return zone;
    }

    // 夏令时缺口内的时间由 atZone 顺延
    private ZonedDateTime at(LocalDate date, Trigger trigger) {
        return date.atTime(trigger.toLocalTime()).atZone(zone);
    }

    private static boolean isWeekend(DayOfWeek d) {
        return d == DayOfWeek.SATURDAY || d == DayOfWeek.SUNDAY;
    }
}
