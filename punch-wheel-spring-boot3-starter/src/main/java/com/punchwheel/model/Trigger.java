package com.punchwheel.model;

import com.punchwheel.exception.PunchConfigException;

import java.time.LocalTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 每日触发点：hh:mm + 是否仅工作日
 */
public final class Trigger {

    private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");

    private final String id;
    private final int hour;
    private final int minute;
    private final boolean weekdayOnly;

    public Trigger(String id, int hour, int minute, boolean weekdayOnly) {
        if (id == null || id.isBlank()) {
            throw new PunchConfigException("trigger id is required");
        }
        if (hour < 0 || hour > 23 || minute < 0 || minute > 59) {
            throw new PunchConfigException(
                    String.format("trigger '%s' has invalid time %02d:%02d", id, hour, minute));
        }
        this.id = id;
        this.hour = hour;
        this.minute = minute;
        this.weekdayOnly = weekdayOnly;
    }

    /**
     * 解析 "HH:MM"
     */
    public static Trigger parse(String id, String hhmm, boolean weekdayOnly) {
        if (hhmm == null || hhmm.isBlank()) {
            throw new PunchConfigException("trigger '" + id + "' time is required (HH:MM)");
        }
        Matcher m = HH_MM.matcher(hhmm.trim());
        if (!m.matches()) {
            throw new PunchConfigException("trigger '" + id + "' time '" + hhmm + "' is not HH:MM");
        }
        return new Trigger(id, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), weekdayOnly);
    }

    public String getId() {
        return id;
    }

    public int getHour() {
        return hour;
    }

    public int getMinute() {
        return minute;
    }

    public boolean isWeekdayOnly() {
        return weekdayOnly;
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Trigger t)) return false;
        return hour == t.hour && minute == t.minute && weekdayOnly == t.weekdayOnly && id.equals(t.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, hour, minute, weekdayOnly);
    }

    @Override
    public String toString() {
        return String.format("%s@%02d:%02d%s", id, hour, minute, weekdayOnly ? "(weekdays)" : "");
    }
}
