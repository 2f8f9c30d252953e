package com.punchwheel.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 通知等级
 * rank 用于 min-level 过滤：INFO < SUCCESS < WARNING < ERROR
 */
@AllArgsConstructor
@Getter
public enum NotificationLevel {
    INFO(0, 0x0099FF),
    SUCCESS(1, 0x00FF00),
    WARNING(2, 0xFFAA00),
    ERROR(3, 0xFF0000);

    public final int rank;
    /** Discord/Slack 颜色 */
    public final int color;

    public boolean atLeast(NotificationLevel min) {
        return min == null || this.rank >= min.rank;
    }

    public String hexColor() {
        return String.format("#%06X", color);
    }
}
