package com.punchwheel.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 打卡动作
 */
@AllArgsConstructor
@Getter
public enum PunchType {
    CLOCK_IN("clock-in", "签到"),
    CLOCK_OUT("clock-out", "签退");

    /** 对应的 job id */
    public final String jobId;
    public final String desc;
}
