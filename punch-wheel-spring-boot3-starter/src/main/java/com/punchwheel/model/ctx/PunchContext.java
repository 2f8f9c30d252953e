package com.punchwheel.model.ctx;

import com.punchwheel.model.enums.PunchType;
import lombok.Builder;
import lombok.Data;

import java.time.ZonedDateTime;

/**
 * 传给打卡 handler 的上下文
 */
@Data
@Builder
public class PunchContext {

    private String jobId;
    private PunchType punchType;
    private String operation;
    /** 计划触发时间，手动触发时为当前时间 */
    private ZonedDateTime scheduledAt;
    private boolean manual;
}
