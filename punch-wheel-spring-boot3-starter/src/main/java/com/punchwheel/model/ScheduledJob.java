package com.punchwheel.model;

import com.punchwheel.core.spi.PunchTaskHandler;
import com.punchwheel.model.enums.PunchType;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 调度器持有的任务
 */
@Getter
@Builder
@ToString(exclude = "handler")
public class ScheduledJob {

    @NonNull
    private final String id;

    @NonNull
    private final Trigger trigger;

    @NonNull
    private final PunchType punchType;

    @NonNull
    private final PunchTaskHandler handler;

    /** 熔断器/串行化的 key，两个打卡任务共用 "punch" */
    @Builder.Default
    private final String operation = "punch";

    @Builder.Default
    private final boolean enabled = true;
}
