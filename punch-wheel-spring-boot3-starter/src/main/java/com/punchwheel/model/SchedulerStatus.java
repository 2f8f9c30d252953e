package com.punchwheel.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * 调度器状态快照
 */
@Getter
@Builder
@ToString
public class SchedulerStatus {

    private final boolean running;

    private final ZoneId zone;

    @Singular
    private final List<JobStatus> jobs;

    @Singular
    private final List<CircuitSnapshot> circuits;

    private final long fired;

    private final long succeeded;

    private final long failed;

    @Getter
    @Builder
    @ToString
    public static class JobStatus {
        private final String id;
        private final String trigger;
        private final boolean enabled;
        private final ZonedDateTime nextFire;
        /** 最近一次结果，未运行过为 null */
        private final ActionOutcome lastOutcome;
        private final ZonedDateTime lastRunAt;
    }
}
