package com.punchwheel.model;

import com.punchwheel.model.enums.CircuitStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 某个 operation 的熔断器快照
 */
@Getter
@Builder
@ToString
public class CircuitSnapshot {
    private final String operation;
    private final CircuitStatus status;
    private final int consecutiveFailures;
    private final Instant lastFailureAt;
    private final Instant lastProbeAt;
}
