package com.punchwheel.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * RetryExecutor.run 的最终结果
 */
@Getter
@Builder
@ToString
public class RetryResult {

    private final String operation;

    /** 最后一次结果（成功或最后的失败） */
    private final ActionOutcome outcome;

    /** 实际调用 action 的次数 */
    private final int attempts;

    /** 累计退避等待 */
    private final Duration elapsedBackoff;

    public boolean isSuccess() {
        return outcome.isSuccess();
    }
}
