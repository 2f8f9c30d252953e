package com.punchwheel.core.retry;

import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.exception.PunchConfigException;

import java.time.Duration;
import java.util.Objects;

/**
 * 一次重试调用的契约：熔断 key + 最大尝试次数 + 退避
 */
public final class RetryPolicy {

    private final String operation;
    private final int maxAttempts;
    private final BackoffPolicy backoffPolicy;
    private final PunchRetryProperties.Backoff backoff;

    private RetryPolicy(String operation, int maxAttempts, BackoffPolicy backoffPolicy,
                        PunchRetryProperties.Backoff backoff) {
        if (operation == null || operation.isBlank()) {
            throw new PunchConfigException("retry operation name is required");
        }
        if (maxAttempts < 1) {
            throw new PunchConfigException("max attempts must be >= 1, got " + maxAttempts);
        }
        this.operation = operation;
        this.maxAttempts = maxAttempts;
        this.backoffPolicy = Objects.requireNonNull(backoffPolicy, "backoffPolicy");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
    }

    public static RetryPolicy of(String operation, int maxAttempts, BackoffPolicy backoffPolicy,
                                 PunchRetryProperties.Backoff backoff) {
        return new RetryPolicy(operation, maxAttempts, backoffPolicy, backoff);
    }

    /** 第 attempt 次失败后的等待 */
    public Duration backoff(int attempt) {
        return backoffPolicy.delay(attempt, backoff);
    }

    public String getOperation() {
        return operation;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    @Override
    public String toString() {
        return "RetryPolicy{" + operation + ", maxAttempts=" + maxAttempts + ", backoff=" + backoffPolicy.name() + "}";
    }
}
