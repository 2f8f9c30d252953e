package com.punchwheel.core.backoff;

import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 固定间隔策略（可选小幅抖动）
 */
public class FixedBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "fixed";
    }

    @Override
    public Duration delay(int attempt, PunchRetryProperties.Backoff props) {
        long base = props.baseMillis(), max = props.maxMillis();
        double jr = ExponentialJitterBackoffPolicy.clampRatio(props.getJitterRatio());

        long delay = base;
        if (jr > 0 && delay > 0) {
            delay += Math.round(ThreadLocalRandom.current().nextDouble(0, jr) * delay);
        }
        return Duration.ofMillis(Math.max(0, Math.min(delay, max)));
    }
}
