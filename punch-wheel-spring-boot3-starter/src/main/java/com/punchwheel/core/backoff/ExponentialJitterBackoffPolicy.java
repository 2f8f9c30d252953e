package com.punchwheel.core.backoff;

import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

public class ExponentialJitterBackoffPolicy implements BackoffPolicy {
    @Override
    public String name() {
        return "exponential";
    }

    @Override
    public Duration delay(int attempt, PunchRetryProperties.Backoff props) {
        long base = props.baseMillis(), max = props.maxMillis();
        double jr = clampRatio(props.getJitterRatio());

        // attempt从1开始计数：1 -> base, 2 -> base * 2, 3 -> base * 4 ...
        double pow = Math.pow(2.0, Math.max(0, attempt - 1));
        long ideal = (long) Math.min((double) Long.MAX_VALUE, base * pow);

        // 抖动只往上加且不超过 ideal，保证 delay(k) <= delay(k+1)
        long jittered = ideal;
        if (jr > 0 && ideal > 0) {
            jittered = ideal + Math.round(ThreadLocalRandom.current().nextDouble(0, jr) * ideal);
        }
        return Duration.ofMillis(Math.max(0, Math.min(jittered, max)));
    }

    static double clampRatio(double jr) {
        return Math.max(0.0, Math.min(jr, 1.0));
    }
}
