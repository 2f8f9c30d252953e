package com.punchwheel.core.retry;

import java.time.Duration;

/**
 * 有界等待, 测试中可替换
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> {
        if (!d.isNegative() && !d.isZero()) {
            Thread.sleep(d.toMillis());
        }
    };

    void sleep(Duration duration) throws InterruptedException;
}
