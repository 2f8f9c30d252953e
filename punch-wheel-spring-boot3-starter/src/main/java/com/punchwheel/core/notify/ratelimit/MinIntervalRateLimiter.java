package com.punchwheel.core.notify.ratelimit;

import com.punchwheel.core.retry.Sleeper;

import java.time.Duration;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 单渠道最小发送间隔
 * 不丢弃消息, 距离上次发送不足 interval 时阻塞等待
 */
public class MinIntervalRateLimiter {

    private final long intervalNanos;

    private final Sleeper sleeper;

    private final LongSupplier nanoClock;

    private final ReentrantLock lock = new ReentrantLock(true);

    /** 下一次允许发送的时间点(nanoTime)，首发前无限制 */
    private long nextAllowedAt;

    private boolean primed;

    public MinIntervalRateLimiter(Duration interval) {
        this(interval, Sleeper.THREAD, System::nanoTime);
    }

    public MinIntervalRateLimiter(Duration interval, Sleeper sleeper, LongSupplier nanoClock) {
        this.intervalNanos = interval == null || interval.isNegative() ? 0L : interval.toNanos();
        this.sleeper = sleeper;
        this.nanoClock = nanoClock;
    }

    /**
     * 等待直到允许发送, 返回实际等待时长
     */
    public Duration acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            long now = nanoClock.getAsLong();
            long waitNanos = primed ? nextAllowedAt - now : 0L;
            if (waitNanos > 0) {
                // 向上取整到毫秒, 保证不早于间隔
                sleeper.sleep(Duration.ofMillis((waitNanos + 999_999L) / 1_000_000L));
                now = nanoClock.getAsLong();
            } else {
                waitNanos = 0L;
            }
            nextAllowedAt = now + intervalNanos;
            primed = true;
            return Duration.ofNanos(waitNanos);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 服务端要求的冷却（如 429 Retry-After），只会推迟不会提前
     */
    public void penalize(Duration atLeast) {
        if (atLeast == null || atLeast.isNegative() || atLeast.isZero()) {
            return;
        }
        lock.lock();
        try {
            long until = nanoClock.getAsLong() + atLeast.toNanos();
            if (!primed || until - nextAllowedAt > 0) {
                nextAllowedAt = until;
                primed = true;
            }
        } finally {
            lock.unlock();
        }
    }

    public Duration getInterval() {
        return Duration.ofNanos(intervalNanos);
    }
}
