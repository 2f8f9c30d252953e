package com.punchwheel.core.guard;

import com.punchwheel.config.PunchGuardProperties;
import com.punchwheel.exception.PunchConfigException;
import com.punchwheel.model.CircuitSnapshot;
import com.punchwheel.model.enums.CircuitStatus;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 按 operation 名称维护熔断器
 * resilience4j 计数窗口 = 阈值 T 且失败率阈值 100%, 等价于"连续 T 次失败即打开";
 * 半开状态只放行一次探测
 */
public class CircuitGuard {

    private static final Logger log = LoggerFactory.getLogger(CircuitGuard.class);

    private final PunchGuardProperties props;

    private final Clock clock;

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();

    public CircuitGuard(PunchGuardProperties props) {
        this(props, Clock.systemUTC());
    }

    public CircuitGuard(PunchGuardProperties props, Clock clock) {
        this.props = props;
        this.clock = clock;
        // 配置错误在启动时暴露
        check("*", props.getCircuitBreaker());
        if (props.getCbPerOperation() != null) {
            props.getCbPerOperation().forEach(CircuitGuard::check);
        }
    }

    /**
     * 尝试前询问是否放行
     * OPEN 且冷却未结束返回 false; 冷却结束后转 HALF_OPEN 并只放行一次
     */
    public boolean allow(String operation) {
        Entry e = entry(operation);
        e.lock.lock();
        try {
            boolean permitted = e.cb.tryAcquirePermission();
            if (permitted && e.cb.getState() == CircuitBreaker.State.HALF_OPEN) {
                e.lastProbeAt = clock.instant();
                log.info("[Circuit-Guard] operation={} half-open, trial call permitted", operation);
            }
            return permitted;
        } finally {
            e.lock.unlock();
        }
    }

    public void onSuccess(String operation, long elapsedNanos) {
        Entry e = entry(operation);
        e.lock.lock();
        try {
            CircuitBreaker.State before = e.cb.getState();
            e.cb.onSuccess(elapsedNanos, TimeUnit.NANOSECONDS);
            e.consecutiveFailures = 0;
            if (before != CircuitBreaker.State.CLOSED && e.cb.getState() == CircuitBreaker.State.CLOSED) {
                log.info("[Circuit-Guard] operation={} recovered, circuit closed", operation);
            }
        } finally {
            e.lock.unlock();
        }
    }

    public void onFailure(String operation, long elapsedNanos, Throwable cause) {
        Entry e = entry(operation);
        e.lock.lock();
        try {
            e.cb.onError(elapsedNanos, TimeUnit.NANOSECONDS, cause);
            e.consecutiveFailures++;
            e.lastFailureAt = clock.instant();
            if (e.cb.getState() == CircuitBreaker.State.OPEN) {
                log.error("[Circuit-Guard] operation={} circuit open after {} consecutive failures",
                        operation, e.consecutiveFailures);
            }
        } finally {
            e.lock.unlock();
        }
    }

    public CircuitSnapshot snapshot(String operation) {
        Entry e = entry(operation);
        e.lock.lock();
        try {
            return CircuitSnapshot.builder()
                    .operation(operation)
                    .status(CircuitStatus.of(e.cb.getState()))
                    .consecutiveFailures(e.consecutiveFailures)
                    .lastFailureAt(e.lastFailureAt)
                    .lastProbeAt(e.lastProbeAt)
                    .build();
        } finally {
            e.lock.unlock();
        }
    }

    public Set<String> operations() {
        return Set.copyOf(entries.keySet());
    }

    private Entry entry(String operation) {
        return entries.computeIfAbsent(operation, k -> new Entry(buildCb(k)));
    }

    private CircuitBreaker buildCb(String operation) {
        PunchGuardProperties.CbConfig c = props.resolve(operation);
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getFailureThreshold())
                .minimumNumberOfCalls(c.getFailureThreshold())
                .failureRateThreshold(100f)
                // 打卡动作可能很慢, 慢调用不参与判定
                .slowCallRateThreshold(100f)
                .slowCallDurationThreshold(Duration.ofDays(1))
                .waitDurationInOpenState(c.getCoolDown())
                .permittedNumberOfCallsInHalfOpenState(1)
                .automaticTransitionFromOpenToHalfOpenEnabled(false)
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + operation, cfg);
    }

    private static void check(String operation, PunchGuardProperties.CbConfig c) {
        if (c == null) {
            throw new PunchConfigException("punch.guard circuit-breaker config missing (operation=" + operation + ")");
        }
        if (c.getFailureThreshold() < 1) {
            throw new PunchConfigException("punch.guard failure-threshold must be >= 1 (operation=" + operation + ")");
        }
        if (c.getCoolDown() == null || c.getCoolDown().isNegative() || c.getCoolDown().isZero()) {
            throw new PunchConfigException("punch.guard cool-down must be > 0 (operation=" + operation + ")");
        }
    }

    private static final class Entry {
        private final CircuitBreaker cb;
        private final ReentrantLock lock = new ReentrantLock();
        private int consecutiveFailures;
        private Instant lastFailureAt;
        private Instant lastProbeAt;

        private Entry(CircuitBreaker cb) {
            this.cb = cb;
        }
    }
}
