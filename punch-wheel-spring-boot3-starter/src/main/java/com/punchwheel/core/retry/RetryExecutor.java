package com.punchwheel.core.retry;

import com.punchwheel.core.guard.CircuitGuard;
import com.punchwheel.core.metric.PunchMetrics;
import com.punchwheel.core.spi.RetryableOperation;
import com.punchwheel.core.spi.failure.FailureDecider;
import com.punchwheel.exception.ActionException;
import com.punchwheel.exception.guard.OpenCircuitException;
import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.RetryResult;
import com.punchwheel.model.enums.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 熔断保护下的有界重试
 *
 * 每次尝试前询问 CircuitGuard，被拒绝立即以 CIRCUIT_OPEN 结束；
 * 成功即返回，不可重试的失败立即返回，否则按退避等待后继续，直到 maxAttempts。
 * 同一 operation 的调用串行执行，保证熔断计数按调用顺序累计。
 */
public class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final CircuitGuard guard;

    private final FailureDecider decider;

    private final Sleeper sleeper;

    private final PunchMetrics metrics;

    private final ConcurrentHashMap<String, ReentrantLock> operationLocks = new ConcurrentHashMap<>();

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    private volatile CountDownLatch shutdownSignal = new CountDownLatch(1);

    /** 默认等待可被 shutdown 提前唤醒 */
    public RetryExecutor(CircuitGuard guard, FailureDecider decider, PunchMetrics metrics) {
        this.guard = guard;
        this.decider = decider;
        this.metrics = metrics;
        this.sleeper = d -> shutdownSignal.await(Math.max(0L, d.toMillis()), TimeUnit.MILLISECONDS);
    }

    public RetryExecutor(CircuitGuard guard, FailureDecider decider, PunchMetrics metrics, Sleeper sleeper) {
        this.guard = guard;
        this.decider = decider;
        this.metrics = metrics;
        this.sleeper = sleeper;
    }

    public RetryResult run(RetryPolicy policy, RetryableOperation operation) {
        ReentrantLock lock = operationLocks.computeIfAbsent(policy.getOperation(), k -> new ReentrantLock(true));
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return RetryResult.builder()
                    .operation(policy.getOperation())
                    .outcome(ActionOutcome.failure(ErrorKind.UNKNOWN, "interrupted before first attempt", ie))
                    .attempts(0)
                    .elapsedBackoff(Duration.ZERO)
                    .build();
        }
        try {
            return doRun(policy, operation);
        } finally {
            lock.unlock();
        }
    }

    private RetryResult doRun(RetryPolicy policy, RetryableOperation operation) {
        final String name = policy.getOperation();
        int attempts = 0;
        long backoffMillis = 0L;
        ActionOutcome last = null;

        for (int attempt = 1; attempt <= policy.getMaxAttempts(); attempt++) {
            if (!guard.allow(name)) {
                metrics.incCircuitRejected();
                log.warn("[Retry-Executor] operation={} rejected by open circuit at attempt {}", name, attempt);
                last = ActionOutcome.failure(ErrorKind.CIRCUIT_OPEN,
                        "circuit open for operation " + name, new OpenCircuitException(name));
                break;
            }

            attempts++;
            long start = System.nanoTime();
            ActionOutcome outcome;
            try {
                outcome = invoke(operation);
            } catch (Error err) {
                // 半开时的这次调用也要归还许可, 记为失败后继续上抛
                guard.onFailure(name, System.nanoTime() - start, err);
                log.error("[Retry-Executor] operation={} attempt {} aborted by {}", name, attempt, err.toString());
                throw err;
            }
            long elapsed = System.nanoTime() - start;
            last = outcome;

            if (outcome.isSuccess()) {
                guard.onSuccess(name, elapsed);
                log.info("[Retry-Executor] operation={} succeeded at attempt {}/{}", name, attempt, policy.getMaxAttempts());
                break;
            }

            guard.onFailure(name, elapsed, asThrowable(outcome));
            log.warn("[Retry-Executor] operation={} attempt {}/{} failed, kind={}, msg={}",
                    name, attempt, policy.getMaxAttempts(), outcome.getErrorKind(), outcome.getMessage());

            if (!outcome.isRetryable()) {
                log.error("[Retry-Executor] operation={} non-retryable failure {}, giving up", name, outcome.getErrorKind());
                break;
            }
            if (attempt == policy.getMaxAttempts()) {
                break;
            }
            if (shuttingDown.get()) {
                log.info("[Retry-Executor] operation={} shutdown requested, stop after attempt {}", name, attempt);
                break;
            }

            Duration wait = policy.backoff(attempt);
            log.info("[Retry-Executor] operation={} retry in {} ms", name, wait.toMillis());
            try {
                sleeper.sleep(wait);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("[Retry-Executor] operation={} interrupted during backoff", name);
                break;
            }
            backoffMillis += wait.toMillis();
            if (shuttingDown.get()) {
                log.info("[Retry-Executor] operation={} shutdown requested during backoff", name);
                break;
            }
        }

        if (attempts > 0) {
            metrics.recordAttempts(attempts);
        }
        return RetryResult.builder()
                .operation(name)
                .outcome(last)
                .attempts(attempts)
                .elapsedBackoff(Duration.ofMillis(backoffMillis))
                .build();
    }

    private ActionOutcome invoke(RetryableOperation operation) {
        try {
            ActionOutcome outcome = operation.call();
            if (outcome == null) {
                return ActionOutcome.failure(ErrorKind.UNKNOWN, "operation returned no outcome");
            }
            return outcome;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return ActionOutcome.failure(ErrorKind.UNKNOWN, "interrupted", ie);
        } catch (Exception e) {
            ErrorKind kind = decider.decide(e);
            return ActionOutcome.failure(kind, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    private static Throwable asThrowable(ActionOutcome outcome) {
        if (outcome.getCause() != null) {
            return outcome.getCause();
        }
        return new ActionException(outcome.getErrorKind(), outcome.getMessage());
    }

    /** 进行中的尝试会执行完，之后不再重试 */
    public void shutdown() {
        if (shuttingDown.compareAndSet(false, true)) {
            shutdownSignal.countDown();
            log.info("[Retry-Executor] shutdown signalled");
        }
    }

    /**
     * 撤销 shutdown, 调度器重新 start 时调用
     */
    public void resume() {
        if (shuttingDown.get()) {
            shutdownSignal = new CountDownLatch(1);
            shuttingDown.set(false);
            log.info("[Retry-Executor] resumed");
        }
    }

    public boolean isShuttingDown() {
        return shuttingDown.get();
    }
}
