package com.punchwheel.core.retry;

import com.punchwheel.config.PunchGuardProperties;
import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.core.backoff.FixedBackoffPolicy;
import com.punchwheel.core.failure.RouterFailureDecider;
import com.punchwheel.core.guard.CircuitGuard;
import com.punchwheel.core.metric.PunchMetrics;
import com.punchwheel.core.spi.RetryableOperation;
import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.RetryResult;
import com.punchwheel.model.enums.CircuitStatus;
import com.punchwheel.model.enums.ErrorKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private final List<Duration> sleeps = new ArrayList<>();

    private CircuitGuard guard;

    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        PunchGuardProperties props = new PunchGuardProperties();
        props.getCircuitBreaker().setFailureThreshold(3);
        props.getCircuitBreaker().setCoolDown(Duration.ofMinutes(5));
        guard = new CircuitGuard(props);
        executor = new RetryExecutor(guard, RouterFailureDecider.defaults(),
                PunchMetrics.create(new SimpleMeterRegistry()), sleeps::add);
    }

    private static RetryPolicy policy(int maxAttempts) {
        return RetryPolicy.of("punch", maxAttempts, new FixedBackoffPolicy(),
                new PunchRetryProperties.Backoff("fixed", Duration.ofMillis(50), Duration.ofMillis(50), 0.0));
    }

    @Test
    void stopsAtFirstSuccess() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult result = executor.run(policy(5), () -> calls.incrementAndGet() < 2
                ? ActionOutcome.failure(ErrorKind.TIMEOUT, "slow page")
                : ActionOutcome.success("punched"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(calls).hasValue(2);
        assertThat(sleeps).containsExactly(Duration.ofMillis(50));
        assertThat(result.getElapsedBackoff()).isEqualTo(Duration.ofMillis(50));
        assertThat(guard.snapshot("punch").getConsecutiveFailures()).isZero();
    }

    @Test
    void neverExceedsMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult result = executor.run(policy(2), () -> {
            calls.incrementAndGet();
            return ActionOutcome.failure(ErrorKind.NETWORK, "offline");
        });

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(calls).hasValue(2);
        assertThat(result.getOutcome().getErrorKind()).isEqualTo(ErrorKind.NETWORK);
        assertThat(sleeps).hasSize(1);
    }

    @Test
    void terminalFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult result = executor.run(policy(3), () -> {
            calls.incrementAndGet();
            return ActionOutcome.failure(ErrorKind.LOGIN, "bad password");
        });

        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getOutcome().getErrorKind()).isEqualTo(ErrorKind.LOGIN);
        assertThat(sleeps).isEmpty();
        // 终止性失败也计入熔断
        assertThat(guard.snapshot("punch").getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    void thrownExceptionIsClassified() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult result = executor.run(policy(3), () -> {
            if (calls.incrementAndGet() == 1) {
                throw new ConnectException("Connection refused");
            }
            return ActionOutcome.success("ok");
        });

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(2);
    }

    @Test
    void thrownConfigErrorIsTerminal() {
        RetryResult result = executor.run(policy(3), () -> {
            throw new IllegalArgumentException("selector missing");
        });

        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getOutcome().getErrorKind()).isEqualTo(ErrorKind.CONFIG);
        assertThat(result.getOutcome().getCause()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nullOutcomeCountsAsUnknownFailure() {
        RetryResult result = executor.run(policy(2), () -> null);

        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(result.getOutcome().getErrorKind()).isEqualTo(ErrorKind.UNKNOWN);
    }

    @Test
    void openCircuitRejectsWithoutCallingAction() {
        AtomicInteger calls = new AtomicInteger();
        RetryableOperation failing = () -> {
            calls.incrementAndGet();
            return ActionOutcome.failure(ErrorKind.BROWSER, "crashed");
        };

        RetryResult first = executor.run(policy(3), failing);
        assertThat(first.getAttempts()).isEqualTo(3);
        assertThat(guard.snapshot("punch").getStatus()).isEqualTo(CircuitStatus.OPEN);

        RetryResult fourth = executor.run(policy(3), failing);

        assertThat(calls).hasValue(3);
        assertThat(fourth.getAttempts()).isZero();
        assertThat(fourth.getOutcome().getErrorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
        assertThat(fourth.getElapsedBackoff()).isEqualTo(Duration.ZERO);
    }

    @Test
    void circuitOpeningMidLoopEndsTheLoop() {
        AtomicInteger calls = new AtomicInteger();

        RetryResult result = executor.run(policy(5), () -> {
            calls.incrementAndGet();
            return ActionOutcome.failure(ErrorKind.TIMEOUT, "slow");
        });

        assertThat(calls).hasValue(3);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.getOutcome().getErrorKind()).isEqualTo(ErrorKind.CIRCUIT_OPEN);
    }

    @Test
    void shutdownStopsAfterCurrentAttempt() {
        AtomicInteger calls = new AtomicInteger();
        RetryExecutor[] holder = new RetryExecutor[1];
        holder[0] = new RetryExecutor(guard, RouterFailureDecider.defaults(),
                PunchMetrics.create(new SimpleMeterRegistry()), d -> holder[0].shutdown());

        RetryResult result = holder[0].run(policy(3), () -> {
            calls.incrementAndGet();
            return ActionOutcome.failure(ErrorKind.TIMEOUT, "slow");
        });

        assertThat(calls).hasValue(1);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(holder[0].isShuttingDown()).isTrue();
    }

    @Test
    void defaultSleeperWakesOnShutdown() throws InterruptedException {
        RetryExecutor real = new RetryExecutor(guard, RouterFailureDecider.defaults(),
                PunchMetrics.create(new SimpleMeterRegistry()));
        RetryPolicy slow = RetryPolicy.of("punch", 3, new FixedBackoffPolicy(),
                new PunchRetryProperties.Backoff("fixed", Duration.ofSeconds(30), Duration.ofSeconds(30), 0.0));
        RetryResult[] out = new RetryResult[1];

        Thread t = new Thread(() -> out[0] = real.run(slow, () -> ActionOutcome.failure(ErrorKind.TIMEOUT, "slow")));
        t.start();
        Thread.sleep(200);
        real.shutdown();
        t.join(5_000);

        assertThat(t.isAlive()).isFalse();
        assertThat(out[0].getAttempts()).isEqualTo(1);
    }

    @Test
    void errorEscapingActionIsRecordedAsFailure() {
        assertThatThrownBy(() -> executor.run(policy(3), () -> {
            throw new NoClassDefFoundError("org/example/Missing");
        })).isInstanceOf(NoClassDefFoundError.class);

        assertThat(guard.snapshot("punch").getConsecutiveFailures()).isEqualTo(1);
        assertThat(guard.snapshot("punch").getLastFailureAt()).isNotNull();
    }

    @Test
    void errorDuringHalfOpenAttemptReopensCircuit() throws InterruptedException {
        PunchGuardProperties props = new PunchGuardProperties();
        props.getCircuitBreaker().setFailureThreshold(1);
        props.getCircuitBreaker().setCoolDown(Duration.ofMillis(100));
        CircuitGuard quick = new CircuitGuard(props);
        RetryExecutor exec = new RetryExecutor(quick, RouterFailureDecider.defaults(),
                PunchMetrics.create(new SimpleMeterRegistry()), d -> { });

        exec.run(policy(1), () -> ActionOutcome.failure(ErrorKind.NETWORK, "down"));
        assertThat(quick.snapshot("punch").getStatus()).isEqualTo(CircuitStatus.OPEN);
        Thread.sleep(250);

        assertThatThrownBy(() -> exec.run(policy(1), () -> {
            throw new LinkageError("broken classpath");
        })).isInstanceOf(LinkageError.class);

        // 探测许可已归还, 熔断重新打开而不是卡在半开
        assertThat(quick.snapshot("punch").getStatus()).isEqualTo(CircuitStatus.OPEN);
    }

    @Test
    void resumeRestoresRetriesAfterShutdown() {
        AtomicInteger calls = new AtomicInteger();
        RetryableOperation failing = () -> {
            calls.incrementAndGet();
            return ActionOutcome.failure(ErrorKind.NETWORK, "offline");
        };
        executor.shutdown();

        assertThat(executor.run(policy(3), failing).getAttempts()).isEqualTo(1);

        executor.resume();
        calls.set(0);
        RetryResult result = executor.run(policy(2), failing);

        assertThat(executor.isShuttingDown()).isFalse();
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(calls).hasValue(2);
    }

    @Test
    void defaultSleeperWaitsAgainAfterResume() {
        RetryExecutor real = new RetryExecutor(guard, RouterFailureDecider.defaults(),
                PunchMetrics.create(new SimpleMeterRegistry()));
        RetryPolicy shortWait = RetryPolicy.of("punch", 2, new FixedBackoffPolicy(),
                new PunchRetryProperties.Backoff("fixed", Duration.ofMillis(200), Duration.ofMillis(200), 0.0));
        real.shutdown();
        real.resume();

        long start = System.nanoTime();
        RetryResult result = real.run(shortWait, () -> ActionOutcome.failure(ErrorKind.TIMEOUT, "slow"));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(150);
    }
}
