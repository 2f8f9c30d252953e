package com.punchwheel.core.engine;

import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.config.PunchScheduleProperties;
import com.punchwheel.core.backoff.BackoffRegistry;
import com.punchwheel.core.guard.CircuitGuard;
import com.punchwheel.core.metric.PunchMetrics;
import com.punchwheel.core.notify.NotificationDispatcher;
import com.punchwheel.core.notify.NotificationEvents;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.retry.RetryPolicy;
import com.punchwheel.exception.AlreadyRunningException;
import com.punchwheel.exception.JobExecutionException;
import com.punchwheel.exception.PunchConfigException;
import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.NotificationEvent;
import com.punchwheel.model.RetryResult;
import com.punchwheel.model.ScheduledJob;
import com.punchwheel.model.SchedulerStatus;
import com.punchwheel.model.WheelTask;
import com.punchwheel.model.ctx.PunchContext;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 打卡调度器
 *
 * 时间轮只负责到点触发，触发后交给 job 线程池执行 RetryExecutor，
 * 执行完立即按触发点重新计算下一次时间挂回时间轮。
 * 时间轮 stop 后不能复用，因此每次 start 新建。
 */
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final PunchScheduleProperties props;

    private final PunchRetryProperties retryProps;

    private final BackoffRegistry backoffRegistry;

    private final RetryExecutor retryExecutor;

    private final CircuitGuard guard;

    /** 可为 null（未启用通知） */
    private final NotificationDispatcher dispatcher;

    private final PunchMetrics metrics;

    private final Clock clock;

    private final FireTimeCalculator calculator;

    private final Map<String, ScheduledJob> jobs = new LinkedHashMap<>();

    private final Map<String, Timeout> pending = new ConcurrentHashMap<>();

    private final Map<String, ZonedDateTime> nextFires = new ConcurrentHashMap<>();

    private final Map<String, ActionOutcome> lastOutcomes = new ConcurrentHashMap<>();

    private final Map<String, ZonedDateTime> lastRunAt = new ConcurrentHashMap<>();

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final ReentrantLock lifecycleLock = new ReentrantLock();

    private HashedWheelTimer timer;

    private volatile ThreadPoolExecutor jobExecutor;

    private ScheduledExecutorService statusExecutor;

    public JobScheduler(PunchScheduleProperties props,
                        PunchRetryProperties retryProps,
                        BackoffRegistry backoffRegistry,
                        RetryExecutor retryExecutor,
                        CircuitGuard guard,
                        NotificationDispatcher dispatcher,
                        PunchMetrics metrics,
                        Clock clock) {
        this.props = props;
        this.retryProps = retryProps;
        this.backoffRegistry = backoffRegistry;
        this.retryExecutor = retryExecutor;
        this.guard = guard;
        this.dispatcher = dispatcher;
        this.metrics = metrics;
        this.clock = clock;
        this.calculator = new FireTimeCalculator(props.effectiveZone());
    }

    /**
     * 注册任务, id 重复抛 PunchConfigException；运行中注册会立即挂上时间轮
     */
    public void schedule(ScheduledJob job) {
        lifecycleLock.lock();
        try {
            if (jobs.containsKey(job.getId())) {
                throw new PunchConfigException("duplicate job id: " + job.getId());
            }
            jobs.put(job.getId(), job);
            log.info("[Punch-Scheduler] job registered: {} trigger={} operation={}",
                    job.getId(), job.getTrigger(), job.getOperation());
            if (running.get() && job.isEnabled()) {
                arm(job, ZonedDateTime.now(clock));
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    public void start() {
        lifecycleLock.lock();
        try {
            if (running.get()) {
                throw new AlreadyRunningException("scheduler is already running");
            }
            PunchScheduleProperties.Exec exec = props.getExecutor();
            this.jobExecutor = new ThreadPoolExecutor(
                    exec.getCorePoolSize(),
                    exec.getMaxPoolSize(),
                    exec.getKeepAlive().toSeconds(),
                    TimeUnit.SECONDS,
                    new LinkedBlockingDeque<>(exec.getQueueCapacity()),
                    new NamedThreadFactory("punch-job-exec"),
                    exec.getRejectedHandler().toHandler());
            this.timer = new HashedWheelTimer(
                    new NamedThreadFactory("punch-wheel-timer"),
                    props.wheelTickMillis(),
                    TimeUnit.MILLISECONDS,
                    props.getWheel().getTicksPerWheel());
            timer.start();
            running.set(true);

            ZonedDateTime now = ZonedDateTime.now(clock);
            for (ScheduledJob job : jobs.values()) {
                if (job.isEnabled()) {
                    arm(job, now);
                }
            }
            startStatusLog();
            log.info("[Punch-Scheduler] started, zone={}, jobs={}, next={}", calculator.getZone(), jobs.size(), nextFires);
            publishAsync(NotificationEvents.schedulerStarted(nextFireTimes()));
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * 取消待触发任务, 等待在途执行完成（上限 shutdown.await）；已停止时直接返回
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (!running.compareAndSet(true, false)) {
                log.info("[Punch-Scheduler] stop skipped: not running");
                return;
            }
            for (Timeout timeout : pending.values()) {
                if (timeout.cancel()) {
                    WheelTask task = (WheelTask) timeout.task();
                    log.info("[Punch-Scheduler] cancelled pending fire of job {} at {}",
                            task.getJobId(), Instant.ofEpochMilli(task.getFireAtMillis()).atZone(calculator.getZone()));
                }
            }
            pending.clear();
            nextFires.clear();
            Set<Timeout> unprocessed = timer.stop();
            if (!unprocessed.isEmpty()) {
                log.info("[Punch-Scheduler] dropped {} pending fire(s)", unprocessed.size());
            }
            if (statusExecutor != null) {
                statusExecutor.shutdownNow();
                statusExecutor = null;
            }
            publishAsync(NotificationEvents.schedulerStopped());
            awaitJobs(props.getShutdown().getAwait());
            log.info("[Punch-Scheduler] stopped");
        } finally {
            lifecycleLock.unlock();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 立即执行一次（同步，走同一条重试/通知链路）
     */
    public RetryResult triggerNow(String jobId) {
        ScheduledJob job;
        lifecycleLock.lock();
        try {
            job = jobs.get(jobId);
        } finally {
            lifecycleLock.unlock();
        }
        if (job == null) {
            throw new IllegalArgumentException("unknown job id: " + jobId);
        }
        log.info("[Punch-Scheduler] manual trigger: {}", jobId);
        return execute(job, ZonedDateTime.now(clock).withZoneSameInstant(calculator.getZone()), true);
    }

    /**
     * job id -> 下一次触发时间, 未运行时按当前时间推算
     */
    public Map<String, ZonedDateTime> nextFireTimes() {
        Map<String, ZonedDateTime> out = new LinkedHashMap<>();
        ZonedDateTime now = ZonedDateTime.now(clock);
        lifecycleLock.lock();
        try {
            for (ScheduledJob job : jobs.values()) {
                if (!job.isEnabled()) {
                    continue;
                }
                ZonedDateTime armed = running.get() ? nextFires.get(job.getId()) : null;
                out.put(job.getId(), armed != null ? armed : calculator.next(job.getTrigger(), now));
            }
        } finally {
            lifecycleLock.unlock();
        }
        return out;
    }

    public SchedulerStatus status() {
        Map<String, ZonedDateTime> next = nextFireTimes();
        SchedulerStatus.SchedulerStatusBuilder b = SchedulerStatus.builder()
                .running(running.get())
                .zone(calculator.getZone())
                .fired(metrics.firedCount())
                .succeeded(metrics.successCount())
                .failed(metrics.failedCount());
        Set<String> operations = new LinkedHashSet<>();
        lifecycleLock.lock();
        try {
            for (ScheduledJob job : jobs.values()) {
                operations.add(job.getOperation());
                b.job(SchedulerStatus.JobStatus.builder()
                        .id(job.getId())
                        .trigger(job.getTrigger().toString())
                        .enabled(job.isEnabled())
                        .nextFire(next.get(job.getId()))
                        .lastOutcome(lastOutcomes.get(job.getId()))
                        .lastRunAt(lastRunAt.get(job.getId()))
                        .build());
            }
        } finally {
            lifecycleLock.unlock();
        }
        operations.forEach(op -> b.circuit(guard.snapshot(op)));
        return b.build();
    }

    public List<ScheduledJob> getJobs() {
        lifecycleLock.lock();
        try {
            return new ArrayList<>(jobs.values());
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void arm(ScheduledJob job, ZonedDateTime after) {
        ZonedDateTime fireAt = calculator.next(job.getTrigger(), after);
        long delayMs = Math.max(0L, Duration.between(ZonedDateTime.now(clock), fireAt).toMillis());
        WheelTask task = new WheelTask(job.getId(), fireAt.toInstant().toEpochMilli(), () -> onFire(job, fireAt));
        Timeout timeout = timer.newTimeout(task, delayMs, TimeUnit.MILLISECONDS);
        pending.put(job.getId(), timeout);
        nextFires.put(job.getId(), fireAt);
        log.info("[Punch-Scheduler] job {} next fire at {} (in {} ms)", job.getId(), fireAt, delayMs);
    }

    /** 时间轮线程 */
    private void onFire(ScheduledJob job, ZonedDateTime fireAt) {
        ThreadPoolExecutor exec = this.jobExecutor;
        if (!running.get() || exec == null) {
            return;
        }
        try {
            exec.execute(() -> fireSafely(job, fireAt));
        } catch (RejectedExecutionException e) {
            metrics.incJobError();
            log.error("[Punch-Scheduler] job {} fire at {} rejected by executor", job.getId(), fireAt, e);
        }
        // stop() 持锁时会中断时间轮线程
        try {
            lifecycleLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        }
        try {
            if (running.get()) {
                ZonedDateTime now = ZonedDateTime.now(clock);
                arm(job, now.isAfter(fireAt) ? now : fireAt);
            }
        } finally {
            lifecycleLock.unlock();
        }
    }

    private void fireSafely(ScheduledJob job, ZonedDateTime fireAt) {
        try {
            execute(job, fireAt, false);
        } catch (JobExecutionException e) {
            log.error("[Punch-Scheduler] job {} raised an unexpected error, scheduling continues", job.getId(), e);
        }
    }

    private RetryResult execute(ScheduledJob job, ZonedDateTime scheduledAt, boolean manual) {
        metrics.incFired();
        long start = System.nanoTime();
        try {
            PunchContext ctx = PunchContext.builder()
                    .jobId(job.getId())
                    .punchType(job.getPunchType())
                    .operation(job.getOperation())
                    .scheduledAt(scheduledAt)
                    .manual(manual)
                    .build();
            RetryPolicy policy = RetryPolicy.of(job.getOperation(), retryProps.getMaxAttempts(),
                    backoffRegistry.defaultPolicy(), retryProps.getBackoff());
            RetryResult result = retryExecutor.run(policy, () -> job.getHandler().execute(ctx));

            lastOutcomes.put(job.getId(), result.getOutcome());
            lastRunAt.put(job.getId(), scheduledAt);
            if (result.isSuccess()) {
                metrics.incSuccess();
                log.info("[Punch-Scheduler] job {} succeeded in {} attempt(s): {}",
                        job.getId(), result.getAttempts(), result.getOutcome().getDetail());
            } else {
                metrics.incFailed();
                log.error("[Punch-Scheduler] job {} failed after {} attempt(s): {} {}",
                        job.getId(), result.getAttempts(), result.getOutcome().getErrorKind(), result.getOutcome().getMessage());
            }
            publish(NotificationEvents.punchResult(job, result, scheduledAt));
            return result;
        } catch (Exception e) {
            metrics.incJobError();
            JobExecutionException ex = new JobExecutionException(job.getId(), e);
            publish(NotificationEvents.schedulerError(job.getId(), ex));
            throw ex;
        } finally {
            metrics.recordExecNanos(System.nanoTime() - start);
        }
    }

    private void publish(NotificationEvent event) {
        if (dispatcher == null) {
            return;
        }
        try {
            dispatcher.publish(event);
        } catch (RuntimeException e) {
            log.error("[Punch-Scheduler] notification '{}' failed", event.getTitle(), e);
        }
    }

    private void publishAsync(NotificationEvent event) {
        ThreadPoolExecutor exec = this.jobExecutor;
        if (dispatcher == null || exec == null) {
            return;
        }
        try {
            exec.execute(() -> publish(event));
        } catch (RejectedExecutionException e) {
            log.warn("[Punch-Scheduler] notification '{}' rejected by executor", event.getTitle());
        }
    }

    private void startStatusLog() {
        Duration interval = props.getStatusLogInterval();
        if (interval == null || interval.isZero() || interval.isNegative()) {
            return;
        }
        statusExecutor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("punch-status"));
        statusExecutor.scheduleAtFixedRate(this::logStatus, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void logStatus() {
        try {
            SchedulerStatus s = status();
            log.info("[Punch-Scheduler] status running={} fired={} succeeded={} failed={} next={} circuits={}",
                    s.isRunning(), s.getFired(), s.getSucceeded(), s.getFailed(), nextFires, s.getCircuits());
        } catch (RuntimeException e) {
            log.warn("[Punch-Scheduler] status log failed: {}", e.toString());
        }
    }

    private void awaitJobs(Duration await) {
        ThreadPoolExecutor exec = this.jobExecutor;
        this.jobExecutor = null;
        exec.shutdown();
        try {
            if (!exec.awaitTermination(Math.max(1L, await.toMillis()), TimeUnit.MILLISECONDS)) {
                exec.shutdownNow();
                log.warn("[Punch-Scheduler] job executor forced shutdown after {} ms", await.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exec.shutdownNow();
        }
    }
}
