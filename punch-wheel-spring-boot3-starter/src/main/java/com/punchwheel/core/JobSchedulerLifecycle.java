package com.punchwheel.core;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.config.PunchScheduleProperties;
import com.punchwheel.core.engine.JobScheduler;
import com.punchwheel.core.retry.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class JobSchedulerLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(JobSchedulerLifecycle.class);

    private final JobScheduler scheduler;

    private final RetryExecutor retryExecutor;

    private final PunchScheduleProperties props;

    private final PunchRetryProperties retryProps;

    private final PunchNotifierProperties notifyProps;

    /** @EnablePunchWheel(false) 时为 false */
    private final boolean enabled;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public JobSchedulerLifecycle(JobScheduler scheduler,
                                 RetryExecutor retryExecutor,
                                 PunchScheduleProperties props,
                                 PunchRetryProperties retryProps,
                                 PunchNotifierProperties notifyProps,
                                 boolean enabled) {
        this.scheduler = scheduler;
        this.retryExecutor = retryExecutor;
        this.props = props;
        this.retryProps = retryProps;
        this.notifyProps = notifyProps;
        this.enabled = enabled;
    }

    @Override
    public void start() {
        if (!enabled || !props.isEnabled()) {
            log.info("[Punch-Scheduler] start skipped, scheduling disabled");
            return;
        }
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ PunchScheduler starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ zone               : {}", props.effectiveZone());
            log.info("│ clock-in / out     : {} / {}", props.getClockIn(), props.getClockOut());
            log.info("│ weekdays-only      : {}", props.isWeekdaysOnly());
            log.info("│ operation          : {}", props.getOperation());
            log.info("│ wheel.tick         : {} ms", props.wheelTickMillis());
            log.info("│ exec.core / max    : {} / {}", props.getExecutor().getCorePoolSize(), props.getExecutor().getMaxPoolSize());
            log.info("│ retry.max-attempts : {}", retryProps.getMaxAttempts());
            log.info("│ backoff.strategy   : {}", retryProps.getBackoff().getStrategy());
            log.info("│ notifier.enabled   : {} ({} provider(s))", notifyProps.isEnabled(), notifyProps.getProviders().size());
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (RuntimeException t) {
            log.warn("[Punch-Scheduler] failed to render startup banner: {}", t.toString());
        }
        // 上一次 stop 留下的 shutdown 状态
        retryExecutor.resume();
        scheduler.start();
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Punch-Scheduler] stop skipped: already stopped");
            return;
        }
        log.info("[Punch-Scheduler] stopping...");
        // 在途重试做完当前这次尝试即返回
        retryExecutor.shutdown();
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public boolean isAutoStartup() {
        return props.isAutoStartup();
    }
}
