package com.punchwheel.app.command;

import com.punchwheel.core.JobSchedulerLifecycle;
import com.punchwheel.core.notify.NotificationDispatcher;
import com.punchwheel.model.ProviderResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * 执行 run / test-notifications
 *
 * run：手动启动调度器并阻塞，SIGTERM/SIGINT 触发容器关闭（SmartLifecycle.stop）后返回
 * test-notifications：对每个启用的渠道发测试消息，全部成功退出码 0，否则 1
 */
@Component
public class PunchCommandRunner implements ApplicationRunner, ExitCodeGenerator, ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(PunchCommandRunner.class);

    private final JobSchedulerLifecycle lifecycle;

    private final NotificationDispatcher dispatcher;

    private final PrintStream out;

    private final CountDownLatch closed = new CountDownLatch(1);

    private volatile int exitCode;

    @Autowired
    public PunchCommandRunner(JobSchedulerLifecycle lifecycle, NotificationDispatcher dispatcher) {
        this(lifecycle, dispatcher, System.out);
    }

    PunchCommandRunner(JobSchedulerLifecycle lifecycle, NotificationDispatcher dispatcher, PrintStream out) {
        this.lifecycle = lifecycle;
        this.dispatcher = dispatcher;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws InterruptedException {
        List<String> commands = args.getNonOptionArgs();
        PunchCommand command = PunchCommand.from(commands.isEmpty() ? null : commands.get(0));
        log.info("[Punch-App] command: {}", command.getValue());
        switch (command) {
            case RUN -> runScheduler();
            case TEST_NOTIFICATIONS -> exitCode = testNotifications();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        closed.countDown();
    }

    private void runScheduler() throws InterruptedException {
        lifecycle.start();
        if (!lifecycle.isRunning()) {
            log.warn("[Punch-App] scheduler did not start, check punch.schedule.enabled and @EnablePunchWheel");
            return;
        }
        log.info("[Punch-App] scheduler running, waiting for SIGTERM/SIGINT");
        closed.await();
        log.info("[Punch-App] shutdown signal received");
    }

    int testNotifications() {
        if (dispatcher.enabledProviders().isEmpty()) {
            out.println("No notification provider is enabled (punch.notify.providers)");
            log.warn("[Punch-App] test-notifications: no enabled provider");
            return 1;
        }
        List<ProviderResult> results = dispatcher.testConnections();
        boolean allSent = true;
        for (ProviderResult r : results) {
            if (r.isSent()) {
                out.printf("[OK]   %s (attempts=%d)%n", r.getProvider(), r.getAttempts());
            } else {
                allSent = false;
                out.printf("[FAIL] %s: %s%n", r.getProvider(), r.getErrorMessage());
            }
        }
        log.info("[Punch-App] test-notifications: {}/{} reachable",
                results.stream().filter(ProviderResult::isSent).count(), results.size());
        return allSent ? 0 : 1;
    }
}
