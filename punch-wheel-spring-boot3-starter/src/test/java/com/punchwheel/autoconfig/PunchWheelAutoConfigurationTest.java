package com.punchwheel.autoconfig;

import com.punchwheel.config.PunchGuardProperties;
import com.punchwheel.core.JobSchedulerLifecycle;
import com.punchwheel.core.engine.JobScheduler;
import com.punchwheel.core.notify.NotificationDispatcher;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.spi.PunchTaskHandler;
import com.punchwheel.exception.PunchConfigException;
import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.ScheduledJob;
import com.punchwheel.model.enums.ProviderKind;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.core.env.MapPropertySource;

import java.time.ZoneId;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PunchWheelAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    PunchGuardAutoConfiguration.class,
                    PunchWheelMetricsAutoConfiguration.class,
                    FailureDeciderAutoConfiguration.class,
                    PunchWheelAutoConfiguration.class,
                    PunchNotifierAutoConfiguration.class))
            .withPropertyValues(
                    "punch.schedule.clock-in=09:00",
                    "punch.schedule.clock-out=18:00",
                    "punch.schedule.zone=Asia/Taipei",
                    "punch.schedule.auto-startup=false");

    private final ApplicationContextRunner withHandler = runner
            .withBean(PunchTaskHandler.class, () -> ctx -> ActionOutcome.success("ok"));

    @Test
    void registersClockInAndClockOutJobs() {
        withHandler.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(RetryExecutor.class);
            assertThat(context).hasSingleBean(NotificationDispatcher.class);
            assertThat(context).hasSingleBean(JobSchedulerLifecycle.class);

            JobScheduler scheduler = context.getBean(JobScheduler.class);
            assertThat(scheduler.getJobs()).extracting(ScheduledJob::getId).containsExactly("clock-in", "clock-out");
            assertThat(scheduler.getJobs()).allSatisfy(job -> {
                assertThat(job.getOperation()).isEqualTo("punch");
                assertThat(job.getTrigger().isWeekdayOnly()).isTrue();
            });
            assertThat(scheduler.status().getZone()).isEqualTo(ZoneId.of("Asia/Taipei"));
            // auto-startup=false 时不会被容器启动
            assertThat(scheduler.isRunning()).isFalse();
            assertThat(context.getBean(JobSchedulerLifecycle.class).isRunning()).isFalse();
        });
    }

    @Test
    void missingClockInFailsStartup() {
        withHandler.withPropertyValues("punch.schedule.clock-in=")
                .run(context -> assertThat(context).getFailure().hasRootCauseInstanceOf(PunchConfigException.class));
    }

    @Test
    void malformedTimeFailsStartup() {
        withHandler.withPropertyValues("punch.schedule.clock-out=25:00")
                .run(context -> assertThat(context).getFailure().hasRootCauseInstanceOf(PunchConfigException.class));
    }

    @Test
    void missingHandlerFailsStartup() {
        runner.run(context -> assertThat(context).getFailure()
                .hasRootCauseInstanceOf(PunchConfigException.class)
                .rootCause().hasMessageContaining("PunchTaskHandler"));
    }

    @Test
    void disabledScheduleRegistersNoJobs() {
        runner.withPropertyValues("punch.schedule.enabled=false").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(JobScheduler.class).getJobs()).isEmpty();
        });
    }

    @Test
    void bindsConfiguredProviders() {
        withHandler.withPropertyValues(
                        "punch.notify.providers[0].name=console",
                        "punch.notify.providers[0].kind=log",
                        "punch.notify.providers[1].name=discord-main",
                        "punch.notify.providers[1].kind=discord",
                        "punch.notify.providers[1].url=https://discord.com/api/webhooks/1/token",
                        "punch.notify.providers[1].min-level=error")
                .run(context -> {
                    NotificationDispatcher dispatcher = context.getBean(NotificationDispatcher.class);
                    assertThat(dispatcher.getProviders()).hasSize(2);
                    assertThat(dispatcher.getProviders().get(0).kind()).isEqualTo(ProviderKind.LOG);
                    assertThat(dispatcher.getProviders().get(1).name()).isEqualTo("discord-main");
                });
    }

    @Test
    void invalidDiscordUrlFailsStartup() {
        withHandler.withPropertyValues(
                        "punch.notify.providers[0].name=discord-main",
                        "punch.notify.providers[0].kind=discord",
                        "punch.notify.providers[0].url=https://example.com/hook")
                .run(context -> assertThat(context).getFailure().hasRootCauseInstanceOf(PunchConfigException.class));
    }

    @Test
    void disabledNotifierHasNoProviders() {
        withHandler.withPropertyValues(
                        "punch.notify.enabled=false",
                        "punch.notify.providers[0].name=console",
                        "punch.notify.providers[0].kind=log")
                .run(context -> {
                    NotificationDispatcher dispatcher = context.getBean(NotificationDispatcher.class);
                    assertThat(dispatcher.isEnabled()).isFalse();
                    assertThat(dispatcher.getProviders()).isEmpty();
                });
    }

    @Test
    void bindsPerOperationCircuitBreaker() {
        // key 里带冒号，不能走 withPropertyValues
        Map<String, Object> guard = Map.of(
                "punch.guard.circuit-breaker.failure-threshold", "3",
                "punch.guard.cb-per-operation[notify:discord-main].failure-threshold", "2",
                "punch.guard.cb-per-operation[notify:discord-main].cool-down", "5s");
        withHandler.withInitializer(ctx -> ctx.getEnvironment().getPropertySources()
                        .addFirst(new MapPropertySource("guard", guard)))
                .run(context -> {
                    PunchGuardProperties props = context.getBean(PunchGuardProperties.class);
                    assertThat(props.resolve("punch").getFailureThreshold()).isEqualTo(3);
                    assertThat(props.resolve("notify:discord-main").getFailureThreshold()).isEqualTo(2);
                    assertThat(props.resolve("notify:discord-main").getCoolDown()).hasSeconds(5);
                });
    }
}
