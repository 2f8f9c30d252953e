package com.punchwheel.autoconfig;

import com.punchwheel.annotation.EnablePunchWheel;
import com.punchwheel.config.PunchGuardProperties;
import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.config.PunchScheduleProperties;
import com.punchwheel.core.JobSchedulerLifecycle;
import com.punchwheel.core.backoff.BackoffRegistry;
import com.punchwheel.core.engine.JobScheduler;
import com.punchwheel.core.guard.CircuitGuard;
import com.punchwheel.core.metric.PunchMetrics;
import com.punchwheel.core.notify.NotificationDispatcher;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.serializer.JacksonPayloadSerializer;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.core.spi.PayloadSerializer;
import com.punchwheel.core.spi.PunchTaskHandler;
import com.punchwheel.core.spi.failure.FailureDecider;
import com.punchwheel.exception.PunchConfigException;
import com.punchwheel.model.ScheduledJob;
import com.punchwheel.model.Trigger;
import com.punchwheel.model.enums.PunchType;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.core.annotation.AnnotationUtils;

import java.time.Clock;
import java.util.List;

/**
 * 调度器、重试执行器及其依赖
 */
@AutoConfiguration(after = {PunchGuardAutoConfiguration.class,
        PunchWheelMetricsAutoConfiguration.class,
        FailureDeciderAutoConfiguration.class})
@EnableConfigurationProperties({
        PunchScheduleProperties.class,
        PunchRetryProperties.class,
        PunchGuardProperties.class,
        PunchNotifierProperties.class
})
public class PunchWheelAutoConfiguration {

    /**
     * 策略注册中心
     */
    @Bean
    public BackoffRegistry backoffRegistry(PunchRetryProperties props,
                                           @Autowired(required = false) List<BackoffPolicy> discoveredPolicies) {
        return new BackoffRegistry(props, discoveredPolicies);
    }

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 打卡与通知共用的重试执行器
     */
    @Bean
    @ConditionalOnMissingBean
    public RetryExecutor retryExecutor(CircuitGuard guard, FailureDecider failureDecider, PunchMetrics metrics) {
        return new RetryExecutor(guard, failureDecider, metrics);
    }

    /**
     * 调度器, 按配置注册签到/签退两个任务
     */
    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(PunchScheduleProperties props,
                                     PunchRetryProperties retryProps,
                                     BackoffRegistry backoffRegistry,
                                     RetryExecutor retryExecutor,
                                     CircuitGuard guard,
                                     ObjectProvider<NotificationDispatcher> dispatcher,
                                     ObjectProvider<PunchTaskHandler> handlers,
                                     PunchMetrics metrics) {
        JobScheduler scheduler = new JobScheduler(props, retryProps, backoffRegistry, retryExecutor, guard,
                dispatcher.getIfAvailable(), metrics, Clock.systemDefaultZone());
        if (!props.isEnabled()) {
            return scheduler;
        }
        PunchTaskHandler handler = handlers.getIfUnique();
        if (handler == null) {
            throw new PunchConfigException("punch.schedule is enabled but no unique PunchTaskHandler bean is defined");
        }
        String operation = props.getOperation();
        if (operation == null || operation.isBlank()) {
            throw new PunchConfigException("punch.schedule.operation must not be blank");
        }
        scheduler.schedule(job(PunchType.CLOCK_IN, props.getClockIn(), props, handler));
        scheduler.schedule(job(PunchType.CLOCK_OUT, props.getClockOut(), props, handler));
        return scheduler;
    }

    /**
     * 调度器启动器
     */
    @Bean
    public JobSchedulerLifecycle jobSchedulerLifecycle(JobScheduler scheduler,
                                                       RetryExecutor retryExecutor,
                                                       PunchScheduleProperties props,
                                                       PunchRetryProperties retryProps,
                                                       PunchNotifierProperties notifyProps,
                                                       ApplicationContext applicationContext) {
        EnablePunchWheel enable = findEnablePunchWheel(applicationContext);
        boolean enabled = enable == null || enable.value();
        return new JobSchedulerLifecycle(scheduler, retryExecutor, props, retryProps, notifyProps, enabled);
    }

    private static ScheduledJob job(PunchType type, String time, PunchScheduleProperties props, PunchTaskHandler handler) {
        return ScheduledJob.builder()
                .id(type.getJobId())
                .trigger(Trigger.parse(type.getJobId(), time, props.isWeekdaysOnly()))
                .punchType(type)
                .handler(handler)
                .operation(props.getOperation())
                .build();
    }

    private EnablePunchWheel findEnablePunchWheel(ListableBeanFactory factory) {
        String[] names = factory.getBeanDefinitionNames();
        for (String n : names) {
            Class<?> type = factory.getType(n, false);
            if (type == null) continue;
            EnablePunchWheel an = AnnotationUtils.findAnnotation(type, EnablePunchWheel.class);
            if (an != null) return an;
        }
        return null;
    }
}
