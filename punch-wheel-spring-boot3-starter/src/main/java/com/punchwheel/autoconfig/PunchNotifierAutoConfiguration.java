package com.punchwheel.autoconfig;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.backoff.BackoffRegistry;
import com.punchwheel.core.metric.PunchMetrics;
import com.punchwheel.core.notify.NotificationDispatcher;
import com.punchwheel.core.notify.NotificationProviderFactory;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.spi.PayloadSerializer;
import com.punchwheel.core.spi.notify.NotificationProvider;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@AutoConfiguration(after = PunchWheelAutoConfiguration.class)
@EnableConfigurationProperties(PunchNotifierProperties.class)
public class PunchNotifierAutoConfiguration {

    /**
     * 通知线程池, 队列满时由调用线程发送
     */
    @Bean("punchNotifyExecutor")
    public ExecutorService punchNotifyExecutor(PunchNotifierProperties props) {
        PunchNotifierProperties.Async cfg = props.getAsync();
        return new ThreadPoolExecutor(cfg.getCorePoolSize(),
                cfg.getMaxPoolSize(),
                cfg.getKeepAlive().toSeconds(),
                TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(cfg.getQueueCapacity()),
                new NamedThreadFactory("punch-notify"),
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationProviderFactory notificationProviderFactory(ObjectProvider<RestClient.Builder> restClientBuilder,
                                                                   PayloadSerializer serializer,
                                                                   RetryExecutor retryExecutor,
                                                                   BackoffRegistry backoffRegistry) {
        return new NotificationProviderFactory(restClientBuilder.getIfAvailable(RestClient::builder),
                serializer, retryExecutor, backoffRegistry);
    }

    /**
     * 配置中的渠道加上容器里自定义的 NotificationProvider Bean
     */
    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher(NotificationProviderFactory factory,
                                                         ObjectProvider<NotificationProvider> customProviders,
                                                         @Qualifier("punchNotifyExecutor") ExecutorService exec,
                                                         PunchMetrics metrics,
                                                         PunchNotifierProperties props) {
        List<NotificationProvider> providers = new ArrayList<>();
        if (props.isEnabled()) {
            providers.addAll(factory.createAll(props.getProviders()));
            customProviders.orderedStream().forEach(providers::add);
        }
        return new NotificationDispatcher(providers, exec, props.getPublishTimeout(), metrics, props.isEnabled());
    }
}
