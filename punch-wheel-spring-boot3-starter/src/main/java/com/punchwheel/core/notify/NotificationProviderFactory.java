package com.punchwheel.core.notify;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.backoff.BackoffRegistry;
import com.punchwheel.core.notify.provider.DiscordWebhookProvider;
import com.punchwheel.core.notify.provider.GenericWebhookProvider;
import com.punchwheel.core.notify.provider.LoggingNotificationProvider;
import com.punchwheel.core.notify.provider.SlackWebhookProvider;
import com.punchwheel.core.notify.ratelimit.MinIntervalRateLimiter;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.core.spi.PayloadSerializer;
import com.punchwheel.core.spi.notify.NotificationProvider;
import com.punchwheel.exception.PunchConfigException;
import com.punchwheel.model.enums.ProviderKind;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.net.http.HttpClient;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 按配置 kind 创建通知渠道，配置有误启动即失败
 */
public class NotificationProviderFactory {

    private final RestClient.Builder restClientBuilder;

    private final PayloadSerializer serializer;

    private final RetryExecutor retryExecutor;

    private final BackoffRegistry backoffRegistry;

    public NotificationProviderFactory(RestClient.Builder restClientBuilder,
                                       PayloadSerializer serializer,
                                       RetryExecutor retryExecutor,
                                       BackoffRegistry backoffRegistry) {
        this.restClientBuilder = restClientBuilder;
        this.serializer = serializer;
        this.retryExecutor = retryExecutor;
        this.backoffRegistry = backoffRegistry;
    }

    public List<NotificationProvider> createAll(List<PunchNotifierProperties.Provider> configs) {
        List<NotificationProvider> out = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (PunchNotifierProperties.Provider cfg : configs) {
            if (cfg.getName() != null && !names.add(cfg.getName())) {
                throw new PunchConfigException("duplicate notification provider name: " + cfg.getName());
            }
            out.add(create(cfg));
        }
        return out;
    }

    public NotificationProvider create(PunchNotifierProperties.Provider cfg) {
        validate(cfg);
        return switch (cfg.getKind()) {
            case DISCORD -> new DiscordWebhookProvider(cfg, restClient(cfg), serializer, retryExecutor,
                    backoff(cfg), new MinIntervalRateLimiter(cfg.getRateLimitInterval()));
            case SLACK -> new SlackWebhookProvider(cfg, restClient(cfg), serializer, retryExecutor,
                    backoff(cfg), new MinIntervalRateLimiter(cfg.getRateLimitInterval()));
            case GENERIC -> new GenericWebhookProvider(cfg, restClient(cfg), serializer, retryExecutor,
                    backoff(cfg), new MinIntervalRateLimiter(cfg.getRateLimitInterval()));
            case LOG -> new LoggingNotificationProvider(cfg);
        };
    }

    private void validate(PunchNotifierProperties.Provider cfg) {
        if (cfg.getName() == null || cfg.getName().isBlank()) {
            throw new PunchConfigException("punch.notify.providers[].name is required");
        }
        String prefix = "punch.notify.providers[" + cfg.getName() + "]";
        if (cfg.getKind() == null) {
            throw new PunchConfigException(prefix + ".kind is required");
        }
        if (cfg.getKind() == ProviderKind.LOG) {
            return;
        }
        if (cfg.getUrl() == null || cfg.getUrl().isBlank()) {
            throw new PunchConfigException(prefix + ".url is required for " + cfg.getKind());
        }
        if (cfg.getKind() == ProviderKind.DISCORD) {
            DiscordWebhookProvider.validateUrl(cfg.getUrl());
        }
        if (cfg.getMaxRetries() < 1) {
            throw new PunchConfigException(prefix + ".max-retries must be >= 1");
        }
        if (cfg.getTimeout() == null || cfg.getTimeout().isNegative() || cfg.getTimeout().isZero()) {
            throw new PunchConfigException(prefix + ".timeout must be > 0");
        }
        if (cfg.getRateLimitInterval() != null && cfg.getRateLimitInterval().isNegative()) {
            throw new PunchConfigException(prefix + ".rate-limit-interval must not be negative");
        }
        BackoffRegistry.validate(cfg.getBackoff(), prefix + ".backoff");
    }

    private BackoffPolicy backoff(PunchNotifierProperties.Provider cfg) {
        return backoffRegistry.resolve(cfg.getBackoff().getStrategy());
    }

    private RestClient restClient(PunchNotifierProperties.Provider cfg) {
        HttpClient http = HttpClient.newBuilder().connectTimeout(cfg.getTimeout()).build();
        JdkClientHttpRequestFactory rf = new JdkClientHttpRequestFactory(http);
        rf.setReadTimeout(cfg.getTimeout());
        return restClientBuilder.clone().requestFactory(rf).build();
    }
}
