package com.punchwheel.config;

import com.punchwheel.model.enums.NotificationLevel;
import com.punchwheel.model.enums.ProviderKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 通知配置（绑定前缀：punch.notify）
 *
 * YAML 示例：
 * punch:
 *   notify:
 *     enabled: true
 *     publish-timeout: 60s
 *     providers:
 *       - name: discord-main
 *         kind: DISCORD
 *         url: https://discord.com/api/webhooks/xxx/yyy
 *         min-level: INFO
 *         rate-limit-interval: 1s
 *         max-retries: 3
 *         notify-success: true
 *         notify-failure: true
 *         notify-errors: true
 *         notify-scheduler: false
 */
@ConfigurationProperties(prefix = "punch.notify")
public class PunchNotifierProperties {

    private boolean enabled = true;

    /** 一次 publish 等待所有 provider 的上限 */
    private Duration publishTimeout = Duration.ofSeconds(60);

    private Async async = new Async();

    private List<Provider> providers = new ArrayList<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getPublishTimeout() {
        return publishTimeout;
    }

    public void setPublishTimeout(Duration publishTimeout) {
        this.publishTimeout = publishTimeout;
    }

    public Async getAsync() {
        return async;
    }

    public void setAsync(Async async) {
        this.async = async;
    }

    public List<Provider> getProviders() {
        return providers;
    }

    public void setProviders(List<Provider> providers) {
        this.providers = providers;
    }

    public static class Async {
        private int corePoolSize = 4;

        private int maxPoolSize = 8;

        private int queueCapacity = 200;

        private Duration keepAlive = Duration.ofSeconds(60);

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getKeepAlive() {
            return keepAlive;
        }

        public void setKeepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
        }
    }

    /**
     * 单个通知渠道
     */
    public static class Provider {

        /** 唯一名称，同时作为熔断 key 的一部分（notify:{name}） */
        private String name;

        private ProviderKind kind;

        /** webhook 地址（LOG 渠道不需要） */
        private String url;

        private boolean enabled = true;

        /** 低于该等级的事件跳过 */
        private NotificationLevel minLevel = NotificationLevel.INFO;

        /** 两次发送的最小间隔 */
        private Duration rateLimitInterval = Duration.ofSeconds(1);

        /** 单次发送最多尝试次数 */
        private int maxRetries = 3;

        /** HTTP 读超时 */
        private Duration timeout = Duration.ofSeconds(30);

        /** 发送失败后的退避 */
        private PunchRetryProperties.Backoff backoff =
                new PunchRetryProperties.Backoff("exponential", Duration.ofSeconds(2), Duration.ofSeconds(10), 0.0);

        /** 机器人显示名 */
        private String username = "Punch Bot";

        /** 附件大小上限，超过则跳过附件 */
        private long attachmentMaxBytes = 8L * 1024 * 1024;

        /** 按等级的开关, 在 min-level 之后再过滤一次 */
        private boolean notifySuccess = true;

        private boolean notifyFailure = true;

        /** WARNING（如熔断打开） */
        private boolean notifyErrors = true;

        /** INFO（启动/停止等调度器事件） */
        private boolean notifyScheduler = true;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public ProviderKind getKind() {
            return kind;
        }

        public void setKind(ProviderKind kind) {
            this.kind = kind;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public NotificationLevel getMinLevel() {
            return minLevel;
        }

        public void setMinLevel(NotificationLevel minLevel) {
            this.minLevel = minLevel;
        }

        public Duration getRateLimitInterval() {
            return rateLimitInterval;
        }

        public void setRateLimitInterval(Duration rateLimitInterval) {
            this.rateLimitInterval = rateLimitInterval;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public PunchRetryProperties.Backoff getBackoff() {
            return backoff;
        }

        public void setBackoff(PunchRetryProperties.Backoff backoff) {
            this.backoff = backoff;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public long getAttachmentMaxBytes() {
            return attachmentMaxBytes;
        }

        public void setAttachmentMaxBytes(long attachmentMaxBytes) {
            this.attachmentMaxBytes = attachmentMaxBytes;
        }

        public boolean isNotifySuccess() {
            return notifySuccess;
        }

        public void setNotifySuccess(boolean notifySuccess) {
            this.notifySuccess = notifySuccess;
        }

        public boolean isNotifyFailure() {
            return notifyFailure;
        }

        public void setNotifyFailure(boolean notifyFailure) {
            this.notifyFailure = notifyFailure;
        }

        public boolean isNotifyErrors() {
            return notifyErrors;
        }

        public void setNotifyErrors(boolean notifyErrors) {
            this.notifyErrors = notifyErrors;
        }

        public boolean isNotifyScheduler() {
            return notifyScheduler;
        }

        public void setNotifyScheduler(boolean notifyScheduler) {
            this.notifyScheduler = notifyScheduler;
        }

        /**
         * min-level 与等级开关都放行才发送
         */
        public boolean notifies(NotificationLevel level) {
            if (!level.atLeast(minLevel)) {
                return false;
            }
            return switch (level) {
                case SUCCESS -> notifySuccess;
                case ERROR -> notifyFailure;
                case WARNING -> notifyErrors;
                case INFO -> notifyScheduler;
            };
        }

        /** 被过滤时的原因 */
        public String filterReason(NotificationLevel level) {
            if (!level.atLeast(minLevel)) {
                return "level " + level + " below " + minLevel;
            }
            return "level " + level + " switched off";
        }
    }
}
