package com.punchwheel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 重试配置（绑定前缀：punch.retry）
 *
 * YAML 示例：
 * punch:
 *   retry:
 *     max-attempts: 3
 *     backoff:
 *       strategy: exponential
 *       base: 1s
 *       max: 30s
 *       jitter-ratio: 0.25
 */
@ConfigurationProperties(prefix = "punch.retry")
public class PunchRetryProperties {

    /** 单次触发最多尝试次数（含首次） */
    private int maxAttempts = 3;

    private Backoff backoff = new Backoff();

    public static class Backoff {
        /** 策略：fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 基础间隔（指数退避的 base） */
        private Duration base = Duration.ofSeconds(1);

        /** 最大间隔 */
        private Duration max = Duration.ofSeconds(30);

        /** 抖动比例（0~1），0.25 表示在理想值上最多再加 25% */
        private double jitterRatio = 0.25;

        public Backoff() {
        }

        public Backoff(String strategy, Duration base, Duration max, double jitterRatio) {
            this.strategy = strategy;
            this.base = base;
            this.max = max;
            this.jitterRatio = jitterRatio;
        }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public Duration getBase() { return base; }
        public void setBase(Duration base) { this.base = base; }

        public Duration getMax() { return max; }
        public void setMax(Duration max) { this.max = max; }

        public double getJitterRatio() { return jitterRatio; }
        public void setJitterRatio(double jitterRatio) { this.jitterRatio = jitterRatio; }

        public long baseMillis() { return base.toMillis(); }
        public long maxMillis() { return max.toMillis(); }
    }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public Backoff getBackoff() { return backoff; }
    public void setBackoff(Backoff backoff) { this.backoff = backoff; }
}
