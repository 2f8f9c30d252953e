package com.punchwheel.core.backoff;

import com.punchwheel.config.PunchRetryProperties;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.exception.PunchConfigException;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicy（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry implements InitializingBean {

    private static final String PREFIX_SPI = "spi:";

    private final Map<String, BackoffPolicy> policies = new ConcurrentHashMap<>(16);

    private final PunchRetryProperties props;

    public BackoffRegistry(PunchRetryProperties props, @Nullable List<BackoffPolicy> discovered) {
        this.props = Objects.requireNonNull(props, "props");
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        policies.putIfAbsent("fixed", new FixedBackoffPolicy());
        policies.putIfAbsent("exponential", new ExponentialJitterBackoffPolicy());
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicy policy) {
        policies.put(normalize(name), policy);
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀, 不存在则采用默认exponential策略
     */
    public BackoffPolicy resolve(String strategy) {
        if (strategy == null || strategy.isBlank()) {
            return policies.get("exponential");
        }
        String s = strategy.trim();
        if (s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())) {
            String spiName = normalize(s.substring(PREFIX_SPI.length()));
            return policies.getOrDefault(spiName, policies.get("exponential"));
        }
        return policies.getOrDefault(normalize(s), policies.get("exponential"));
    }

    /** 全局默认策略 */
    public BackoffPolicy defaultPolicy() {
        return resolve(props.getBackoff().getStrategy());
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(policies.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    @Override
    public void afterPropertiesSet() {
        // 参数校验
        validate(props.getBackoff(), "punch.retry.backoff");
        if (props.getMaxAttempts() < 1) {
            throw new PunchConfigException("punch.retry.max-attempts must be >= 1");
        }
    }

    public static void validate(PunchRetryProperties.Backoff backoff, String prefix) {
        if (backoff.getBase() == null || backoff.getMax() == null || backoff.getBase().isNegative()) {
            throw new PunchConfigException(prefix + ".base/max are required and must not be negative");
        }
        if (backoff.getMax().compareTo(backoff.getBase()) < 0) {
            throw new PunchConfigException(prefix + ".max must be >= " + prefix + ".base");
        }
    }
}
