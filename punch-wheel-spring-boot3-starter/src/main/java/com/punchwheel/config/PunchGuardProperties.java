package com.punchwheel.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * punch:
 *   guard:
 *     circuit-breaker:
 *       failure-threshold: 5
 *       cool-down: 60s
 *     cb-per-operation:
 *       "[notify:discord-main]": { failure-threshold: 3, cool-down: 30s }
 */
@Data
@ConfigurationProperties(prefix = "punch.guard")
public class PunchGuardProperties {

    /** 默认配置（可被 operation 覆盖） */
    private CbConfig circuitBreaker = new CbConfig();

    /** 按 operation 覆盖 */
    private Map<String, CbConfig> cbPerOperation;

    @Data
    public static class CbConfig {
        /** 连续失败多少次打开熔断 */
        private int failureThreshold = 5;
        /** 打开后的冷却时间，过后放行一次探测 */
        private Duration coolDown = Duration.ofSeconds(60);
    }

    public CbConfig resolve(String operation) {
        if (cbPerOperation != null && cbPerOperation.get(operation) != null) {
            return cbPerOperation.get(operation);
        }
        return circuitBreaker;
    }
}
