package com.punchwheel.app.config;

import com.punchwheel.model.enums.ErrorKind;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 模拟打卡（未接入浏览器自动化时使用）
 *
 * <pre>
 * punch:
 *   simulation:
 *     latency: 500ms
 *     fail-first: 1        # 前 N 次尝试失败
 *     failure-kind: PUNCH_ACTION
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "punch.simulation")
public class SimulationProperties {

    /** 单次尝试耗时 */
    private Duration latency = Duration.ZERO;

    /** 每个任务前 N 次尝试返回失败, 0 表示总是成功 */
    private int failFirst = 0;

    private ErrorKind failureKind = ErrorKind.PUNCH_ACTION;
}
