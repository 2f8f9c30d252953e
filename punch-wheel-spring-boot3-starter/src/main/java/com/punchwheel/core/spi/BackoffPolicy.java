package com.punchwheel.core.spi;

import com.punchwheel.config.PunchRetryProperties;

import java.time.Duration;

/**
 * 回退策略（计算两次尝试之间的等待）
 */
public interface BackoffPolicy {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    /**
     * 计算等待时长
     * @param attempt 刚失败的是第几次尝试（从1开始）
     * @param props   退避参数（base/max/jitterRatio）
     * @return 下一次尝试前的等待，不为负
     */
    Duration delay(int attempt, PunchRetryProperties.Backoff props);
}
