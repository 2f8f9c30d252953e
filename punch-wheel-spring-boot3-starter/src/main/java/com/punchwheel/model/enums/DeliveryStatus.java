package com.punchwheel.model.enums;

/**
 * 单个 provider 的投递结果
 */
public enum DeliveryStatus {
    SENT,
    /** 等级低于 provider 的 min-level */
    SKIPPED,
    FAILED
}
