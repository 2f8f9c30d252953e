package com.punchwheel.model.enums;

/**
 * 通知渠道类型（配置中的 kind）
 */
public enum ProviderKind {
    DISCORD,
    SLACK,
    GENERIC,
    LOG
}
