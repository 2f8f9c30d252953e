package com.punchwheel.core.spi.notify;

import com.punchwheel.model.NotificationEvent;
import com.punchwheel.model.ProviderResult;
import com.punchwheel.model.enums.NotificationLevel;
import com.punchwheel.model.enums.ProviderKind;

/**
 * 通知渠道
 */
public interface NotificationProvider {

    /**
     * 渠道名称, 用于日志、熔断 key 与结果
     */
    String name();

    ProviderKind kind();

    /**
     * 配置里是否启用
     */
    boolean isEnabled();

    /**
     * 等级过滤
     */
    boolean accepts(NotificationLevel level);

    /**
     * 是否能携带二进制附件
     */
    default boolean supportsAttachments() {
        return false;
    }

    /**
     * 发送一条事件（含限流与内部重试），同步方法, 由 dispatcher 负责并发
     * 不抛异常，失败体现在结果中
     */
    ProviderResult send(NotificationEvent event);

    /**
     * 发送一条测试消息，不受等级过滤
     */
    ProviderResult testConnection();
}
