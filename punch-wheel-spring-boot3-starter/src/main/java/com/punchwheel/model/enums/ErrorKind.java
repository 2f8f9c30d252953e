package com.punchwheel.model.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 失败分类
 */
@AllArgsConstructor
@Getter
public enum ErrorKind {
    TIMEOUT(true, "操作超时"),
    NETWORK(true, "网络连接异常"),
    BROWSER(true, "浏览器/自动化层异常"),
    PUNCH_ACTION(true, "打卡动作执行失败"),
    RATE_LIMITED(true, "下游限流"),
    LOGIN(false, "登录凭证错误，重试无意义"),
    AUTH(false, "下游认证失败"),
    CONFIG(false, "配置错误"),
    CIRCUIT_OPEN(false, "熔断打开，本轮直接失败"),
    UNKNOWN(true, "未知异常");

    public final boolean retryable;
    public final String desc;
}
