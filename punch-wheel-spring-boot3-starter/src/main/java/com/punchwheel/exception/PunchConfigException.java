package com.punchwheel.exception;

/**
 * 配置错误，仅在启动阶段抛出
 */
public class PunchConfigException extends IllegalArgumentException {

    public PunchConfigException(String message) {
        super(message);
    }

    public PunchConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
