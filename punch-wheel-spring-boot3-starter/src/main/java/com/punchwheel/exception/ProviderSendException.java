package com.punchwheel.exception;

/**
 * 单个通知渠道发送失败，只记录不上抛到调度器
 */
public class ProviderSendException extends RuntimeException {

    private final String provider;

    public ProviderSendException(String provider, String message, Throwable cause) {
        super("[" + provider + "] " + message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
