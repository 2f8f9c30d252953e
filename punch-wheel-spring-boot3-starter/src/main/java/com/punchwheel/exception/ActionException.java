package com.punchwheel.exception;

import com.punchwheel.model.enums.ErrorKind;

/**
 * 动作层异常，kind 决定可重试/终止
 */
public class ActionException extends RuntimeException {

    private final ErrorKind kind;

    public ActionException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ActionException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind.isRetryable();
    }
}
