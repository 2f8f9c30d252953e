package com.punchwheel.model;

import com.punchwheel.model.enums.ErrorKind;

import java.nio.file.Path;
import java.util.Objects;

/**
 * 单次尝试的结果
 * Success(detail) | Failure(kind, message)，创建后不可变
 */
public final class ActionOutcome {

    private final boolean success;
    private final String detail;
    private final ErrorKind errorKind;
    private final String message;
    private final Throwable cause;
    /** 截图等附件引用，可为 null */
    private final Path attachment;

    private ActionOutcome(boolean success, String detail, ErrorKind errorKind, String message,
                          Throwable cause, Path attachment) {
        this.success = success;
        this.detail = detail;
        this.errorKind = errorKind;
        this.message = message;
        this.cause = cause;
        this.attachment = attachment;
    }

    public static ActionOutcome success(String detail) {
        return new ActionOutcome(true, detail, null, null, null, null);
    }

    public static ActionOutcome failure(ErrorKind kind, String message) {
        return failure(kind, message, null);
    }

    public static ActionOutcome failure(ErrorKind kind, String message, Throwable cause) {
        return new ActionOutcome(false, null, Objects.requireNonNull(kind, "kind"), message, cause, null);
    }

    public ActionOutcome withAttachment(Path attachment) {
        return new ActionOutcome(success, detail, errorKind, message, cause, attachment);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isRetryable() {
        return !success && errorKind.isRetryable();
    }

    public String getDetail() {
        return detail;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    public Throwable getCause() {
        return cause;
    }

    public Path getAttachment() {
        return attachment;
    }

    @Override
    public String toString() {
        return success
                ? "Success(" + detail + ")"
                : "Failure(" + errorKind + ", " + message + ")";
    }
}
