package com.punchwheel.core.failure.decider;

import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.model.enums.ErrorKind;

import java.util.List;
import java.util.Locale;

/**
 * 未知异常兜底, 按消息关键字粗分类
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {

    private static final List<String> NETWORK_KEYWORDS = List.of(
            "connection", "network", "disconnected", "reset", "refused", "unreachable", "aborted");

    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public ErrorKind execute(Throwable ex) {
        String msg = ex.getMessage() == null ? "" : ex.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("timeout") || msg.contains("timed out")) {
            return ErrorKind.TIMEOUT;
        }
        if (NETWORK_KEYWORDS.stream().anyMatch(msg::contains)) {
            return ErrorKind.NETWORK;
        }
        return ErrorKind.UNKNOWN;
    }
}
