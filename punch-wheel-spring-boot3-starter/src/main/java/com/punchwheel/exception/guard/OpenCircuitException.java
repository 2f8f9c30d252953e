package com.punchwheel.exception.guard;

/**
 * 异常类型
 * 熔断打开时拒绝调用，以 Failure(CIRCUIT_OPEN) 的形式暴露给调用方
 */
public class OpenCircuitException extends RuntimeException {

    public OpenCircuitException(String operation) {
        super("circuit open for operation '" + operation + "'");
    }
}
