package com.punchwheel.core.spi.failure;

import com.punchwheel.model.enums.ErrorKind;

/**
 * 异常处理器 SPI
 */
public interface FailureCaseHandler<E extends Throwable> {

    /**
     * 返回能够处理的异常类型
     */
    Class<E> exceptionType();

    /** 是否匹配 */
    default boolean supports(Throwable t) {
        return exceptionType().isInstance(t);
    }

    /** 产出分类 */
    ErrorKind execute(E ex);
}
