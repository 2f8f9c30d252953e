package com.punchwheel.core.spi.failure;

import com.punchwheel.model.enums.ErrorKind;

/**
 * 失败判定器 按异常类型给出分类
 */
public interface FailureDecider {

    /**
     * 根据异常做出分类
     */
    ErrorKind decide(Throwable t);
}
