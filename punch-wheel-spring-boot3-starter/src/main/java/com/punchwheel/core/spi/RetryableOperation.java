package com.punchwheel.core.spi;

import com.punchwheel.model.ActionOutcome;

/**
 * RetryExecutor 执行的零参操作
 */
@FunctionalInterface
public interface RetryableOperation {

    ActionOutcome call() throws Exception;
}
