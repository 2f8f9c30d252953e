package com.punchwheel.core.failure.decider;

import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.model.enums.ErrorKind;

/**
 * 参数/配置错误（含 PunchConfigException）, 重试无意义
 */
public class ConfigHandler implements FailureCaseHandler<IllegalArgumentException> {
    @Override
    public Class<IllegalArgumentException> exceptionType() {
        return IllegalArgumentException.class;
    }

    @Override
    public ErrorKind execute(IllegalArgumentException ex) {
        return ErrorKind.CONFIG;
    }
}
