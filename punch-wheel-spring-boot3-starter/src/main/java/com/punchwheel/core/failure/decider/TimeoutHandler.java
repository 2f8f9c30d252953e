package com.punchwheel.core.failure.decider;

import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.model.enums.ErrorKind;

import java.util.concurrent.TimeoutException;

/**
 * 超时处理
 */
public class TimeoutHandler implements FailureCaseHandler<TimeoutException> {
    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public ErrorKind execute(TimeoutException ex) {
        return ErrorKind.TIMEOUT;
    }
}
