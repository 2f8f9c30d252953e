package com.punchwheel.core.failure.decider;

import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.exception.guard.OpenCircuitException;
import com.punchwheel.model.enums.ErrorKind;

/**
 * 熔断打开
 */
public class OpenCircuitHandler implements FailureCaseHandler<OpenCircuitException> {
    @Override
    public Class<OpenCircuitException> exceptionType() {
        return OpenCircuitException.class;
    }

    @Override
    public ErrorKind execute(OpenCircuitException ex) {
        return ErrorKind.CIRCUIT_OPEN;
    }
}
