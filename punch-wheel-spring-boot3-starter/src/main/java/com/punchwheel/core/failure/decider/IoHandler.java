package com.punchwheel.core.failure.decider;

import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.model.enums.ErrorKind;

import java.io.IOException;
import java.net.SocketTimeoutException;

/**
 * 网络 IO
 */
public class IoHandler implements FailureCaseHandler<IOException> {
    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public ErrorKind execute(IOException ex) {
        return ex instanceof SocketTimeoutException ? ErrorKind.TIMEOUT : ErrorKind.NETWORK;
    }
}
