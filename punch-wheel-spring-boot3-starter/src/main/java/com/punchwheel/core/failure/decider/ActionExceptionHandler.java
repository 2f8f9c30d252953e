package com.punchwheel.core.failure.decider;

import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.exception.ActionException;
import com.punchwheel.model.enums.ErrorKind;

/**
 * 动作层自带分类
 */
public class ActionExceptionHandler implements FailureCaseHandler<ActionException> {
    @Override
    public Class<ActionException> exceptionType() {
        return ActionException.class;
    }

    @Override
    public ErrorKind execute(ActionException ex) {
        return ex.getKind();
    }
}
