package com.punchwheel.core.spi;

import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.ctx.PunchContext;

/**
 * 打卡动作 SPI（浏览器自动化层实现）
 * 预期内的失败用 ActionOutcome.failure 返回，不要抛异常；抛出的异常会在边界被归类
 */
@FunctionalInterface
public interface PunchTaskHandler {

    ActionOutcome execute(PunchContext ctx) throws Exception;
}
