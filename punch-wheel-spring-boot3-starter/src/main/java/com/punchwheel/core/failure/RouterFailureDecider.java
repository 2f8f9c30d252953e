package com.punchwheel.core.failure;

import com.punchwheel.core.failure.decider.ActionExceptionHandler;
import com.punchwheel.core.failure.decider.ConfigHandler;
import com.punchwheel.core.failure.decider.IoHandler;
import com.punchwheel.core.failure.decider.OpenCircuitHandler;
import com.punchwheel.core.failure.decider.TimeoutHandler;
import com.punchwheel.core.failure.decider.UnknownHandler;
import com.punchwheel.core.spi.failure.FailureCaseHandler;
import com.punchwheel.core.spi.failure.FailureDecider;
import com.punchwheel.model.enums.ErrorKind;

import java.util.Comparator;
import java.util.List;

public class RouterFailureDecider implements FailureDecider {

    private final List<FailureCaseHandler<?>> handlers;

    /** 未匹配时的默认分类 */
    private final ErrorKind defaultKind;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, ErrorKind.UNKNOWN);
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, ErrorKind defaultKind) {
        this.handlers = List.copyOf(handlers);
        this.defaultKind = defaultKind;
    }

    /**
     * 内置一组处理器
     */
    public static RouterFailureDecider defaults() {
        return new RouterFailureDecider(List.of(
                new ActionExceptionHandler(),
                new OpenCircuitHandler(),
                new TimeoutHandler(),
                new IoHandler(),
                new ConfigHandler(),
                new UnknownHandler()));
    }

    /**
     * 同类型匹配时选择离异常类最近的处理器
     * 先沿 cause 链找具体处理器, 都没有再交给兜底(Throwable)处理器
     */
    @Override
    public ErrorKind decide(Throwable t) {
        for (Throwable e = t; e != null; e = e.getCause()) {
            FailureCaseHandler<?> matched = findBestHandler(e, false);
            if (matched != null) {
                return safeCall(matched, e);
            }
            if (e.getCause() == e) {
                break;
            }
        }
        FailureCaseHandler<?> fallback = t == null ? null : findBestHandler(t, true);
        return fallback == null ? defaultKind : safeCall(fallback, t);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private ErrorKind safeCall(FailureCaseHandler h, Throwable e) {
        ErrorKind kind = h.execute(e);
        return kind == null ? defaultKind : kind;
    }

    private FailureCaseHandler<?> findBestHandler(Throwable e, boolean includeCatchAll) {
        // 过滤 supports 再按继承层级深度排序
        return handlers.stream()
                .filter(h -> includeCatchAll || !Throwable.class.equals(h.exceptionType()))
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
