package com.punchwheel.app.handler;

import com.punchwheel.app.config.SimulationProperties;
import com.punchwheel.core.spi.PunchTaskHandler;
import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.ctx.PunchContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 模拟打卡：不访问 HR 系统，按配置返回成功或失败
 */
@Component
public class SimulatedPunchHandler implements PunchTaskHandler {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPunchHandler.class);

    private final SimulationProperties props;

    /** job id -> 已尝试次数 */
    private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();

    public SimulatedPunchHandler(SimulationProperties props) {
        this.props = props;
    }

    @Override
    public ActionOutcome execute(PunchContext ctx) throws InterruptedException {
        Duration latency = props.getLatency();
        if (latency != null && !latency.isZero() && !latency.isNegative()) {
            Thread.sleep(latency.toMillis());
        }
        int n = attempts.computeIfAbsent(ctx.getJobId(), k -> new AtomicInteger()).incrementAndGet();
        if (n <= props.getFailFirst()) {
            log.info("[Punch-Sim] {} attempt #{} -> simulated {}", ctx.getJobId(), n, props.getFailureKind());
            return ActionOutcome.failure(props.getFailureKind(), "simulated failure #" + n);
        }
        log.info("[Punch-Sim] {} ({}) punched at {}{}", ctx.getJobId(), ctx.getPunchType().getDesc(),
                ctx.getScheduledAt(), ctx.isManual() ? " [manual]" : "");
        return ActionOutcome.success(ctx.getPunchType().getDesc() + " completed (simulated)");
    }

    /**
     * 已尝试次数, 未执行过为 0
     */
    public int attempts(String jobId) {
        AtomicInteger n = attempts.get(jobId);
        return n == null ? 0 : n.get();
    }
}
