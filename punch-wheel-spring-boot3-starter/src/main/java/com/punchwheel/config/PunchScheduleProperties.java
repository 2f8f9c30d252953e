package com.punchwheel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Locale;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 打卡调度配置（绑定前缀：punch.schedule）
 *
 * YAML 示例：
 * punch:
 *   schedule:
 *     enabled: true
 *     auto-startup: true
 *     clock-in: "09:00"
 *     clock-out: "18:00"
 *     weekdays-only: true
 *     zone: Asia/Taipei
 *     operation: punch
 *     status-log-interval: 300s
 *     wheel:
 *       tick-duration: 100ms
 *       ticks-per-wheel: 512
 *     executor:
 *       core-pool-size: 2
 *       max-pool-size: 4
 *       queue-capacity: 16
 *       keep-alive: 60s
 *       rejected-handler: ABORT
 *     shutdown:
 *       await: 30s
 */
@ConfigurationProperties(prefix = "punch.schedule")
public class PunchScheduleProperties {

    /** 总开关，false 时不注册任何打卡任务 */
    private boolean enabled = true;

    /** 容器启动时自动启动调度器；命令行工具可关闭后手动启动 */
    private boolean autoStartup = true;

    /** 签到时间 HH:MM（必填） */
    private String clockIn;

    /** 签退时间 HH:MM（必填） */
    private String clockOut;

    /** 仅工作日（跳过周六/周日） */
    private boolean weekdaysOnly = true;

    /** 触发时区，为空使用系统时区 */
    private ZoneId zone;

    /** 熔断/串行化 key */
    private String operation = "punch";

    /** 定期状态日志间隔，<=0 关闭 */
    private Duration statusLogInterval = Duration.ofSeconds(300);

    private Wheel wheel = new Wheel();

    private Exec executor = new Exec();

    private Shutdown shutdown = new Shutdown();

    // ----------------- 嵌套配置对象 -----------------

    public static class Wheel {
        /** 时间轮刻度 */
        private Duration tickDuration = Duration.ofMillis(100);

        /** 槽位数量（2^n 较佳） */
        private int ticksPerWheel = 512;

        public Duration getTickDuration() { return tickDuration; }
        public void setTickDuration(Duration tickDuration) { this.tickDuration = tickDuration; }

        public int getTicksPerWheel() { return ticksPerWheel; }
        public void setTicksPerWheel(int ticksPerWheel) { this.ticksPerWheel = ticksPerWheel; }
    }

    public static class Exec {
        private int corePoolSize = 2;

        private int maxPoolSize = 4;

        /** 任务队列容量 */
        private int queueCapacity = 16;

        /** 线程空闲存活时间 */
        private Duration keepAlive = Duration.ofSeconds(60);

        /** 拒绝策略：ABORT | CALLER_RUNS | DISCARD | DISCARD_OLDEST */
        private RejectedHandlerPolicy rejectedHandler = RejectedHandlerPolicy.ABORT;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }

        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

        public Duration getKeepAlive() { return keepAlive; }
        public void setKeepAlive(Duration keepAlive) { this.keepAlive = keepAlive; }

        public RejectedHandlerPolicy getRejectedHandler() { return rejectedHandler; }
        public void setRejectedHandler(RejectedHandlerPolicy rejectedHandler) { this.rejectedHandler = rejectedHandler; }
    }

    public static class Shutdown {
        /** 停机时等待在途任务的时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    /** 线程池拒绝策略枚举（YAML 中大小写均可） */
    public enum RejectedHandlerPolicy {
        ABORT, CALLER_RUNS, DISCARD, DISCARD_OLDEST;

        public static RejectedHandlerPolicy from(String v) {
            return RejectedHandlerPolicy.valueOf(v.trim().toUpperCase(Locale.ROOT));
        }

        public RejectedExecutionHandler toHandler() {
            return switch (this) {
                case ABORT -> new ThreadPoolExecutor.AbortPolicy();
                case CALLER_RUNS -> new ThreadPoolExecutor.CallerRunsPolicy();
                case DISCARD -> new ThreadPoolExecutor.DiscardPolicy();
                case DISCARD_OLDEST -> new ThreadPoolExecutor.DiscardOldestPolicy();
            };
        }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public boolean isAutoStartup() { return autoStartup; }
    public void setAutoStartup(boolean autoStartup) { this.autoStartup = autoStartup; }

    public String getClockIn() { return clockIn; }
    public void setClockIn(String clockIn) { this.clockIn = clockIn; }

    public String getClockOut() { return clockOut; }
    public void setClockOut(String clockOut) { this.clockOut = clockOut; }

    public boolean isWeekdaysOnly() { return weekdaysOnly; }
    public void setWeekdaysOnly(boolean weekdaysOnly) { this.weekdaysOnly = weekdaysOnly; }

    public ZoneId getZone() { return zone; }
    public void setZone(ZoneId zone) { this.zone = zone; }

    public String getOperation() { return operation; }
    public void setOperation(String operation) { this.operation = operation; }

    public Duration getStatusLogInterval() { return statusLogInterval; }
    public void setStatusLogInterval(Duration statusLogInterval) { this.statusLogInterval = statusLogInterval; }

    public Wheel getWheel() { return wheel; }
    public void setWheel(Wheel wheel) { this.wheel = wheel; }

    public Exec getExecutor() { return executor; }
    public void setExecutor(Exec executor) { this.executor = executor; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    // ----------------- 便捷换算 -----------------

    /** 生效时区 */
    public ZoneId effectiveZone() { return zone == null ? ZoneId.systemDefault() : zone; }

    /** 以毫秒返回刻度（供 HashedWheelTimer 使用） */
    public long wheelTickMillis() { return wheel.getTickDuration().toMillis(); }
}
