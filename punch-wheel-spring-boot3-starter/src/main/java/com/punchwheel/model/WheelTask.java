package com.punchwheel.model;

import io.netty.util.Timeout;
import io.netty.util.TimerTask;

/**
 * 时间轮上的任务封装
 * 带上 job id 和计划触发时间, stop() 取消时据此记录被丢弃的触发
 */
public class WheelTask implements TimerTask {

    private final String jobId;

    /** 计划触发时间（epoch millis） */
    private final long fireAtMillis;

    /** 真正要执行的逻辑 */
    private final Runnable actual;

    public WheelTask(String jobId, long fireAtMillis, Runnable actual) {
        this.jobId = jobId;
        this.fireAtMillis = fireAtMillis;
        this.actual = actual;
    }

    @Override
    public void run(Timeout timeout) {
        if (timeout.isCancelled()) {
            return;
        }
        actual.run();
    }

    public String getJobId() {
        return jobId;
    }

    public long getFireAtMillis() {
        return fireAtMillis;
    }
}
