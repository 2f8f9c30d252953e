package com.punchwheel.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class PunchMetrics {
    private final Counter fired;
    private final Counter success;
    private final Counter failed;
    private final Counter jobError;
    private final Counter circuitRejected;
    private final Counter notifySent;
    private final Counter notifySkipped;
    private final Counter notifyFailed;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private PunchMetrics(MeterRegistry reg) {
        this.fired    = Counter.builder("punch.job.fired").description("job fires").register(reg);
        this.success  = Counter.builder("punch.job.success").description("job runs succeeded").register(reg);
        this.failed   = Counter.builder("punch.job.failed").description("job runs failed").register(reg);
        this.jobError = Counter.builder("punch.job.error").description("unexpected job errors").register(reg);
        this.circuitRejected = Counter.builder("punch.circuit.rejected").description("attempts rejected by open circuit").register(reg);
        this.notifySent    = Counter.builder("punch.notify.sent").description("notifications sent").register(reg);
        this.notifySkipped = Counter.builder("punch.notify.skipped").description("notifications skipped by level").register(reg);
        this.notifyFailed  = Counter.builder("punch.notify.failed").description("notifications failed").register(reg);
        this.attempts = DistributionSummary.builder("punch.retry.attempts")
                .description("attempt count per retry run").baseUnit("times").register(reg);
        this.execTimer = Timer.builder("punch.job.exec.time").description("job execution time").register(reg);
    }

    public static PunchMetrics create(MeterRegistry reg) { return new PunchMetrics(reg); }

    public void incFired(){ fired.increment(); }
    public void incSuccess(){ success.increment(); }
    public void incFailed(){ failed.increment(); }
    public void incJobError(){ jobError.increment(); }
    public void incCircuitRejected(){ circuitRejected.increment(); }
    public void incNotifySent(){ notifySent.increment(); }
    public void incNotifySkipped(){ notifySkipped.increment(); }
    public void incNotifyFailed(){ notifyFailed.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }

    public long firedCount(){ return (long) fired.count(); }
    public long successCount(){ return (long) success.count(); }
    public long failedCount(){ return (long) failed.count(); }
}
