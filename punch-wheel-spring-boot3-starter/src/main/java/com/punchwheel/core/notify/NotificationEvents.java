package com.punchwheel.core.notify;

import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.NotificationEvent;
import com.punchwheel.model.RetryResult;
import com.punchwheel.model.ScheduledJob;
import com.punchwheel.model.enums.NotificationLevel;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 常用通知事件
 */
public final class NotificationEvents {

    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private NotificationEvents() {
    }

    /** 打卡结果：成功 SUCCESS，失败 ERROR */
    public static NotificationEvent punchResult(ScheduledJob job, RetryResult result, ZonedDateTime firedAt) {
        ActionOutcome outcome = result.getOutcome();
        String label = job.getPunchType().getDesc();
        NotificationEvent.NotificationEventBuilder b = NotificationEvent.builder()
                .field("Job", job.getId())
                .field("Type", job.getPunchType().getJobId())
                .field("Time", firedAt.format(TIME_FMT))
                .field("Attempts", String.valueOf(result.getAttempts()))
                .attachment(outcome.getAttachment());
        if (outcome.isSuccess()) {
            return b.level(NotificationLevel.SUCCESS)
                    .title(label + "成功")
                    .message(outcome.getDetail() != null ? outcome.getDetail() : job.getId() + " completed")
                    .build();
        }
        return b.level(NotificationLevel.ERROR)
                .title(label + "失败")
                .message(outcome.getMessage())
                .field("Error", String.valueOf(outcome.getErrorKind()))
                .build();
    }

    public static NotificationEvent schedulerStarted(Map<String, ZonedDateTime> nextFires) {
        NotificationEvent.NotificationEventBuilder b = NotificationEvent.builder()
                .level(NotificationLevel.INFO)
                .title("打卡调度已启动")
                .message(nextFires.size() + " job(s) scheduled");
        nextFires.forEach((id, at) -> b.field(id, at.format(TIME_FMT)));
        return b.build();
    }

    public static NotificationEvent schedulerStopped() {
        return NotificationEvent.builder()
                .level(NotificationLevel.INFO)
                .title("打卡调度已停止")
                .message("scheduler stopped")
                .build();
    }

    public static NotificationEvent schedulerError(String jobId, Throwable error) {
        return NotificationEvent.builder()
                .level(NotificationLevel.ERROR)
                .title("调度异常")
                .message(error.getMessage() != null ? error.getMessage() : error.getClass().getName())
                .field("Job", jobId)
                .field("Exception", error.getClass().getSimpleName())
                .build();
    }

    /** 连通性测试 */
    public static NotificationEvent connectionTest(String provider) {
        return NotificationEvent.builder()
                .level(NotificationLevel.INFO)
                .title("通知测试")
                .message("Test notification from punch-wheel")
                .field("Provider", provider)
                .timestamp(Instant.now())
                .build();
    }
}
