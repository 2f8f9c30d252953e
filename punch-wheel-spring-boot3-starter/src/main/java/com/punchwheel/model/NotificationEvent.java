package com.punchwheel.model;

import com.punchwheel.model.enums.NotificationLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

/**
 * 通知事件，publish 后被各 provider 独立消费
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class NotificationEvent {

    @NonNull
    private final NotificationLevel level;

    @NonNull
    private final String title;

    private final String message;

    /** 有序的 name/value 字段 */
    @Singular
    private final Map<String, String> fields;

    /** 可选附件（截图） */
    private final Path attachment;

    @Builder.Default
    private final Instant timestamp = Instant.now();

    public boolean hasAttachment() {
        return attachment != null;
    }
}
