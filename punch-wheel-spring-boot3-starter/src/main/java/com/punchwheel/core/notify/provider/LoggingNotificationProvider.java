package com.punchwheel.core.notify.provider;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.notify.NotificationEvents;
import com.punchwheel.core.spi.notify.NotificationProvider;
import com.punchwheel.model.NotificationEvent;
import com.punchwheel.model.ProviderResult;
import com.punchwheel.model.enums.NotificationLevel;
import com.punchwheel.model.enums.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知，写入应用日志
 */
public class LoggingNotificationProvider implements NotificationProvider {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationProvider.class);

    private final PunchNotifierProperties.Provider cfg;

    public LoggingNotificationProvider(PunchNotifierProperties.Provider cfg) {
        this.cfg = cfg;
    }

    @Override
    public String name() {
        return cfg.getName();
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.LOG;
    }

    @Override
    public boolean isEnabled() {
        return cfg.isEnabled();
    }

    @Override
    public boolean accepts(NotificationLevel level) {
        return cfg.notifies(level);
    }

    @Override
    public ProviderResult send(NotificationEvent event) {
        if (!accepts(event.getLevel())) {
            return ProviderResult.skipped(name(), cfg.filterReason(event.getLevel()));
        }
        write(event);
        return ProviderResult.sent(name(), null, 1);
    }

    @Override
    public ProviderResult testConnection() {
        write(NotificationEvents.connectionTest(name()));
        return ProviderResult.sent(name(), null, 1);
    }

    private void write(NotificationEvent event) {
        switch (event.getLevel()) {
            case ERROR -> log.error("[Notify-{}] {}: {} fields={}", name(), event.getTitle(), truncate(event.getMessage()), event.getFields());
            case WARNING -> log.warn("[Notify-{}] {}: {} fields={}", name(), event.getTitle(), event.getMessage(), event.getFields());
            default -> log.info("[Notify-{}] {}: {} fields={}", name(), event.getTitle(), event.getMessage(), event.getFields());
        }
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
