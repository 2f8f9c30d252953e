package com.punchwheel.core.notify.provider;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.notify.ratelimit.MinIntervalRateLimiter;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.core.spi.PayloadSerializer;
import com.punchwheel.model.NotificationEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slack incoming webhook，不支持二进制附件
 */
public class SlackWebhookProvider extends AbstractWebhookProvider {

    public SlackWebhookProvider(PunchNotifierProperties.Provider cfg,
                                RestClient restClient,
                                PayloadSerializer serializer,
                                RetryExecutor retryExecutor,
                                BackoffPolicy backoffPolicy,
                                MinIntervalRateLimiter rateLimiter) {
        super(cfg, restClient, serializer, retryExecutor, backoffPolicy, rateLimiter);
    }

    @Override
    protected ResponseEntity<Void> post(NotificationEvent event) {
        if (event.hasAttachment()) {
            log.debug("[Notify-{}] attachment {} dropped, not supported", name(), event.getAttachment());
        }
        return postJson(payload(event));
    }

    Map<String, Object> payload(NotificationEvent event) {
        List<Map<String, Object>> fields = new ArrayList<>();
        event.getFields().forEach((k, v) -> {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("title", k);
            f.put("value", orDash(v));
            f.put("short", true);
            fields.add(f);
        });

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", event.getLevel().hexColor());
        attachment.put("title", event.getTitle());
        attachment.put("text", orDash(event.getMessage()));
        attachment.put("fields", fields);
        attachment.put("ts", event.getTimestamp().getEpochSecond());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("username", cfg.getUsername());
        payload.put("text", event.getTitle());
        payload.put("attachments", List.of(attachment));
        return payload;
    }
}
