package com.punchwheel.core.notify.provider;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.notify.ratelimit.MinIntervalRateLimiter;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.core.spi.PayloadSerializer;
import com.punchwheel.model.NotificationEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 通用 JSON webhook，扁平报文
 */
public class GenericWebhookProvider extends AbstractWebhookProvider {

    public GenericWebhookProvider(PunchNotifierProperties.Provider cfg,
                                  RestClient restClient,
                                  PayloadSerializer serializer,
                                  RetryExecutor retryExecutor,
                                  BackoffPolicy backoffPolicy,
                                  MinIntervalRateLimiter rateLimiter) {
        super(cfg, restClient, serializer, retryExecutor, backoffPolicy, rateLimiter);
    }

    @Override
    protected ResponseEntity<Void> post(NotificationEvent event) {
        return postJson(payload(event));
    }

    Map<String, Object> payload(NotificationEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", cfg.getUsername());
        payload.put("level", event.getLevel().name());
        payload.put("title", event.getTitle());
        payload.put("message", event.getMessage());
        payload.put("fields", event.getFields());
        payload.put("timestamp", event.getTimestamp().toString());
        if (event.hasAttachment()) {
            payload.put("attachment", event.getAttachment().toString());
        }
        return payload;
    }
}
