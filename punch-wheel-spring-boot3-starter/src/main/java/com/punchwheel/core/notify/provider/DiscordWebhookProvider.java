package com.punchwheel.core.notify.provider;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.notify.ratelimit.MinIntervalRateLimiter;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.core.spi.PayloadSerializer;
import com.punchwheel.exception.PunchConfigException;
import com.punchwheel.model.NotificationEvent;
import org.springframework.core.io.FileSystemResource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Discord webhook：embed 报文，有截图时走 multipart（payload_json + files[0]）
 */
public class DiscordWebhookProvider extends AbstractWebhookProvider {

    private static final List<String> URL_PREFIXES = List.of(
            "https://discord.com/api/webhooks/",
            "https://discordapp.com/api/webhooks/");

    static final String FOOTER = "Punch Wheel";

    public DiscordWebhookProvider(PunchNotifierProperties.Provider cfg,
                                  RestClient restClient,
                                  PayloadSerializer serializer,
                                  RetryExecutor retryExecutor,
                                  BackoffPolicy backoffPolicy,
                                  MinIntervalRateLimiter rateLimiter) {
        super(cfg, restClient, serializer, retryExecutor, backoffPolicy, rateLimiter);
        validateUrl(cfg.getUrl());
    }

    public static void validateUrl(String url) {
        if (url == null || URL_PREFIXES.stream().noneMatch(url::startsWith)) {
            throw new PunchConfigException("invalid Discord webhook url: " + url);
        }
    }

    @Override
    public boolean supportsAttachments() {
        return true;
    }

    @Override
    protected ResponseEntity<Void> post(NotificationEvent event) {
        Map<String, Object> payload = payload(event);
        Path file = usableAttachment(event);
        if (file == null) {
            return postJson(payload);
        }
        HttpHeaders jsonPart = new HttpHeaders();
        jsonPart.setContentType(MediaType.APPLICATION_JSON);
        HttpHeaders filePart = new HttpHeaders();
        filePart.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        filePart.setContentDisposition(ContentDisposition.formData()
                .name("files[0]")
                .filename(file.getFileName().toString())
                .build());

        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("payload_json", new HttpEntity<>(serializer.serialize(payload), jsonPart));
        body.add("files[0]", new HttpEntity<>(new FileSystemResource(file), filePart));
        return restClient.post()
                .uri(cfg.getUrl())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(body)
                .retrieve()
                .toBodilessEntity();
    }

    Map<String, Object> payload(NotificationEvent event) {
        List<Map<String, Object>> fields = new ArrayList<>();
        event.getFields().forEach((k, v) -> {
            Map<String, Object> f = new LinkedHashMap<>();
            f.put("name", k);
            f.put("value", orDash(v));
            f.put("inline", true);
            fields.add(f);
        });

        Map<String, Object> embed = new LinkedHashMap<>();
        embed.put("title", event.getTitle());
        embed.put("description", orDash(event.getMessage()));
        embed.put("color", event.getLevel().getColor());
        embed.put("timestamp", event.getTimestamp().toString());
        if (!fields.isEmpty()) {
            embed.put("fields", fields);
        }
        embed.put("footer", Map.of("text", FOOTER));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("username", cfg.getUsername());
        payload.put("embeds", List.of(embed));
        return payload;
    }

    /** 附件不存在或超限时返回 null，事件照常发送 */
    private Path usableAttachment(NotificationEvent event) {
        if (!event.hasAttachment()) {
            return null;
        }
        Path file = event.getAttachment();
        try {
            if (!Files.isRegularFile(file)) {
                log.warn("[Notify-{}] attachment {} not found, sending without it", name(), file);
                return null;
            }
            long size = Files.size(file);
            if (size > cfg.getAttachmentMaxBytes()) {
                log.warn("[Notify-{}] attachment {} is {} bytes (limit {}), sending without it",
                        name(), file, size, cfg.getAttachmentMaxBytes());
                return null;
            }
            return file;
        } catch (IOException e) {
            log.warn("[Notify-{}] attachment {} unreadable, sending without it", name(), file, e);
            return null;
        }
    }
}
