package com.punchwheel.core.notify.provider;

import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.notify.NotificationEvents;
import com.punchwheel.core.notify.ratelimit.MinIntervalRateLimiter;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.retry.RetryPolicy;
import com.punchwheel.core.spi.BackoffPolicy;
import com.punchwheel.core.spi.PayloadSerializer;
import com.punchwheel.core.spi.notify.NotificationProvider;
import com.punchwheel.exception.ProviderSendException;
import com.punchwheel.model.ActionOutcome;
import com.punchwheel.model.NotificationEvent;
import com.punchwheel.model.ProviderResult;
import com.punchwheel.model.RetryResult;
import com.punchwheel.model.enums.DeliveryStatus;
import com.punchwheel.model.enums.ErrorKind;
import com.punchwheel.model.enums.NotificationLevel;
import com.punchwheel.model.enums.ProviderKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * webhook 渠道模板：等级过滤 -> 限流 -> 熔断重试 -> HTTP
 * 子类只负责把事件转成各自的报文
 */
public abstract class AbstractWebhookProvider implements NotificationProvider {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final PunchNotifierProperties.Provider cfg;

    protected final RestClient restClient;

    protected final PayloadSerializer serializer;

    private final RetryExecutor retryExecutor;

    private final BackoffPolicy backoffPolicy;

    private final MinIntervalRateLimiter rateLimiter;

    protected AbstractWebhookProvider(PunchNotifierProperties.Provider cfg,
                                      RestClient restClient,
                                      PayloadSerializer serializer,
                                      RetryExecutor retryExecutor,
                                      BackoffPolicy backoffPolicy,
                                      MinIntervalRateLimiter rateLimiter) {
        this.cfg = cfg;
        this.restClient = restClient;
        this.serializer = serializer;
        this.retryExecutor = retryExecutor;
        this.backoffPolicy = backoffPolicy;
        this.rateLimiter = rateLimiter;
    }

    /**
     * 发送报文，非 2xx 以 RestClientResponseException 抛出
     */
    protected abstract ResponseEntity<Void> post(NotificationEvent event);

    @Override
    public String name() {
        return cfg.getName();
    }

    @Override
    public ProviderKind kind() {
        return cfg.getKind();
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
        return deliver(event);
    }

    @Override
    public ProviderResult testConnection() {
        return deliver(NotificationEvents.connectionTest(name()));
    }

    /** 熔断 key */
    public String circuitKey() {
        return "notify:" + name();
    }

    protected ProviderResult deliver(NotificationEvent event) {
        AtomicReference<Integer> lastStatus = new AtomicReference<>();
        RetryPolicy policy = RetryPolicy.of(circuitKey(), cfg.getMaxRetries(), backoffPolicy, cfg.getBackoff());
        RetryResult result;
        try {
            result = retryExecutor.run(policy, () -> {
                rateLimiter.acquire();
                return attempt(event, lastStatus);
            });
        } catch (RuntimeException e) {
            ProviderSendException ex = new ProviderSendException(name(), "unexpected error", e);
            log.error("[Notify-{}] send '{}' aborted", name(), event.getTitle(), ex);
            return ProviderResult.failed(name(), 0, ex.getMessage());
        }

        if (result.isSuccess()) {
            log.info("[Notify-{}] sent '{}' in {} attempt(s)", name(), event.getTitle(), result.getAttempts());
            return ProviderResult.sent(name(), lastStatus.get(), result.getAttempts());
        }
        ActionOutcome outcome = result.getOutcome();
        ProviderSendException ex = new ProviderSendException(name(),
                outcome.getErrorKind() + ": " + outcome.getMessage(), outcome.getCause());
        log.warn("[Notify-{}] send '{}' failed after {} attempt(s): {}",
                name(), event.getTitle(), result.getAttempts(), ex.getMessage());
        return ProviderResult.builder()
                .provider(name())
                .status(DeliveryStatus.FAILED)
                .statusCode(lastStatus.get())
                .attempts(result.getAttempts())
                .errorMessage(ex.getMessage())
                .build();
    }

    private ActionOutcome attempt(NotificationEvent event, AtomicReference<Integer> lastStatus) {
        try {
            ResponseEntity<Void> resp = post(event);
            lastStatus.set(resp.getStatusCode().value());
            return ActionOutcome.success("HTTP " + resp.getStatusCode().value());
        } catch (RestClientResponseException e) {
            int code = e.getStatusCode().value();
            lastStatus.set(code);
            if (code == HttpStatus.TOO_MANY_REQUESTS.value()) {
                Duration retryAfter = retryAfter(e.getResponseHeaders());
                rateLimiter.penalize(retryAfter);
                return ActionOutcome.failure(ErrorKind.RATE_LIMITED,
                        "HTTP 429, retry after " + retryAfter.toMillis() + " ms", e);
            }
            if (code == HttpStatus.UNAUTHORIZED.value() || code == HttpStatus.FORBIDDEN.value()) {
                return ActionOutcome.failure(ErrorKind.AUTH, "HTTP " + code + " webhook rejected", e);
            }
            return ActionOutcome.failure(ErrorKind.NETWORK, "HTTP " + code + " " + truncate(e.getResponseBodyAsString()), e);
        }
    }

    /** Retry-After 以秒计，可带小数；缺失时按限流间隔 */
    private Duration retryAfter(HttpHeaders headers) {
        String v = headers == null ? null : headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (v != null) {
            try {
                return Duration.ofMillis((long) Math.ceil(Double.parseDouble(v.trim()) * 1000d));
            } catch (NumberFormatException ignore) {
                log.debug("[Notify-{}] unparsable Retry-After '{}'", name(), v);
            }
        }
        return rateLimiter.getInterval();
    }

    protected ResponseEntity<Void> postJson(Object payload) {
        return restClient.post()
                .uri(cfg.getUrl())
                .contentType(MediaType.APPLICATION_JSON)
                .body(serializer.serialize(payload))
                .retrieve()
                .toBodilessEntity();
    }

    protected static String orDash(String s) {
        return s == null || s.isBlank() ? "-" : s;
    }

    private static String truncate(String s) {
        return s == null ? "" : (s.length() > 200 ? s.substring(0, 200) : s);
    }
}
