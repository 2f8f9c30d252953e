package com.punchwheel.core.notify;

import com.punchwheel.core.metric.PunchMetrics;
import com.punchwheel.core.spi.notify.NotificationProvider;
import com.punchwheel.exception.ProviderSendException;
import com.punchwheel.model.NotificationEvent;
import com.punchwheel.model.ProviderResult;
import com.punchwheel.model.enums.DeliveryStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * 通知分发
 * 按等级过滤后并发投递到各渠道，等待全部完成（上限 publish-timeout），从不抛异常
 */
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationProvider> providers;

    private final ExecutorService exec;

    private final Duration publishTimeout;

    private final PunchMetrics metrics;

    private final boolean enabled;

    public NotificationDispatcher(List<NotificationProvider> providers,
                                  ExecutorService exec,
                                  Duration publishTimeout,
                                  PunchMetrics metrics,
                                  boolean enabled) {
        this.providers = List.copyOf(providers);
        this.exec = exec;
        this.publishTimeout = publishTimeout;
        this.metrics = metrics;
        this.enabled = enabled;
    }

    /**
     * 每个已启用渠道返回一个结果，禁用的渠道不出现
     */
    public List<ProviderResult> publish(NotificationEvent event) {
        if (!enabled) {
            return List.of();
        }
        List<ProviderResult> results = fanOut(p -> {
            if (!p.accepts(event.getLevel())) {
                return null;
            }
            return () -> p.send(event);
        }, event);
        results.forEach(this::count);
        log.info("[Notify] '{}' ({}) -> {}", event.getTitle(), event.getLevel(), summary(results));
        return results;
    }

    /**
     * 对每个已启用渠道发送测试消息, 不受等级过滤
     */
    public List<ProviderResult> testConnections() {
        NotificationEvent ping = NotificationEvents.connectionTest("*");
        return fanOut(p -> p::testConnection, ping);
    }

    public List<NotificationProvider> getProviders() {
        return providers;
    }

    public List<NotificationProvider> enabledProviders() {
        return providers.stream().filter(NotificationProvider::isEnabled).toList();
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * task 为 null 表示按等级跳过
     */
    private List<ProviderResult> fanOut(Function<NotificationProvider, Callable<ProviderResult>> taskOf,
                                        NotificationEvent event) {
        List<NotificationProvider> active = enabledProviders();
        List<Object> slots = new ArrayList<>(active.size());
        for (NotificationProvider p : active) {
            Callable<ProviderResult> task = taskOf.apply(p);
            if (task == null) {
                slots.add(ProviderResult.skipped(p.name(), "level " + event.getLevel() + " filtered"));
                continue;
            }
            try {
                slots.add(exec.submit(task));
            } catch (RejectedExecutionException e) {
                slots.add(failure(p, "notify pool rejected the task", e));
            }
        }

        long deadline = System.nanoTime() + publishTimeout.toNanos();
        List<ProviderResult> results = new ArrayList<>(active.size());
        for (int i = 0; i < active.size(); i++) {
            NotificationProvider p = active.get(i);
            Object slot = slots.get(i);
            if (slot instanceof ProviderResult r) {
                results.add(r);
                continue;
            }
            @SuppressWarnings("unchecked")
            Future<ProviderResult> f = (Future<ProviderResult>) slot;
            results.add(await(p, f, deadline));
        }
        return results;
    }

    private ProviderResult await(NotificationProvider p, Future<ProviderResult> f, long deadline) {
        try {
            ProviderResult r = f.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            return r != null ? r : failure(p, "provider returned no result", null);
        } catch (TimeoutException e) {
            f.cancel(true);
            return failure(p, "timed out after " + publishTimeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            return failure(p, String.valueOf(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            f.cancel(true);
            return failure(p, "interrupted while waiting", e);
        }
    }

    private ProviderResult failure(NotificationProvider p, String msg, Throwable cause) {
        ProviderSendException ex = new ProviderSendException(p.name(), msg, cause);
        log.error("[Notify] provider {} failed", p.name(), ex);
        return ProviderResult.failed(p.name(), 0, ex.getMessage());
    }

    private void count(ProviderResult r) {
        if (r.getStatus() == DeliveryStatus.SENT) {
            metrics.incNotifySent();
        } else if (r.getStatus() == DeliveryStatus.SKIPPED) {
            metrics.incNotifySkipped();
        } else {
            metrics.incNotifyFailed();
        }
    }

    private static String summary(List<ProviderResult> results) {
        StringBuilder sb = new StringBuilder();
        for (ProviderResult r : results) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(r.getProvider()).append('=').append(r.getStatus());
        }
        return sb.length() == 0 ? "no providers" : sb.toString();
    }
}
