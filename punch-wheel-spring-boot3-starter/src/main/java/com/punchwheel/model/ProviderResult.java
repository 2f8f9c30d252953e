package com.punchwheel.model;

import com.punchwheel.model.enums.DeliveryStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 单个 provider 的发送结果
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ProviderResult {

    private final String provider;

    private final DeliveryStatus status;

    /** HTTP 状态码，非 HTTP 渠道为 null */
    private final Integer statusCode;

    private final int attempts;

    private final String errorMessage;

    @Builder.Default
    private final Instant timestamp = Instant.now();

    public boolean isSent() {
        return status == DeliveryStatus.SENT;
    }

    public static ProviderResult sent(String provider, Integer statusCode, int attempts) {
        return ProviderResult.builder().provider(provider).status(DeliveryStatus.SENT)
                .statusCode(statusCode).attempts(attempts).build();
    }

    public static ProviderResult skipped(String provider, String reason) {
        return ProviderResult.builder().provider(provider).status(DeliveryStatus.SKIPPED)
                .errorMessage(reason).build();
    }

    public static ProviderResult failed(String provider, int attempts, String error) {
        return ProviderResult.builder().provider(provider).status(DeliveryStatus.FAILED)
                .attempts(attempts).errorMessage(error).build();
    }
}
