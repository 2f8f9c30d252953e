package com.punchwheel.model.enums;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;

/**
 * 熔断器状态
 */
public enum CircuitStatus {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public static CircuitStatus of(CircuitBreaker.State state) {
        return switch (state) {
            case OPEN, FORCED_OPEN -> OPEN;
            case HALF_OPEN -> HALF_OPEN;
            default -> CLOSED;
        };
    }
}
