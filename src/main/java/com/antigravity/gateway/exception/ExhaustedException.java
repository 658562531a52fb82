package com.antigravity.gateway.exception;

import lombok.Getter;

/**
 * 所有账号、端点、重试与回退模型均已耗尽
 * <p>
 * retryAfterMs 为 null 表示无法估计恢复时间
 */
@Getter
public class ExhaustedException extends GatewayException {

    private final Long retryAfterMs;

    public ExhaustedException(String message, Long retryAfterMs) {
        super(ErrorKind.EXHAUSTED, message, retryAfterMs != null ? 429 : 503);
        this.retryAfterMs = retryAfterMs;
    }

    public ExhaustedException(String message, Long retryAfterMs, Throwable cause) {
        super(ErrorKind.EXHAUSTED, message, retryAfterMs != null ? 429 : 503, cause);
        this.retryAfterMs = retryAfterMs;
    }
}
