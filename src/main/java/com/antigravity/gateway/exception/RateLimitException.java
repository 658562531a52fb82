package com.antigravity.gateway.exception;

import lombok.Getter;

/**
 * 配额耗尽（429）
 * <p>
 * accountLevel 为 true 时表示账号已被标记限流，应直接切换账号而不是尝试下一个端点
 */
@Getter
public class RateLimitException extends GatewayException {

    private final Long resetMs;
    private final String endpoint;
    private final boolean accountLevel;

    public RateLimitException(String message, Long resetMs, String endpoint) {
        this(message, resetMs, endpoint, false);
    }

    private RateLimitException(String message, Long resetMs, String endpoint, boolean accountLevel) {
        super(ErrorKind.RATE_LIMIT, message, 429);
        this.resetMs = resetMs;
        this.endpoint = endpoint;
        this.accountLevel = accountLevel;
    }

    public static RateLimitException forAccount(String message, Long resetMs) {
        return new RateLimitException(message, resetMs, null, true);
    }

    public RateLimitException escalate() {
        return new RateLimitException(getMessage(), resetMs, endpoint, true);
    }
}
