package com.antigravity.gateway.exception;

import lombok.Getter;

/**
 * 网关异常基类
 */
@Getter
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;
    private final int statusCode;

    public GatewayException(ErrorKind kind, String message, int statusCode) {
        super(message);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public GatewayException(ErrorKind kind, String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }
}
