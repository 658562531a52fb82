package com.antigravity.gateway.exception;

/**
 * 客户端请求违反协议结构约束，不可重试
 */
public class TranslationException extends GatewayException {

    public TranslationException(String message) {
        super(ErrorKind.TRANSLATION, message, 400);
    }
}
