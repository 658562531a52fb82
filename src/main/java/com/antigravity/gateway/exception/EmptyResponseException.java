package com.antigravity.gateway.exception;

/**
 * 上游调用成功但没有产生任何内容
 */
public class EmptyResponseException extends GatewayException {

    public EmptyResponseException(String model) {
        super(ErrorKind.EMPTY_RESPONSE, "模型 " + model + " 返回空响应", 502);
    }
}
