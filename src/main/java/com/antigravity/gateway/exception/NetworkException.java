package com.antigravity.gateway.exception;

/**
 * 传输层失败（连接拒绝、重置、超时），视为暂时性故障
 */
public class NetworkException extends GatewayException {

    public NetworkException(String message, Throwable cause) {
        super(ErrorKind.NETWORK, message, 502, cause);
    }
}
