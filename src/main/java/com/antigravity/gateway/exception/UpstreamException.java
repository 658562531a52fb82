package com.antigravity.gateway.exception;

import lombok.Getter;

/**
 * 上游非 2xx 响应（429/401 除外）
 */
@Getter
public class UpstreamException extends GatewayException {

    private final String responseBody;

    public UpstreamException(int statusCode, String responseBody) {
        super(ErrorKind.UPSTREAM, "上游 API 错误: " + statusCode + " - " + abbreviate(responseBody), statusCode);
        this.responseBody = responseBody;
    }

    public boolean isServerError() {
        return getStatusCode() >= 500;
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 500 ? body.substring(0, 500) + "..." : body;
    }
}
