package com.antigravity.gateway.exception;

import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

/**
 * 全局异常处理器
 * <p>
 * 统一渲染为 Anthropic 错误格式 {"type":"error","error":{"type":...,"message":...}}
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ExhaustedException.class)
    public ResponseEntity<String> handleExhausted(ExhaustedException e) {
        log.warn("请求耗尽: {}", e.getMessage());
        HttpHeaders headers = new HttpHeaders();
        if (e.getRetryAfterMs() != null) {
            headers.set(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(e.getRetryAfterMs())));
        }
        return buildErrorResponse(e.getStatusCode(), errorType(e), e.getMessage(), headers);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<String> handleGateway(GatewayException e) {
        log.error("网关异常: kind={}, message={}", e.getKind(), e.getMessage());
        return buildErrorResponse(e.getStatusCode(), errorType(e), e.getMessage(), new HttpHeaders());
    }

    @ExceptionHandler(JSONException.class)
    public ResponseEntity<String> handleJson(JSONException e) {
        log.warn("请求体解析失败: {}", e.getMessage());
        return buildErrorResponse(400, "invalid_request_error", "请求体不是合法 JSON", new HttpHeaders());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<String> handleResponseStatus(ResponseStatusException e) {
        int statusCode = e.getStatusCode().value();
        log.warn("HTTP 状态异常: {} {}", statusCode, e.getReason());
        String type = statusCode == 404 ? "not_found_error" : "invalid_request_error";
        return buildErrorResponse(statusCode, type, e.getReason(), new HttpHeaders());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<String> handleUnexpected(Exception e) {
        log.error("未预期异常: {}", e.getMessage(), e);
        return buildErrorResponse(500, "api_error", "服务器内部错误", new HttpHeaders());
    }

    /**
     * 错误类型映射
     */
    public static String errorType(GatewayException e) {
        return switch (e.getKind()) {
            case RATE_LIMIT -> "rate_limit_error";
            case AUTH -> "authentication_error";
            case TRANSLATION -> "invalid_request_error";
            case EXHAUSTED -> e.getStatusCode() == 429 ? "rate_limit_error" : "overloaded_error";
            case UPSTREAM -> e.getStatusCode() < 500 ? "invalid_request_error" : "api_error";
            case NETWORK, EMPTY_RESPONSE -> "api_error";
        };
    }

    /**
     * Anthropic 错误体
     */
    public static JSONObject errorBody(String errorType, String message) {
        return JSONObject.of(
                "type", "error", //
                "error", JSONObject.of( //
                        "type", errorType, //
                        "message", message //
                ) //
        );
    }

    static long retryAfterSeconds(long retryAfterMs) {
        return Math.max(1, (retryAfterMs + 999) / 1000);
    }

    private ResponseEntity<String> buildErrorResponse(int statusCode, String errorType, String message,
                                                      HttpHeaders headers) {
        return ResponseEntity
                .status(HttpStatus.valueOf(Math.min(statusCode, 599)))
                .headers(headers)
                .contentType(MediaType.APPLICATION_JSON)
                .body(errorBody(errorType, message).toJSONString());
    }
}
