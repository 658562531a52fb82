package com.antigravity.gateway.orchestrator;

/**
 * 单个请求的处理阶段
 */
public enum RequestPhase {
    SELECT_ACCOUNT,
    TRY_ENDPOINT,
    STREAM,
    RETRY,
    ROTATE_ACCOUNT,
    FALLBACK_MODEL,
    SUCCESS,
    FAIL
}
