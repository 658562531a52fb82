package com.antigravity.gateway.exception;

/**
 * 失败分类
 * <p>
 * 在首次检测到失败的位置确定，后续只按类型分派，不再解析消息文本
 */
public enum ErrorKind {
    RATE_LIMIT,
    AUTH,
    UPSTREAM,
    NETWORK,
    EMPTY_RESPONSE,
    TRANSLATION,
    EXHAUSTED
}
