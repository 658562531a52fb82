package com.antigravity.gateway.signature;

/**
 * 模型家族，签名只在同一家族内有效
 */
public enum ModelFamily {
    CLAUDE,
    GEMINI;

    public static ModelFamily of(String modelId) {
        return modelId != null && modelId.toLowerCase().contains("claude") ? CLAUDE : GEMINI;
    }
}
