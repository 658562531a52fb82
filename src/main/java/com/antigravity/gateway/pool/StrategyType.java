package com.antigravity.gateway.pool;

/**
 * 账号选择策略类型
 */
public enum StrategyType {
    HYBRID,
    STICKY,
    ROUND_ROBIN;

    public static StrategyType parse(String name) {
        if (name == null) {
            return HYBRID;
        }
        return switch (name.toLowerCase()) {
            case "sticky" -> STICKY;
            case "round-robin", "round_robin", "roundrobin" -> ROUND_ROBIN;
            default -> HYBRID;
        };
    }
}
