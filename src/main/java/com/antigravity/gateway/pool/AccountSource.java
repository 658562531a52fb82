package com.antigravity.gateway.pool;

/**
 * 账号来源
 */
public enum AccountSource {
    OAUTH,
    MANUAL,
    DATABASE,
    ENV;

    public static AccountSource parse(String value) {
        if (value == null || value.isEmpty()) {
            return OAUTH;
        }
        return switch (value.toLowerCase()) {
            case "manual" -> MANUAL;
            case "database" -> DATABASE;
            case "env" -> ENV;
            default -> OAUTH;
        };
    }

    public String value() {
        return name().toLowerCase();
    }
}
