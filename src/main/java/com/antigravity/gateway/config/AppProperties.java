package com.antigravity.gateway.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 应用配置属性绑定
 */
@Data
@Component
@ConfigurationProperties(prefix = "antigravity")
public class AppProperties {

    // 入站共享密钥，为空时不校验
    private String apiKey = "";
    private List<String> endpoints = List.of(
            "https://daily-cloudcode-pa.sandbox.googleapis.com",
            "https://cloudcode-pa.googleapis.com"
    );
    private String defaultProjectId = "rising-fact-p41fc";
    private PoolConfig pool = new PoolConfig();
    private CooldownConfig cooldown = new CooldownConfig();
    private RetryConfig retry = new RetryConfig();
    private QuotaConfig quota = new QuotaConfig();
    private FallbackConfig fallback = new FallbackConfig();
    private OAuthConfig oauth = new OAuthConfig();
    private SignatureConfig signature = new SignatureConfig();
    private LegacyConfig legacy = new LegacyConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private DatabaseConfig database = new DatabaseConfig();
    private LoggingConfig logging = new LoggingConfig();

    // --- 嵌套配置类 ---

    @Data
    public static class PoolConfig {
        private String strategy = "hybrid";
        private double initialHealth = 70;
        private double maxHealth = 100;
        private double successReward = 1;
        private double rateLimitPenalty = 10;
        private double failurePenalty = 20;
        private int tokenBucketCapacity = 50;
        private double tokensPerMinute = 6;
        private double healthWeight = 2;
        private double tokenWeight = 5;
        private double quotaWeight = 3;
        private double lruWeight = 0.1;
    }

    @Data
    public static class CooldownConfig {
        // 429 未携带重置时间时的默认冷却
        private long defaultMs = 60_000;
    }

    @Data
    public static class RetryConfig {
        private int maxRetries = 5;
        private int maxEmptyResponseRetries = 2;
        private long emptyResponseBaseDelayMs = 500;
        private long serverErrorDelayMs = 1000;
        private long networkErrorDelayMs = 1000;
        private long maxWaitBeforeErrorMs = 120_000;
        private long waitBufferMs = 500;
    }

    @Data
    public static class QuotaConfig {
        // 剩余配额低于该比例时降权
        private double threshold = 0.1;
        private long refreshIntervalMs = 300_000;
    }

    @Data
    public static class FallbackConfig {
        private boolean enabled = false;
        private Map<String, String> models = new LinkedHashMap<>(Map.of(
                "gemini-3-pro-high", "claude-opus-4-5-thinking",
                "gemini-3-pro-low", "claude-sonnet-4-5",
                "gemini-3-flash", "claude-sonnet-4-5-thinking",
                "claude-opus-4-5-thinking", "gemini-3-pro-high",
                "claude-sonnet-4-5-thinking", "gemini-3-flash",
                "claude-sonnet-4-5", "gemini-3-flash"
        ));
    }

    @Data
    public static class OAuthConfig {
        private String tokenUrl = "https://oauth2.googleapis.com/token";
        private String clientId = "";
        private String clientSecret = "";
    }

    @Data
    public static class SignatureConfig {
        private long ttlMs = 2 * 60 * 60 * 1000L;
        private int minLength = 50;
    }

    @Data
    public static class LegacyConfig {
        // 单账号兼容模式的静态凭证
        private String token = "";
        private String email = "default@antigravity";
    }

    @Data
    public static class ProxyConfig {
        private boolean enabled = false;
        private String url = "";
    }

    @Data
    public static class DatabaseConfig {
        private String path = "data/antigravity.db";
    }

    @Data
    public static class LoggingConfig {
        private String filePath = "data/logs";
        private String maxFileSize = "100MB";
        private int maxHistory = 30;
        private String totalSizeCap = "1GB";
    }
}
