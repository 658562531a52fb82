package com.antigravity.gateway.pool;

import java.util.HashMap;
import java.util.Map;

/**
 * Cloud Code 账号实体
 * <p>
 * 可变状态（限流、健康分、令牌桶、配额）只在 {@link AccountPool} 的锁内修改
 */
public class Account {

    private final String email;
    private final AccountSource source;
    private final String refreshToken;
    private final String apiKey;
    private final long addedAt;

    private volatile boolean enabled = true;
    private volatile boolean invalid;
    private volatile String invalidReason;
    private volatile String projectId;
    private volatile String subscriptionTier = "unknown";
    private volatile double healthScore;
    private volatile long lastUsed;
    private volatile Double quotaThreshold;
    private volatile long quotaLastChecked;

    private final Map<String, Long> modelRateLimits = new HashMap<>();
    private final Map<String, ModelQuota> quota = new HashMap<>();
    private final Map<String, Double> modelQuotaThresholds = new HashMap<>();
    private TokenBucket tokenBucket;

    public Account(String email, AccountSource source, String refreshToken, String apiKey, long addedAt) {
        this.email = email;
        this.source = source;
        this.refreshToken = refreshToken;
        this.apiKey = apiKey;
        this.addedAt = addedAt;
    }

    /**
     * 是否使用静态 API Key（无需刷新）
     */
    public boolean hasStaticKey() {
        return apiKey != null && !apiKey.isEmpty();
    }

    /**
     * 某模型是否仍在限流中
     */
    public boolean isRateLimited(String modelId, long now) {
        Long resetAt = modelRateLimits.get(modelId);
        return resetAt != null && now < resetAt;
    }

    /**
     * 是否可参与选择（不含限流与令牌桶判断）
     */
    public boolean isUsable() {
        return enabled && !invalid;
    }

    /**
     * 生效的配额阈值：模型级 > 账号级 > 全局
     */
    public double effectiveQuotaThreshold(String modelId, double globalThreshold) {
        Double modelLevel = modelQuotaThresholds.get(modelId);
        if (modelLevel != null) {
            return modelLevel;
        }
        return quotaThreshold != null ? quotaThreshold : globalThreshold;
    }

    /**
     * 某模型的剩余配额比例，未知时返回 null
     */
    public Double remainingFraction(String modelId) {
        ModelQuota q = quota.get(modelId);
        return q != null ? q.remainingFraction() : null;
    }

    /**
     * 与账号池脱离的副本，供异步持久化读取；须在池锁内调用。令牌桶不复制
     */
    public Account snapshot() {
        Account copy = new Account(email, source, refreshToken, apiKey, addedAt);
        copy.enabled = enabled;
        copy.invalid = invalid;
        copy.invalidReason = invalidReason;
        copy.projectId = projectId;
        copy.subscriptionTier = subscriptionTier;
        copy.healthScore = healthScore;
        copy.lastUsed = lastUsed;
        copy.quotaThreshold = quotaThreshold;
        copy.quotaLastChecked = quotaLastChecked;
        copy.modelRateLimits.putAll(modelRateLimits);
        copy.quota.putAll(quota);
        copy.modelQuotaThresholds.putAll(modelQuotaThresholds);
        return copy;
    }

    // --- getter / setter ---

    public String email() { return email; }
    public AccountSource source() { return source; }
    public String refreshToken() { return refreshToken; }
    public String apiKey() { return apiKey; }
    public long addedAt() { return addedAt; }

    public boolean enabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public boolean invalid() { return invalid; }
    public void setInvalid(boolean invalid) { this.invalid = invalid; }
    public String invalidReason() { return invalidReason; }
    public void setInvalidReason(String invalidReason) { this.invalidReason = invalidReason; }
    public String projectId() { return projectId; }
    public void setProjectId(String projectId) { this.projectId = projectId; }
    public String subscriptionTier() { return subscriptionTier; }
    public void setSubscriptionTier(String subscriptionTier) { this.subscriptionTier = subscriptionTier; }
    public double healthScore() { return healthScore; }
    public void setHealthScore(double healthScore) { this.healthScore = healthScore; }
    public long lastUsed() { return lastUsed; }
    public void setLastUsed(long lastUsed) { this.lastUsed = lastUsed; }
    public Double quotaThreshold() { return quotaThreshold; }
    public void setQuotaThreshold(Double quotaThreshold) { this.quotaThreshold = quotaThreshold; }
    public long quotaLastChecked() { return quotaLastChecked; }
    public void setQuotaLastChecked(long quotaLastChecked) { this.quotaLastChecked = quotaLastChecked; }

    public Map<String, Long> modelRateLimits() { return modelRateLimits; }
    public Map<String, ModelQuota> quota() { return quota; }
    public Map<String, Double> modelQuotaThresholds() { return modelQuotaThresholds; }
    public TokenBucket tokenBucket() { return tokenBucket; }
    public void setTokenBucket(TokenBucket tokenBucket) { this.tokenBucket = tokenBucket; }

    @Override
    public String toString() {
        return "Account{" + email + ", source=" + source.value() + ", health=" + healthScore + "}";
    }
}
