package com.antigravity.gateway.dao;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.pool.AccountSource;
import com.antigravity.gateway.pool.AccountStore;
import com.antigravity.gateway.pool.ModelQuota;
import org.springframework.context.annotation.DependsOn;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 账号 DAO
 * <p>
 * 限流、配额、模型级阈值以 JSON 文本列存储
 */
@Component
@DependsOn("databaseConfig")
public class AccountDAO implements AccountStore {

    private final JdbcTemplate jdbc;

    public AccountDAO(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Account> loadAll() {
        return jdbc.query("SELECT * FROM accounts ORDER BY added_at", ACCOUNT_ROW_MAPPER);
    }

    @Override
    public void save(Account account) {
        jdbc.update("""
                        INSERT OR REPLACE INTO accounts (email, source, refresh_token, api_key, enabled, invalid,
                            invalid_reason, project_id, subscription_tier, health_score, last_used, quota_threshold,
                            model_rate_limits, quota, model_quota_thresholds, quota_last_checked, added_at, updated_at)
                        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                        """,
                account.email(), account.source().value(), account.refreshToken(), account.apiKey(),
                account.enabled() ? 1 : 0, account.invalid() ? 1 : 0, account.invalidReason(),
                account.projectId(), account.subscriptionTier(), account.healthScore(), account.lastUsed(),
                account.quotaThreshold(),
                JSON.toJSONString(account.modelRateLimits()),
                quotaToJson(account.quota()),
                JSON.toJSONString(account.modelQuotaThresholds()),
                account.quotaLastChecked(), account.addedAt(), Instant.now().toString());
    }

    @Override
    public void delete(String email) {
        jdbc.update("DELETE FROM accounts WHERE email = ?", email);
    }

    private static String quotaToJson(Map<String, ModelQuota> quota) {
        JSONObject json = new JSONObject();
        quota.forEach((model, q) -> json.put(model, JSONObject.of( //
                "remainingFraction", q.remainingFraction(), //
                "resetTime", q.resetTime() //
        )));
        return json.toJSONString();
    }

    private static void readQuota(String text, Account account) {
        JSONObject json = text == null ? null : JSONObject.parseObject(text);
        if (json == null) return;
        for (String model : json.keySet()) {
            JSONObject q = json.getJSONObject(model);
            account.quota().put(model, new ModelQuota(q.getDouble("remainingFraction"), q.getString("resetTime")));
        }
    }

    private static void readLongMap(String text, Map<String, Long> target) {
        JSONObject json = text == null ? null : JSONObject.parseObject(text);
        if (json == null) return;
        json.forEach((k, v) -> target.put(k, json.getLong(k)));
    }

    private static void readDoubleMap(String text, Map<String, Double> target) {
        JSONObject json = text == null ? null : JSONObject.parseObject(text);
        if (json == null) return;
        json.forEach((k, v) -> target.put(k, json.getDouble(k)));
    }

    private static final RowMapper<Account> ACCOUNT_ROW_MAPPER = (rs, rowNum) -> {
        Account account = new Account(
                rs.getString("email"), AccountSource.parse(rs.getString("source")),
                rs.getString("refresh_token"), rs.getString("api_key"), rs.getLong("added_at"));
        account.setEnabled(rs.getInt("enabled") != 0);
        account.setInvalid(rs.getInt("invalid") != 0);
        account.setInvalidReason(rs.getString("invalid_reason"));
        account.setProjectId(rs.getString("project_id"));
        account.setSubscriptionTier(rs.getString("subscription_tier"));
        account.setHealthScore(rs.getDouble("health_score"));
        account.setLastUsed(rs.getLong("last_used"));
        double threshold = rs.getDouble("quota_threshold");
        account.setQuotaThreshold(rs.wasNull() ? null : threshold);
        account.setQuotaLastChecked(rs.getLong("quota_last_checked"));
        readLongMap(rs.getString("model_rate_limits"), account.modelRateLimits());
        readQuota(rs.getString("quota"), account);
        readDoubleMap(rs.getString("model_quota_thresholds"), account.modelQuotaThresholds());
        return account;
    };
}
