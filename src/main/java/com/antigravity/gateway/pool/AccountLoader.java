package com.antigravity.gateway.pool;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * 启动时加载账号
 * <p>
 * 来源优先级：PROXY_ACCOUNTS 环境变量 > 账号存储；两者都为空时使用单个遗留凭证。
 * 无效标记在加载时重置，给账号一次重新认证的机会
 */
@Component
public class AccountLoader {

    private static final Logger log = LoggerFactory.getLogger(AccountLoader.class);
    static final String ENV_ACCOUNTS = "PROXY_ACCOUNTS";

    private final AppProperties properties;
    private final AccountStore store;
    private final Clock clock;
    private final UnaryOperator<String> env;

    @Autowired
    public AccountLoader(AppProperties properties, AccountStore store, Clock clock) {
        this(properties, store, clock, System::getenv);
    }

    AccountLoader(AppProperties properties, AccountStore store, Clock clock, UnaryOperator<String> env) {
        this.properties = properties;
        this.store = store;
        this.clock = clock;
        this.env = env;
    }

    public List<Account> load() {
        Map<String, Account> byEmail = new LinkedHashMap<>();

        try {
            for (Account account : store.loadAll()) {
                account.setInvalid(false);
                account.setInvalidReason(null);
                byEmail.put(account.email(), account);
            }
        } catch (RuntimeException e) {
            log.error("读取账号存储失败: {}", e.getMessage(), e);
        }

        List<Account> fromEnv = loadFromEnv();
        for (Account account : fromEnv) {
            byEmail.put(account.email(), account);
        }

        if (byEmail.isEmpty()) {
            Account legacy = loadLegacy();
            if (legacy != null) {
                byEmail.put(legacy.email(), legacy);
            }
        }

        log.info("账号加载完成: 共 {} 个, 其中环境变量 {} 个", byEmail.size(), fromEnv.size());
        return new ArrayList<>(byEmail.values());
    }

    /**
     * 解析 PROXY_ACCOUNTS
     * <p>
     * 格式：[{"email":"a@x.com","refresh_token":"..."},{"email":"b@x.com","api_key":"..."}]
     */
    List<Account> loadFromEnv() {
        String raw = env.apply(ENV_ACCOUNTS);
        if (raw == null || raw.isBlank()) {
            return List.of();
        }

        JSONArray parsed;
        try {
            Object value = JSON.parse(raw);
            if (!(value instanceof JSONArray array)) {
                log.warn("{} 必须是 JSON 数组", ENV_ACCOUNTS);
                return List.of();
            }
            parsed = array;
        } catch (JSONException e) {
            log.error("{} 解析失败: {}", ENV_ACCOUNTS, e.getMessage());
            return List.of();
        }

        List<Account> accounts = new ArrayList<>();
        long now = clock.millis();
        for (int i = 0; i < parsed.size(); i++) {
            JSONObject entry = parsed.getJSONObject(i);
            String email = entry.getString("email");
            if (email == null || email.isEmpty()) {
                log.warn("跳过缺少 email 的环境变量账号");
                continue;
            }

            String refreshToken = firstNonEmpty(entry.getString("refresh_token"), entry.getString("refreshToken"));
            String apiKey = firstNonEmpty(entry.getString("api_key"), entry.getString("apiKey"));
            if (refreshToken == null && apiKey == null) {
                log.warn("跳过环境变量账号 {}: 缺少 refresh_token 或 api_key", email);
                continue;
            }

            // 两者都有时以 api key 为准
            accounts.add(new Account(email, AccountSource.ENV, apiKey == null ? refreshToken : null, apiKey, now));
        }
        return accounts;
    }

    private Account loadLegacy() {
        AppProperties.LegacyConfig legacy = properties.getLegacy();
        if (legacy.getToken() == null || legacy.getToken().isEmpty()) {
            return null;
        }
        log.info("使用单账号遗留凭证: {}", legacy.getEmail());
        return new Account(legacy.getEmail(), AccountSource.DATABASE, null, legacy.getToken(), clock.millis());
    }

    private static String firstNonEmpty(String a, String b) {
        if (a != null && !a.isEmpty()) {
            return a;
        }
        return b != null && !b.isEmpty() ? b : null;
    }
}
