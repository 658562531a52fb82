package com.antigravity.gateway.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.pool.AccountPool;
import com.antigravity.gateway.proxy.CloudCodeRestApi;
import com.antigravity.gateway.signature.ModelFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 模型目录
 * <p>
 * 模型家族与思考模型识别、回退模型映射、/v1/models 列表
 */
@Component
public class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);

    // 上游不可用时返回的默认目录
    private static final Map<String, String> DEFAULT_LABELS = new LinkedHashMap<>();

    static {
        DEFAULT_LABELS.put("claude-sonnet-4-5", "Claude Sonnet 4.5");
        DEFAULT_LABELS.put("claude-sonnet-4-5-thinking", "Claude Sonnet 4.5 (Thinking)");
        DEFAULT_LABELS.put("claude-opus-4-5-thinking", "Claude Opus 4.5 (Thinking)");
        DEFAULT_LABELS.put("gemini-3-pro-high", "Gemini 3 Pro (High)");
        DEFAULT_LABELS.put("gemini-3-pro-low", "Gemini 3 Pro (Low)");
        DEFAULT_LABELS.put("gemini-3-flash", "Gemini 3 Flash");
    }

    private final AppProperties properties;
    private final AccountPool accountPool;
    private final CloudCodeRestApi restApi;
    private final Clock clock;

    public ModelCatalog(AppProperties properties, AccountPool accountPool, CloudCodeRestApi restApi, Clock clock) {
        this.properties = properties;
        this.accountPool = accountPool;
        this.restApi = restApi;
        this.clock = clock;
    }

    /**
     * 是否为网关支持的模型（Claude 或 Gemini）
     */
    public static boolean isSupported(String modelId) {
        if (modelId == null) {
            return false;
        }
        String lower = modelId.toLowerCase();
        return lower.contains("claude") || lower.contains("gemini");
    }

    public static ModelFamily familyOf(String modelId) {
        return ModelFamily.of(modelId);
    }

    /**
     * 是否为思考模型
     * <p>
     * Claude：名称含 thinking；Gemini：gemini-3 系列或名称含 thinking
     */
    public static boolean isThinkingModel(String modelId) {
        if (modelId == null) {
            return false;
        }
        String lower = modelId.toLowerCase();
        if (lower.contains("claude")) {
            return lower.contains("thinking");
        }
        if (lower.contains("gemini")) {
            return lower.contains("thinking") || geminiVersion(lower) >= 3;
        }
        return false;
    }

    /**
     * 回退模型，没有映射时返回 null
     */
    public String fallbackFor(String modelId) {
        return properties.getFallback().getModels().get(modelId);
    }

    public String labelOf(String modelId) {
        return DEFAULT_LABELS.getOrDefault(modelId, modelId);
    }

    /**
     * 列出可用模型
     * <p>
     * 依次用可用账号调用 fetchAvailableModels，全部失败时返回默认目录
     */
    public Mono<JSONObject> listModels() {
        return Flux.fromIterable(accountPool.listAccounts())
                .filter(Account::isUsable)
                .concatMap(account -> accountPool.getCredential(account)
                        .flatMap(restApi::fetchAvailableModels)
                        .onErrorResume(e -> {
                            log.warn("账号 {} 获取模型列表失败: {}", account.email(), e.getMessage());
                            return Mono.empty();
                        }))
                .next()
                .map(this::toModelList)
                .switchIfEmpty(Mono.fromSupplier(this::defaultModelList));
    }

    // ==================== 辅助方法 ====================

    private JSONObject toModelList(JSONObject upstream) {
        JSONArray data = new JSONArray();
        JSONObject models = upstream.getJSONObject("models");
        if (models != null) {
            for (String modelId : models.keySet()) {
                if (!isSupported(modelId)) {
                    continue;
                }
                String displayName = models.getJSONObject(modelId).getString("displayName");
                data.add(modelEntry(modelId, displayName != null ? displayName : labelOf(modelId)));
            }
        }
        return JSONObject.of("object", "list", "data", data);
    }

    private JSONObject defaultModelList() {
        JSONArray data = new JSONArray();
        DEFAULT_LABELS.forEach((id, label) -> data.add(modelEntry(id, label)));
        return JSONObject.of("object", "list", "data", data);
    }

    private JSONObject modelEntry(String modelId, String label) {
        return JSONObject.of(
                "id", modelId, //
                "object", "model", //
                "created", clock.millis() / 1000, //
                "owned_by", "anthropic", //
                "description", label //
        );
    }

    private static int geminiVersion(String lower) {
        int idx = lower.indexOf("gemini-");
        if (idx < 0) {
            return 0;
        }
        int start = idx + "gemini-".length();
        int end = start;
        while (end < lower.length() && Character.isDigit(lower.charAt(end))) {
            end++;
        }
        return end > start ? Integer.parseInt(lower.substring(start, end)) : 0;
    }
}
