package com.antigravity.gateway.proxy;

import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.auth.ProjectInfo;
import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.exception.UpstreamException;
import com.antigravity.gateway.model.ModelCatalog;
import com.antigravity.gateway.pool.ModelQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cloud Code REST API 客户端
 * <p>
 * 用于辅助功能：模型列表、配额查询、项目与订阅发现。按端点顺序逐个尝试，非 2xx 时换下一个
 */
@Component
public class CloudCodeRestApi {

    private static final Logger log = LoggerFactory.getLogger(CloudCodeRestApi.class);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public CloudCodeRestApi(HttpClient upstreamHttpClient, AppProperties properties) {
        this.httpClient = upstreamHttpClient;
        this.properties = properties;
    }

    /**
     * 获取可用模型（含配额信息）的原始响应
     */
    public Mono<JSONObject> fetchAvailableModels(String accessToken) {
        return callEndpoints("fetchAvailableModels", accessToken, new JSONObject())
                .switchIfEmpty(Mono.error(() -> new UpstreamException(502, "所有端点均无法获取模型列表")));
    }

    /**
     * 获取各模型配额，只保留 Claude 与 Gemini 模型
     */
    public Mono<Map<String, ModelQuota>> getModelQuotas(String accessToken) {
        return fetchAvailableModels(accessToken).map(CloudCodeRestApi::parseQuotas);
    }

    /**
     * 发现项目 ID 与订阅等级
     * <p>
     * 所有端点都失败时返回 free 等级、无项目
     */
    public Mono<ProjectInfo> loadCodeAssist(String accessToken) {
        JSONObject body = JSONObject.of(
                "metadata", JSONObject.of( //
                        "ideType", "IDE_UNSPECIFIED", //
                        "platform", "PLATFORM_UNSPECIFIED", //
                        "pluginType", "GEMINI" //
                ) //
        );
        return callEndpoints("loadCodeAssist", accessToken, body)
                .map(CloudCodeRestApi::parseProjectInfo)
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("所有端点均无法获取订阅信息，默认 free");
                    return new ProjectInfo(null, "free");
                }));
    }

    // ==================== 辅助方法 ====================

    private Mono<JSONObject> callEndpoints(String method, String accessToken, JSONObject body) {
        return Flux.fromIterable(properties.getEndpoints())
                .concatMap(endpoint -> post(endpoint, method, accessToken, body)
                        .onErrorResume(e -> {
                            log.warn("{} 请求异常: endpoint={}, error={}", method, endpoint, e.getMessage());
                            return Mono.empty();
                        }))
                .next();
    }

    private Mono<JSONObject> post(String endpoint, String method, String accessToken, JSONObject body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(endpoint + "/v1internal:" + method))
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(body.toJSONString()));
        UpstreamHeaders.common(accessToken).forEach(builder::header);
        HttpRequest request = builder.build();

        return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
                .flatMap(response -> {
                    if (response.statusCode() != 200) {
                        log.warn("{} 失败: endpoint={}, status={}", method, endpoint, response.statusCode());
                        return Mono.empty();
                    }
                    return Mono.justOrEmpty(JSONObject.parseObject(response.body()));
                });
    }

    static Map<String, ModelQuota> parseQuotas(JSONObject data) {
        Map<String, ModelQuota> quotas = new LinkedHashMap<>();
        JSONObject models = data.getJSONObject("models");
        if (models == null) {
            return quotas;
        }
        for (String modelId : models.keySet()) {
            if (!ModelCatalog.isSupported(modelId)) {
                continue;
            }
            JSONObject quotaInfo = models.getJSONObject(modelId).getJSONObject("quotaInfo");
            if (quotaInfo == null) {
                continue;
            }
            quotas.put(modelId, new ModelQuota(
                    quotaInfo.getDouble("remainingFraction"),
                    quotaInfo.getString("resetTime")));
        }
        return quotas;
    }

    static ProjectInfo parseProjectInfo(JSONObject data) {
        String projectId = null;
        Object project = data.get("cloudaicompanionProject");
        if (project instanceof String s) {
            projectId = s;
        } else if (project instanceof JSONObject obj) {
            projectId = obj.getString("id");
        }

        String tierId = null;
        JSONObject paidTier = data.getJSONObject("paidTier");
        if (paidTier != null) {
            tierId = paidTier.getString("id");
        }
        if (tierId == null) {
            JSONObject currentTier = data.getJSONObject("currentTier");
            if (currentTier != null) {
                tierId = currentTier.getString("id");
            }
        }

        String tier = "free";
        if (tierId != null) {
            String lower = tierId.toLowerCase();
            if (lower.contains("ultra")) {
                tier = "ultra";
            } else if (lower.contains("pro")) {
                tier = "pro";
            }
        }
        log.debug("订阅发现: tier={}, project={}", tier, projectId);
        return new ProjectInfo(projectId, tier);
    }
}
