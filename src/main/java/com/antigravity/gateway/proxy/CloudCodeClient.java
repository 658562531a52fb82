package com.antigravity.gateway.proxy;

import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.exception.AuthException;
import com.antigravity.gateway.exception.NetworkException;
import com.antigravity.gateway.exception.RateLimitException;
import com.antigravity.gateway.exception.UpstreamException;
import com.antigravity.gateway.model.ModelCatalog;
import com.antigravity.gateway.signature.ModelFamily;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;

import java.io.IOException;

/**
 * Cloud Code 生成接口客户端
 * <p>
 * 单端点调用，非 2xx 在此处分类为 RateLimit / Auth / Upstream 异常，传输失败为 NetworkException。
 * 端点回退与账号轮换由编排器负责
 */
@Component
public class CloudCodeClient {

    private static final Logger log = LoggerFactory.getLogger(CloudCodeClient.class);
    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final RateLimitParser rateLimitParser;

    public CloudCodeClient(WebClient upstreamWebClient, RateLimitParser rateLimitParser) {
        this.webClient = upstreamWebClient;
        this.rateLimitParser = rateLimitParser;
    }

    /**
     * 流式生成
     *
     * @return SSE data 负载（每个元素是一个完整 JSON 块）
     */
    public Flux<String> streamGenerate(String endpoint, String accessToken, String model, JSONObject payload) {
        String url = endpoint + "/v1internal:streamGenerateContent?alt=sse";
        return webClient.post()
                .uri(url)
                .headers(h -> applyHeaders(h, accessToken, model))
                .accept(MediaType.TEXT_EVENT_STREAM)
                .bodyValue(payload.toJSONString())
                .exchangeToFlux(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToFlux(SSE_TYPE)
                                .mapNotNull(ServerSentEvent::data)
                                .filter(data -> !data.isBlank() && !"[DONE]".equals(data.trim()));
                    }
                    return classifyError(response, endpoint);
                })
                .onErrorMap(CloudCodeClient::isTransportError,
                        e -> new NetworkException("上游连接失败: " + endpoint + " - " + e.getMessage(), e));
    }

    /**
     * 非流式生成
     *
     * @return 只含一个完整响应的 Flux，可直接交给 StreamReassembler
     */
    public Flux<String> generate(String endpoint, String accessToken, String model, JSONObject payload) {
        String url = endpoint + "/v1internal:generateContent";
        return webClient.post()
                .uri(url)
                .headers(h -> applyHeaders(h, accessToken, model))
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(payload.toJSONString())
                .exchangeToFlux(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(String.class).flux();
                    }
                    return classifyError(response, endpoint);
                })
                .onErrorMap(CloudCodeClient::isTransportError,
                        e -> new NetworkException("上游连接失败: " + endpoint + " - " + e.getMessage(), e));
    }

    // ==================== 辅助方法 ====================

    private <T> Flux<T> classifyError(ClientResponse response, String endpoint) {
        int status = response.statusCode().value();
        HttpHeaders headers = response.headers().asHttpHeaders();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .flatMapMany(body -> {
                    log.warn("上游错误: endpoint={}, status={}, body={}", endpoint, status, abbreviate(body));
                    if (status == 429) {
                        Long resetMs = rateLimitParser.parseResetMs(headers, body);
                        return Flux.error(new RateLimitException("上游限流: " + abbreviate(body), resetMs, endpoint));
                    }
                    if (status == 401) {
                        return Flux.error(new AuthException("上游认证失败: " + abbreviate(body)));
                    }
                    return Flux.error(new UpstreamException(status, body));
                });
    }

    private static void applyHeaders(HttpHeaders headers, String accessToken, String model) {
        UpstreamHeaders.common(accessToken).forEach(headers::set);
        if (ModelCatalog.familyOf(model) == ModelFamily.CLAUDE && ModelCatalog.isThinkingModel(model)) {
            headers.set("anthropic-beta", "interleaved-thinking-2025-05-14");
        }
    }

    private static boolean isTransportError(Throwable e) {
        return e instanceof WebClientRequestException || e instanceof IOException;
    }

    private static String abbreviate(String body) {
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
