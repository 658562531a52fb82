package com.antigravity.gateway.controller;

import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.exception.GlobalExceptionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * 共享密钥校验过滤器
 * <p>
 * 对 /v1/ 开头的请求校验 x-api-key 或 Authorization: Bearer，/v1/models 放行；未配置密钥时不校验
 */
@Component
@Order(10)
public class ApiKeyFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);

    private final AppProperties properties;

    public ApiKeyFilter(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().value();

        // 仅对 API 路径验证
        if (!path.startsWith("/v1/") || path.equals("/v1/models")) {
            return chain.filter(exchange);
        }

        String expected = properties.getApiKey();
        if (expected == null || expected.isEmpty()) {
            return chain.filter(exchange);
        }

        String provided = exchange.getRequest().getHeaders().getFirst("x-api-key");
        if (provided == null) {
            String authHeader = exchange.getRequest().getHeaders().getFirst("Authorization");
            if (authHeader != null && authHeader.startsWith("Bearer ")) {
                provided = authHeader.substring(7).trim();
            }
        }
        if (provided == null || provided.isEmpty()) {
            return unauthorized(exchange, "缺少 API Key");
        }

        if (!MessageDigest.isEqual(provided.getBytes(StandardCharsets.UTF_8), expected.getBytes(StandardCharsets.UTF_8))) {
            log.warn("无效的 API Key: {}***", provided.substring(0, Math.min(4, provided.length())));
            return unauthorized(exchange, "无效的 API Key");
        }
        return chain.filter(exchange);
    }

    private Mono<Void> unauthorized(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] body = GlobalExceptionHandler.errorBody("authentication_error", message)
                .toJSONString().getBytes(StandardCharsets.UTF_8);
        return exchange.getResponse().writeWith(
                Mono.just(exchange.getResponse().bufferFactory().wrap(body))
        );
    }
}
