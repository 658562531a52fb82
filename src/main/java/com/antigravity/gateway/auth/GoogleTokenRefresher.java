package com.antigravity.gateway.auth;

import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.exception.AuthException;
import com.antigravity.gateway.exception.NetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Google OAuth Token 刷新
 * <p>
 * 使用标准 refresh_token 授权方式，表单提交到 token 端点
 */
@Component
public class GoogleTokenRefresher implements TokenRefresher {

    private static final Logger log = LoggerFactory.getLogger(GoogleTokenRefresher.class);

    private final HttpClient httpClient;
    private final AppProperties properties;

    public GoogleTokenRefresher(HttpClient upstreamHttpClient, AppProperties properties) {
        this.httpClient = upstreamHttpClient;
        this.properties = properties;
    }

    @Override
    public Mono<TokenResult> refresh(String refreshToken) {
        AppProperties.OAuthConfig oauth = properties.getOauth();
        String form = "grant_type=refresh_token"
                + "&refresh_token=" + encode(refreshToken)
                + "&client_id=" + encode(oauth.getClientId())
                + "&client_secret=" + encode(oauth.getClientSecret());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(oauth.getTokenUrl()))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .timeout(Duration.ofSeconds(30))
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();

        return Mono.fromFuture(() -> httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
                .onErrorMap(e -> new NetworkException("Token 刷新请求失败: " + e.getMessage(), e))
                .map(this::parse);
    }

    private TokenResult parse(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status == 400 || status == 401) {
            // invalid_grant 等：refresh token 已失效
            log.error("Token 刷新被拒绝: status={}, body={}", status, response.body());
            throw new AuthException("Token 刷新被拒绝: " + status, true);
        }
        if (status != 200) {
            log.error("Token 刷新失败: status={}, body={}", status, response.body());
            throw new AuthException("Token 刷新失败: " + status);
        }

        JSONObject json = JSONObject.parseObject(response.body());
        String accessToken = json.getString("access_token");
        long expiresIn = json.getLongValue("expires_in", 3600);
        if (accessToken == null || accessToken.isEmpty()) {
            throw new AuthException("刷新响应未返回 access_token");
        }

        log.debug("Token 刷新成功: expiresIn={}s", expiresIn);
        return new TokenResult(accessToken, expiresIn);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value != null ? value : "", StandardCharsets.UTF_8);
    }
}
