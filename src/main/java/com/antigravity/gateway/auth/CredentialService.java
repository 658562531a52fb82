package com.antigravity.gateway.auth;

import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.exception.AuthException;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.proxy.CloudCodeRestApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 凭证服务
 * <p>
 * 管理每个账号的 access token 与项目 ID：
 * - 自动刷新（过期前 5 分钟）
 * - 防抖（并发刷新共享同一个进行中的请求）
 * - 认证失败时 token 与项目缓存一起失效
 */
@Service
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);
    // 提前 5 分钟刷新
    private static final long REFRESH_THRESHOLD_MS = 5 * 60 * 1000L;

    private final TokenRefresher tokenRefresher;
    private final CloudCodeRestApi restApi;
    private final AppProperties properties;
    private final Clock clock;

    // email -> 缓存的 token
    private final ConcurrentHashMap<String, CachedToken> tokenCache = new ConcurrentHashMap<>();
    // email -> 进行中的刷新
    private final ConcurrentHashMap<String, Mono<String>> inFlight = new ConcurrentHashMap<>();
    // email -> 项目信息
    private final ConcurrentHashMap<String, ProjectInfo> projectCache = new ConcurrentHashMap<>();

    public CredentialService(TokenRefresher tokenRefresher, CloudCodeRestApi restApi,
                             AppProperties properties, Clock clock) {
        this.tokenRefresher = tokenRefresher;
        this.restApi = restApi;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 获取有效的 access token
     * <p>
     * 静态 API Key 账号直接返回 key；OAuth 账号优先使用缓存，临近过期时刷新
     */
    public Mono<String> getToken(Account account) {
        if (account.hasStaticKey()) {
            return Mono.just(account.apiKey());
        }

        String email = account.email();
        CachedToken cached = tokenCache.get(email);
        if (cached != null && !cached.needsRefresh(clock.millis())) {
            return Mono.just(cached.accessToken);
        }

        return inFlight.computeIfAbsent(email, k -> doRefresh(account)
                .doFinally(signal -> inFlight.remove(k))
                .cache());
    }

    /**
     * 获取项目信息
     * <p>
     * 账号已配置的项目 > 缓存 > loadCodeAssist 发现 > 默认项目
     */
    public Mono<ProjectInfo> resolveProject(Account account, String accessToken) {
        if (account.projectId() != null && !account.projectId().isEmpty()) {
            return Mono.just(new ProjectInfo(account.projectId(), account.subscriptionTier()));
        }
        ProjectInfo cached = projectCache.get(account.email());
        if (cached != null) {
            return Mono.just(cached);
        }

        return restApi.loadCodeAssist(accessToken)
                .map(info -> info.projectId() != null
                        ? info
                        : new ProjectInfo(properties.getDefaultProjectId(), info.tier()))
                .doOnNext(info -> {
                    projectCache.put(account.email(), info);
                    log.info("账号 {} 项目发现: project={}, tier={}", account.email(), info.projectId(), info.tier());
                });
    }

    /**
     * 清除指定账号的 token 与项目缓存
     */
    public void invalidate(String email) {
        tokenCache.remove(email);
        projectCache.remove(email);
        log.debug("账号 {} 凭证缓存已清除", email);
    }

    private Mono<String> doRefresh(Account account) {
        String refreshToken = account.refreshToken();
        if (refreshToken == null || refreshToken.isEmpty()) {
            return Mono.error(new AuthException("账号 " + account.email() + " 缺少 refreshToken", true));
        }

        return tokenRefresher.refresh(refreshToken)
                .map(result -> {
                    long expiresAt = clock.millis() + result.expiresInSeconds() * 1000;
                    tokenCache.put(account.email(), new CachedToken(result.accessToken(), expiresAt));
                    log.info("账号 {} Token 刷新成功, 有效期 {}s", account.email(), result.expiresInSeconds());
                    return result.accessToken();
                });
    }

    // 缓存的 Token 信息
    private record CachedToken(String accessToken, long expiresAt) {

        boolean needsRefresh(long now) {
            return now + REFRESH_THRESHOLD_MS >= expiresAt;
        }
    }
}
