package com.antigravity.gateway.auth;

import reactor.core.publisher.Mono;

/**
 * Token 刷新接口
 */
public interface TokenRefresher {

    /**
     * 用 refresh token 换取 access token
     * <p>
     * 凭证被拒绝时以 credentialRejected=true 的 AuthException 结束
     *
     * @param refreshToken 刷新令牌
     * @return 刷新结果
     */
    Mono<TokenResult> refresh(String refreshToken);

    /**
     * 刷新结果
     *
     * @param accessToken      新的访问令牌
     * @param expiresInSeconds 过期时间（秒）
     */
    record TokenResult(String accessToken, long expiresInSeconds) {}
}
