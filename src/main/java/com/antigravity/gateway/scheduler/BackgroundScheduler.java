package com.antigravity.gateway.scheduler;

import com.antigravity.gateway.exception.AuthException;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.pool.AccountPool;
import com.antigravity.gateway.proxy.CloudCodeRestApi;
import com.antigravity.gateway.signature.SignatureCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * 后台定时任务调度器
 * <p>
 * - 账号配额与订阅刷新
 * - 过期限流清理
 * - 签名缓存清理
 */
@Component
public class BackgroundScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final AccountPool accountPool;
    private final CloudCodeRestApi restApi;
    private final SignatureCache signatureCache;

    public BackgroundScheduler(AccountPool accountPool, CloudCodeRestApi restApi, SignatureCache signatureCache) {
        this.accountPool = accountPool;
        this.restApi = restApi;
        this.signatureCache = signatureCache;
    }

    /**
     * 配额刷新（默认每 5 分钟）
     */
    @Scheduled(initialDelay = 10_000, fixedRateString = "${antigravity.quota.refresh-interval-ms:300000}")
    public void refreshQuotas() {
        try {
            Integer refreshed = refreshAllQuotas().block(Duration.ofMinutes(2));
            log.info("配额刷新完成: {}/{} 个账号", refreshed, accountPool.size());
        } catch (RuntimeException e) {
            log.error("配额刷新失败", e);
        }
    }

    /**
     * 逐个账号刷新配额，单个账号失败不影响其他账号
     */
    public Mono<Integer> refreshAllQuotas() {
        return Flux.fromIterable(accountPool.listAccounts())
                .filter(Account::isUsable)
                .concatMap(this::refreshAccount)
                .count()
                .map(Long::intValue);
    }

    private Mono<Boolean> refreshAccount(Account account) {
        return accountPool.getCredential(account)
                .flatMap(token -> accountPool.getProject(account, token)
                        .then(restApi.getModelQuotas(token)))
                .map(quotas -> {
                    accountPool.updateQuota(account.email(), quotas);
                    log.debug("账号 {} 配额已刷新: {} 个模型", account.email(), quotas.size());
                    return true;
                })
                .onErrorResume(e -> {
                    if (e instanceof AuthException auth && auth.isCredentialRejected()) {
                        accountPool.markInvalid(account.email(), e.getMessage());
                    } else {
                        log.warn("账号 {} 配额刷新失败: {}", account.email(), e.getMessage());
                    }
                    return Mono.empty();
                });
    }

    /**
     * 过期限流清理（每分钟）
     */
    @Scheduled(fixedRate = 60_000)
    public void clearExpiredLimits() {
        accountPool.clearExpiredLimits();
    }

    /**
     * 签名缓存清理（每 10 分钟）
     */
    @Scheduled(fixedRate = 600_000)
    public void cleanupSignatures() {
        int removed = signatureCache.cleanup();
        if (removed > 0) {
            log.info("清理过期签名: {} 条, 剩余 {} 条", removed, signatureCache.size());
        }
    }
}
