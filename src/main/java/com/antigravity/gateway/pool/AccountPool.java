package com.antigravity.gateway.pool;

import com.antigravity.gateway.auth.CredentialService;
import com.antigravity.gateway.auth.ProjectInfo;
import com.antigravity.gateway.config.AppProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * 多账号池管理
 * <p>
 * 支持 3 种选择策略：hybrid（默认） / sticky / round-robin。
 * 所有状态修改与多字段读取都在同一把锁内完成；凭证获取委托给 {@link CredentialService}
 */
@Component
public class AccountPool {

    private static final Logger log = LoggerFactory.getLogger(AccountPool.class);
    // 低于配额阈值时的评分惩罚
    private static final double QUOTA_PENALTY = 1000;

    private final AppProperties properties;
    private final AccountLoader loader;
    private final AccountStore store;
    private final CredentialService credentials;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    // 插入有序，round-robin 游标依赖稳定顺序
    private final Map<String, Account> accounts = new LinkedHashMap<>();
    // sessionId -> email
    private final Map<String, String> stickyBindings = new HashMap<>();
    private int cursor;
    // 持久化写入串行执行
    private final Scheduler persistScheduler = Schedulers.newSingle("account-store", true);

    private final HybridStrategy hybrid = new HybridStrategy();
    private final StickyStrategy sticky = new StickyStrategy();
    private final RoundRobinStrategy roundRobin = new RoundRobinStrategy();

    public AccountPool(AppProperties properties, AccountLoader loader, AccountStore store,
                       CredentialService credentials, Clock clock) {
        this.properties = properties;
        this.loader = loader;
        this.store = store;
        this.credentials = credentials;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        initialize(loader.load());
        log.info("账号池初始化完成: {} 个账号, 策略={}", size(), properties.getPool().getStrategy());
    }

    @PreDestroy
    public void shutdown() {
        persistScheduler.dispose();
    }

    /**
     * 用给定账号替换池内容，补齐健康分与令牌桶
     */
    public void initialize(Collection<Account> loaded) {
        lock.lock();
        try {
            accounts.clear();
            stickyBindings.clear();
            cursor = 0;
            long now = clock.millis();
            for (Account account : loaded) {
                prepare(account, now);
                accounts.put(account.email(), account);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 添加或替换账号
     */
    public void addAccount(Account account) {
        Account snapshot;
        lock.lock();
        try {
            prepare(account, clock.millis());
            accounts.put(account.email(), account);
            snapshot = account.snapshot();
        } finally {
            lock.unlock();
        }
        persist(snapshot);
        log.info("添加账号: {}, source={}", account.email(), account.source().value());
    }

    // ==================== 选择 ====================

    /**
     * 为模型选择账号
     * <p>
     * 不抛异常：没有可用账号时返回最短等待时间，或 {@link SelectionResult#NO_WAIT_POSSIBLE}
     *
     * @param modelId   目标模型
     * @param type      选择策略
     * @param sessionId 会话 ID（sticky 使用），可为 null
     * @param excluded  本次请求内已排除的账号
     */
    public SelectionResult selectForModel(String modelId, StrategyType type, String sessionId, Set<String> excluded) {
        lock.lock();
        try {
            long now = clock.millis();
            clearExpired(now);

            List<Account> eligible = new ArrayList<>();
            for (Account a : accounts.values()) {
                if (a.isUsable() && !a.isRateLimited(modelId, now) && !excluded.contains(a.email())) {
                    eligible.add(a);
                }
            }
            if (eligible.isEmpty()) {
                long wait = minResetWait(modelId, now);
                return wait == SelectionResult.NO_WAIT_POSSIBLE
                        ? SelectionResult.unavailable()
                        : SelectionResult.waitFor(wait);
            }

            SelectionStrategy strategy = switch (type) {
                case STICKY -> sticky;
                case ROUND_ROBIN -> roundRobin;
                case HYBRID -> hybrid;
            };
            Account selected = strategy.select(eligible, modelId, sessionId, now);
            if (selected == null) {
                // 只有 hybrid 会因为令牌桶为空而选不出
                long wait = eligible.stream()
                        .mapToLong(a -> a.tokenBucket().millisUntilToken(now))
                        .min()
                        .orElse(SelectionResult.NO_WAIT_POSSIBLE);
                log.debug("所有可用账号令牌耗尽: model={}, wait={}ms", modelId, wait);
                return SelectionResult.waitFor(Math.max(wait, 1));
            }

            selected.setLastUsed(now);
            log.debug("选中账号: {}, model={}, strategy={}", selected.email(), modelId, type);
            return SelectionResult.of(selected);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 软失败后推进游标，并解除指向该账号的会话绑定
     */
    public void advancePast(String email, String sessionId) {
        lock.lock();
        try {
            List<String> order = new ArrayList<>(accounts.keySet());
            int idx = order.indexOf(email);
            if (idx >= 0) {
                cursor = (idx + 1) % order.size();
            }
            if (sessionId != null && email.equals(stickyBindings.get(sessionId))) {
                stickyBindings.remove(sessionId);
            }
        } finally {
            lock.unlock();
        }
    }

    // ==================== 限流 ====================

    /**
     * 标记账号对某模型限流，保留已有与新的重置时间中较晚的一个
     */
    public void markRateLimited(String email, long resetAtMs, String modelId) {
        lock.lock();
        try {
            Account account = accounts.get(email);
            if (account == null) {
                return;
            }
            account.modelRateLimits().merge(modelId, resetAtMs, Math::max);
            log.warn("账号 {} 对模型 {} 限流，重置于 {}ms 后", email, modelId, resetAtMs - clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清除已过期的限流条目
     */
    public void clearExpiredLimits() {
        lock.lock();
        try {
            clearExpired(clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 启用且有效的账号是否全部对该模型限流
     */
    public boolean isAllRateLimited(String modelId) {
        lock.lock();
        try {
            long now = clock.millis();
            boolean any = false;
            for (Account a : accounts.values()) {
                if (!a.isUsable()) {
                    continue;
                }
                any = true;
                if (!a.isRateLimited(modelId, now)) {
                    return false;
                }
            }
            return any;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 最早恢复的限流账号还需等待的毫秒数
     * <p>
     * 有账号未限流时返回 0，没有任何候选时返回 {@link SelectionResult#NO_WAIT_POSSIBLE}
     */
    public long getMinWaitTimeMs(String modelId) {
        lock.lock();
        try {
            return minWait(modelId, clock.millis());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 乐观恢复：清除该模型的全部限流
     */
    public void resetAllRateLimits(String modelId) {
        lock.lock();
        try {
            accounts.values().forEach(a -> a.modelRateLimits().remove(modelId));
            log.warn("乐观重置模型 {} 的全部限流", modelId);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 健康分 ====================

    public void recordSuccess(String email) {
        adjustHealth(email, properties.getPool().getSuccessReward());
    }

    public void recordRateLimit(String email) {
        adjustHealth(email, -properties.getPool().getRateLimitPenalty());
    }

    public void recordFailure(String email) {
        adjustHealth(email, -properties.getPool().getFailurePenalty());
    }

    // ==================== 凭证 ====================

    public Mono<String> getCredential(Account account) {
        return credentials.getToken(account);
    }

    /**
     * 获取项目 ID，发现的订阅等级写回账号
     */
    public Mono<String> getProject(Account account, String accessToken) {
        return credentials.resolveProject(account, accessToken)
                .doOnNext(info -> {
                    if (!info.tier().equals(account.subscriptionTier())) {
                        updateSubscription(account.email(), info.tier(), null);
                    }
                })
                .map(ProjectInfo::projectId);
    }

    /**
     * 认证失败后清除账号的 token 与项目缓存
     */
    public void invalidateCredential(String email) {
        credentials.invalidate(email);
    }

    // ==================== 运维操作 ====================

    public void markInvalid(String email, String reason) {
        Account account = mutate(email, a -> {
            a.setInvalid(true);
            a.setInvalidReason(reason);
        });
        if (account != null) {
            credentials.invalidate(email);
            log.error("账号 {} 标记为无效: {}", email, reason);
        }
    }

    /**
     * 启用/禁用账号，重新启用时清除无效标记
     */
    public boolean setEnabled(String email, boolean enabled) {
        Account account = mutate(email, a -> {
            a.setEnabled(enabled);
            if (enabled) {
                a.setInvalid(false);
                a.setInvalidReason(null);
            }
        });
        if (account != null) {
            log.info("账号 {} 已{}", email, enabled ? "启用" : "禁用");
        }
        return account != null;
    }

    /**
     * 删除账号，同时解除所有指向它的会话绑定
     */
    public boolean removeAccount(String email) {
        Account removed;
        lock.lock();
        try {
            removed = accounts.remove(email);
            if (removed != null) {
                stickyBindings.values().removeIf(email::equals);
                if (cursor >= accounts.size()) {
                    cursor = 0;
                }
            }
        } finally {
            lock.unlock();
        }
        if (removed == null) {
            return false;
        }
        credentials.invalidate(email);
        Mono.fromRunnable(() -> store.delete(email))
                .subscribeOn(persistScheduler)
                .subscribe(null, e -> log.warn("删除账号持久化失败: {}, error={}", email, e.getMessage()));
        log.info("删除账号: {}", email);
        return true;
    }

    public void updateQuota(String email, Map<String, ModelQuota> quotas) {
        mutate(email, a -> {
            a.quota().clear();
            a.quota().putAll(quotas);
            a.setQuotaLastChecked(clock.millis());
        });
    }

    /**
     * 更新订阅等级，projectId 为 null 时保持原值
     */
    public void updateSubscription(String email, String tier, String projectId) {
        mutate(email, a -> {
            a.setSubscriptionTier(tier);
            if (projectId != null) {
                a.setProjectId(projectId);
            }
        });
    }

    public List<Account> listAccounts() {
        lock.lock();
        try {
            return new ArrayList<>(accounts.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 各账号状态快照，rateLimitedUntil 只含仍在冷却中的模型
     */
    public List<AccountStatus> describeAccounts() {
        lock.lock();
        try {
            long now = clock.millis();
            List<AccountStatus> result = new ArrayList<>();
            for (Account a : accounts.values()) {
                Map<String, Long> limited = new TreeMap<>();
                a.modelRateLimits().forEach((model, resetAt) -> {
                    if (now < resetAt) {
                        limited.put(model, resetAt - now);
                    }
                });
                result.add(new AccountStatus(a.email(), a.source().value(), a.subscriptionTier(),
                        a.healthScore(), a.enabled(), a.invalid(), a.invalidReason(), limited));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public Account getByEmail(String email) {
        lock.lock();
        try {
            return accounts.get(email);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return accounts.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 获取统计信息（针对单个模型的限流状态需调用 isAllRateLimited）
     */
    public PoolStats getStats() {
        lock.lock();
        try {
            long now = clock.millis();
            int available = 0;
            int rateLimited = 0;
            int invalid = 0;
            int disabled = 0;
            for (Account a : accounts.values()) {
                if (!a.enabled()) {
                    disabled++;
                } else if (a.invalid()) {
                    invalid++;
                } else if (a.modelRateLimits().values().stream().anyMatch(reset -> now < reset)) {
                    rateLimited++;
                } else {
                    available++;
                }
            }
            return new PoolStats(accounts.size(), available, rateLimited, invalid, disabled);
        } finally {
            lock.unlock();
        }
    }

    // ==================== 辅助方法 ====================

    private void prepare(Account account, long now) {
        AppProperties.PoolConfig pool = properties.getPool();
        if (account.healthScore() <= 0) {
            account.setHealthScore(pool.getInitialHealth());
        }
        if (account.tokenBucket() == null) {
            account.setTokenBucket(new TokenBucket(pool.getTokenBucketCapacity(), pool.getTokensPerMinute(), now));
        }
    }

    private void clearExpired(long now) {
        for (Account a : accounts.values()) {
            a.modelRateLimits().values().removeIf(resetAt -> now >= resetAt);
        }
    }

    private long minWait(String modelId, long now) {
        long min = SelectionResult.NO_WAIT_POSSIBLE;
        for (Account a : accounts.values()) {
            if (!a.isUsable()) {
                continue;
            }
            Long resetAt = a.modelRateLimits().get(modelId);
            long wait = resetAt == null ? 0 : Math.max(0, resetAt - now);
            min = Math.min(min, wait);
        }
        return min;
    }

    /**
     * 只看限流中的账号：距离最早重置的时间，没有限流账号时返回 NO_WAIT_POSSIBLE
     */
    private long minResetWait(String modelId, long now) {
        long min = SelectionResult.NO_WAIT_POSSIBLE;
        for (Account a : accounts.values()) {
            Long resetAt = a.modelRateLimits().get(modelId);
            if (a.isUsable() && resetAt != null && resetAt > now) {
                min = Math.min(min, resetAt - now);
            }
        }
        return min;
    }

    private void adjustHealth(String email, double delta) {
        double max = properties.getPool().getMaxHealth();
        mutate(email, a -> a.setHealthScore(Math.max(0, Math.min(max, a.healthScore() + delta))));
    }

    private Account mutate(String email, Consumer<Account> change) {
        Account account;
        Account snapshot;
        lock.lock();
        try {
            account = accounts.get(email);
            if (account == null) {
                return null;
            }
            change.accept(account);
            snapshot = account.snapshot();
        } finally {
            lock.unlock();
        }
        persist(snapshot);
        return account;
    }

    /**
     * 异步写回锁内拍下的快照；单线程调度保证写入顺序与变更顺序一致
     */
    private void persist(Account snapshot) {
        // 环境变量与遗留凭证账号不落盘
        if (snapshot.source() == AccountSource.ENV || snapshot.source() == AccountSource.DATABASE) {
            return;
        }
        Mono.fromRunnable(() -> store.save(snapshot))
                .subscribeOn(persistScheduler)
                .subscribe(null, e -> log.warn("账号持久化失败: {}, error={}", snapshot.email(), e.getMessage()));
    }

    // ==================== 策略实现 ====================

    /**
     * 综合评分：健康分、令牌桶余量、剩余配额、最近使用时间
     * <p>
     * 只考虑令牌桶至少有 1 个令牌的账号，选中后消耗一个令牌
     */
    private class HybridStrategy implements SelectionStrategy {
        @Override
        public Account select(List<Account> eligible, String modelId, String sessionId, long now) {
            Account best = null;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (Account a : eligible) {
                if (!a.tokenBucket().hasToken(now)) {
                    continue;
                }
                double score = score(a, modelId, now);
                if (best == null || score > bestScore
                        || (score == bestScore && a.lastUsed() < best.lastUsed())) {
                    best = a;
                    bestScore = score;
                }
            }
            if (best != null) {
                best.tokenBucket().tryConsume(now);
            }
            return best;
        }

        private double score(Account a, String modelId, long now) {
            AppProperties.PoolConfig pool = properties.getPool();
            TokenBucket bucket = a.tokenBucket();
            double tokenFill = bucket.available(now) / bucket.capacity() * 100;

            Double fraction = a.remainingFraction(modelId);
            // 配额未知按中性处理
            double quotaScore = fraction != null ? fraction * 100 : 50;

            double idleSeconds = a.lastUsed() == 0 ? 3600 : (now - a.lastUsed()) / 1000.0;
            double recency = Math.min(idleSeconds / 3600, 1) * 100;

            double score = pool.getHealthWeight() * a.healthScore()
                    + pool.getTokenWeight() * tokenFill
                    + pool.getQuotaWeight() * quotaScore
                    + pool.getLruWeight() * recency;

            double threshold = a.effectiveQuotaThreshold(modelId, properties.getQuota().getThreshold());
            if (fraction != null && fraction < threshold) {
                score -= QUOTA_PENALTY;
            }
            return score;
        }
    }

    /**
     * 会话粘滞：绑定账号仍可用且有令牌时继续使用；
     * 仅令牌耗尽时临时按 hybrid 选择、保留原绑定，其他情况按 hybrid 重新选择并绑定
     */
    private class StickyStrategy implements SelectionStrategy {
        @Override
        public Account select(List<Account> eligible, String modelId, String sessionId, long now) {
            boolean throttled = false;
            if (sessionId != null) {
                String bound = stickyBindings.get(sessionId);
                if (bound != null) {
                    for (Account a : eligible) {
                        if (a.email().equals(bound)) {
                            if (a.tokenBucket().tryConsume(now)) {
                                return a;
                            }
                            throttled = true;
                            break;
                        }
                    }
                    log.debug("会话 {} 绑定账号 {} {}，改用 hybrid", sessionId, bound, throttled ? "令牌耗尽" : "不可用");
                }
            }
            Account selected = hybrid.select(eligible, modelId, sessionId, now);
            if (selected != null && sessionId != null && !throttled) {
                stickyBindings.put(sessionId, selected.email());
            }
            return selected;
        }
    }

    /**
     * 按账号稳定顺序轮询，跳过不可用账号
     */
    private class RoundRobinStrategy implements SelectionStrategy {
        @Override
        public Account select(List<Account> eligible, String modelId, String sessionId, long now) {
            List<Account> order = new ArrayList<>(accounts.values());
            int n = order.size();
            for (int i = 0; i < n; i++) {
                int idx = (cursor + i) % n;
                Account a = order.get(idx);
                if (eligible.contains(a)) {
                    cursor = (idx + 1) % n;
                    return a;
                }
            }
            return null;
        }
    }

    // ==================== 数据类 ====================

    public record PoolStats(int total, int available, int rateLimited, int invalid, int disabled) {}

    /**
     * @param rateLimitedUntil 模型 → 剩余冷却毫秒
     */
    public record AccountStatus(String email, String source, String tier, double healthScore, boolean enabled,
                                boolean invalid, String invalidReason, Map<String, Long> rateLimitedUntil) {}
}
