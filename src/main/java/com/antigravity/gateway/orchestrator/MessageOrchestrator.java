package com.antigravity.gateway.orchestrator;

import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.exception.AuthException;
import com.antigravity.gateway.exception.EmptyResponseException;
import com.antigravity.gateway.exception.ExhaustedException;
import com.antigravity.gateway.exception.NetworkException;
import com.antigravity.gateway.exception.RateLimitException;
import com.antigravity.gateway.exception.UpstreamException;
import com.antigravity.gateway.model.ModelCatalog;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.pool.AccountPool;
import com.antigravity.gateway.pool.SelectionResult;
import com.antigravity.gateway.pool.StrategyType;
import com.antigravity.gateway.proxy.CloudCodeClient;
import com.antigravity.gateway.proxy.RetryHandler;
import com.antigravity.gateway.proxy.StreamReassembler;
import com.antigravity.gateway.translator.RequestTranslator;
import com.antigravity.gateway.translator.ResponseAccumulator;
import com.antigravity.gateway.translator.Translation;
import com.antigravity.gateway.util.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 消息请求编排
 * <p>
 * 选择账号 → 逐个端点尝试 → 流式重组；按失败类型决定重试、换端点、换账号、回退模型或失败。
 * 已向客户端发出事件后不再重试，错误直接在流内结束
 */
@Service
public class MessageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(MessageOrchestrator.class);

    private final AccountPool accountPool;
    private final RequestTranslator translator;
    private final CloudCodeClient client;
    private final StreamReassembler reassembler;
    private final ModelCatalog modelCatalog;
    private final RetryHandler retryHandler;
    private final AppProperties properties;
    private final Metrics metrics;
    private final Clock clock;

    public MessageOrchestrator(AccountPool accountPool, RequestTranslator translator, CloudCodeClient client,
                               StreamReassembler reassembler, ModelCatalog modelCatalog, RetryHandler retryHandler,
                               AppProperties properties, Metrics metrics, Clock clock) {
        this.accountPool = accountPool;
        this.translator = translator;
        this.client = client;
        this.reassembler = reassembler;
        this.modelCatalog = modelCatalog;
        this.retryHandler = retryHandler;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * 流式请求，返回 Anthropic 事件序列
     */
    public Flux<JSONObject> stream(JSONObject request) {
        return measured(execute(request, request.getString("model"), true, properties.getFallback().isEnabled()));
    }

    /**
     * 非流式请求，事件折叠为完整响应
     */
    public Mono<JSONObject> complete(JSONObject request) {
        return ResponseAccumulator.collect(
                measured(execute(request, request.getString("model"), false, properties.getFallback().isEnabled())));
    }

    // ==================== 状态机 ====================

    private Flux<JSONObject> execute(JSONObject request, String model, boolean streaming, boolean fallbackAllowed) {
        return Flux.defer(() -> {
            // 结构错误在这里直接失败，不进入重试
            Translation translation = translator.translate(request, model);
            RequestRun run = new RequestRun(request, translation, streaming, fallbackAllowed,
                    retryHandler.maxAttempts(accountPool.size()));
            log.debug("开始处理: model={}, stream={}, session={}, maxAttempts={}",
                    model, streaming, translation.sessionId(), run.maxAttempts);
            return attempt(run);
        });
    }

    private Flux<JSONObject> attempt(RequestRun run) {
        return Flux.defer(() -> {
            if (run.attempt >= run.maxAttempts) {
                long wait = accountPool.getMinWaitTimeMs(run.model());
                Long retryAfter = wait > 0 && wait != SelectionResult.NO_WAIT_POSSIBLE ? wait : null;
                return failOrFallback(run, new ExhaustedException(
                        "模型 " + run.model() + " 重试 " + run.maxAttempts + " 次后仍失败", retryAfter, run.lastError));
            }
            if (run.attempt > 0) {
                metrics.increment(Metrics.RETRIES);
            }
            run.attempt++;
            run.phase(RequestPhase.SELECT_ACCOUNT);
            return acquire(run).flatMapMany(acquired -> acquired.account() != null
                    ? runOnAccount(run, acquired.account())
                    : failOrFallback(run, acquired.failure()));
        });
    }

    /**
     * 选择账号，必要时等待冷却、乐观重置
     */
    private Mono<Acquired> acquire(RequestRun run) {
        return Mono.defer(() -> {
            SelectionResult result = select(run);
            if (result.hasAccount()) {
                return Mono.just(Acquired.of(result.account()));
            }
            if (!result.canWait()) {
                return Mono.just(Acquired.failed(new ExhaustedException(
                        "模型 " + run.model() + " 没有可用账号", null, run.lastError)));
            }

            long wait = result.waitMs();
            if (wait > retryHandler.maxWaitBeforeErrorMs()) {
                log.warn("模型 {} 全部账号限流, 需等待 {}s, 超过上限直接失败", run.model(), wait / 1000);
                return Mono.just(Acquired.failed(new ExhaustedException(
                        "模型 " + run.model() + " 限流, " + (wait / 1000) + " 秒后恢复", wait, run.lastError)));
            }

            log.warn("模型 {} 暂无可用账号, 等待 {}ms", run.model(), wait);
            return Mono.delay(Duration.ofMillis(wait).plus(retryHandler.waitBuffer()))
                    .then(Mono.fromSupplier(() -> {
                        accountPool.clearExpiredLimits();
                        run.excluded.clear();
                        run.softFailed.clear();
                        SelectionResult again = select(run);
                        if (again.hasAccount()) {
                            return Acquired.of(again.account());
                        }
                        log.warn("等待后仍无可用账号, 尝试乐观重置: model={}", run.model());
                        accountPool.resetAllRateLimits(run.model());
                        again = select(run);
                        if (again.hasAccount()) {
                            return Acquired.of(again.account());
                        }
                        return Acquired.failed(new ExhaustedException(
                                "模型 " + run.model() + " 没有可用账号", wait, run.lastError));
                    }));
        });
    }

    /**
     * 优先避开本次请求内 5xx / 网络失败过的账号，没有其他账号时仍可重用
     */
    private SelectionResult select(RequestRun run) {
        StrategyType strategy = StrategyType.parse(properties.getPool().getStrategy());
        String sessionId = run.translation.sessionId();
        if (!run.softFailed.isEmpty()) {
            Set<String> avoid = new HashSet<>(run.excluded);
            avoid.addAll(run.softFailed);
            SelectionResult preferred = accountPool.selectForModel(run.model(), strategy, sessionId, avoid);
            if (preferred.hasAccount()) {
                return preferred;
            }
        }
        return accountPool.selectForModel(run.model(), strategy, sessionId, run.excluded);
    }

    private Flux<JSONObject> runOnAccount(RequestRun run, Account account) {
        log.info("使用账号 {} 请求模型 {} (第 {}/{} 次)", account.email(), run.model(), run.attempt, run.maxAttempts);
        return resolveCredential(account)
                .flatMapMany(credential -> tryEndpoint(run, account, credential, 0, new EndpointOutcome()))
                .doOnNext(event -> run.emitted = true)
                .doOnComplete(() -> {
                    accountPool.recordSuccess(account.email());
                    run.phase(RequestPhase.SUCCESS);
                })
                .onErrorResume(e -> !run.emitted, e -> onAccountFailure(run, account, e));
    }

    private Mono<Credential> resolveCredential(Account account) {
        return accountPool.getCredential(account)
                .flatMap(token -> accountPool.getProject(account, token)
                        .map(project -> new Credential(token, project)));
    }

    /**
     * 按顺序尝试端点
     * <p>
     * 401 换新凭证试下一个端点；429 记录重置时间试下一个端点；5xx 等待后试下一个端点
     */
    private Flux<JSONObject> tryEndpoint(RequestRun run, Account account, Credential credential,
                                         int index, EndpointOutcome outcome) {
        List<String> endpoints = properties.getEndpoints();
        if (index >= endpoints.size()) {
            return Flux.error(outcome.toAccountFailure(account.email(), endpoints.size()));
        }
        String endpoint = endpoints.get(index);
        run.phase(RequestPhase.TRY_ENDPOINT);

        return callWithEmptyRetries(run, account, credential, endpoint, 0)
                .onErrorResume(e -> !run.emitted, e -> {
                    if (e instanceof AuthException auth && !auth.isAccountLevel()) {
                        log.warn("端点 {} 认证失败, 清除账号 {} 凭证缓存", endpoint, account.email());
                        accountPool.invalidateCredential(account.email());
                        outcome.auth = auth;
                        if (index + 1 >= endpoints.size()) {
                            return tryEndpoint(run, account, credential, index + 1, outcome);
                        }
                        return resolveCredential(account)
                                .flatMapMany(fresh -> tryEndpoint(run, account, fresh, index + 1, outcome));
                    }
                    if (e instanceof RateLimitException rateLimit && !rateLimit.isAccountLevel()) {
                        log.debug("端点 {} 限流, 尝试下一个端点", endpoint);
                        outcome.recordRateLimit(rateLimit);
                        return tryEndpoint(run, account, credential, index + 1, outcome);
                    }
                    if (e instanceof UpstreamException upstream) {
                        if (upstream.isServerError()) {
                            outcome.serverError = upstream;
                            log.warn("端点 {} 返回 {}, 等待后尝试下一个端点", endpoint, upstream.getStatusCode());
                            return Mono.delay(retryHandler.serverErrorDelay())
                                    .thenMany(tryEndpoint(run, account, credential, index + 1, outcome));
                        }
                        outcome.clientError = upstream;
                        return tryEndpoint(run, account, credential, index + 1, outcome);
                    }
                    return Flux.error(e);
                });
    }

    /**
     * 单端点调用，空响应按指数退避重试，重试耗尽后返回兜底消息
     */
    private Flux<JSONObject> callWithEmptyRetries(RequestRun run, Account account, Credential credential,
                                                  String endpoint, int emptyRetry) {
        return Flux.defer(() -> {
            run.phase(emptyRetry == 0 ? RequestPhase.STREAM : RequestPhase.RETRY);
            JSONObject payload = run.translation.payload().project(credential.project()).build();
            Flux<String> chunks = run.useStreamingCall()
                    ? client.streamGenerate(endpoint, credential.token(), run.model(), payload)
                    : client.generate(endpoint, credential.token(), run.model(), payload);
            Flux<JSONObject> events = reassembler.reassemble(chunks, run.model());
            if (emptyRetry > 0) {
                events = events.onErrorMap(e -> escalateDuringRetry(run, account, e));
            }
            return events;
        }).onErrorResume(e -> !run.emitted, e -> {
            int max = retryHandler.maxEmptyResponseRetries();
            if (e instanceof EmptyResponseException) {
                if (emptyRetry >= max) {
                    log.error("模型 {} 空响应, 重试 {} 次后返回兜底消息", run.model(), max);
                    metrics.increment(Metrics.EMPTY_FALLBACKS);
                    return Flux.fromIterable(StreamReassembler.emptyResponseFallback(run.model()));
                }
                Duration delay = retryHandler.emptyResponseDelay(emptyRetry);
                log.warn("模型 {} 空响应, 第 {}/{} 次重试, 等待 {}ms", run.model(), emptyRetry + 1, max, delay.toMillis());
                metrics.increment(Metrics.EMPTY_RETRIES);
                return Mono.delay(delay)
                        .thenMany(callWithEmptyRetries(run, account, credential, endpoint, emptyRetry + 1));
            }
            if (emptyRetry > 0 && emptyRetry < max
                    && e instanceof UpstreamException upstream && upstream.isServerError()) {
                // 重试中的 5xx 占用一次重试机会
                log.warn("空响应重试时返回 {}, 等待后继续", upstream.getStatusCode());
                return Mono.delay(retryHandler.serverErrorDelay())
                        .thenMany(callWithEmptyRetries(run, account, credential, endpoint, emptyRetry + 1));
            }
            return Flux.error(e);
        });
    }

    /**
     * 空响应重试中遇到 429/401 时直接升级为账号级失败
     */
    private Throwable escalateDuringRetry(RequestRun run, Account account, Throwable e) {
        if (e instanceof RateLimitException rateLimit) {
            log.warn("空响应重试时账号 {} 被限流, 切换账号", account.email());
            return rateLimit.escalate();
        }
        if (e instanceof AuthException auth) {
            log.warn("空响应重试时账号 {} 认证失败, 切换账号", account.email());
            accountPool.invalidateCredential(account.email());
            return auth.escalate();
        }
        return e;
    }

    /**
     * 账号级失败的处理：限流与认证失败排除该账号，5xx 与网络错误推进游标，其他错误终止
     */
    private Flux<JSONObject> onAccountFailure(RequestRun run, Account account, Throwable e) {
        String email = account.email();
        if (e instanceof RateLimitException rateLimit) {
            Long resetMs = rateLimit.getResetMs();
            long cooldown = resetMs != null ? resetMs : properties.getCooldown().getDefaultMs();
            accountPool.markRateLimited(email, clock.millis() + cooldown, run.model());
            accountPool.recordRateLimit(email);
            run.excluded.add(email);
            run.lastError = rateLimit;
            metrics.increment(Metrics.RATE_LIMITS);
            return rotate(run, "账号 " + email + " 限流");
        }
        if (e instanceof AuthException auth) {
            if (auth.isCredentialRejected()) {
                accountPool.markInvalid(email, auth.getMessage());
            } else {
                accountPool.invalidateCredential(email);
            }
            accountPool.recordFailure(email);
            run.excluded.add(email);
            run.lastError = auth;
            return rotate(run, "账号 " + email + " 认证失败");
        }
        if (e instanceof UpstreamException upstream && upstream.isServerError()) {
            accountPool.recordFailure(email);
            accountPool.advancePast(email, run.translation.sessionId());
            run.softFailed.add(email);
            run.lastError = upstream;
            return rotate(run, "账号 " + email + " 上游 " + upstream.getStatusCode());
        }
        if (e instanceof NetworkException network) {
            accountPool.recordFailure(email);
            run.softFailed.add(email);
            run.lastError = network;
            log.warn("账号 {} 网络错误: {}", email, network.getMessage());
            return Mono.delay(retryHandler.networkErrorDelay())
                    .thenMany(Flux.defer(() -> {
                        accountPool.advancePast(email, run.translation.sessionId());
                        return rotate(run, "账号 " + email + " 网络错误");
                    }));
        }
        run.phase(RequestPhase.FAIL);
        log.error("请求失败, 不再重试: model={}, error={}", run.model(), e.getMessage());
        return Flux.error(e);
    }

    private Flux<JSONObject> rotate(RequestRun run, String reason) {
        run.phase(RequestPhase.ROTATE_ACCOUNT);
        metrics.increment(Metrics.ROTATIONS);
        log.info("{}, 切换账号", reason);
        return attempt(run);
    }

    /**
     * 回退模型只尝试一次，嵌套调用禁用回退
     */
    private Flux<JSONObject> failOrFallback(RequestRun run, ExhaustedException failure) {
        if (run.fallbackAllowed) {
            String fallback = modelCatalog.fallbackFor(run.model());
            if (fallback != null) {
                run.phase(RequestPhase.FALLBACK_MODEL);
                metrics.increment(Metrics.FALLBACKS);
                log.warn("模型 {} 已耗尽, 回退到 {}", run.model(), fallback);
                return execute(run.request, fallback, run.streaming, false);
            }
        }
        run.phase(RequestPhase.FAIL);
        log.error("模型 {} 请求失败: {}", run.model(), failure.getMessage());
        return Flux.error(failure);
    }

    private Flux<JSONObject> measured(Flux<JSONObject> events) {
        return Flux.defer(() -> {
            long start = clock.millis();
            return events
                    .doOnComplete(() -> metrics.recordRequest(true, clock.millis() - start))
                    .doOnError(e -> metrics.recordRequest(false, clock.millis() - start));
        });
    }

    // ==================== 数据类 ====================

    /**
     * 单次请求（单个模型）的运行状态
     */
    private static class RequestRun {
        final JSONObject request;
        final Translation translation;
        final boolean streaming;
        final boolean fallbackAllowed;
        final int maxAttempts;
        // 本次请求内因限流或认证失败排除的账号
        final Set<String> excluded = new HashSet<>();
        // 5xx 或网络失败过的账号，仅在有其他账号时避开
        final Set<String> softFailed = new HashSet<>();
        int attempt;
        volatile boolean emitted;
        Throwable lastError;
        private RequestPhase phase;

        RequestRun(JSONObject request, Translation translation, boolean streaming,
                   boolean fallbackAllowed, int maxAttempts) {
            this.request = request;
            this.translation = translation;
            this.streaming = streaming;
            this.fallbackAllowed = fallbackAllowed;
            this.maxAttempts = maxAttempts;
        }

        String model() {
            return translation.model();
        }

        /**
         * 非流式的非思考模型走 generateContent，其余走流式接口
         */
        boolean useStreamingCall() {
            return streaming || translation.thinking();
        }

        void phase(RequestPhase next) {
            if (phase != next) {
                log.debug("阶段 {} → {}: model={}", phase, next, model());
                phase = next;
            }
        }
    }

    /**
     * 各端点的失败汇总
     */
    private static class EndpointOutcome {
        int rateLimited;
        Long minResetMs;
        AuthException auth;
        UpstreamException serverError;
        UpstreamException clientError;

        void recordRateLimit(RateLimitException e) {
            rateLimited++;
            Long reset = e.getResetMs();
            if (reset != null && (minResetMs == null || reset < minResetMs)) {
                minResetMs = reset;
            }
        }

        /**
         * 全部端点 429 → 账号限流；其他 4xx → 终止；认证失败 → 换账号；5xx → 换账号
         */
        RuntimeException toAccountFailure(String email, int endpointCount) {
            if (rateLimited == endpointCount) {
                return RateLimitException.forAccount("账号 " + email + " 在所有端点均被限流", minResetMs);
            }
            if (clientError != null) {
                return clientError;
            }
            if (auth != null) {
                return auth.escalate();
            }
            if (serverError != null) {
                return serverError;
            }
            return RateLimitException.forAccount("账号 " + email + " 部分端点限流", minResetMs);
        }
    }

    private record Credential(String token, String project) {}

    private record Acquired(Account account, ExhaustedException failure) {

        static Acquired of(Account account) {
            return new Acquired(account, null);
        }

        static Acquired failed(ExhaustedException failure) {
            return new Acquired(null, failure);
        }
    }
}
