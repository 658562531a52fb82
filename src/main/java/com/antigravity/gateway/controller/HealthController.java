package com.antigravity.gateway.controller;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.pool.AccountPool;
import com.antigravity.gateway.util.Metrics;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * 运维端点：/health 账号池状态，/metrics Prometheus 文本
 */
@RestController
public class HealthController {

    private final AccountPool accountPool;
    private final Metrics metrics;

    public HealthController(AccountPool accountPool, Metrics metrics) {
        this.accountPool = accountPool;
        this.metrics = metrics;
    }

    /**
     * 有可用账号时为 ok，否则 degraded；detail=true 时附带每个账号的状态
     */
    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health(@RequestParam(name = "detail", defaultValue = "false") boolean detail) {
        AccountPool.PoolStats stats = accountPool.getStats();
        JSONObject counts = JSONObject.of( //
                "total", stats.total(), //
                "available", stats.available(), //
                "rateLimited", stats.rateLimited(), //
                "invalid", stats.invalid(), //
                "disabled", stats.disabled());
        JSONObject result = JSONObject.of("status", stats.available() > 0 ? "ok" : "degraded", "accounts", counts);

        if (detail) {
            JSONArray list = new JSONArray();
            for (AccountPool.AccountStatus status : accountPool.describeAccounts()) {
                JSONObject item = JSONObject.of( //
                        "email", status.email(), //
                        "source", status.source(), //
                        "tier", status.tier(), //
                        "healthScore", status.healthScore(), //
                        "enabled", status.enabled());
                item.put("invalid", status.invalid());
                if (status.invalidReason() != null) {
                    item.put("invalidReason", status.invalidReason());
                }
                item.put("rateLimitedMs", status.rateLimitedUntil());
                list.add(item);
            }
            result.put("details", list);
        }
        return Mono.just(result.toJSONString());
    }

    @GetMapping(value = "/metrics", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<String> metrics() {
        return Mono.just(metrics.toPrometheusFormat());
    }
}
