package com.antigravity.gateway.util;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prometheus 风格指标收集器
 * <p>
 * 请求、重试、账号轮换、回退与空响应计数，以及请求延迟直方图
 */
@Component
public class Metrics {

    public static final String REQUESTS = "requests_total";
    public static final String REQUESTS_SUCCESS = "requests_success";
    public static final String REQUESTS_ERROR = "requests_error";
    public static final String RETRIES = "retries_total";
    public static final String ROTATIONS = "account_rotations_total";
    public static final String RATE_LIMITS = "rate_limits_total";
    public static final String FALLBACKS = "model_fallbacks_total";
    public static final String EMPTY_RETRIES = "empty_response_retries_total";
    public static final String EMPTY_FALLBACKS = "empty_response_fallbacks_total";

    // 计数器
    private final ConcurrentHashMap<String, AtomicLong> counters = new ConcurrentHashMap<>();
    // 延迟直方图桶
    private final long[] bucketBounds = {100, 500, 1000, 2500, 5000, 10000, 30000, 60000};
    private final long[] latencyBuckets = new long[bucketBounds.length + 1];
    private long latencySumMs;

    public void increment(String name) {
        counters.computeIfAbsent(name, k -> new AtomicLong(0)).incrementAndGet();
    }

    public long get(String name) {
        AtomicLong counter = counters.get(name);
        return counter != null ? counter.get() : 0;
    }

    /**
     * 记录请求结果
     */
    public void recordRequest(boolean success, long latencyMs) {
        increment(REQUESTS);
        increment(success ? REQUESTS_SUCCESS : REQUESTS_ERROR);
        synchronized (latencyBuckets) {
            latencySumMs += latencyMs;
            for (int i = 0; i < bucketBounds.length; i++) {
                if (latencyMs <= bucketBounds[i]) {
                    latencyBuckets[i]++;
                    return;
                }
            }
            latencyBuckets[bucketBounds.length]++;
        }
    }

    /**
     * 输出 Prometheus 文本格式
     */
    public String toPrometheusFormat() {
        StringBuilder sb = new StringBuilder();

        Map<String, AtomicLong> sorted = new TreeMap<>(counters);
        sorted.forEach((name, value) -> {
            sb.append("# TYPE antigravity_").append(name).append(" counter\n");
            sb.append("antigravity_").append(name).append(' ').append(value.get()).append('\n');
        });

        sb.append("# TYPE antigravity_request_latency_ms histogram\n");
        synchronized (latencyBuckets) {
            long cumulative = 0;
            for (int i = 0; i < bucketBounds.length; i++) {
                cumulative += latencyBuckets[i];
                sb.append("antigravity_request_latency_ms_bucket{le=\"")
                        .append(bucketBounds[i]).append("\"} ").append(cumulative).append('\n');
            }
            cumulative += latencyBuckets[bucketBounds.length];
            sb.append("antigravity_request_latency_ms_bucket{le=\"+Inf\"} ").append(cumulative).append('\n');
            sb.append("antigravity_request_latency_ms_sum ").append(latencySumMs).append('\n');
            sb.append("antigravity_request_latency_ms_count ").append(cumulative).append('\n');
        }
        return sb.toString();
    }
}
