package com.antigravity.gateway.proxy;

import com.antigravity.gateway.config.AppProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * 重试预算与退避时间
 * <p>
 * 空响应按 base × 2^n 指数退避；5xx 与网络错误使用固定间隔
 */
@Component
public class RetryHandler {

    private final AppProperties.RetryConfig retry;

    public RetryHandler(AppProperties properties) {
        this.retry = properties.getRetry();
    }

    /**
     * 单个请求最多尝试的账号次数
     * <p>
     * 至少把每个账号轮一遍，再多一次用于进入"全部限流"分支
     */
    public int maxAttempts(int accountCount) {
        return Math.max(retry.getMaxRetries(), accountCount + 1);
    }

    /**
     * 第 n 次空响应重试前的等待
     */
    public Duration emptyResponseDelay(int retryIndex) {
        return Duration.ofMillis((long) (retry.getEmptyResponseBaseDelayMs() * Math.pow(2, retryIndex)));
    }

    public int maxEmptyResponseRetries() {
        return retry.getMaxEmptyResponseRetries();
    }

    public Duration serverErrorDelay() {
        return Duration.ofMillis(retry.getServerErrorDelayMs());
    }

    public Duration networkErrorDelay() {
        return Duration.ofMillis(retry.getNetworkErrorDelayMs());
    }

    /**
     * 等待超过该值时直接失败
     */
    public long maxWaitBeforeErrorMs() {
        return retry.getMaxWaitBeforeErrorMs();
    }

    /**
     * 冷却等待结束后额外等待，确保限流确实过期
     */
    public Duration waitBuffer() {
        return Duration.ofMillis(retry.getWaitBufferMs());
    }
}
