package com.antigravity.gateway.pool;

/**
 * 客户端令牌桶
 * <p>
 * 容量固定、连续补充、允许小数累积。非线程安全，由账号池锁保护
 */
public class TokenBucket {

    private final int capacity;
    private final double tokensPerMs;
    private double tokens;
    private long lastRefill;

    public TokenBucket(int capacity, double tokensPerMinute, long now) {
        this.capacity = capacity;
        this.tokensPerMs = tokensPerMinute / 60_000.0;
        this.tokens = capacity;
        this.lastRefill = now;
    }

    /**
     * 当前可用令牌数（含补充）
     */
    public double available(long now) {
        refill(now);
        return tokens;
    }

    public boolean hasToken(long now) {
        return available(now) >= 1.0;
    }

    /**
     * 消耗一个令牌
     *
     * @return 令牌不足时返回 false
     */
    public boolean tryConsume(long now) {
        refill(now);
        if (tokens < 1.0) {
            return false;
        }
        tokens -= 1.0;
        return true;
    }

    /**
     * 距离下一个完整令牌可用的毫秒数
     */
    public long millisUntilToken(long now) {
        refill(now);
        if (tokens >= 1.0) {
            return 0;
        }
        return (long) Math.ceil((1.0 - tokens) / tokensPerMs);
    }

    public int capacity() {
        return capacity;
    }

    private void refill(long now) {
        if (now <= lastRefill) {
            return;
        }
        tokens = Math.min(capacity, tokens + (now - lastRefill) * tokensPerMs);
        lastRefill = now;
    }
}
