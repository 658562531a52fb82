package com.antigravity.gateway.pool;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TokenBucketTest {

    @Test
    void tryConsume_allowsUpToCapacity() {
        TokenBucket bucket = new TokenBucket(50, 6, 0);

        for (int i = 0; i < 50; i++) {
            assertTrue(bucket.tryConsume(0), "Request " + (i + 1) + " should be allowed");
        }
        assertFalse(bucket.tryConsume(0));
        assertFalse(bucket.hasToken(0));
    }

    @Test
    void refill_isFractionalAndContinuous() {
        TokenBucket bucket = new TokenBucket(50, 6, 0);
        for (int i = 0; i < 50; i++) {
            bucket.tryConsume(0);
        }

        // 6 个/分钟 = 每 10 秒 1 个
        assertEquals(0.5, bucket.available(5_000), 1e-9);
        assertFalse(bucket.hasToken(5_000));
        assertTrue(bucket.hasToken(10_000));
        assertTrue(bucket.tryConsume(10_000));
        assertFalse(bucket.tryConsume(10_000));
    }

    @Test
    void refill_neverExceedsCapacity() {
        TokenBucket bucket = new TokenBucket(50, 6, 0);
        bucket.tryConsume(0);

        assertEquals(50, bucket.available(3_600_000), 1e-9);
    }

    @Test
    void millisUntilToken_reportsRemainingRefillTime() {
        TokenBucket bucket = new TokenBucket(2, 6, 0);
        bucket.tryConsume(0);
        assertEquals(0, bucket.millisUntilToken(0));

        bucket.tryConsume(0);
        assertEquals(10_000, bucket.millisUntilToken(0));
        assertEquals(4_000, bucket.millisUntilToken(6_000), 1.0);
    }

    @Test
    void clockGoingBackwards_isIgnored() {
        TokenBucket bucket = new TokenBucket(1, 6, 10_000);
        bucket.tryConsume(10_000);

        assertEquals(0, bucket.available(5_000), 1e-9);
    }
}
