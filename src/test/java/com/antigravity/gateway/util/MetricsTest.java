package com.antigravity.gateway.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MetricsTest {

    @Test
    void counters_startAtZeroAndIncrement() {
        Metrics metrics = new Metrics();
        assertEquals(0, metrics.get(Metrics.ROTATIONS));

        metrics.increment(Metrics.ROTATIONS);
        metrics.increment(Metrics.ROTATIONS);

        assertEquals(2, metrics.get(Metrics.ROTATIONS));
    }

    @Test
    void recordRequest_countsOutcome() {
        Metrics metrics = new Metrics();

        metrics.recordRequest(true, 50);
        metrics.recordRequest(false, 700);

        assertEquals(2, metrics.get(Metrics.REQUESTS));
        assertEquals(1, metrics.get(Metrics.REQUESTS_SUCCESS));
        assertEquals(1, metrics.get(Metrics.REQUESTS_ERROR));
    }

    @Test
    void prometheusFormat_hasCumulativeHistogram() {
        Metrics metrics = new Metrics();
        metrics.recordRequest(true, 50);
        metrics.recordRequest(true, 700);
        metrics.recordRequest(true, 120_000);

        String text = metrics.toPrometheusFormat();

        assertTrue(text.contains("# TYPE antigravity_requests_total counter\nantigravity_requests_total 3\n"));
        assertTrue(text.contains("antigravity_request_latency_ms_bucket{le=\"100\"} 1\n"));
        assertTrue(text.contains("antigravity_request_latency_ms_bucket{le=\"1000\"} 2\n"));
        assertTrue(text.contains("antigravity_request_latency_ms_bucket{le=\"60000\"} 2\n"));
        assertTrue(text.contains("antigravity_request_latency_ms_bucket{le=\"+Inf\"} 3\n"));
        assertTrue(text.contains("antigravity_request_latency_ms_sum 120750\n"));
        assertTrue(text.contains("antigravity_request_latency_ms_count 3\n"));
    }
}
