package com.antigravity.gateway.controller;

import com.antigravity.gateway.pool.AccountPool;
import com.antigravity.gateway.util.Metrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.*;

class HealthControllerTest {

    private AccountPool accountPool;
    private Metrics metrics;
    private WebTestClient webClient;

    @BeforeEach
    void setUp() {
        accountPool = mock(AccountPool.class);
        metrics = new Metrics();
        webClient = WebTestClient.bindToController(new HealthController(accountPool, metrics)).build();
    }

    @Test
    void health_okWhenAnyAccountAvailable() {
        when(accountPool.getStats()).thenReturn(new AccountPool.PoolStats(3, 1, 1, 1, 0));

        webClient.get().uri("/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("ok")
                .jsonPath("$.accounts.total").isEqualTo(3)
                .jsonPath("$.accounts.rateLimited").isEqualTo(1)
                .jsonPath("$.details").doesNotExist();

        verify(accountPool, never()).describeAccounts();
    }

    @Test
    void health_degradedWithoutAvailableAccounts() {
        when(accountPool.getStats()).thenReturn(new AccountPool.PoolStats(1, 0, 1, 0, 0));

        webClient.get().uri("/health")
                .exchange()
                .expectBody()
                .jsonPath("$.status").isEqualTo("degraded");
    }

    @Test
    void health_detailListsAccounts() {
        when(accountPool.getStats()).thenReturn(new AccountPool.PoolStats(1, 0, 1, 0, 0));
        when(accountPool.describeAccounts()).thenReturn(List.of(new AccountPool.AccountStatus(
                "a@example.com", "oauth", "pro", 64.0, true, false, null, Map.of("gemini-3-flash", 12_000L))));

        webClient.get().uri("/health?detail=true")
                .exchange()
                .expectBody()
                .jsonPath("$.details[0].email").isEqualTo("a@example.com")
                .jsonPath("$.details[0].tier").isEqualTo("pro")
                .jsonPath("$.details[0].rateLimitedMs['gemini-3-flash']").isEqualTo(12_000)
                .jsonPath("$.details[0].invalidReason").doesNotExist();
    }

    @Test
    void metrics_servesPrometheusText() {
        metrics.increment(Metrics.ROTATIONS);

        webClient.get().uri("/metrics")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.TEXT_PLAIN)
                .expectBody(String.class)
                .value(body -> assertTrue(body.contains("antigravity_account_rotations_total 1")));
    }
}
