package com.antigravity.gateway.model;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.exception.UpstreamException;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.pool.AccountPool;
import com.antigravity.gateway.pool.AccountSource;
import com.antigravity.gateway.proxy.CloudCodeRestApi;
import com.antigravity.gateway.signature.ModelFamily;
import com.antigravity.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ModelCatalogTest {

    private AccountPool pool;
    private CloudCodeRestApi restApi;
    private ModelCatalog catalog;

    @BeforeEach
    void setUp() {
        pool = mock(AccountPool.class);
        restApi = mock(CloudCodeRestApi.class);
        catalog = new ModelCatalog(new AppProperties(), pool, restApi, new MutableClock(1_700_000_000_000L));
    }

    @Test
    void isThinkingModel_followsFamilyRules() {
        assertTrue(ModelCatalog.isThinkingModel("claude-sonnet-4-5-thinking"));
        assertFalse(ModelCatalog.isThinkingModel("claude-sonnet-4-5"));
        assertTrue(ModelCatalog.isThinkingModel("gemini-3-flash"));
        assertTrue(ModelCatalog.isThinkingModel("gemini-2.5-flash-thinking"));
        assertFalse(ModelCatalog.isThinkingModel("gemini-2.5-flash"));
        assertFalse(ModelCatalog.isThinkingModel("gpt-4o"));
    }

    @Test
    void familyOf_andSupport() {
        assertEquals(ModelFamily.CLAUDE, ModelCatalog.familyOf("claude-opus-4-5-thinking"));
        assertEquals(ModelFamily.GEMINI, ModelCatalog.familyOf("gemini-3-pro-high"));
        assertTrue(ModelCatalog.isSupported("gemini-3-pro-low"));
        assertFalse(ModelCatalog.isSupported("chat_20706"));
        assertFalse(ModelCatalog.isSupported(null));
    }

    @Test
    void fallbackFor_usesConfiguredMapping() {
        assertEquals("claude-opus-4-5-thinking", catalog.fallbackFor("gemini-3-pro-high"));
        assertEquals("gemini-3-pro-high", catalog.fallbackFor("claude-opus-4-5-thinking"));
        assertEquals("gemini-3-flash", catalog.fallbackFor("claude-sonnet-4-5"));
        assertEquals("claude-sonnet-4-5", catalog.fallbackFor("gemini-3-pro-low"));
        assertNull(catalog.fallbackFor("unknown-model"));
    }

    @Test
    void listModels_usesUpstreamCatalog() {
        Account account = new Account("a@x.com", AccountSource.MANUAL, null, "key", 0);
        when(pool.listAccounts()).thenReturn(List.of(account));
        when(pool.getCredential(account)).thenReturn(Mono.just("key"));
        when(restApi.fetchAvailableModels("key")).thenReturn(Mono.just(JSONObject.of("models", JSONObject.of(
                "claude-sonnet-4-5", JSONObject.of("displayName", "Claude Sonnet 4.5"),
                "chat_20706", JSONObject.of("displayName", "internal")))));

        StepVerifier.create(catalog.listModels())
                .assertNext(list -> {
                    assertEquals("list", list.getString("object"));
                    JSONArray data = list.getJSONArray("data");
                    assertEquals(1, data.size());
                    assertEquals("claude-sonnet-4-5", data.getJSONObject(0).getString("id"));
                    assertEquals("Claude Sonnet 4.5", data.getJSONObject(0).getString("description"));
                })
                .verifyComplete();
    }

    @Test
    void listModels_fallsBackToDefaultsWhenUpstreamFails() {
        Account account = new Account("a@x.com", AccountSource.MANUAL, null, "key", 0);
        when(pool.listAccounts()).thenReturn(List.of(account));
        when(pool.getCredential(account)).thenReturn(Mono.just("key"));
        when(restApi.fetchAvailableModels("key")).thenReturn(Mono.error(new UpstreamException(502, "down")));

        StepVerifier.create(catalog.listModels())
                .assertNext(list -> assertEquals(6, list.getJSONArray("data").size()))
                .verifyComplete();
    }
}
