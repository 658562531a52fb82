package com.antigravity.gateway.scheduler;

import com.antigravity.gateway.exception.AuthException;
import com.antigravity.gateway.exception.UpstreamException;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.pool.AccountPool;
import com.antigravity.gateway.pool.AccountSource;
import com.antigravity.gateway.pool.ModelQuota;
import com.antigravity.gateway.proxy.CloudCodeRestApi;
import com.antigravity.gateway.signature.SignatureCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class BackgroundSchedulerTest {

    private AccountPool accountPool;
    private CloudCodeRestApi restApi;
    private SignatureCache signatureCache;
    private BackgroundScheduler scheduler;

    private final Account healthy = new Account("a@example.com", AccountSource.OAUTH, "rt-a", null, 1);
    private final Account revoked = new Account("b@example.com", AccountSource.OAUTH, "rt-b", null, 2);
    private final Account disabled = new Account("c@example.com", AccountSource.OAUTH, "rt-c", null, 3);

    @BeforeEach
    void setUp() {
        accountPool = mock(AccountPool.class);
        restApi = mock(CloudCodeRestApi.class);
        signatureCache = mock(SignatureCache.class);
        scheduler = new BackgroundScheduler(accountPool, restApi, signatureCache);

        disabled.setEnabled(false);
        when(accountPool.listAccounts()).thenReturn(List.of(healthy, revoked, disabled));
        when(accountPool.getProject(any(), anyString())).thenReturn(Mono.just("proj"));
    }

    @Test
    void refreshAllQuotas_updatesHealthyAndInvalidatesRevoked() {
        Map<String, ModelQuota> quotas = Map.of("gemini-3-flash", new ModelQuota(0.5, null));
        when(accountPool.getCredential(healthy)).thenReturn(Mono.just("tok-a"));
        when(accountPool.getCredential(revoked))
                .thenReturn(Mono.error(new AuthException("invalid_grant", true)));
        when(restApi.getModelQuotas("tok-a")).thenReturn(Mono.just(quotas));

        StepVerifier.create(scheduler.refreshAllQuotas())
                .expectNext(1)
                .verifyComplete();

        verify(accountPool).updateQuota("a@example.com", quotas);
        verify(accountPool).markInvalid(eq("b@example.com"), anyString());
        verify(accountPool, never()).getCredential(disabled);
    }

    @Test
    void refreshAllQuotas_transientFailureKeepsAccountValid() {
        when(accountPool.getCredential(any())).thenReturn(Mono.just("tok"));
        when(restApi.getModelQuotas("tok")).thenReturn(Mono.error(new UpstreamException(503, "busy")));

        StepVerifier.create(scheduler.refreshAllQuotas())
                .expectNext(0)
                .verifyComplete();

        verify(accountPool, never()).markInvalid(anyString(), anyString());
        verify(accountPool, never()).updateQuota(anyString(), any());
    }

    @Test
    void refreshQuotas_logsAndSurvivesFailure() {
        when(accountPool.listAccounts()).thenThrow(new IllegalStateException("pool closed"));

        scheduler.refreshQuotas();

        verify(accountPool).listAccounts();
    }

    @Test
    void clearExpiredLimits_delegatesToPool() {
        scheduler.clearExpiredLimits();

        verify(accountPool).clearExpiredLimits();
    }

    @Test
    void cleanupSignatures_delegatesToCache() {
        when(signatureCache.cleanup()).thenReturn(3);

        scheduler.cleanupSignatures();

        verify(signatureCache).cleanup();
        verify(signatureCache).size();
    }
}
