package com.antigravity.gateway.dao;

import com.antigravity.gateway.config.AppProperties;
import com.antigravity.gateway.config.DatabaseConfig;
import com.antigravity.gateway.pool.Account;
import com.antigravity.gateway.pool.AccountSource;
import com.antigravity.gateway.pool.ModelQuota;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccountDAOTest {

    @TempDir
    Path tempDir;

    private AccountDAO dao;
    private Path dbFile;

    @BeforeEach
    void setUp() {
        dbFile = tempDir.resolve("nested").resolve("accounts.db");
        AppProperties properties = new AppProperties();
        properties.getDatabase().setPath(dbFile.toString());

        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dbFile);
        dataSource.setDriverClassName("org.sqlite.JDBC");
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);

        // 目录需在首次连接前创建
        new DatabaseConfig(properties, jdbc).init();
        dao = new AccountDAO(jdbc);
    }

    @Test
    void init_createsDirectoryAndIsIdempotent() {
        assertTrue(Files.isDirectory(dbFile.getParent()));

        AppProperties properties = new AppProperties();
        properties.getDatabase().setPath(dbFile.toString());
        DriverManagerDataSource dataSource = new DriverManagerDataSource("jdbc:sqlite:" + dbFile);
        assertDoesNotThrow(() -> new DatabaseConfig(properties, new JdbcTemplate(dataSource)).init());
    }

    @Test
    void save_thenLoad_restoresAllState() {
        Account account = new Account("alice@example.com", AccountSource.OAUTH, "rt-1", null, 100);
        account.setEnabled(false);
        account.setInvalid(true);
        account.setInvalidReason("invalid_grant");
        account.setProjectId("proj-9");
        account.setSubscriptionTier("pro");
        account.setHealthScore(83.5);
        account.setLastUsed(1_700_000_000_000L);
        account.setQuotaThreshold(0.25);
        account.setQuotaLastChecked(1_700_000_001_000L);
        account.modelRateLimits().put("claude-sonnet-4-5", 1_700_000_060_000L);
        account.quota().put("gemini-3-flash", new ModelQuota(0.4, "2023-11-15T00:00:00Z"));
        account.modelQuotaThresholds().put("gemini-3-flash", 0.05);

        dao.save(account);
        List<Account> loaded = dao.loadAll();

        assertEquals(1, loaded.size());
        Account restored = loaded.get(0);
        assertEquals("alice@example.com", restored.email());
        assertEquals(AccountSource.OAUTH, restored.source());
        assertEquals("rt-1", restored.refreshToken());
        assertNull(restored.apiKey());
        assertFalse(restored.enabled());
        assertTrue(restored.invalid());
        assertEquals("invalid_grant", restored.invalidReason());
        assertEquals("proj-9", restored.projectId());
        assertEquals("pro", restored.subscriptionTier());
        assertEquals(83.5, restored.healthScore());
        assertEquals(1_700_000_000_000L, restored.lastUsed());
        assertEquals(0.25, restored.quotaThreshold());
        assertEquals(1_700_000_001_000L, restored.quotaLastChecked());
        assertEquals(1_700_000_060_000L, restored.modelRateLimits().get("claude-sonnet-4-5"));
        assertEquals(0.4, restored.quota().get("gemini-3-flash").remainingFraction());
        assertEquals("2023-11-15T00:00:00Z", restored.quota().get("gemini-3-flash").resetTime());
        assertEquals(0.05, restored.modelQuotaThresholds().get("gemini-3-flash"));
        assertEquals(100, restored.addedAt());
    }

    @Test
    void nullQuotaThreshold_staysNull() {
        dao.save(new Account("bob@example.com", AccountSource.MANUAL, null, "key-1", 5));

        Account restored = dao.loadAll().get(0);
        assertNull(restored.quotaThreshold());
        assertEquals("key-1", restored.apiKey());
        assertTrue(restored.hasStaticKey());
        assertTrue(restored.quota().isEmpty());
    }

    @Test
    void save_replacesExistingRow() {
        Account account = new Account("alice@example.com", AccountSource.OAUTH, "rt-1", null, 1);
        dao.save(account);
        account.setSubscriptionTier("ultra");
        dao.save(account);

        List<Account> loaded = dao.loadAll();
        assertEquals(1, loaded.size());
        assertEquals("ultra", loaded.get(0).subscriptionTier());
    }

    @Test
    void loadAll_ordersByAddedAt() {
        dao.save(new Account("late@example.com", AccountSource.OAUTH, "rt", null, 300));
        dao.save(new Account("early@example.com", AccountSource.OAUTH, "rt", null, 100));

        List<Account> loaded = dao.loadAll();
        assertEquals("early@example.com", loaded.get(0).email());
        assertEquals("late@example.com", loaded.get(1).email());
    }

    @Test
    void delete_removesRow() {
        dao.save(new Account("alice@example.com", AccountSource.OAUTH, "rt", null, 1));

        dao.delete("alice@example.com");

        assertTrue(dao.loadAll().isEmpty());
    }
}
