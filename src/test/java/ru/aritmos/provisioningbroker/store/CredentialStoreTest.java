package ru.aritmos.provisioningbroker.store;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import ru.aritmos.provisioningbroker.token.CapturedToken;
import ru.aritmos.provisioningbroker.token.TokenKind;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CredentialStoreTest {

    private static final Instant ISSUED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant EXPIRES = Instant.parse("2026-03-01T11:00:00Z");

    private JdbcDataSource dataSource;
    private CredentialStore store;

    @BeforeEach
    void setUp() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:pb-" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        try (InputStream in = getClass().getResourceAsStream("/db/migration/V1__tenant_credentials.sql");
             Connection c = dataSource.getConnection();
             Statement st = c.createStatement()) {
            st.execute(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        store = new CredentialStore(dataSource);
    }

    private static CredentialModels.CredentialUpdate bearer(String value) {
        return new CredentialModels.CredentialUpdate(value, ISSUED, EXPIRES, null, null, null, null);
    }

    private static CredentialModels.CredentialUpdate integration(String value) {
        return new CredentialModels.CredentialUpdate(null, null, null, null, null, null, value);
    }

    @Test
    void insertThenFind() {
        CredentialModels.PersistOutcome out = store.upsert("tenant-1", bearer("bearer-1"));

        assertTrue(out.ok());
        assertTrue(out.inserted(), "TEST_EXPECTED: первая запись арендатора создаётся");
        CredentialModels.TenantCredentialRecord r = store.find("tenant-1").orElseThrow();
        assertEquals("bearer-1", r.bearerToken());
        assertEquals(ISSUED, r.bearerIssuedAt());
        assertEquals(EXPIRES, r.bearerExpiresAt());
    }

    @Test
    void nullFieldsDoNotOverwriteStoredValues() {
        store.upsert("tenant-1", bearer("bearer-1"));
        CredentialModels.PersistOutcome out = store.upsert("tenant-1", integration("pit-integration"));

        assertTrue(out.ok());
        assertFalse(out.inserted());
        CredentialModels.TenantCredentialRecord r = store.find("tenant-1").orElseThrow();
        assertEquals("bearer-1", r.bearerToken(), "TEST_EXPECTED: bearer сохранён после частичного обновления");
        assertEquals("pit-integration", r.integrationToken());
    }

    @Test
    void newTokenWithoutExpiryClearsPreviousExpiry() {
        store.upsert("tenant-1", new CredentialModels.CredentialUpdate("bearer-1", ISSUED, EXPIRES,
                "session-1", EXPIRES, null, null));
        store.upsert("tenant-1", new CredentialModels.CredentialUpdate("bearer-2", null, null,
                "session-2", null, null, null));

        CredentialModels.TenantCredentialRecord r = store.find("tenant-1").orElseThrow();
        assertEquals("bearer-2", r.bearerToken());
        assertNull(r.bearerIssuedAt(), "TEST_EXPECTED: срок прежнего bearer не переносится на новый");
        assertNull(r.bearerExpiresAt(), "TEST_EXPECTED: срок прежнего bearer не переносится на новый");
        assertEquals("session-2", r.sessionToken());
        assertNull(r.sessionExpiresAt(), "TEST_EXPECTED: срок прежней сессии не переносится на новую");
    }

    @Test
    void disjointUpdatesCommute() {
        store.upsert("a", bearer("bearer-a"));
        store.upsert("a", integration("pit-a"));
        store.upsert("b", integration("pit-b"));
        store.upsert("b", bearer("bearer-a"));

        CredentialModels.TenantCredentialRecord a = store.find("a").orElseThrow();
        CredentialModels.TenantCredentialRecord b = store.find("b").orElseThrow();
        assertEquals(a.bearerToken(), b.bearerToken());
        assertEquals(a.bearerExpiresAt(), b.bearerExpiresAt());
        assertEquals("pit-a", a.integrationToken());
        assertEquals("pit-b", b.integrationToken());
    }

    @Test
    void repeatedUpsertIsIdempotent() {
        store.upsert("tenant-1", bearer("bearer-1"));
        store.upsert("tenant-1", bearer("bearer-1"));
        CredentialModels.TenantCredentialRecord r = store.find("tenant-1").orElseThrow();
        assertEquals("bearer-1", r.bearerToken());
        assertEquals(ISSUED, r.bearerIssuedAt());
    }

    @Test
    void concurrentFirstInsertsBothSucceed() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CredentialModels.PersistOutcome>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> {
                start.await();
                return store.upsert("race", bearer("bearer-race"));
            }));
            futures.add(pool.submit(() -> {
                start.await();
                return store.upsert("race", integration("pit-race"));
            }));
            start.countDown();
            for (Future<CredentialModels.PersistOutcome> f : futures) {
                assertTrue(f.get(10, TimeUnit.SECONDS).ok(), "TEST_EXPECTED: гонка вставок разрешается повтором");
            }
        } finally {
            pool.shutdownNow();
        }
        CredentialModels.TenantCredentialRecord r = store.find("race").orElseThrow();
        assertEquals("bearer-race", r.bearerToken());
        assertEquals("pit-race", r.integrationToken());
    }

    @Test
    void emptyUpdateAndBlankTenant() {
        assertTrue(store.upsert("t", CredentialModels.CredentialUpdate.fromCaptured(Map.of())).ok());
        assertTrue(store.find("t").isEmpty(), "TEST_EXPECTED: пустое обновление не создаёт запись");
        assertFalse(store.upsert(" ", bearer("x")).ok());
    }

    @Test
    void fromCapturedMapsKinds() {
        CredentialModels.CredentialUpdate u = CredentialModels.CredentialUpdate.fromCaptured(Map.of(
                TokenKind.BEARER, new CapturedToken(TokenKind.BEARER, "b", ISSUED, EXPIRES, CapturedToken.Source.INTERCEPTED),
                TokenKind.REFRESH, CapturedToken.of(TokenKind.REFRESH, "r", CapturedToken.Source.STORAGE)));
        assertEquals("b", u.bearerToken());
        assertEquals(EXPIRES, u.bearerExpiresAt());
        assertEquals("r", u.refreshToken());
        assertEquals(null, u.integrationToken());
    }

    @Test
    void databaseFailureIsReturnedNotThrown() throws Exception {
        try (Connection c = dataSource.getConnection(); Statement st = c.createStatement()) {
            st.execute("DROP TABLE pb_tenant_credentials");
        }
        CredentialModels.PersistOutcome out = assertDoesNotThrow(() -> store.upsert("t", bearer("x")));
        assertFalse(out.ok());
        assertThrows(IllegalStateException.class, () -> store.ping());
        assertThrows(IllegalStateException.class, () -> store.find("t"));
    }
}
