package ru.aritmos.provisioningbroker.store;

import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.provisioningbroker.core.SensitiveDataSanitizer;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.Optional;

/**
 * Хранилище учётных данных арендаторов (таблица {@code pb_tenant_credentials}).
 * <p>
 * Upsert идемпотентен и привязан к tenant_id:
 * <ul>
 *   <li>поля обновления со значением {@code null} не трогают сохранённые значения (COALESCE);</li>
 *   <li>сроки токена записываются вместе с токеном: новый токен без срока обнуляет срок прежнего;</li>
 *   <li>одна транзакция: {@code SELECT ... FOR UPDATE}, затем UPDATE либо INSERT;</li>
 *   <li>гонка двух первых вставок разрешается повтором в виде UPDATE.</li>
 * </ul>
 * Поэтому последовательные upsert-ы непересекающихся полей коммутативны.
 * <p>
 * SQL совместим с PostgreSQL и H2.
 */
@Singleton
public class CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final int MAX_TRIES = 2;

    private static final String SQL_LOCK =
            "SELECT tenant_id FROM pb_tenant_credentials WHERE tenant_id=? FOR UPDATE";

    private static final String SQL_UPDATE =
            "UPDATE pb_tenant_credentials SET "
                    + "bearer_token=COALESCE(CAST(? AS VARCHAR(8192)), bearer_token), "
                    + "bearer_issued_at=CASE WHEN CAST(? AS VARCHAR(8192)) IS NULL THEN bearer_issued_at ELSE CAST(? AS TIMESTAMP) END, "
                    + "bearer_expires_at=CASE WHEN CAST(? AS VARCHAR(8192)) IS NULL THEN bearer_expires_at ELSE CAST(? AS TIMESTAMP) END, "
                    + "session_token=COALESCE(CAST(? AS VARCHAR(8192)), session_token), "
                    + "session_expires_at=CASE WHEN CAST(? AS VARCHAR(8192)) IS NULL THEN session_expires_at ELSE CAST(? AS TIMESTAMP) END, "
                    + "refresh_token=COALESCE(CAST(? AS VARCHAR(8192)), refresh_token), "
                    + "integration_token=COALESCE(CAST(? AS VARCHAR(8192)), integration_token), "
                    + "updated_at=? "
                    + "WHERE tenant_id=?";

    private static final String SQL_INSERT =
            "INSERT INTO pb_tenant_credentials(tenant_id, bearer_token, bearer_issued_at, bearer_expires_at, "
                    + "session_token, session_expires_at, refresh_token, integration_token, created_at, updated_at) "
                    + "VALUES (?,?,?,?,?,?,?,?,?,?)";

    private static final String SQL_FIND =
            "SELECT tenant_id, bearer_token, bearer_issued_at, bearer_expires_at, session_token, session_expires_at, "
                    + "refresh_token, integration_token, created_at, updated_at "
                    + "FROM pb_tenant_credentials WHERE tenant_id=?";

    private final DataSource dataSource;

    public CredentialStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Сохранить учётные данные арендатора.
     * <p>
     * Ошибка БД не выбрасывается, а возвращается как {@link CredentialModels.PersistOutcome#fail}:
     * оркестратор фиксирует её как предупреждение.
     */
    public CredentialModels.PersistOutcome upsert(String tenantId, CredentialModels.CredentialUpdate update) {
        if (tenantId == null || tenantId.isBlank()) {
            return CredentialModels.PersistOutcome.fail("tenantId не задан");
        }
        if (update == null || update.isEmpty()) {
            return CredentialModels.PersistOutcome.ok(false);
        }
        String tenant = tenantId.trim();
        SQLException last = null;
        for (int attempt = 1; attempt <= MAX_TRIES; attempt++) {
            try {
                return upsertOnce(tenant, update);
            } catch (SQLException e) {
                last = e;
                if (!UNIQUE_VIOLATION.equals(e.getSQLState())) {
                    break;
                }
                log.debug("Конкурентная вставка учётных данных tenant={}, повтор как UPDATE", tenant);
            }
        }
        String msg = SensitiveDataSanitizer.sanitizeText(last == null ? "unknown" : last.getMessage());
        log.warn("Не удалось сохранить учётные данные tenant={}: {}", tenant, msg);
        return CredentialModels.PersistOutcome.fail(msg);
    }

    private CredentialModels.PersistOutcome upsertOnce(String tenant, CredentialModels.CredentialUpdate u) throws SQLException {
        Instant now = Instant.now();
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try {
                boolean exists = lock(c, tenant);
                if (exists) {
                    update(c, tenant, u, now);
                } else {
                    insert(c, tenant, u, now);
                }
                c.commit();
                return CredentialModels.PersistOutcome.ok(!exists);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(autoCommit);
            }
        }
    }

    private static boolean lock(Connection c, String tenant) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SQL_LOCK)) {
            ps.setString(1, tenant);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static void update(Connection c, String tenant, CredentialModels.CredentialUpdate u, Instant now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SQL_UPDATE)) {
            setText(ps, 1, u.bearerToken());
            setText(ps, 2, u.bearerToken());
            setTs(ps, 3, u.bearerIssuedAt());
            setText(ps, 4, u.bearerToken());
            setTs(ps, 5, u.bearerExpiresAt());
            setText(ps, 6, u.sessionToken());
            setText(ps, 7, u.sessionToken());
            setTs(ps, 8, u.sessionExpiresAt());
            setText(ps, 9, u.refreshToken());
            setText(ps, 10, u.integrationToken());
            ps.setTimestamp(11, Timestamp.from(now));
            ps.setString(12, tenant);
            ps.executeUpdate();
        }
    }

    private static void insert(Connection c, String tenant, CredentialModels.CredentialUpdate u, Instant now) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(SQL_INSERT)) {
            ps.setString(1, tenant);
            setText(ps, 2, u.bearerToken());
            setTs(ps, 3, u.bearerIssuedAt());
            setTs(ps, 4, u.bearerExpiresAt());
            setText(ps, 5, u.sessionToken());
            setTs(ps, 6, u.sessionExpiresAt());
            setText(ps, 7, u.refreshToken());
            setText(ps, 8, u.integrationToken());
            ps.setTimestamp(9, Timestamp.from(now));
            ps.setTimestamp(10, Timestamp.from(now));
            ps.executeUpdate();
        }
    }

    /**
     * Прочитать запись арендатора.
     */
    public Optional<CredentialModels.TenantCredentialRecord> find(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Optional.empty();
        }
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(SQL_FIND)) {
            ps.setString(1, tenantId.trim());
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new CredentialModels.TenantCredentialRecord(
                        rs.getString("tenant_id"),
                        rs.getString("bearer_token"),
                        ts(rs.getTimestamp("bearer_issued_at")),
                        ts(rs.getTimestamp("bearer_expires_at")),
                        rs.getString("session_token"),
                        ts(rs.getTimestamp("session_expires_at")),
                        rs.getString("refresh_token"),
                        rs.getString("integration_token"),
                        ts(rs.getTimestamp("created_at")),
                        ts(rs.getTimestamp("updated_at"))
                ));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Не удалось прочитать учётные данные tenant=" + tenantId + ": "
                    + SensitiveDataSanitizer.sanitizeText(e.getMessage()), e);
        }
    }

    /**
     * Проверка доступности таблицы (для стартовой проверки).
     */
    public void ping() {
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM pb_tenant_credentials WHERE 1=0");
             ResultSet rs = ps.executeQuery()) {
            rs.next();
        } catch (SQLException e) {
            throw new IllegalStateException("Хранилище учётных данных недоступно: " + e.getMessage(), e);
        }
    }

    private static void setText(PreparedStatement ps, int idx, String v) throws SQLException {
        if (v == null) {
            ps.setNull(idx, Types.VARCHAR);
        } else {
            ps.setString(idx, v);
        }
    }

    private static void setTs(PreparedStatement ps, int idx, Instant v) throws SQLException {
        if (v == null) {
            ps.setNull(idx, Types.TIMESTAMP);
        } else {
            ps.setTimestamp(idx, Timestamp.from(v));
        }
    }

    private static Instant ts(Timestamp t) {
        return t == null ? null : t.toInstant();
    }
}
