package io.tiergate.core.entitlement;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import org.sqlite.SQLiteConfig;

/**
 * SQLite-backed store. Mutations run in {@code BEGIN IMMEDIATE} transactions, which take the write lock
 * up front, so a read-modify-write of one user never interleaves with another writer. The payment ledger
 * is its own table keyed by payment id; {@code INSERT OR IGNORE} lets exactly one delivery win.
 * Lock waits are bounded by {@code busy_timeout} and surface as {@link TransientStoreException}.
 */
public final class SqliteEntitlementStore implements EntitlementStore {
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final String jdbcUrl;
    private final EntitlementDefaults defaults;
    private final SQLiteConfig sqliteConfig;

    public SqliteEntitlementStore(Path dbPath, EntitlementDefaults defaults) throws IOException {
        this(dbPath, defaults, 5_000);
    }

    public SqliteEntitlementStore(Path dbPath, EntitlementDefaults defaults, int busyTimeoutMs) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.sqliteConfig = new SQLiteConfig();
        this.sqliteConfig.setJournalMode(SQLiteConfig.JournalMode.WAL);
        this.sqliteConfig.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        this.sqliteConfig.setBusyTimeout(Math.max(1, busyTimeoutMs));
        this.sqliteConfig.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        init();
    }

    @Override
    public UserEntitlement get(String userId) throws IOException {
        return update(userId, UnaryOperator.identity()).after();
    }

    @Override
    public void save(UserEntitlement record) throws IOException {
        update(record.userId(), current -> record);
    }

    @Override
    public EntitlementChange update(String userId, UnaryOperator<UserEntitlement> mutation) throws IOException {
        String id = key(userId);
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                UserEntitlement stored = selectOrCreate(connection, id);
                UserEntitlement before = defaults.withConfiguredLimit(stored);
                UserEntitlement after = mutation.apply(before).settledAgainst(before);
                if (!after.equals(stored)) {
                    write(connection, after);
                }
                connection.commit();
                return new EntitlementChange(before, after);
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw translate("Failed to update entitlement for user " + id, e);
        }
    }

    /**
     * The ledger insert and the entitlement update commit or roll back together.
     */
    @Override
    public Optional<EntitlementChange> applyPayment(String userId, String paymentId, UnaryOperator<UserEntitlement> grant)
        throws IOException {
        String id = key(userId);
        String sql = """
            INSERT OR IGNORE INTO processed_payments (payment_id, user_id, processed_at)
            VALUES (?, ?, ?)
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try {
                UserEntitlement stored = selectOrCreate(connection, id);
                int inserted;
                try (PreparedStatement statement = connection.prepareStatement(sql)) {
                    statement.setString(1, paymentId);
                    statement.setString(2, id);
                    statement.setString(3, defaults.now().toString());
                    inserted = statement.executeUpdate();
                }
                if (inserted == 0) {
                    connection.rollback();
                    return Optional.empty();
                }
                UserEntitlement before = defaults.withConfiguredLimit(stored);
                UserEntitlement after = grant.apply(before).settledAgainst(before).withPayment(paymentId, defaults.now());
                write(connection, after);
                connection.commit();
                return Optional.of(new EntitlementChange(before, after));
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw translate("Failed to apply payment " + paymentId, e);
        }
    }

    @Override
    public List<String> userIds() throws IOException {
        String sql = "SELECT user_id FROM entitlements ORDER BY user_id ASC";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<String> ids = new ArrayList<>();
            while (resultSet.next()) {
                ids.add(resultSet.getString("user_id"));
            }
            return ids;
        } catch (SQLException e) {
            throw translate("Failed to list users", e);
        }
    }

    /**
     * Single conditional statement; ISO dates order lexicographically.
     */
    @Override
    public int resetBefore(LocalDate day, Instant now) throws IOException {
        String sql = """
            UPDATE entitlements
            SET daily_used = 0, last_reset_at = ?, updated_at = ?
            WHERE last_reset_at < ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, day.toString());
            statement.setString(2, now.toString());
            statement.setString(3, day.toString());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw translate("Failed to reset daily usage", e);
        }
    }

    private UserEntitlement select(Connection connection, String userId) throws SQLException {
        String sql = """
            SELECT user_id, tier, daily_used, daily_limit, last_reset_at, subscription_expires_at,
                   subscription_plan_id, created_at, updated_at
            FROM entitlements
            WHERE user_id = ?
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, userId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                String expires = resultSet.getString("subscription_expires_at");
                return new UserEntitlement(
                    resultSet.getString("user_id"),
                    resultSet.getString("tier"),
                    resultSet.getInt("daily_used"),
                    resultSet.getInt("daily_limit"),
                    LocalDate.parse(resultSet.getString("last_reset_at")),
                    expires == null ? null : Instant.parse(expires),
                    resultSet.getString("subscription_plan_id"),
                    payments(connection, userId),
                    Instant.parse(resultSet.getString("created_at")),
                    Instant.parse(resultSet.getString("updated_at"))
                );
            }
        }
    }

    private UserEntitlement selectOrCreate(Connection connection, String userId) throws SQLException {
        UserEntitlement existing = select(connection, userId);
        return existing == null ? insertDefault(connection, userId) : existing;
    }

    private Set<String> payments(Connection connection, String userId) throws SQLException {
        String sql = "SELECT payment_id FROM processed_payments WHERE user_id = ? ORDER BY processed_at ASC";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, userId);
            try (ResultSet resultSet = statement.executeQuery()) {
                Set<String> ids = new LinkedHashSet<>();
                while (resultSet.next()) {
                    ids.add(resultSet.getString("payment_id"));
                }
                return ids;
            }
        }
    }

    private UserEntitlement insertDefault(Connection connection, String userId) throws SQLException {
        UserEntitlement record = defaults.create(userId);
        String sql = """
            INSERT INTO entitlements (user_id, tier, daily_used, daily_limit, last_reset_at,
                                      subscription_expires_at, subscription_plan_id, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.userId());
            statement.setString(2, record.tier());
            statement.setInt(3, record.dailyUsed());
            statement.setInt(4, record.dailyLimit());
            statement.setString(5, record.lastResetAt().toString());
            statement.setString(6, null);
            statement.setString(7, record.subscriptionPlanId());
            statement.setString(8, record.createdAt().toString());
            statement.setString(9, record.updatedAt().toString());
            statement.executeUpdate();
        }
        return record;
    }

    private void write(Connection connection, UserEntitlement record) throws SQLException {
        String sql = """
            UPDATE entitlements
            SET tier = ?, daily_used = ?, daily_limit = ?, last_reset_at = ?, subscription_expires_at = ?,
                subscription_plan_id = ?, updated_at = ?
            WHERE user_id = ?
            """;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, record.tier());
            statement.setInt(2, record.dailyUsed());
            statement.setInt(3, record.dailyLimit());
            statement.setString(4, record.lastResetAt().toString());
            statement.setString(5, record.subscriptionExpiresAt() == null ? null : record.subscriptionExpiresAt().toString());
            statement.setString(6, record.subscriptionPlanId());
            statement.setString(7, record.updatedAt().toString());
            statement.setString(8, record.userId());
            statement.executeUpdate();
        }
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, sqliteConfig.toProperties());
    }

    private void init() throws IOException {
        String entitlements = """
            CREATE TABLE IF NOT EXISTS entitlements (
                user_id TEXT PRIMARY KEY,
                tier TEXT NOT NULL,
                daily_used INTEGER NOT NULL CHECK (daily_used >= 0),
                daily_limit INTEGER NOT NULL CHECK (daily_limit >= 0),
                last_reset_at TEXT NOT NULL,
                subscription_expires_at TEXT,
                subscription_plan_id TEXT NOT NULL,
                created_at TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                CHECK (daily_used <= daily_limit)
            )
            """;
        String payments = """
            CREATE TABLE IF NOT EXISTS processed_payments (
                payment_id TEXT PRIMARY KEY,
                user_id TEXT NOT NULL,
                processed_at TEXT NOT NULL
            )
            """;
        String resetIdx = """
            CREATE INDEX IF NOT EXISTS idx_entitlements_last_reset_at
            ON entitlements(last_reset_at)
            """;
        String paymentsIdx = """
            CREATE INDEX IF NOT EXISTS idx_processed_payments_user_id
            ON processed_payments(user_id)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(entitlements);
            statement.execute(payments);
            statement.execute(resetIdx);
            statement.execute(paymentsIdx);
        } catch (SQLException e) {
            throw translate("Failed to initialize SQLite entitlement store", e);
        }
    }

    private static IOException translate(String message, SQLException e) {
        int primary = e.getErrorCode() & 0xFF;
        if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
            return new TransientStoreException(message + ": store busy", e);
        }
        return new IOException(message, e);
    }

    private static String key(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return userId.trim();
    }
}
