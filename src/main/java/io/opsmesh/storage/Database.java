package io.opsmesh.storage;

import io.opsmesh.config.OpsMeshConfig;
import io.opsmesh.util.Hashing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite file holding the state that must survive a restart: dead letters and breaker state.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private static final List<Migration> MIGRATIONS = List.of(
            new Migration("001_dead_letter_indexes", "Index dead letters by failure time and channel", List.of(
                    "CREATE INDEX IF NOT EXISTS idx_dead_letters_first_failed ON dead_letters(first_failed_at_ms)",
                    "CREATE INDEX IF NOT EXISTS idx_dead_letters_channel ON dead_letters(channel, first_failed_at_ms)"
            )),
            new Migration("002_dead_letter_kind_index", "Index dead letters by failure kind", List.of(
                    "CREATE INDEX IF NOT EXISTS idx_dead_letters_kind ON dead_letters(failure_kind)"
            ))
    );
    private final OpsMeshConfig config;
    private final String jdbcUrl;

    public Database(OpsMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        applyPragmas();
        initSchema();
    }

    /**
     * Opens a new connection. Callers own it; the busy timeout is per connection in SQLite.
     */
    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=" + BUSY_TIMEOUT_MS);
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    public OpsMeshConfig config() {
        return config;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS dead_letters (
                        message_id TEXT PRIMARY KEY,
                        topic TEXT NOT NULL,
                        payload_json TEXT,
                        priority TEXT NOT NULL,
                        sender_id TEXT,
                        recipient_id TEXT,
                        created_at_ms INTEGER NOT NULL,
                        ttl_ms INTEGER NOT NULL,
                        contract_version TEXT NOT NULL,
                        failure_kind TEXT NOT NULL,
                        failure_reason TEXT NOT NULL,
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        first_failed_at_ms INTEGER NOT NULL,
                        last_attempt_at_ms INTEGER NOT NULL,
                        channel TEXT NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS circuit_breakers (
                        channel TEXT PRIMARY KEY,
                        state TEXT NOT NULL,
                        consecutive_failures INTEGER NOT NULL,
                        opened_at_ms INTEGER NOT NULL,
                        half_open_trial_budget INTEGER NOT NULL,
                        half_open_successes INTEGER NOT NULL,
                        trips INTEGER NOT NULL DEFAULT 0,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL
                    )
                    """);
        }
    }

    /**
     * Applies pending migrations in order. An applied migration whose statements changed since
     * it ran fails the init instead of being silently skipped.
     */
    private void applyVersionedMigrations(Connection conn) throws SQLException {
        for (Migration migration : MIGRATIONS) {
            String recorded = recordedChecksum(conn, migration.version());
            if (recorded == null) {
                applyMigration(conn, migration);
            } else if (!recorded.equals(migration.checksum())) {
                throw new IllegalStateException("Migration " + migration.version()
                        + " changed after it was applied (recorded=" + recorded + ", current=" + migration.checksum() + ")");
            }
        }
    }

    private String recordedChecksum(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT checksum FROM schema_migrations WHERE version=?")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private void applyMigration(Connection conn, Migration migration) throws SQLException {
        boolean autoCommit = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try (Statement st = conn.createStatement();
             PreparedStatement record = conn.prepareStatement(
                     "INSERT INTO schema_migrations(version,description,checksum,applied_at_ms) VALUES(?,?,?,?)")) {
            for (String sql : migration.statements()) {
                st.execute(sql);
            }
            record.setString(1, migration.version());
            record.setString(2, migration.description());
            record.setString(3, migration.checksum());
            record.setLong(4, Instant.now().toEpochMilli());
            record.executeUpdate();
            conn.commit();
            log.info("Applied schema migration {} ({})", migration.version(), migration.description());
        } catch (SQLException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(autoCommit);
        }
    }

    private void applyPragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            try (ResultSet rs = st.executeQuery("PRAGMA journal_mode")) {
                String mode = rs.next() ? rs.getString(1) : null;
                if (!"wal".equalsIgnoreCase(mode)) {
                    throw new IllegalStateException("SQLite refused WAL journal mode, got " + mode);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private record Migration(String version, String description, List<String> statements) {
        String checksum() {
            return Hashing.sha256Hex(version + "|" + String.join(";", statements));
        }
    }

    public List<String> appliedMigrations() {
        List<String> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version FROM schema_migrations ORDER BY version")) {
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }
}
