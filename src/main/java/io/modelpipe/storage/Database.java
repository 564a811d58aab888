package io.modelpipe.storage;

import io.modelpipe.config.PipelineConfig;
import io.modelpipe.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * SQLite file holding the pipeline state documents. The schema is the ordered {@link #MIGRATIONS} list;
 * each step runs once, in its own transaction, and is recorded with a checksum in {@code schema_migrations}.
 */
public final class Database {
    static final List<Migration> MIGRATIONS = List.of(
            new Migration(
                    "20260301_001_pipeline_state",
                    "One JSON state document per scope, versioned by content revision",
                    List.of("""
                            CREATE TABLE IF NOT EXISTS pipeline_state (
                                scope TEXT PRIMARY KEY,
                                revision TEXT NOT NULL,
                                state_json TEXT NOT NULL,
                                created_at_ms INTEGER NOT NULL,
                                updated_at_ms INTEGER NOT NULL
                            )
                            """)
            ),
            new Migration(
                    "20260301_002_pipeline_state_updated_index",
                    "Index state documents by last update",
                    List.of("CREATE INDEX IF NOT EXISTS idx_pipeline_state_updated ON pipeline_state(updated_at_ms)")
            ),
            new Migration(
                    "20260315_003_pipeline_state_document_version",
                    "Record the codec version of each state document",
                    List.of("ALTER TABLE pipeline_state ADD COLUMN document_version INTEGER NOT NULL DEFAULT 2")
            )
    );

    private static final Map<String, String> EXPECTED_PRAGMAS = expectedPragmas();

    private final PipelineConfig config;
    private final String jdbcUrl;
    private final Clock clock;

    public Database(PipelineConfig config) {
        this(config, Clock.systemUTC());
    }

    public Database(PipelineConfig config, Clock clock) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile();
        this.clock = clock;
    }

    public PipelineConfig config() {
        return config;
    }

    /**
     * Creates the data directories, brings the schema up to the latest migration and switches the file to WAL.
     */
    public void init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create data directories under " + config.rootDir(), e);
        }
        try (Connection conn = openConnection()) {
            configure(conn);
            migrate(conn);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite database " + config.dbFile(), e);
        }
    }

    public Connection openConnection() throws SQLException {
        Properties properties = new Properties();
        properties.setProperty("busy_timeout", "5000");
        return DriverManager.getConnection(jdbcUrl, properties);
    }

    private void configure(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (Map.Entry<String, String> pragma : EXPECTED_PRAGMAS.entrySet()) {
                st.execute("PRAGMA " + pragma.getKey() + "=" + pragma.getValue());
            }
            for (Map.Entry<String, String> pragma : EXPECTED_PRAGMAS.entrySet()) {
                String actual = readPragma(st, pragma.getKey());
                if (!pragma.getValue().equalsIgnoreCase(actual)) {
                    throw new IllegalStateException("PRAGMA " + pragma.getKey() + " is " + actual
                            + ", expected " + pragma.getValue());
                }
            }
        }
    }

    private static String readPragma(Statement st, String name) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + name)) {
            return rs.next() ? rs.getString(1) : null;
        }
    }

    private void migrate(Connection conn) throws SQLException {
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
        Map<String, String> applied = appliedChecksums(conn);
        for (Migration migration : MIGRATIONS) {
            String recorded = applied.get(migration.version());
            if (recorded == null) {
                apply(conn, migration);
            } else if (!recorded.equals(migration.checksum())) {
                throw new IllegalStateException("Migration " + migration.version()
                        + " was applied with a different definition");
            }
        }
    }

    private static Map<String, String> appliedChecksums(Connection conn) throws SQLException {
        Map<String, String> out = new LinkedHashMap<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT version,checksum FROM schema_migrations")) {
            while (rs.next()) {
                out.put(rs.getString("version"), rs.getString("checksum"));
            }
        }
        return out;
    }

    private void apply(Connection conn, Migration migration) throws SQLException {
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
            record.setLong(4, clock.millis());
            record.executeUpdate();
            conn.commit();
        } catch (SQLException | RuntimeException e) {
            conn.rollback();
            throw e;
        } finally {
            conn.setAutoCommit(true);
        }
    }

    /**
     * Applied migrations, oldest first.
     */
    public List<AppliedMigration> listSchemaMigrations(int limit) {
        String sql = "SELECT version,description,checksum,applied_at_ms FROM schema_migrations ORDER BY version LIMIT ?";
        List<AppliedMigration> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AppliedMigration(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private static Map<String, String> expectedPragmas() {
        Map<String, String> pragmas = new LinkedHashMap<>();
        pragmas.put("journal_mode", "wal");
        pragmas.put("synchronous", "1");
        return pragmas;
    }

    record Migration(String version, String description, List<String> statements) {
        String checksum() {
            return Hashing.sha256Hex(version + "|" + String.join(";", statements));
        }
    }

    public record AppliedMigration(String version, String description, String checksum, long appliedAtMs) {
    }
}
