package in.pollwall.migration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Creates the poll schema on startup. Tables that already exist are left untouched.
 *
 * Tables, in dependency order:
 * - users: accounts, unique email
 * - polls: poll rows with derived like/dislike counters
 * - poll_options: ordered options with derived vote counters
 * - poll_likes / poll_dislikes: relation rows, primary key (user_id, poll_id)
 * - poll_votes: vote facts, unique (user_id, poll_id)
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private static final Map<String, String> TABLES = new LinkedHashMap<>();

    static {
        TABLES.put("users", """
            CREATE TABLE users (
                id VARCHAR(32) PRIMARY KEY,
                email VARCHAR(255) NOT NULL UNIQUE,
                hashed_password VARCHAR(255) NOT NULL,
                full_name VARCHAR(255),
                is_admin BOOLEAN NOT NULL DEFAULT FALSE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW()
            )
            """);
        TABLES.put("polls", """
            CREATE TABLE polls (
                id VARCHAR(32) PRIMARY KEY,
                title VARCHAR(500) NOT NULL,
                description TEXT,
                poll_expires_at TIMESTAMPTZ,
                likes INT NOT NULL DEFAULT 0,
                dislikes INT NOT NULL DEFAULT 0,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                updated_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                created_by VARCHAR(32) REFERENCES users(id) ON DELETE SET NULL
            )
            """);
        TABLES.put("poll_options", """
            CREATE TABLE poll_options (
                id VARCHAR(32) PRIMARY KEY,
                poll_id VARCHAR(32) NOT NULL REFERENCES polls(id) ON DELETE CASCADE,
                text VARCHAR(500) NOT NULL,
                votes INT NOT NULL DEFAULT 0,
                position INT NOT NULL DEFAULT 0
            )
            """);
        TABLES.put("poll_likes", """
            CREATE TABLE poll_likes (
                user_id VARCHAR(32) NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                poll_id VARCHAR(32) NOT NULL REFERENCES polls(id) ON DELETE CASCADE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (user_id, poll_id)
            )
            """);
        TABLES.put("poll_dislikes", """
            CREATE TABLE poll_dislikes (
                user_id VARCHAR(32) NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                poll_id VARCHAR(32) NOT NULL REFERENCES polls(id) ON DELETE CASCADE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                PRIMARY KEY (user_id, poll_id)
            )
            """);
        TABLES.put("poll_votes", """
            CREATE TABLE poll_votes (
                id VARCHAR(32) PRIMARY KEY,
                user_id VARCHAR(32) NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                poll_id VARCHAR(32) NOT NULL REFERENCES polls(id) ON DELETE CASCADE,
                option_id VARCHAR(32) NOT NULL REFERENCES poll_options(id) ON DELETE CASCADE,
                created_at TIMESTAMPTZ NOT NULL DEFAULT NOW(),
                CONSTRAINT uq_poll_votes_user_poll UNIQUE (user_id, poll_id)
            )
            """);
    }

    private static final String[] INDEXES = {
        "CREATE INDEX IF NOT EXISTS idx_polls_created_at ON polls (created_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_polls_likes ON polls (likes DESC, created_at DESC)",
        "CREATE INDEX IF NOT EXISTS idx_polls_created_by ON polls (created_by)",
        "CREATE INDEX IF NOT EXISTS idx_poll_options_poll ON poll_options (poll_id, position)",
        "CREATE INDEX IF NOT EXISTS idx_poll_likes_poll ON poll_likes (poll_id)",
        "CREATE INDEX IF NOT EXISTS idx_poll_dislikes_poll ON poll_dislikes (poll_id)",
        "CREATE INDEX IF NOT EXISTS idx_poll_votes_option ON poll_votes (option_id)"
    };

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Checking poll schema");

        try (Connection conn = dataSource.getConnection()) {
            int created = 0;
            for (Map.Entry<String, String> table : TABLES.entrySet()) {
                if (tableExists(conn, table.getKey())) {
                    log.debug("[MIGRATION] {} already exists", table.getKey());
                    continue;
                }
                execute(conn, table.getValue());
                created++;
                log.info("[MIGRATION] Created table {}", table.getKey());
            }
            for (String index : INDEXES) {
                execute(conn, index);
            }
            log.info("[MIGRATION] Schema ready ({} tables created)", created);

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void execute(Connection conn, String sql) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute(sql);
        }
    }
}
