package io.foreman.storage;

import io.foreman.config.ForemanConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.Set;

public final class Database {
    private final ForemanConfig config;
    private final String jdbcUrl;

    public Database(ForemanConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public ForemanConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", "5000");
        props.setProperty("foreign_keys", "true");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.logsDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new StoreException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS tasks (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        name TEXT NOT NULL,
                        project TEXT,
                        phase TEXT,
                        priority INTEGER NOT NULL DEFAULT 3,
                        implementation_plan TEXT,
                        notes TEXT,
                        solution TEXT,
                        status TEXT NOT NULL DEFAULT 'TODO',
                        assigned_role TEXT,
                        worker_handle TEXT,
                        attempt_count INTEGER NOT NULL DEFAULT 0,
                        blocked_reason TEXT,
                        error_log TEXT,
                        created_at_ms INTEGER NOT NULL,
                        started_at_ms INTEGER,
                        completed_at_ms INTEGER,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            ensureTaskColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS task_history (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id INTEGER NOT NULL,
                        project TEXT,
                        status TEXT NOT NULL,
                        notes TEXT,
                        error_log TEXT,
                        changed_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(task_id) REFERENCES tasks(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS blocked_reasons (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        task_id INTEGER NOT NULL,
                        reason TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        FOREIGN KEY(task_id) REFERENCES tasks(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pending_questions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        agent TEXT NOT NULL,
                        task_id INTEGER,
                        question TEXT NOT NULL,
                        answer TEXT,
                        status TEXT NOT NULL DEFAULT 'pending',
                        created_at_ms INTEGER NOT NULL,
                        answered_at_ms INTEGER,
                        FOREIGN KEY(task_id) REFERENCES tasks(id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS orchestrator_state (
                        state_key TEXT PRIMARY KEY,
                        state_value TEXT NOT NULL,
                        version INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);

            // one history row on insert and one per status/notes/error_log change
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_tasks_history_insert
                    AFTER INSERT ON tasks
                    FOR EACH ROW
                    BEGIN
                        INSERT INTO task_history(task_id,project,status,notes,error_log,changed_at_ms)
                        VALUES(NEW.id,NEW.project,NEW.status,NEW.notes,NEW.error_log,NEW.updated_at_ms);
                    END
                    """);
            st.execute("""
                    CREATE TRIGGER IF NOT EXISTS trg_tasks_history_update
                    AFTER UPDATE ON tasks
                    FOR EACH ROW
                    WHEN OLD.status IS NOT NEW.status
                      OR OLD.notes IS NOT NEW.notes
                      OR OLD.error_log IS NOT NEW.error_log
                    BEGIN
                        INSERT INTO task_history(task_id,project,status,notes,error_log,changed_at_ms)
                        VALUES(NEW.id,NEW.project,NEW.status,NEW.notes,NEW.error_log,NEW.updated_at_ms);
                    END
                    """);

            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_status_priority ON tasks(status, priority DESC, id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_role_status ON tasks(assigned_role, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_worker_handle ON tasks(worker_handle) WHERE worker_handle IS NOT NULL");
            st.execute("CREATE INDEX IF NOT EXISTS idx_tasks_project_phase ON tasks(project, phase)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_task_history_task_changed ON task_history(task_id, changed_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_blocked_reasons_task_created ON blocked_reasons(task_id, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_pending_questions_status_created ON pending_questions(status, created_at_ms)");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize SQLite schema", e);
        }
    }

    /**
     * Older databases may predate some task columns; add whatever is missing.
     */
    private void ensureTaskColumns(Connection conn) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(tasks)")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        Map<String, String> wanted = Map.of(
                "project", "TEXT",
                "phase", "TEXT",
                "solution", "TEXT",
                "assigned_role", "TEXT",
                "worker_handle", "TEXT",
                "attempt_count", "INTEGER NOT NULL DEFAULT 0",
                "blocked_reason", "TEXT",
                "error_log", "TEXT",
                "started_at_ms", "INTEGER",
                "completed_at_ms", "INTEGER"
        );
        try (Statement st = conn.createStatement()) {
            for (Map.Entry<String, String> column : wanted.entrySet()) {
                if (!columns.contains(column.getKey())) {
                    st.execute("ALTER TABLE tasks ADD COLUMN " + column.getKey() + " " + column.getValue());
                }
            }
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
