package io.minicron.core.log;

import io.minicron.core.error.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SqliteExecutionLogStore implements ExecutionLogStore {
    private final String jdbcUrl;
    private final int maxEntriesPerJob;

    public SqliteExecutionLogStore(Path dbPath, int maxEntriesPerJob) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        if (maxEntriesPerJob < 1) {
            throw new IllegalArgumentException("maxEntriesPerJob must be positive");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.maxEntriesPerJob = maxEntriesPerJob;
        init();
    }

    @Override
    public synchronized void append(ExecutionLogEntry entry) {
        String insert = """
            INSERT INTO execution_log (
                job_id, started_at, finished_at, exit_status, exit_code,
                stdout_excerpt, stderr_excerpt, triggered_by, duration_ms
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;
        String trim = """
            DELETE FROM execution_log
            WHERE job_id = ?
              AND seq NOT IN (
                SELECT seq FROM execution_log WHERE job_id = ? ORDER BY seq DESC LIMIT ?
              )
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(insert)) {
                statement.setString(1, entry.jobId());
                statement.setString(2, entry.startedAt().toString());
                statement.setString(3, entry.finishedAt().toString());
                statement.setString(4, entry.exitStatus().name());
                if (entry.exitCode() == null) {
                    statement.setNull(5, Types.INTEGER);
                } else {
                    statement.setInt(5, entry.exitCode());
                }
                statement.setString(6, safe(entry.stdoutExcerpt()));
                statement.setString(7, safe(entry.stderrExcerpt()));
                statement.setString(8, entry.triggeredBy().name());
                statement.setLong(9, entry.durationMs());
                statement.executeUpdate();
            }
            try (PreparedStatement statement = connection.prepareStatement(trim)) {
                statement.setString(1, entry.jobId());
                statement.setString(2, entry.jobId());
                statement.setInt(3, maxEntriesPerJob);
                statement.executeUpdate();
            }
            connection.commit();
        } catch (SQLException e) {
            throw new StorageException("Failed to append execution log for " + entry.jobId(), e);
        }
    }

    @Override
    public synchronized List<ExecutionLogEntry> list(String jobId, int offset, int limit) {
        String sql = """
            SELECT job_id, started_at, finished_at, exit_status, exit_code,
                   stdout_excerpt, stderr_excerpt, triggered_by, duration_ms
            FROM execution_log
            WHERE job_id = ?
            ORDER BY seq DESC
            LIMIT ? OFFSET ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, jobId);
            statement.setInt(2, Math.max(0, limit));
            statement.setInt(3, Math.max(0, offset));
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ExecutionLogEntry> entries = new ArrayList<>();
                while (resultSet.next()) {
                    Integer exitCode = resultSet.getInt("exit_code");
                    if (resultSet.wasNull()) {
                        exitCode = null;
                    }
                    entries.add(new ExecutionLogEntry(
                        resultSet.getString("job_id"),
                        Instant.parse(resultSet.getString("started_at")),
                        Instant.parse(resultSet.getString("finished_at")),
                        RunStatus.valueOf(resultSet.getString("exit_status")),
                        exitCode,
                        resultSet.getString("stdout_excerpt"),
                        resultSet.getString("stderr_excerpt"),
                        TriggerSource.valueOf(resultSet.getString("triggered_by")),
                        resultSet.getLong("duration_ms")
                    ));
                }
                return entries;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list execution log for " + jobId, e);
        }
    }

    @Override
    public synchronized int count(String jobId) {
        String sql = "SELECT COUNT(*) FROM execution_log WHERE job_id = ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, jobId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to count execution log for " + jobId, e);
        }
    }

    @Override
    public synchronized int purge(String jobId) {
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement("DELETE FROM execution_log WHERE job_id = ?")) {
            statement.setString(1, jobId);
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new StorageException("Failed to purge execution log for " + jobId, e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=FULL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS execution_log (
                seq INTEGER PRIMARY KEY AUTOINCREMENT,
                job_id TEXT NOT NULL,
                started_at TEXT NOT NULL,
                finished_at TEXT NOT NULL,
                exit_status TEXT NOT NULL,
                exit_code INTEGER,
                stdout_excerpt TEXT NOT NULL,
                stderr_excerpt TEXT NOT NULL,
                triggered_by TEXT NOT NULL,
                duration_ms INTEGER NOT NULL
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_execution_log_job_seq
            ON execution_log(job_id, seq DESC)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite execution log store", e);
        }
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
