package com.switchyard.core.persistence;

import com.switchyard.core.errors.DatabaseException;
import com.switchyard.core.model.GitStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

import static com.switchyard.core.persistence.JdbcSupport.getInstant;
import static com.switchyard.core.persistence.JdbcSupport.setInstant;

/**
 * Stores the last computed {@link GitStats} per session. One row per session, replaced on save.
 */
public class JdbcGitStatsStore implements GitStatsStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcGitStatsStore.class);

    private static final String TABLE_NAME = "git_stats";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                session_id      TEXT PRIMARY KEY,
                files_changed   INTEGER NOT NULL,
                lines_added     INTEGER NOT NULL,
                lines_removed   INTEGER NOT NULL,
                has_uncommitted INTEGER NOT NULL,
                calculated_at   INTEGER NOT NULL
            )
            """.formatted(TABLE_NAME);

    private static final String UPSERT_SQL = """
            INSERT OR REPLACE INTO %s
                (session_id, files_changed, lines_added, lines_removed, has_uncommitted, calculated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_SQL = """
            SELECT * FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE session_id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcGitStatsStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Git stats table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public Optional<GitStats> find(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_SQL)) {
            stmt.setString(1, sessionId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new GitStats(
                        rs.getString("session_id"),
                        rs.getInt("files_changed"),
                        rs.getInt("lines_added"),
                        rs.getInt("lines_removed"),
                        rs.getInt("has_uncommitted") != 0,
                        getInstant(rs, "calculated_at")));
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to load git stats for " + sessionId, e);
        }
    }

    @Override
    public void save(GitStats stats) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPSERT_SQL)) {
            stmt.setString(1, stats.sessionId());
            stmt.setInt(2, stats.filesChanged());
            stmt.setInt(3, stats.linesAdded());
            stmt.setInt(4, stats.linesRemoved());
            stmt.setInt(5, stats.hasUncommitted() ? 1 : 0);
            setInstant(stmt, 6, stats.calculatedAt());
            stmt.executeUpdate();
            log.debug("Saved git stats for session {}", stats.sessionId());
        } catch (SQLException e) {
            throw new DatabaseException("failed to save git stats for " + stats.sessionId(), e);
        }
    }

    @Override
    public void delete(String sessionId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, sessionId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to delete git stats for " + sessionId, e);
        }
    }
}
