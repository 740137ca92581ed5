package com.switchyard.core.persistence;

import com.switchyard.core.errors.DatabaseException;
import com.switchyard.core.errors.SessionAlreadyExistsException;
import com.switchyard.core.model.Session;
import com.switchyard.core.model.SessionState;
import com.switchyard.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.switchyard.core.persistence.JdbcSupport.*;

/**
 * JDBC-backed {@link SessionStore} over the {@code sessions} table.
 * <p>
 * The table is created by {@link #createTables()}; uniqueness of
 * {@code (repository_path, name)} is enforced by the schema, which makes the
 * row insert the final arbiter when two creations race past the name reservation.
 */
public class JdbcSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

    private static final String TABLE_NAME = "sessions";

    private static final String COLUMNS = """
            id, name, display_name, version_group_id, version_number, repository_path,
            repository_name, branch, parent_branch, original_parent_branch, worktree_path,
            status, session_state, created_at, updated_at, last_activity, initial_prompt,
            spec_content, ready_to_merge, resume_allowed, pending_name_generation,
            was_auto_generated, original_agent_type, original_skip_permissions, epic_id
            """;

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id                        TEXT PRIMARY KEY,
                name                      TEXT NOT NULL,
                display_name              TEXT,
                version_group_id          TEXT,
                version_number            INTEGER,
                repository_path           TEXT NOT NULL,
                repository_name           TEXT NOT NULL,
                branch                    TEXT NOT NULL,
                parent_branch             TEXT NOT NULL,
                original_parent_branch    TEXT,
                worktree_path             TEXT NOT NULL,
                status                    TEXT NOT NULL,
                session_state             TEXT NOT NULL DEFAULT 'running',
                created_at                INTEGER NOT NULL,
                updated_at                INTEGER NOT NULL,
                last_activity             INTEGER,
                initial_prompt            TEXT,
                spec_content              TEXT,
                ready_to_merge            INTEGER NOT NULL DEFAULT 0,
                resume_allowed            INTEGER NOT NULL DEFAULT 1,
                pending_name_generation   INTEGER NOT NULL DEFAULT 0,
                was_auto_generated        INTEGER NOT NULL DEFAULT 0,
                original_agent_type       TEXT,
                original_skip_permissions INTEGER,
                epic_id                   TEXT,
                UNIQUE (repository_path, name)
            )
            """.formatted(TABLE_NAME);

    private static final String CREATE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_sessions_repo_status ON %s (repository_path, status)
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME, COLUMNS);

    private static final String UPDATE_SQL = """
            UPDATE %s SET display_name = ?, version_group_id = ?, version_number = ?,
                branch = ?, parent_branch = ?, worktree_path = ?, status = ?, session_state = ?,
                updated_at = ?, last_activity = ?, initial_prompt = ?, spec_content = ?,
                ready_to_merge = ?, resume_allowed = ?, pending_name_generation = ?,
                was_auto_generated = ?, original_agent_type = ?, original_skip_permissions = ?,
                epic_id = ?
            WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_NAME_SQL = """
            SELECT %s FROM %s WHERE repository_path = ? AND name = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM %s WHERE id = ?
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM %s WHERE repository_path = ? ORDER BY created_at ASC, name ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String SELECT_ACTIVE_SQL = """
            SELECT %s FROM %s WHERE repository_path = ? AND status != 'cancelled'
            ORDER BY created_at ASC, name ASC
            """.formatted(COLUMNS, TABLE_NAME);

    private static final String UPDATE_STATE_SQL = """
            UPDATE %s SET session_state = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_STATUS_SQL = """
            UPDATE %s SET status = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_ACTIVITY_SQL = """
            UPDATE %s SET last_activity = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String UPDATE_PARENT_SQL = """
            UPDATE %s SET parent_branch = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SET_EPIC_SQL = """
            UPDATE %s SET epic_id = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String CLEAR_EPIC_SQL = """
            UPDATE %s SET epic_id = NULL, updated_at = ? WHERE epic_id = ?
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcSessionStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    /**
     * Creates the sessions table and its index if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE_SQL);
            stmt.execute(CREATE_INDEX_SQL);
            log.info("Session table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void insert(Session session) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, session.id());
            stmt.setString(2, session.name());
            stmt.setString(3, session.displayName());
            stmt.setString(4, session.versionGroupId());
            setInteger(stmt, 5, session.versionNumber());
            stmt.setString(6, pathString(session.repositoryPath()));
            stmt.setString(7, session.repositoryName());
            stmt.setString(8, session.branch());
            stmt.setString(9, session.parentBranch());
            stmt.setString(10, session.originalParentBranch());
            stmt.setString(11, pathString(session.worktreePath()));
            stmt.setString(12, session.status().dbValue());
            stmt.setString(13, session.sessionState().dbValue());
            setInstant(stmt, 14, session.createdAt());
            setInstant(stmt, 15, session.updatedAt());
            setInstant(stmt, 16, session.lastActivity());
            stmt.setString(17, session.initialPrompt());
            stmt.setString(18, session.specContent());
            stmt.setInt(19, session.readyToMerge() ? 1 : 0);
            stmt.setInt(20, session.resumeAllowed() ? 1 : 0);
            stmt.setInt(21, session.pendingNameGeneration() ? 1 : 0);
            stmt.setInt(22, session.wasAutoGenerated() ? 1 : 0);
            stmt.setString(23, session.originalAgentType());
            setNullableBoolean(stmt, 24, session.originalSkipPermissions());
            stmt.setString(25, session.epicId());
            stmt.executeUpdate();
            log.debug("Inserted session '{}' ({})", session.name(), session.id());
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new SessionAlreadyExistsException(session.name());
            }
            throw new DatabaseException("failed to insert session '%s'".formatted(session.name()), e);
        }
    }

    @Override
    public void update(Session session) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, session.displayName());
            stmt.setString(2, session.versionGroupId());
            setInteger(stmt, 3, session.versionNumber());
            stmt.setString(4, session.branch());
            stmt.setString(5, session.parentBranch());
            stmt.setString(6, pathString(session.worktreePath()));
            stmt.setString(7, session.status().dbValue());
            stmt.setString(8, session.sessionState().dbValue());
            setInstant(stmt, 9, session.updatedAt());
            setInstant(stmt, 10, session.lastActivity());
            stmt.setString(11, session.initialPrompt());
            stmt.setString(12, session.specContent());
            stmt.setInt(13, session.readyToMerge() ? 1 : 0);
            stmt.setInt(14, session.resumeAllowed() ? 1 : 0);
            stmt.setInt(15, session.pendingNameGeneration() ? 1 : 0);
            stmt.setInt(16, session.wasAutoGenerated() ? 1 : 0);
            stmt.setString(17, session.originalAgentType());
            setNullableBoolean(stmt, 18, session.originalSkipPermissions());
            stmt.setString(19, session.epicId());
            stmt.setString(20, session.id());
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to update session '%s'".formatted(session.name()), e);
        }
    }

    @Override
    public Optional<Session> findByName(Path repositoryPath, String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_NAME_SQL)) {
            stmt.setString(1, repositoryPath.toString());
            stmt.setString(2, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to load session '%s'".formatted(name), e);
        }
    }

    @Override
    public Optional<Session> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to load session id '%s'".formatted(id), e);
        }
    }

    @Override
    public List<Session> list(Path repositoryPath, boolean includeCancelled) {
        List<Session> sessions = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(includeCancelled ? SELECT_ALL_SQL : SELECT_ACTIVE_SQL)) {
            stmt.setString(1, repositoryPath.toString());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    sessions.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to list sessions", e);
        }
        return sessions;
    }

    @Override
    public void updateSessionState(String id, SessionState state, Instant updatedAt) {
        executeUpdate(UPDATE_STATE_SQL, "update state of session " + id,
                state.dbValue(), updatedAt.toEpochMilli(), id);
    }

    @Override
    public void updateStatus(String id, SessionStatus status, Instant updatedAt) {
        executeUpdate(UPDATE_STATUS_SQL, "update status of session " + id,
                status.dbValue(), updatedAt.toEpochMilli(), id);
    }

    @Override
    public void updateLastActivity(String id, Instant lastActivity) {
        executeUpdate(UPDATE_ACTIVITY_SQL, "stamp activity of session " + id,
                lastActivity.toEpochMilli(), id);
    }

    @Override
    public void updateParentBranch(String id, String parentBranch, Instant updatedAt) {
        executeUpdate(UPDATE_PARENT_SQL, "update parent branch of session " + id,
                parentBranch, updatedAt.toEpochMilli(), id);
    }

    @Override
    public void setEpic(String id, String epicId, Instant updatedAt) {
        executeUpdate(SET_EPIC_SQL, "assign epic to session " + id,
                epicId, updatedAt.toEpochMilli(), id);
    }

    @Override
    public int clearEpic(String epicId, Instant updatedAt) {
        return executeUpdate(CLEAR_EPIC_SQL, "clear epic " + epicId + " from sessions",
                updatedAt.toEpochMilli(), epicId);
    }

    @Override
    public void delete(String id) {
        executeUpdate(DELETE_SQL, "delete session " + id, id);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int executeUpdate(String sql, String description, Object... params) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                stmt.setObject(i + 1, params[i]);
            }
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to " + description, e);
        }
    }

    private Session fromResultSet(ResultSet rs) throws SQLException {
        return Session.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .displayName(rs.getString("display_name"))
                .versionGroupId(rs.getString("version_group_id"))
                .versionNumber(getInteger(rs, "version_number"))
                .repositoryPath(toPath(rs.getString("repository_path")))
                .repositoryName(rs.getString("repository_name"))
                .branch(rs.getString("branch"))
                .parentBranch(rs.getString("parent_branch"))
                .originalParentBranch(rs.getString("original_parent_branch"))
                .worktreePath(toPath(rs.getString("worktree_path")))
                .status(SessionStatus.fromDbValue(rs.getString("status")))
                .sessionState(SessionState.fromDbValue(rs.getString("session_state")))
                .createdAt(getInstant(rs, "created_at"))
                .updatedAt(getInstant(rs, "updated_at"))
                .lastActivity(getInstant(rs, "last_activity"))
                .initialPrompt(rs.getString("initial_prompt"))
                .specContent(rs.getString("spec_content"))
                .readyToMerge(rs.getInt("ready_to_merge") != 0)
                .resumeAllowed(rs.getInt("resume_allowed") != 0)
                .pendingNameGeneration(rs.getInt("pending_name_generation") != 0)
                .wasAutoGenerated(rs.getInt("was_auto_generated") != 0)
                .originalAgentType(rs.getString("original_agent_type"))
                .originalSkipPermissions(getNullableBoolean(rs, "original_skip_permissions"))
                .epicId(rs.getString("epic_id"))
                .build();
    }
}
