package com.switchyard.core.persistence;

import com.switchyard.core.errors.DatabaseException;
import com.switchyard.core.errors.SessionAlreadyExistsException;
import com.switchyard.core.model.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.switchyard.core.persistence.JdbcSupport.*;

/**
 * JDBC-backed {@link SpecStore} over the {@code specs} table.
 */
public class JdbcSpecStore implements SpecStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSpecStore.class);

    private static final String TABLE_NAME = "specs";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id              TEXT PRIMARY KEY,
                name            TEXT NOT NULL,
                display_name    TEXT,
                epic_id         TEXT,
                repository_path TEXT NOT NULL,
                repository_name TEXT NOT NULL,
                content         TEXT NOT NULL DEFAULT '',
                created_at      INTEGER NOT NULL,
                updated_at      INTEGER NOT NULL,
                UNIQUE (repository_path, name)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, name, display_name, epic_id, repository_path, repository_name,
                            content, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_NAME_SQL = """
            SELECT * FROM %s WHERE repository_path = ? AND name = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT * FROM %s WHERE repository_path = ? ORDER BY created_at ASC, name ASC
            """.formatted(TABLE_NAME);

    private static final String UPDATE_CONTENT_SQL = """
            UPDATE %s SET content = ?, updated_at = ? WHERE id = ?
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

    public JdbcSpecStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Spec table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void insert(Spec spec) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, spec.id());
            stmt.setString(2, spec.name());
            stmt.setString(3, spec.displayName());
            stmt.setString(4, spec.epicId());
            stmt.setString(5, pathString(spec.repositoryPath()));
            stmt.setString(6, spec.repositoryName());
            stmt.setString(7, spec.content() == null ? "" : spec.content());
            setInstant(stmt, 8, spec.createdAt());
            setInstant(stmt, 9, spec.updatedAt());
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new SessionAlreadyExistsException(spec.name());
            }
            throw new DatabaseException("failed to insert spec '%s'".formatted(spec.name()), e);
        }
    }

    @Override
    public Optional<Spec> findByName(Path repositoryPath, String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_NAME_SQL)) {
            stmt.setString(1, repositoryPath.toString());
            stmt.setString(2, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to load spec '%s'".formatted(name), e);
        }
    }

    @Override
    public List<Spec> list(Path repositoryPath) {
        List<Spec> specs = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL)) {
            stmt.setString(1, repositoryPath.toString());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    specs.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to list specs", e);
        }
        return specs;
    }

    @Override
    public void updateContent(String id, String content, Instant updatedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_CONTENT_SQL)) {
            stmt.setString(1, content);
            setInstant(stmt, 2, updatedAt);
            stmt.setString(3, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to update spec content " + id, e);
        }
    }

    @Override
    public void setEpic(String id, String epicId, Instant updatedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SET_EPIC_SQL)) {
            stmt.setString(1, epicId);
            setInstant(stmt, 2, updatedAt);
            stmt.setString(3, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to assign epic to spec " + id, e);
        }
    }

    @Override
    public int clearEpic(String epicId, Instant updatedAt) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CLEAR_EPIC_SQL)) {
            setInstant(stmt, 1, updatedAt);
            stmt.setString(2, epicId);
            return stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to clear epic " + epicId + " from specs", e);
        }
    }

    @Override
    public void delete(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to delete spec " + id, e);
        }
    }

    private Spec fromResultSet(ResultSet rs) throws SQLException {
        return new Spec(
                rs.getString("id"),
                rs.getString("name"),
                rs.getString("display_name"),
                rs.getString("epic_id"),
                toPath(rs.getString("repository_path")),
                rs.getString("repository_name"),
                rs.getString("content"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"));
    }
}
