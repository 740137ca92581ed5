package com.switchyard.core.persistence;

import com.switchyard.core.errors.DatabaseException;
import com.switchyard.core.errors.InvalidInputException;
import com.switchyard.core.model.Epic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static com.switchyard.core.persistence.JdbcSupport.*;

public class JdbcEpicStore implements EpicStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEpicStore.class);

    private static final String TABLE_NAME = "epics";

    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id              TEXT PRIMARY KEY,
                repository_path TEXT NOT NULL,
                name            TEXT NOT NULL,
                color           TEXT,
                created_at      INTEGER NOT NULL,
                updated_at      INTEGER NOT NULL,
                UNIQUE (repository_path, name)
            )
            """.formatted(TABLE_NAME);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, repository_path, name, color, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(TABLE_NAME);

    private static final String UPDATE_SQL = """
            UPDATE %s SET name = ?, color = ?, updated_at = ? WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_ID_SQL = """
            SELECT * FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_BY_NAME_SQL = """
            SELECT * FROM %s WHERE repository_path = ? AND name = ?
            """.formatted(TABLE_NAME);

    private static final String SELECT_ALL_SQL = """
            SELECT * FROM %s WHERE repository_path = ? ORDER BY name COLLATE NOCASE ASC
            """.formatted(TABLE_NAME);

    private static final String DELETE_SQL = """
            DELETE FROM %s WHERE id = ?
            """.formatted(TABLE_NAME);

    private final DataSource dataSource;

    public JdbcEpicStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
    }

    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(CREATE_TABLE_SQL)) {
            stmt.execute();
            log.info("Epic table '{}' ensured", TABLE_NAME);
        }
    }

    @Override
    public void insert(Epic epic) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            stmt.setString(1, epic.id());
            stmt.setString(2, pathString(epic.repositoryPath()));
            stmt.setString(3, epic.name());
            stmt.setString(4, epic.color());
            setInstant(stmt, 5, epic.createdAt());
            setInstant(stmt, 6, epic.updatedAt());
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new InvalidInputException("name", "epic '%s' already exists".formatted(epic.name()));
            }
            throw new DatabaseException("failed to insert epic '%s'".formatted(epic.name()), e);
        }
    }

    @Override
    public void update(Epic epic) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(UPDATE_SQL)) {
            stmt.setString(1, epic.name());
            stmt.setString(2, epic.color());
            setInstant(stmt, 3, epic.updatedAt());
            stmt.setString(4, epic.id());
            stmt.executeUpdate();
        } catch (SQLException e) {
            if (isConstraintViolation(e)) {
                throw new InvalidInputException("name", "epic '%s' already exists".formatted(epic.name()));
            }
            throw new DatabaseException("failed to update epic '%s'".formatted(epic.name()), e);
        }
    }

    @Override
    public Optional<Epic> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to load epic " + id, e);
        }
    }

    @Override
    public Optional<Epic> findByName(Path repositoryPath, String name) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_NAME_SQL)) {
            stmt.setString(1, repositoryPath.toString());
            stmt.setString(2, name);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to load epic '%s'".formatted(name), e);
        }
    }

    @Override
    public List<Epic> list(Path repositoryPath) {
        List<Epic> epics = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL)) {
            stmt.setString(1, repositoryPath.toString());
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    epics.add(fromResultSet(rs));
                }
            }
        } catch (SQLException e) {
            throw new DatabaseException("failed to list epics", e);
        }
        return epics;
    }

    @Override
    public void delete(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DELETE_SQL)) {
            stmt.setString(1, id);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw new DatabaseException("failed to delete epic " + id, e);
        }
    }

    private Epic fromResultSet(ResultSet rs) throws SQLException {
        return new Epic(
                rs.getString("id"),
                toPath(rs.getString("repository_path")),
                rs.getString("name"),
                rs.getString("color"),
                getInstant(rs, "created_at"),
                getInstant(rs, "updated_at"));
    }
}
