package com.switchyard.core.persistence;

import com.switchyard.config.SwitchyardProperties;
import com.switchyard.core.errors.IoOperationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} for the SQLite database and the stores on top of it.
 * <p>
 * Each store bean creates its table on startup, so a fresh database file is usable
 * immediately.
 */
@Configuration
public class DatabaseConfig {

    private static final Logger log = LoggerFactory.getLogger(DatabaseConfig.class);

    private static final int BUSY_TIMEOUT_MILLIS = 5000;

    @Bean
    public DataSource dataSource(SwitchyardProperties properties) {
        Path dbPath = Path.of(properties.getDatabasePath()).toAbsolutePath();
        try {
            Files.createDirectories(dbPath.getParent());
        } catch (IOException e) {
            throw new IoOperationException("create_database_directory", dbPath.getParent(), e);
        }
        log.info("Using SQLite database at {}", dbPath);
        return sqliteDataSource(dbPath);
    }

    @Bean
    public SessionStore sessionStore(DataSource dataSource) throws Exception {
        var store = new JdbcSessionStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    public SpecStore specStore(DataSource dataSource) throws Exception {
        var store = new JdbcSpecStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    public EpicStore epicStore(DataSource dataSource) throws Exception {
        var store = new JdbcEpicStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    public GitStatsStore gitStatsStore(DataSource dataSource) throws Exception {
        var store = new JdbcGitStatsStore(dataSource);
        store.createTables();
        return store;
    }

    /**
     * Builds a WAL-mode SQLite data source with a busy timeout, so concurrent writers
     * wait instead of failing with SQLITE_BUSY.
     */
    public static DataSource sqliteDataSource(Path dbPath) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        config.enforceForeignKeys(true);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }
}
