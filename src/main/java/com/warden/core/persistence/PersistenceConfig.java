package com.warden.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.JdbcTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Wires the SQLite ledger: data source, transaction manager, schema, the
 * {@link JdbcEventLog} and {@link JdbcUpdateStore}, and the {@link Ledger}
 * handle that the state machine and recovery receive.
 * <p>
 * Connections start transactions with {@code BEGIN IMMEDIATE} so concurrent
 * writers queue on the busy timeout instead of failing on lock upgrade.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DataSource dataSource(StorageProperties properties) throws IOException, SQLException {
        DataSource dataSource = sqliteDataSource(Path.of(properties.getSqlitePath()), properties.getBusyTimeoutMs());
        LedgerSchema.createTables(dataSource);
        return dataSource;
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new JdbcTransactionManager(dataSource);
    }

    @Bean
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        return new TransactionTemplate(transactionManager);
    }

    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource) {
        return new NamedParameterJdbcTemplate(dataSource);
    }

    @Bean
    public JdbcEventLog eventLog(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate,
                                 ObjectMapper objectMapper, Clock clock, StorageProperties properties) {
        return new JdbcEventLog(jdbc, transactionTemplate, objectMapper, clock, properties.getPageSize());
    }

    @Bean
    public JdbcUpdateStore updateStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate,
                                       ObjectMapper objectMapper, Clock clock) {
        return new JdbcUpdateStore(jdbc, transactionTemplate, objectMapper, clock);
    }

    @Bean
    public Ledger ledger(JdbcEventLog eventLog, JdbcUpdateStore updateStore, TransactionTemplate transactionTemplate) {
        return new Ledger(eventLog, updateStore, transactionTemplate);
    }

    /**
     * Builds a file-backed SQLite data source, creating the parent directory
     * when needed.
     */
    public static DataSource sqliteDataSource(Path databaseFile, int busyTimeoutMs) throws IOException {
        Path parent = databaseFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.FULL);
        config.setBusyTimeout(busyTimeoutMs);
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);

        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        log.info("Using SQLite ledger at {}", databaseFile.toAbsolutePath());
        return dataSource;
    }
}
