package com.warden.core.persistence;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Storage settings, bound from {@code warden.storage.*}.
 *
 * <pre>
 * warden:
 *   storage:
 *     sqlite-path: ./data/db.sqlite
 *     busy-timeout-ms: 5000
 *     page-size: 500
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "warden.storage")
public class StorageProperties {

    /** SQLite database file; parent directories are created on startup. */
    private String sqlitePath = "./data/db.sqlite";

    /** How long a writer waits for the database lock before failing. */
    private int busyTimeoutMs = 5000;

    /** Rows fetched per page when streaming the whole event log. */
    private int pageSize = 500;

    @PostConstruct
    void validate() {
        if (sqlitePath == null || sqlitePath.isBlank()) {
            throw new IllegalStateException("warden.storage.sqlite-path must not be empty");
        }
        if (busyTimeoutMs < 0) {
            throw new IllegalStateException("warden.storage.busy-timeout-ms must be >= 0");
        }
        if (pageSize <= 0) {
            throw new IllegalStateException("warden.storage.page-size must be > 0");
        }
    }

    public String getSqlitePath() { return sqlitePath; }
    public void setSqlitePath(String sqlitePath) { this.sqlitePath = sqlitePath; }
    public int getBusyTimeoutMs() { return busyTimeoutMs; }
    public void setBusyTimeoutMs(int busyTimeoutMs) { this.busyTimeoutMs = busyTimeoutMs; }
    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }
}
