package com.warden.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.model.UpdateRecord;
import com.warden.core.model.UpdateState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * SQLite-backed {@link UpdateStore} over the {@code updates} table.
 * <p>
 * Pending uniqueness is enforced by a single {@code INSERT ... SELECT ... WHERE NOT EXISTS}
 * statement, which SQLite runs under its database write lock, with the partial
 * unique index {@code ux_updates_pending_identity} as a backstop.
 */
public class JdbcUpdateStore implements UpdateStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcUpdateStore.class);

    private static final String COLUMNS = "id, name, version, state, meta, created_at";

    private static final String INSERT_IF_NOT_PENDING_SQL = """
            INSERT INTO updates (name, version, state, meta, created_at)
            SELECT :name, :version, 'pending', :meta, :createdAt
            WHERE NOT EXISTS (
                SELECT 1 FROM updates
                WHERE name = :name AND version IS :version AND state = 'pending'
            )
            """;

    private static final String LAST_ROWID_SQL = "SELECT last_insert_rowid()";

    private static final String SELECT_BY_ID_SQL =
            "SELECT " + COLUMNS + " FROM updates WHERE id = :id";

    private static final String UPDATE_STATE_SQL = """
            UPDATE updates SET state = :state, meta = :meta WHERE id = :id
            """;

    private static final String CAS_STATE_SQL = """
            UPDATE updates SET state = :state, meta = :meta WHERE id = :id AND state = :expected
            """;

    private static final String SELECT_BY_STATE_SQL =
            "SELECT " + COLUMNS + " FROM updates WHERE state = :state ORDER BY id ASC";

    private static final String SELECT_RECENT_BY_STATE_SQL =
            "SELECT " + COLUMNS + " FROM updates WHERE state = :state ORDER BY id DESC LIMIT :limit";

    private static final String SELECT_RECENT_SQL =
            "SELECT " + COLUMNS + " FROM updates ORDER BY id DESC LIMIT :limit";

    private static final String SELECT_BY_IDENTITY_SQL =
            "SELECT " + COLUMNS + " FROM updates WHERE name = :name AND version IS :version ORDER BY id ASC";

    private static final String COUNT_BY_IDENTITY_SQL =
            "SELECT COUNT(*) FROM updates WHERE name = :name AND version IS :version";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumns json;
    private final Clock clock;

    public JdbcUpdateStore(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate,
                           ObjectMapper objectMapper, Clock clock) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
        this.json = new JsonColumns(objectMapper);
        this.clock = clock;
    }

    @Override
    public UpdateRecord create(String name, String version, Map<String, Object> meta) {
        Objects.requireNonNull(name, "name must not be null");
        Instant createdAt = clock.instant();
        try {
            return transactionTemplate.execute(status -> {
                int inserted = jdbc.update(INSERT_IF_NOT_PENDING_SQL, identityParams(name, version)
                        .addValue("meta", json.write(meta))
                        .addValue("createdAt", JsonColumns.writeInstant(createdAt)));
                if (inserted == 0) {
                    throw new UpdateConflictException(name, version);
                }
                Long id = jdbc.getJdbcTemplate().queryForObject(LAST_ROWID_SQL, Long.class);
                if (id == null) {
                    throw new StorageException("Update insert returned no row id");
                }
                log.debug("Created pending update #{} for {}", id, name);
                return new UpdateRecord(id, name, version, UpdateState.PENDING, meta, createdAt);
            });
        } catch (DataAccessException e) {
            if (isConstraintViolation(e)) {
                throw new UpdateConflictException(name, version);
            }
            throw new StorageException("Failed to create update record for " + name, e);
        } catch (TransactionException e) {
            throw new StorageException("Failed to create update record for " + name, e);
        }
    }

    @Override
    public Optional<UpdateRecord> find(long id) {
        try {
            return jdbc.query(SELECT_BY_ID_SQL, Map.of("id", id), this::mapRecord).stream().findFirst();
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read update " + id, e);
        }
    }

    @Override
    public UpdateRecord setState(long id, UpdateState newState, Map<String, Object> meta) {
        try {
            int updated = jdbc.update(UPDATE_STATE_SQL, new MapSqlParameterSource()
                    .addValue("id", id)
                    .addValue("state", newState.wireName())
                    .addValue("meta", json.write(meta)));
            if (updated == 0) {
                throw new UpdateNotFoundException(id);
            }
        } catch (DataAccessException e) {
            throw new StorageException("Failed to set state of update " + id, e);
        }
        return get(id);
    }

    @Override
    public boolean compareAndSetState(long id, UpdateState expected, UpdateState newState, Map<String, Object> meta) {
        try {
            int updated = jdbc.update(CAS_STATE_SQL, new MapSqlParameterSource()
                    .addValue("id", id)
                    .addValue("expected", expected.wireName())
                    .addValue("state", newState.wireName())
                    .addValue("meta", json.write(meta)));
            return updated == 1;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to transition update " + id, e);
        }
    }

    @Override
    public List<UpdateRecord> listByState(UpdateState state) {
        try {
            return jdbc.query(SELECT_BY_STATE_SQL, Map.of("state", state.wireName()), this::mapRecord);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list updates in state " + state.wireName(), e);
        }
    }

    @Override
    public List<UpdateRecord> listRecentByState(UpdateState state, int limit) {
        try {
            return jdbc.query(SELECT_RECENT_BY_STATE_SQL,
                    Map.of("state", state.wireName(), "limit", limit), this::mapRecord);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list updates in state " + state.wireName(), e);
        }
    }

    @Override
    public List<UpdateRecord> listAll(int limit) {
        try {
            return jdbc.query(SELECT_RECENT_SQL, Map.of("limit", limit), this::mapRecord);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list updates", e);
        }
    }

    @Override
    public List<UpdateRecord> listByIdentity(String name, String version) {
        try {
            return jdbc.query(SELECT_BY_IDENTITY_SQL, identityParams(name, version), this::mapRecord);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to list attempts for " + name, e);
        }
    }

    @Override
    public long countByIdentity(String name, String version) {
        try {
            Long count = jdbc.queryForObject(COUNT_BY_IDENTITY_SQL, identityParams(name, version), Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count attempts for " + name, e);
        }
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static MapSqlParameterSource identityParams(String name, String version) {
        return new MapSqlParameterSource()
                .addValue("name", name)
                .addValue("version", version, Types.VARCHAR);
    }

    static boolean isConstraintViolation(DataAccessException e) {
        if (e instanceof DataIntegrityViolationException) {
            return true;
        }
        return e.getMostSpecificCause() instanceof SQLiteException sqlite
                && (sqlite.getResultCode().code & 0xFF) == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
    }

    private UpdateRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        long id = rs.getLong("id");
        String state = rs.getString("state");
        if (state == null) {
            throw new StorageException("Update " + id + " has no state");
        }
        UpdateState parsed;
        try {
            parsed = UpdateState.fromWireName(state);
        } catch (IllegalArgumentException e) {
            throw new StorageException("Update " + id + " has unknown state '" + state + "'", e);
        }
        return new UpdateRecord(
                id,
                rs.getString("name"),
                rs.getString("version"),
                parsed,
                json.read(rs.getString("meta")),
                JsonColumns.readInstant(rs.getString("created_at")));
    }
}
