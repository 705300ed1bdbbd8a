package com.warden.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.events.Event;
import com.warden.core.events.EventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * SQLite-backed {@link EventLog} over the {@code events} table.
 * <p>
 * Appends always run inside a transaction: they join the caller's ledger
 * transaction when one is active and otherwise open their own, so reading the
 * previous timestamp and inserting the new row happen under one write lock.
 */
public class JdbcEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventLog.class);

    private static final String INSERT_SQL = """
            INSERT INTO events (kind, payload, created_at)
            VALUES (:kind, :payload, :createdAt)
            """;

    private static final String LAST_ROWID_SQL = "SELECT last_insert_rowid()";

    private static final String LATEST_CREATED_AT_SQL = """
            SELECT created_at FROM events ORDER BY id DESC LIMIT 1
            """;

    private static final String SELECT_AFTER_SQL = """
            SELECT id, kind, payload, created_at
            FROM events
            WHERE id > :afterId
            ORDER BY id ASC
            LIMIT :limit
            """;

    private static final String SELECT_BY_UPDATE_SQL = """
            SELECT id, kind, payload, created_at
            FROM events
            WHERE json_extract(payload, '$.updateId') = :updateId
            ORDER BY id ASC
            """;

    private static final String COUNT_SQL = "SELECT COUNT(*) FROM events";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final JsonColumns json;
    private final Clock clock;
    private final int pageSize;

    public JdbcEventLog(NamedParameterJdbcTemplate jdbc, TransactionTemplate transactionTemplate,
                        ObjectMapper objectMapper, Clock clock, int pageSize) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc must not be null");
        this.transactionTemplate = Objects.requireNonNull(transactionTemplate, "transactionTemplate must not be null");
        this.json = new JsonColumns(objectMapper);
        this.clock = clock;
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be > 0");
        }
        this.pageSize = pageSize;
    }

    @Override
    public Event append(String kind, Map<String, Object> payload) {
        Objects.requireNonNull(kind, "kind must not be null");
        try {
            Event event = transactionTemplate.execute(status -> insert(kind, payload));
            log.debug("Appended event #{} {}", event.id(), kind);
            return event;
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException("Failed to append event '" + kind + "'", e);
        }
    }

    private Event insert(String kind, Map<String, Object> payload) {
        Instant createdAt = clock.instant();
        List<String> latest = jdbc.queryForList(LATEST_CREATED_AT_SQL, Map.of(), String.class);
        if (!latest.isEmpty()) {
            Instant previous = JsonColumns.readInstant(latest.get(0));
            if (previous != null && createdAt.isBefore(previous)) {
                createdAt = previous;
            }
        }

        jdbc.update(INSERT_SQL, new MapSqlParameterSource()
                .addValue("kind", kind)
                .addValue("payload", json.write(payload))
                .addValue("createdAt", JsonColumns.writeInstant(createdAt)));
        Long id = jdbc.getJdbcTemplate().queryForObject(LAST_ROWID_SQL, Long.class);
        if (id == null) {
            throw new StorageException("Event insert returned no row id");
        }
        return new Event(id, kind, payload, createdAt);
    }

    @Override
    public Stream<Event> readAll() {
        Iterator<Event> pages = new PagingIterator();
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(pages, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public List<Event> readAfter(long afterId, int limit) {
        try {
            return jdbc.query(SELECT_AFTER_SQL, new MapSqlParameterSource()
                    .addValue("afterId", afterId)
                    .addValue("limit", limit), this::mapEvent);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read events after #" + afterId, e);
        }
    }

    @Override
    public List<Event> readByReference(long updateId) {
        try {
            return jdbc.query(SELECT_BY_UPDATE_SQL, Map.of("updateId", updateId), this::mapEvent);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to read events for update " + updateId, e);
        }
    }

    @Override
    public long count() {
        try {
            Long count = jdbc.queryForObject(COUNT_SQL, Map.of(), Long.class);
            return count != null ? count : 0L;
        } catch (DataAccessException e) {
            throw new StorageException("Failed to count events", e);
        }
    }

    private Event mapEvent(ResultSet rs, int rowNum) throws SQLException {
        return new Event(
                rs.getLong("id"),
                rs.getString("kind"),
                json.read(rs.getString("payload")),
                JsonColumns.readInstant(rs.getString("created_at")));
    }

    /**
     * Walks the log in keyset pages so a full scan never holds a connection
     * or loads the whole table.
     */
    private final class PagingIterator implements Iterator<Event> {

        private long lastId = 0L;
        private Iterator<Event> page = List.<Event>of().iterator();
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (page.hasNext()) {
                return true;
            }
            if (exhausted) {
                return false;
            }
            List<Event> next = readAfter(lastId, pageSize);
            if (next.size() < pageSize) {
                exhausted = true;
            }
            if (next.isEmpty()) {
                return false;
            }
            lastId = next.get(next.size() - 1).id();
            page = next.iterator();
            return true;
        }

        @Override
        public Event next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return page.next();
        }
    }
}
