package io.verdict.server.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.verdict.core.exception.ConflictException;
import io.verdict.core.exception.StorageException;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ReviewSession;
import io.verdict.core.storage.SessionRepository;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.sql.DataSource;

/// PostgreSQL-backed session repository.
///
/// Each session record is one row of `verdict.review_sessions`. Items are stored as a
/// JSONB array in first-submission order; session-level fields are plain columns.
/// Archiving updates the row in place, so a session is never visible as both active and
/// archived.
///
/// ### Concurrency
/// - A partial unique index on `session_id WHERE archived_at IS NULL` enforces at most
///   one active record per session id. Losing an insert race yields {@link ConflictException}.
/// - {@link #update(ReviewSession, long)} is a compare-and-set on the `version` column
///   and only matches active rows.
///
/// ### Contracts
/// - **Precondition**: Flyway migration `V1__create_review_sessions` has run
/// - **Postcondition**: every write is a single statement; it applies fully or not at all
///
/// @implNote Thread-safe. Each call acquires its own JDBC connection via {@link JdbcSupport}.
///
/// @see io.verdict.core.storage.InMemorySessionRepository
public class JdbcSessionRepository implements SessionRepository {

    // --- SQL constants ---

    private static final String COLUMNS =
            "session_id, created_at, items, archived_at, merged_by, merge_reference,"
                    + " merge_summary, version";

    private static final String SQL_INSERT =
            """
            INSERT INTO verdict.review_sessions
                (session_id, created_at, items, archived_at, merged_by, merge_reference,
                 merge_summary, version)
            VALUES (?, ?, ?::jsonb, ?, ?, ?, ?, ?)
            """;

    private static final String SQL_FIND_ACTIVE =
            "SELECT "
                    + COLUMNS
                    + " FROM verdict.review_sessions"
                    + " WHERE session_id = ? AND archived_at IS NULL";

    /// Active record first, then the most recently archived one.
    private static final String SQL_FIND_LATEST =
            "SELECT "
                    + COLUMNS
                    + " FROM verdict.review_sessions WHERE session_id = ?"
                    + " ORDER BY archived_at DESC NULLS FIRST, id DESC LIMIT 1";

    private static final String SQL_FIND_ALL =
            "SELECT " + COLUMNS + " FROM verdict.review_sessions ORDER BY created_at, id";

    private static final String SQL_FIND_ALL_ACTIVE =
            "SELECT "
                    + COLUMNS
                    + " FROM verdict.review_sessions WHERE archived_at IS NULL"
                    + " ORDER BY created_at, id";

    private static final String SQL_FIND_CONTAINING =
            "SELECT "
                    + COLUMNS
                    + " FROM verdict.review_sessions WHERE items @> ?::jsonb"
                    + " ORDER BY created_at, id";

    private static final String SQL_FIND_ACTIVE_CONTAINING =
            "SELECT "
                    + COLUMNS
                    + " FROM verdict.review_sessions"
                    + " WHERE items @> ?::jsonb AND archived_at IS NULL"
                    + " ORDER BY created_at, id";

    private static final String SQL_UPDATE =
            """
            UPDATE verdict.review_sessions
            SET items = ?::jsonb,
                archived_at = ?,
                merged_by = ?,
                merge_reference = ?,
                merge_summary = ?,
                version = ?
            WHERE session_id = ? AND archived_at IS NULL AND version = ?
            """;

    private static final String SQL_FLAG =
            """
            UPDATE verdict.review_sessions
            SET inspection_note = ?, flagged_at = now()
            WHERE id = (
                SELECT id FROM verdict.review_sessions
                WHERE session_id = ?
                ORDER BY archived_at DESC NULLS FIRST, id DESC
                LIMIT 1)
            """;

    private static final String SQL_FIND_NOTE =
            """
            SELECT inspection_note FROM verdict.review_sessions
            WHERE session_id = ? AND inspection_note IS NOT NULL
            ORDER BY flagged_at DESC
            LIMIT 1
            """;

    // --- Fields ---

    private static final TypeReference<List<ItemReview>> ITEM_LIST = new TypeReference<>() {};

    private final JdbcSupport jdbc;
    private final ObjectMapper objectMapper;

    /// Creates a repository backed by the given data source.
    ///
    /// @param dataSource the JDBC connection pool, not null
    /// @param objectMapper mapper with the review model registered, not null
    public JdbcSessionRepository(DataSource dataSource, ObjectMapper objectMapper) {
        Objects.requireNonNull(dataSource, "dataSource must not be null");
        this.jdbc = new JdbcSupport(dataSource);
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void insert(ReviewSession session) {
        Objects.requireNonNull(session, "session must not be null");

        String items = writeItems(session);
        try {
            jdbc.update(
                    SQL_INSERT,
                    ps -> {
                        ps.setString(1, session.sessionId());
                        ps.setObject(2, toOffset(session.createdAt()));
                        ps.setString(3, items);
                        bindArchive(ps, 4, session);
                        ps.setLong(8, session.version());
                    },
                    "Failed to insert session: " + session.sessionId());
        } catch (StorageException e) {
            if (JdbcSupport.isUniqueViolation(e)) {
                throw new ConflictException(
                        "Session " + session.sessionId() + " already has an active review session");
            }
            throw e;
        }
    }

    @Override
    public Optional<ReviewSession> findActive(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return jdbc.queryOne(
                SQL_FIND_ACTIVE,
                ps -> ps.setString(1, sessionId),
                this::mapSession,
                "Failed to find active session: " + sessionId);
    }

    @Override
    public Optional<ReviewSession> findLatest(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return jdbc.queryOne(
                SQL_FIND_LATEST,
                ps -> ps.setString(1, sessionId),
                this::mapSession,
                "Failed to find session: " + sessionId);
    }

    @Override
    public List<ReviewSession> findAll(boolean includeArchived) {
        return jdbc.queryList(
                includeArchived ? SQL_FIND_ALL : SQL_FIND_ALL_ACTIVE,
                ps -> {},
                this::mapSession,
                "Failed to list sessions");
    }

    @Override
    public List<ReviewSession> findContainingItem(String itemId, boolean includeArchived) {
        Objects.requireNonNull(itemId, "itemId must not be null");

        String containment = writeJson(List.of(Map.of("itemId", itemId)));
        return jdbc.queryList(
                includeArchived ? SQL_FIND_CONTAINING : SQL_FIND_ACTIVE_CONTAINING,
                ps -> ps.setString(1, containment),
                this::mapSession,
                "Failed to find sessions containing item: " + itemId);
    }

    @Override
    public boolean update(ReviewSession updated, long expectedVersion) {
        Objects.requireNonNull(updated, "updated must not be null");

        String items = writeItems(updated);
        return jdbc.update(
                        SQL_UPDATE,
                        ps -> {
                            ps.setString(1, items);
                            bindArchive(ps, 2, updated);
                            ps.setLong(6, updated.version());
                            ps.setString(7, updated.sessionId());
                            ps.setLong(8, expectedVersion);
                        },
                        "Failed to update session: " + updated.sessionId())
                > 0;
    }

    @Override
    public void flagForInspection(String sessionId, String note) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(note, "note must not be null");

        jdbc.update(
                SQL_FLAG,
                ps -> {
                    ps.setString(1, note);
                    ps.setString(2, sessionId);
                },
                "Failed to flag session for inspection: " + sessionId);
    }

    /// Returns the most recent inspection note recorded for a session.
    ///
    /// @param sessionId session identifier, not null
    /// @return the note, or empty if the session was never flagged
    public Optional<String> inspectionNote(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        return jdbc.queryOne(
                SQL_FIND_NOTE,
                ps -> ps.setString(1, sessionId),
                rs -> rs.getString("inspection_note"),
                "Failed to read inspection note: " + sessionId);
    }

    // --- Internal helpers ---

    private static void bindArchive(PreparedStatement ps, int first, ReviewSession session)
            throws SQLException {
        ps.setObject(first, session.archivedAt() != null ? toOffset(session.archivedAt()) : null);
        ps.setString(first + 1, session.mergedBy());
        ps.setString(first + 2, session.mergeReference());
        ps.setString(first + 3, session.mergeSummary());
    }

    private ReviewSession mapSession(ResultSet rs) throws SQLException {
        String sessionId = rs.getString("session_id");
        return new ReviewSession(
                sessionId,
                toInstant(rs.getObject("created_at", OffsetDateTime.class)),
                readItems(sessionId, rs.getString("items")),
                toInstant(rs.getObject("archived_at", OffsetDateTime.class)),
                rs.getString("merged_by"),
                rs.getString("merge_reference"),
                rs.getString("merge_summary"),
                rs.getLong("version"));
    }

    private String writeItems(ReviewSession session) {
        return writeJson(List.copyOf(session.items().values()));
    }

    private Map<String, ItemReview> readItems(String sessionId, String json) {
        List<ItemReview> list;
        try {
            list = objectMapper.readValue(json, ITEM_LIST);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to read items of session " + sessionId, e);
        }
        Map<String, ItemReview> items = new LinkedHashMap<>();
        for (ItemReview item : list) {
            items.put(item.itemId(), item);
        }
        return items;
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialize to JSON", e);
        }
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value != null ? value.toInstant() : null;
    }
}
