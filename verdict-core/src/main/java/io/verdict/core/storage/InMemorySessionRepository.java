package io.verdict.core.storage;

import io.verdict.core.exception.ConflictException;
import io.verdict.core.review.ReviewSession;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/// In-memory session repository (default implementation).
///
/// Thread-safe, no external dependencies. Records are held under a surrogate key so that
/// archiving replaces a record in place: a reader sees either the active or the archived
/// version of a session, never both and never neither.
///
/// ### Storage Structure
/// - `records`: surrogate key -> session record
/// - `active`: session id -> surrogate key of its unarchived record
public final class InMemorySessionRepository implements SessionRepository {

    private final Map<Long, ReviewSession> records = new ConcurrentHashMap<>();
    private final Map<String, Long> active = new ConcurrentHashMap<>();
    private final Map<String, String> inspectionNotes = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public void insert(ReviewSession session) {
        Objects.requireNonNull(session, "session must not be null");

        long key = sequence.incrementAndGet();
        if (active.putIfAbsent(session.sessionId(), key) != null) {
            throw new ConflictException(
                    "Session " + session.sessionId() + " already has an active review session");
        }
        records.put(key, session);
    }

    @Override
    public Optional<ReviewSession> findActive(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");

        Long key = active.get(sessionId);
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(key)).filter(s -> !s.archived());
    }

    @Override
    public Optional<ReviewSession> findLatest(String sessionId) {
        Optional<ReviewSession> current = findActive(sessionId);
        if (current.isPresent()) {
            return current;
        }
        return ordered(records.entrySet().stream())
                .filter(s -> s.sessionId().equals(sessionId))
                .max(Comparator.comparing(ReviewSession::archivedAt));
    }

    @Override
    public List<ReviewSession> findAll(boolean includeArchived) {
        return ordered(records.entrySet().stream())
                .filter(s -> includeArchived || !s.archived())
                .toList();
    }

    @Override
    public List<ReviewSession> findContainingItem(String itemId, boolean includeArchived) {
        Objects.requireNonNull(itemId, "itemId must not be null");

        return ordered(records.entrySet().stream())
                .filter(s -> includeArchived || !s.archived())
                .filter(s -> s.items().containsKey(itemId))
                .toList();
    }

    @Override
    public boolean update(ReviewSession updated, long expectedVersion) {
        Objects.requireNonNull(updated, "updated must not be null");

        Long key = active.get(updated.sessionId());
        if (key == null) {
            return false;
        }
        AtomicBoolean written = new AtomicBoolean();
        records.computeIfPresent(
                key,
                (k, current) -> {
                    if (current.archived() || current.version() != expectedVersion) {
                        return current;
                    }
                    written.set(true);
                    return updated;
                });
        if (written.get() && updated.archived()) {
            active.remove(updated.sessionId(), key);
        }
        return written.get();
    }

    @Override
    public void flagForInspection(String sessionId, String note) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(note, "note must not be null");
        inspectionNotes.put(sessionId, note);
    }

    /// Returns the inspection note recorded for a session (useful for testing).
    public Optional<String> inspectionNote(String sessionId) {
        return Optional.ofNullable(inspectionNotes.get(sessionId));
    }

    /// Stores a record as-is, bypassing all checks (useful for testing recovery paths).
    public void putRaw(ReviewSession session) {
        long key = sequence.incrementAndGet();
        records.put(key, session);
        if (!session.archived()) {
            active.put(session.sessionId(), key);
        }
    }

    /// Clears all data (useful for testing).
    public void clear() {
        records.clear();
        active.clear();
        inspectionNotes.clear();
    }

    private static Stream<ReviewSession> ordered(Stream<Map.Entry<Long, ReviewSession>> entries) {
        return entries.sorted(
                        Comparator.comparing(
                                        (Map.Entry<Long, ReviewSession> e) ->
                                                e.getValue().createdAt())
                                .thenComparing(Map.Entry::getKey))
                .map(Map.Entry::getValue);
    }
}
