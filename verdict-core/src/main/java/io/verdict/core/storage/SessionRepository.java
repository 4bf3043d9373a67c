package io.verdict.core.storage;

import io.verdict.core.review.ReviewSession;
import java.util.List;
import java.util.Optional;

/// Durable storage for review session records.
///
/// One record per session. At most one record per `sessionId` is active (unarchived);
/// archived records are kept forever and may share a `sessionId` with an older or newer
/// record, since a workspace id can be reused once its session has been merged.
///
/// ### Contracts
/// - **Atomicity**: `insert` and `update` either apply the whole record or nothing
/// - **Isolation**: reads never return a partially written record
/// - **Concurrency**: `update` is a compare-and-set on `ReviewSession.version`
///
/// Implementations signal infrastructure failures with
/// {@link io.verdict.core.exception.StorageException}.
///
/// @see InMemorySessionRepository
/// @see SessionStore
public interface SessionRepository {

    /// Stores a new active session.
    ///
    /// @param session new session, unarchived, not null
    /// @throws io.verdict.core.exception.ConflictException if an active session with the
    ///     same id exists
    void insert(ReviewSession session);

    /// Finds the active record for a session id.
    ///
    /// @param sessionId session id, not null
    /// @return the unarchived record, or empty
    Optional<ReviewSession> findActive(String sessionId);

    /// Finds the active record, falling back to the most recently archived one.
    ///
    /// @param sessionId session id, not null
    /// @return the record, or empty if the id was never used
    Optional<ReviewSession> findLatest(String sessionId);

    /// Lists records ordered by creation time, oldest first.
    ///
    /// @param includeArchived whether archived records are included
    /// @return matching records, never null
    List<ReviewSession> findAll(boolean includeArchived);

    /// Lists records that contain the given item, ordered by creation time, oldest first.
    ///
    /// @param itemId item id, not null
    /// @param includeArchived whether archived records are included
    /// @return matching records, never null
    List<ReviewSession> findContainingItem(String itemId, boolean includeArchived);

    /// Replaces the active record if its stored version still equals `expectedVersion`.
    ///
    /// Passing an archived session archives the record in the same write.
    ///
    /// @param updated new content, with `version == expectedVersion + 1`, not null
    /// @param expectedVersion version the caller read
    /// @return true if written, false if the record changed or is no longer active
    boolean update(ReviewSession updated, long expectedVersion);

    /// Marks the active record for operator inspection.
    ///
    /// @param sessionId session id, not null
    /// @param note what was found wrong, not null
    void flagForInspection(String sessionId, String note);
}
