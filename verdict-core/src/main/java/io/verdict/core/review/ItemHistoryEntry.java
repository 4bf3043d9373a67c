package io.verdict.core.review;

import java.time.Instant;

/// One session's review of an item, as returned by cross-session history queries.
///
/// The contained `ItemReview` is a copy; it is not shared with the session it came from.
///
/// @param sessionId session the review belongs to, not null
/// @param sessionCreatedAt creation time of that session, not null
/// @param archivedAt merge time, null if the session is still active
/// @param mergedBy approver of the merge, null if still active
/// @param mergeReference external commit reference of the merge, null if still active
/// @param item the item's review in that session, not null
public record ItemHistoryEntry(
        String sessionId,
        Instant sessionCreatedAt,
        Instant archivedAt,
        String mergedBy,
        String mergeReference,
        ItemReview item) {

    /// Builds a history entry for an item of the given session.
    ///
    /// @param session the containing session, not null
    /// @param item the item's review in that session, not null
    /// @return the entry, never null
    public static ItemHistoryEntry of(ReviewSession session, ItemReview item) {
        return new ItemHistoryEntry(
                session.sessionId(),
                session.createdAt(),
                session.archivedAt(),
                session.mergedBy(),
                session.mergeReference(),
                item);
    }
}
