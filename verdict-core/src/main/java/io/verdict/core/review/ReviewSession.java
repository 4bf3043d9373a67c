package io.verdict.core.review;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Review state of one isolated workspace.
///
/// A session is created empty when its workspace is created, accumulates item reviews
/// while the workspace is in use, and is archived exactly once when the workspace is
/// merged. Archived sessions are never deleted; they are the permanent audit record of
/// the merge.
///
/// ### Contracts
/// - **Invariant**: `items` keys equal the contained `ItemReview.itemId` values
/// - **Invariant**: `archivedAt`, `mergedBy` and `mergeReference` are either all null or
///   all set
/// - **Invariant**: `version` increases by one on every successful write
///
/// @param sessionId identifier of the external workspace, not null
/// @param createdAt creation time, not null
/// @param items item reviews keyed by item id, in first-submission order, not null
/// @param archivedAt merge time, null while active
/// @param mergedBy approver that merged the session, null while active
/// @param mergeReference opaque commit reference of the merge, null while active
/// @param mergeSummary free-text summary given by the approver, may be null
/// @param version optimistic-concurrency counter, starts at 0
public record ReviewSession(
        String sessionId,
        Instant createdAt,
        Map<String, ItemReview> items,
        Instant archivedAt,
        String mergedBy,
        String mergeReference,
        String mergeSummary,
        long version) {

    public ReviewSession {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        items =
                items != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(items))
                        : Map.of();
    }

    /// Creates an empty, active session.
    ///
    /// @param sessionId workspace identifier, not null
    /// @param createdAt creation time, not null
    /// @return new session at version 0, never null
    public static ReviewSession create(String sessionId, Instant createdAt) {
        return new ReviewSession(sessionId, createdAt, Map.of(), null, null, null, null, 0L);
    }

    public boolean archived() {
        return archivedAt != null;
    }

    public Optional<ItemReview> item(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    /// Returns a copy with the item inserted or replaced, at the next version.
    ///
    /// @param item the item review to store, not null
    /// @return new session, never null
    public ReviewSession withItem(ItemReview item) {
        Map<String, ItemReview> updated = new LinkedHashMap<>(items);
        updated.put(item.itemId(), item);
        return new ReviewSession(
                sessionId,
                createdAt,
                updated,
                archivedAt,
                mergedBy,
                mergeReference,
                mergeSummary,
                version + 1);
    }

    /// Returns the archived copy of this session, at the next version.
    ///
    /// @param mergedAt merge time, not null
    /// @param approverId approver id, not null
    /// @param reference external commit reference, not null
    /// @param summary approver's summary, may be null
    /// @return archived session, never null
    public ReviewSession archive(
            Instant mergedAt, String approverId, String reference, String summary) {
        return new ReviewSession(
                sessionId,
                createdAt,
                items,
                Objects.requireNonNull(mergedAt, "mergedAt must not be null"),
                Objects.requireNonNull(approverId, "approverId must not be null"),
                Objects.requireNonNull(reference, "reference must not be null"),
                summary,
                version + 1);
    }
}
