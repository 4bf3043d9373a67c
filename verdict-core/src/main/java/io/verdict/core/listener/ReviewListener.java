package io.verdict.core.listener;

import io.verdict.core.exception.VerdictException;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ReviewPass;
import io.verdict.core.review.ReviewSession;

/// Listener for review lifecycle events.
///
/// All methods have default no-op implementations, so listeners override only the events
/// they care about. Callbacks fire after the corresponding state change has been
/// persisted; a listener can never veto or alter an outcome.
///
/// @implNote Callbacks arrive from whichever thread performed the operation, so
/// implementations must be thread-safe.
///
/// @see CompositeReviewListener
public interface ReviewListener {

    /// Listener that ignores every event.
    ReviewListener NOOP = new ReviewListener() {};

    /// Called after a new, empty session was stored.
    ///
    /// @param session the created session, not null
    default void onSessionCreated(ReviewSession session) {}

    /// Called after a pass was appended and the item's status recomputed.
    ///
    /// @param sessionId owning session, not null
    /// @param item the item as stored, not null
    /// @param pass the accepted pass, with its store-assigned timestamp, not null
    default void onPassAccepted(String sessionId, ItemReview item, ReviewPass pass) {}

    /// Called after an item was escalated.
    ///
    /// @param sessionId owning session, not null
    /// @param item the escalated item, not null
    default void onEscalated(String sessionId, ItemReview item) {}

    /// Called after a human override resolved an escalation.
    ///
    /// @param sessionId owning session, not null
    /// @param item the item with its resolved escalation, not null
    default void onEscalationResolved(String sessionId, ItemReview item) {}

    /// Called after a session was merged and archived.
    ///
    /// @param archived the archived record, not null
    default void onSessionArchived(ReviewSession archived) {}

    /// Called when a merge attempt failed.
    ///
    /// @param sessionId the session that stays unarchived, not null
    /// @param failure why the merge failed, not null
    default void onMergeFailed(String sessionId, VerdictException failure) {}
}
