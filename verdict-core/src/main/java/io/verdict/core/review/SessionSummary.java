package io.verdict.core.review;

import java.util.ArrayList;
import java.util.List;

/// Counts of item statuses in one session.
///
/// Escalated items are listed in `escalatedItems` and are not counted as approved,
/// rejected or pending.
///
/// @param sessionId the summarised session, not null
/// @param totalItems number of items with at least one pass
/// @param approvedCount items whose status is `APPROVED`
/// @param rejectedCount items whose status is `REJECTED`
/// @param pendingCount items whose status is `PENDING`
/// @param escalatedItems ids of items waiting for a human decision, not null
/// @param archived whether the session has been merged
public record SessionSummary(
        String sessionId,
        int totalItems,
        int approvedCount,
        int rejectedCount,
        int pendingCount,
        List<String> escalatedItems,
        boolean archived) {

    public SessionSummary {
        escalatedItems = escalatedItems != null ? List.copyOf(escalatedItems) : List.of();
    }

    /// Summarises the current state of a session.
    ///
    /// @param session session to summarise, not null
    /// @return summary, never null
    public static SessionSummary of(ReviewSession session) {
        int approved = 0;
        int rejected = 0;
        int pending = 0;
        List<String> escalated = new ArrayList<>();
        for (ItemReview item : session.items().values()) {
            switch (item.status()) {
                case APPROVED -> approved++;
                case REJECTED -> rejected++;
                case PENDING -> pending++;
                case ESCALATION_PENDING -> escalated.add(item.itemId());
            }
        }
        return new SessionSummary(
                session.sessionId(),
                session.items().size(),
                approved,
                rejected,
                pending,
                escalated,
                session.archived());
    }
}
