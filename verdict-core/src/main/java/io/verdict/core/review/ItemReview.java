package io.verdict.core.review;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// All passes recorded for one content item within one session.
///
/// `passes` is kept in acceptance order and is never reordered. `status` is the value
/// the consensus evaluator derived when the item was last written; the session store
/// re-derives it on every write and rejects records where the two disagree in a way no
/// policy can explain.
///
/// @param itemId stable cross-session identifier `<contentType>:<contentId>`, not null
/// @param itemTitle display title, not null
/// @param itemType workflow policy key, not null
/// @param sourcePath source file within the workspace, may be null
/// @param remoteId identifier in the remote content system, may be null
/// @param passes every accepted pass, oldest first, not null
/// @param status derived aggregate status, not null
/// @param escalation escalation record, null if the item was never escalated
///
/// @see io.verdict.core.consensus.ConsensusEvaluator
public record ItemReview(
        String itemId,
        String itemTitle,
        String itemType,
        String sourcePath,
        String remoteId,
        List<ReviewPass> passes,
        ItemStatus status,
        Escalation escalation) {

    public ItemReview {
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(itemTitle, "itemTitle must not be null");
        Objects.requireNonNull(itemType, "itemType must not be null");
        Objects.requireNonNull(status, "status must not be null");
        passes = passes != null ? List.copyOf(passes) : List.of();
    }

    /// Creates an item with no passes yet.
    ///
    /// @param itemId item identifier, not null
    /// @param metadata title and type from the first submission, not null
    /// @return new pending item, never null
    public static ItemReview open(String itemId, ItemMetadata metadata) {
        return new ItemReview(
                itemId,
                metadata.title(),
                metadata.itemType(),
                metadata.sourcePath(),
                metadata.remoteId(),
                List.of(),
                ItemStatus.PENDING,
                null);
    }

    /// Returns a copy with the pass appended.
    ///
    /// The status is carried over unchanged; callers recompute it afterwards.
    ///
    /// @param pass accepted pass, not null
    /// @return new item, never null
    public ItemReview withPass(ReviewPass pass) {
        List<ReviewPass> appended = new ArrayList<>(passes.size() + 1);
        appended.addAll(passes);
        appended.add(Objects.requireNonNull(pass, "pass must not be null"));
        return new ItemReview(
                itemId, itemTitle, itemType, sourcePath, remoteId, appended, status, escalation);
    }

    public ItemReview withStatus(ItemStatus newStatus) {
        return new ItemReview(
                itemId, itemTitle, itemType, sourcePath, remoteId, passes, newStatus, escalation);
    }

    public ItemReview withEscalation(Escalation newEscalation) {
        return new ItemReview(
                itemId, itemTitle, itemType, sourcePath, remoteId, passes, status, newEscalation);
    }

    /// Checks whether the item waits for a human decision.
    ///
    /// @return true if an escalation exists and is unresolved
    public boolean escalationPending() {
        return escalation != null && escalation.awaitingResolution();
    }

    /// Returns the most recently accepted pass of the given kind by the given reviewer.
    ///
    /// @param reviewerId reviewer to look for, not null
    /// @param passKind pass kind to look for, not null
    /// @return the latest matching pass, or empty if the reviewer never submitted one
    public Optional<ReviewPass> latestPass(String reviewerId, String passKind) {
        for (int i = passes.size() - 1; i >= 0; i--) {
            ReviewPass p = passes.get(i);
            if (p.getReviewerId().equals(reviewerId) && p.getPassKind().equals(passKind)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }
}
