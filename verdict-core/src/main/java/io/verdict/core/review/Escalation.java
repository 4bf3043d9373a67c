package io.verdict.core.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Record of an item handed to a human because reviewers deadlocked on a veto.
///
/// Captures the conflicting passes as they stood when the item was escalated so the
/// evidence survives later supersession. Resolution fields are filled in once, when a
/// `human_override` pass is accepted for the item.
///
/// @param reason why the caller escalated, not blank
/// @param evidence item ids or other references supporting the escalation, not null
/// @param conflictingPasses the surviving rejections that vetoed the item, not null
/// @param escalatedBy caller id that raised the escalation, not null
/// @param escalatedAt when the escalation was raised, not null
/// @param state current lifecycle state, not null
/// @param resolvedBy reviewer id of the human override, null while pending
/// @param resolvedAt when the override was accepted, null while pending
/// @param resolution reasoning of the override, null while pending
public record Escalation(
        String reason,
        List<String> evidence,
        List<ReviewPass> conflictingPasses,
        String escalatedBy,
        Instant escalatedAt,
        EscalationState state,
        String resolvedBy,
        Instant resolvedAt,
        String resolution) {

    public Escalation {
        Objects.requireNonNull(reason, "reason must not be null");
        Objects.requireNonNull(escalatedBy, "escalatedBy must not be null");
        Objects.requireNonNull(escalatedAt, "escalatedAt must not be null");
        Objects.requireNonNull(state, "state must not be null");
        evidence = evidence != null ? List.copyOf(evidence) : List.of();
        conflictingPasses = conflictingPasses != null ? List.copyOf(conflictingPasses) : List.of();
    }

    /// Opens a new, unresolved escalation.
    ///
    /// @param reason why the item is escalated, not null
    /// @param evidence supporting references, may be null
    /// @param conflictingPasses the vetoing passes, may be null
    /// @param escalatedBy caller id, not null
    /// @param escalatedAt timestamp, not null
    /// @return pending escalation, never null
    public static Escalation open(
            String reason,
            List<String> evidence,
            List<ReviewPass> conflictingPasses,
            String escalatedBy,
            Instant escalatedAt) {
        return new Escalation(
                reason,
                evidence,
                conflictingPasses,
                escalatedBy,
                escalatedAt,
                EscalationState.PENDING,
                null,
                null,
                null);
    }

    /// Returns a copy resolved by the given override pass.
    ///
    /// @param override the accepted `human_override` pass, not null
    /// @return resolved escalation, never null
    public Escalation resolve(ReviewPass override) {
        EscalationState outcome =
                override.approves()
                        ? EscalationState.RESOLVED_APPROVED
                        : EscalationState.RESOLVED_REVISE;
        return new Escalation(
                reason,
                evidence,
                conflictingPasses,
                escalatedBy,
                escalatedAt,
                outcome,
                override.getReviewerId(),
                override.getTimestamp(),
                override.getReasoning());
    }

    /// Checks whether a human decision is still outstanding.
    ///
    /// @return true while the state is `PENDING`
    public boolean awaitingResolution() {
        return state == EscalationState.PENDING;
    }
}
