package io.verdict.core.review;

/// Aggregate status of one item within one session.
///
/// `PENDING`, `APPROVED` and `REJECTED` are computed by the consensus evaluator from
/// the item's passes. `ESCALATION_PENDING` masks the computed status while a human
/// decision is outstanding.
///
/// @see io.verdict.core.consensus.ConsensusEvaluator
/// @see Escalation
public enum ItemStatus {

    /// At least one required pass kind is missing or the approval threshold is not met.
    PENDING,

    /// Every required pass kind is covered, nothing vetoes, and the threshold is met.
    APPROVED,

    /// At least one surviving required pass rejects the item.
    REJECTED,

    /// The item was escalated and waits for a `human_override` pass.
    ESCALATION_PENDING;

    /// Checks whether this status allows the containing session to merge.
    ///
    /// @return true only for `APPROVED`
    public boolean mergeable() {
        return this == APPROVED;
    }
}
