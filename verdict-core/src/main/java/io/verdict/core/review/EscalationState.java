package io.verdict.core.review;

/// Lifecycle of an escalation record.
///
/// ```
/// REJECTED item ──escalate──> PENDING ──human_override(approved)──> RESOLVED_APPROVED
///                                     └─human_override(rejected)──> RESOLVED_REVISE
/// ```
public enum EscalationState {
    PENDING,
    RESOLVED_APPROVED,
    RESOLVED_REVISE
}
