package io.verdict.core.review;

/// An item with an unresolved escalation, together with the session it belongs to.
///
/// @param sessionId owning session, not null
/// @param item the escalated item review, not null
public record ConflictReport(String sessionId, ItemReview item) {}
