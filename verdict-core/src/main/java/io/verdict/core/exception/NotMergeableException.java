package io.verdict.core.exception;

import java.io.Serial;
import java.util.List;

/// The session does not satisfy the workflow policy at merge time.
///
/// Carries the identifiers of the items that block the merge so that callers can
/// show the reviewer what is still outstanding.
public class NotMergeableException extends VerdictException {

    @Serial private static final long serialVersionUID = -2250937384717744096L;

    private final String sessionId;
    private final List<String> blockingItems;

    /// Creates the exception.
    ///
    /// @param sessionId the session that could not be merged, not null
    /// @param blockingItems ids of items that are not approved or are escalated, not null
    /// @param message human-readable explanation, not null
    public NotMergeableException(String sessionId, List<String> blockingItems, String message) {
        super(message);
        this.sessionId = sessionId;
        this.blockingItems = List.copyOf(blockingItems);
    }

    public String getSessionId() {
        return sessionId;
    }

    /// Returns the items preventing the merge.
    ///
    /// @return immutable list of item ids, empty when the session has no items at all
    public List<String> getBlockingItems() {
        return blockingItems;
    }
}
