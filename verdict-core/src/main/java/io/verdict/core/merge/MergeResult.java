package io.verdict.core.merge;

import io.verdict.core.review.ReviewSession;
import io.verdict.core.workspace.DriftEntry;
import java.util.List;
import java.util.Objects;

/// Outcome of a successful merge.
///
/// @param session the archived session record, not null
/// @param mergeReference commit reference returned by the workspace system, not null
/// @param workspaceRemoved false if best-effort workspace removal failed
/// @param drift remote-sync drift reported after the merge, not null
/// @param driftChecked false if the remote-sync check itself failed
public record MergeResult(
        ReviewSession session,
        String mergeReference,
        boolean workspaceRemoved,
        List<DriftEntry> drift,
        boolean driftChecked) {

    public MergeResult {
        Objects.requireNonNull(session, "session must not be null");
        Objects.requireNonNull(mergeReference, "mergeReference must not be null");
        drift = drift != null ? List.copyOf(drift) : List.of();
    }

    public boolean inSync() {
        return driftChecked && drift.isEmpty();
    }
}
