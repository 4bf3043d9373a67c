package io.verdict.core.workspace;

import java.util.List;

/// Compares the remote content system with the baseline after a merge.
///
/// Called once per successful merge. The report is informational; drift never undoes an
/// archive.
@FunctionalInterface
public interface RemoteSyncChecker {

    /// Checker that never reports drift.
    RemoteSyncChecker NONE = sessionId -> List.of();

    /// @param sessionId the session that was just merged, not null
    /// @return drifted items, empty when in sync, never null
    /// @throws WorkspaceException if the remote system could not be queried
    List<DriftEntry> checkDrift(String sessionId) throws WorkspaceException;
}
