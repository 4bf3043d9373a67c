package io.verdict.core.workspace;

import java.util.List;

/// The workspace could not be merged into the baseline without manual resolution.
///
/// The workspace is left untouched by the system that raised it.
public class WorkspaceConflictException extends WorkspaceException {

    private final List<String> conflictingPaths;

    public WorkspaceConflictException(String message, List<String> conflictingPaths) {
        super(message);
        this.conflictingPaths =
                conflictingPaths != null ? List.copyOf(conflictingPaths) : List.of();
    }

    /// @return paths reported as conflicting, possibly empty, never null
    public List<String> getConflictingPaths() {
        return conflictingPaths;
    }
}
