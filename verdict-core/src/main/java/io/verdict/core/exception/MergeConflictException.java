package io.verdict.core.exception;

import java.io.Serial;
import java.util.List;

/// The versioned-workspace system refused the merge because of conflicting changes.
///
/// The session stays unarchived and the workspace is left intact for manual resolution.
public class MergeConflictException extends VerdictException {

    @Serial private static final long serialVersionUID = 3390871462044513806L;

    private final List<String> conflictingPaths;

    public MergeConflictException(String message, List<String> conflictingPaths, Throwable cause) {
        super(message, cause);
        this.conflictingPaths = List.copyOf(conflictingPaths);
    }

    /// Returns the paths the workspace system reported as conflicting.
    ///
    /// @return immutable list, may be empty when the system gave no detail
    public List<String> getConflictingPaths() {
        return conflictingPaths;
    }
}
