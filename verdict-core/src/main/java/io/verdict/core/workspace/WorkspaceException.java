package io.verdict.core.workspace;

/// Failure reported by the versioned-workspace system.
///
/// Checked so that every call site into the external system decides how the failure maps
/// onto the engine's error taxonomy.
public class WorkspaceException extends Exception {

    public WorkspaceException(String message) {
        super(message);
    }

    public WorkspaceException(String message, Throwable cause) {
        super(message, cause);
    }
}
