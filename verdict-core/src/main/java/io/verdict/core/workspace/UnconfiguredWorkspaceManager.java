package io.verdict.core.workspace;

/// Workspace manager used when no versioned-workspace system is wired in.
///
/// Every call fails, so sessions can be reviewed but never merged.
public final class UnconfiguredWorkspaceManager implements WorkspaceManager {

    private static final String MESSAGE = "No versioned-workspace system is configured";

    @Override
    public String createWorkspace(String base) throws WorkspaceException {
        throw new WorkspaceException(MESSAGE);
    }

    @Override
    public String mergeWorkspace(String workspaceId) throws WorkspaceException {
        throw new WorkspaceException(MESSAGE);
    }

    @Override
    public void removeWorkspace(String workspaceId) throws WorkspaceException {
        throw new WorkspaceException(MESSAGE);
    }
}
