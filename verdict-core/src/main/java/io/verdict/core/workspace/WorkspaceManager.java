package io.verdict.core.workspace;

/// Versioned-workspace system that owns the isolated working copies reviewed by sessions.
///
/// The engine never touches file content. It asks this collaborator to create a workspace
/// for a new session, to merge it once every item is approved, and to remove it after the
/// session has been archived.
///
/// ### Contracts
/// - **Postcondition**: a failed `mergeWorkspace` leaves the workspace intact
/// - **Invariant**: workspace ids are the session ids used by the engine
///
/// @implNote Implementations must be thread-safe. `mergeWorkspace` may block; the merge
/// coordinator runs it on its own executor with a bounded timeout and may interrupt it.
///
/// @see io.verdict.core.merge.MergeCoordinator
public interface WorkspaceManager {

    /// Creates an isolated workspace branched from `base`.
    ///
    /// @param base baseline to branch from, not null
    /// @return identifier of the new workspace, never null
    /// @throws WorkspaceException if the workspace could not be created
    String createWorkspace(String base) throws WorkspaceException;

    /// Merges the workspace into the shared baseline.
    ///
    /// @param workspaceId workspace to merge, not null
    /// @return opaque reference of the resulting commit, never null
    /// @throws WorkspaceConflictException if the merge needs manual resolution
    /// @throws WorkspaceException on any other failure
    String mergeWorkspace(String workspaceId) throws WorkspaceException;

    /// Deletes the workspace.
    ///
    /// @param workspaceId workspace to delete, not null
    /// @throws WorkspaceException if removal failed
    void removeWorkspace(String workspaceId) throws WorkspaceException;
}
