package io.verdict.core.access;

/// Authorization collaborator consulted by the engine facade before each operation.
///
/// Components below the facade never re-check authorization.
///
/// @see RoleBasedAccessPolicy
/// @see io.verdict.core.engine.ReviewEngine
@FunctionalInterface
public interface AccessPolicy {

    /// Policy that allows everything.
    AccessPolicy ALLOW_ALL = (caller, operation, target) -> true;

    /// @param caller who is asking, not null
    /// @param operation what they want to do, not null
    /// @param target what they want to do it to, not null
    /// @return true if the operation may proceed
    boolean isAllowed(CallerContext caller, Operation operation, AccessTarget target);
}
