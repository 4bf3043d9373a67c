package io.verdict.core.access;

import io.verdict.core.exception.ValidationException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// Identity of whoever invokes an engine operation.
///
/// Passed explicitly into every public operation so that the engine's behavior depends
/// only on its arguments.
///
/// @param callerId agent or human identifier, not blank
/// @param role role name understood by the access policy, null for an operator acting
///     outside any agent role
/// @param scope item types the caller works on, empty for no restriction, not null
public record CallerContext(String callerId, String role, Set<String> scope) {

    public CallerContext {
        if (callerId == null || callerId.isBlank()) {
            throw new ValidationException("callerId must not be blank");
        }
        scope =
                scope != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(scope))
                        : Set.of();
    }

    /// Creates a context for a caller acting in a role, without scope restriction.
    public static CallerContext of(String callerId, String role) {
        return new CallerContext(callerId, role, Set.of());
    }

    /// Creates a context for a human operator with no agent role.
    public static CallerContext operator(String callerId) {
        return new CallerContext(callerId, null, Set.of());
    }

    /// Checks whether the caller may work on items of the given type.
    ///
    /// @param itemType item type to check, not null
    /// @return true if the scope is unrestricted or contains the type
    public boolean covers(String itemType) {
        Objects.requireNonNull(itemType, "itemType must not be null");
        return scope.isEmpty() || scope.contains(itemType);
    }
}
