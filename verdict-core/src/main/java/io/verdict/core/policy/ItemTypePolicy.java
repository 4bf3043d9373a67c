package io.verdict.core.policy;

import io.verdict.core.exception.ValidationException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/// Review requirements for one item type.
///
/// @param requiredPassKinds pass kinds that must each have at least one surviving pass,
/// in declaration order, not empty
/// @param optionalPassKinds additional kinds reviewers may submit; they are kept for audit
/// but never affect consensus, not null
/// @param requiredApprovals minimum number of distinct reviewers approving across the
/// required kinds, at least 1
public record ItemTypePolicy(
        Set<String> requiredPassKinds, Set<String> optionalPassKinds, int requiredApprovals) {

    public ItemTypePolicy {
        if (requiredPassKinds == null || requiredPassKinds.isEmpty()) {
            throw new ValidationException("A policy must require at least one pass kind");
        }
        if (requiredPassKinds.contains(PassKinds.HUMAN_OVERRIDE)) {
            throw new ValidationException(
                    PassKinds.HUMAN_OVERRIDE + " cannot be a required pass kind");
        }
        if (requiredApprovals < 1) {
            throw new ValidationException(
                    "requiredApprovals must be at least 1, got " + requiredApprovals);
        }
        requiredPassKinds = Collections.unmodifiableSet(new LinkedHashSet<>(requiredPassKinds));
        optionalPassKinds =
                optionalPassKinds != null
                        ? Collections.unmodifiableSet(new LinkedHashSet<>(optionalPassKinds))
                        : Set.of();
    }

    /// Creates a policy without optional pass kinds.
    ///
    /// @param requiredApprovals distinct-reviewer approval threshold
    /// @param requiredPassKinds the required kinds, in order
    /// @return new policy, never null
    public static ItemTypePolicy of(int requiredApprovals, String... requiredPassKinds) {
        return new ItemTypePolicy(
                new LinkedHashSet<>(Arrays.asList(requiredPassKinds)),
                Set.of(),
                requiredApprovals);
    }

    /// Checks whether reviewers may submit passes of the given kind for this item type.
    ///
    /// @param passKind kind to check, not null
    /// @return true for required kinds, optional kinds and `human_override`
    public boolean recognizes(String passKind) {
        return requiredPassKinds.contains(passKind)
                || optionalPassKinds.contains(passKind)
                || PassKinds.HUMAN_OVERRIDE.equals(passKind);
    }

    public boolean requires(String passKind) {
        return requiredPassKinds.contains(passKind);
    }
}
