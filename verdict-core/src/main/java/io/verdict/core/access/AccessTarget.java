package io.verdict.core.access;

/// What an operation acts upon, as far as authorization is concerned.
///
/// @param sessionId target session, null for cross-session operations
/// @param itemType type of the target item, null when no single item is involved
/// @param passKind kind of pass being submitted, null for other operations
public record AccessTarget(String sessionId, String itemType, String passKind) {

    public static AccessTarget session(String sessionId) {
        return new AccessTarget(sessionId, null, null);
    }

    public static AccessTarget any() {
        return new AccessTarget(null, null, null);
    }
}
