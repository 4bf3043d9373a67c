package io.verdict.core.review;

import io.verdict.core.exception.ValidationException;

/// Descriptive data supplied with the first pass for an item in a session.
///
/// Only the first submission's metadata is kept; later submissions for the same item
/// reuse the stored title and type.
///
/// @param title display title of the item, not blank
/// @param itemType workflow policy key, e.g. `pages` or `quizzes`, not blank
/// @param sourcePath path of the item's source file inside the workspace, may be null
/// @param remoteId identifier of the item in the remote content system, may be null
public record ItemMetadata(String title, String itemType, String sourcePath, String remoteId) {

    public ItemMetadata {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Item title must not be blank");
        }
        if (itemType == null || itemType.isBlank()) {
            throw new ValidationException("Item type must not be blank");
        }
    }

    /// Creates metadata without source or remote references.
    ///
    /// @param title display title, not blank
    /// @param itemType workflow policy key, not blank
    /// @return new metadata, never null
    public static ItemMetadata of(String title, String itemType) {
        return new ItemMetadata(title, itemType, null, null);
    }
}
