package io.verdict.core.review;

import io.verdict.core.exception.ValidationException;

/// Parsed form of a cross-session item identifier `<contentType>:<contentId>`.
///
/// @param contentType the kind of content, e.g. `page` or `quiz`, not blank
/// @param contentId the content's stable identifier within its type, not blank
public record ItemRef(String contentType, String contentId) {

    private static final char SEPARATOR = ':';

    public ItemRef {
        if (contentType == null || contentType.isBlank()) {
            throw new ValidationException("Item content type must not be blank");
        }
        if (contentId == null || contentId.isBlank()) {
            throw new ValidationException("Item content id must not be blank");
        }
        if (contentType.indexOf(SEPARATOR) >= 0) {
            throw new ValidationException("Item content type must not contain ':'");
        }
    }

    /// Parses an item identifier.
    ///
    /// The content id may itself contain `:`; only the first separator splits.
    ///
    /// @param itemId identifier such as `page:week-1-intro`, may be null
    /// @return the parsed reference, never null
    /// @throws ValidationException if the identifier is null or not of the form `type:id`
    public static ItemRef parse(String itemId) {
        if (itemId == null) {
            throw new ValidationException("Item id must not be null");
        }
        int idx = itemId.indexOf(SEPARATOR);
        if (idx <= 0 || idx == itemId.length() - 1) {
            throw new ValidationException(
                    "Item id must have the form <contentType>:<contentId>, got: " + itemId);
        }
        return new ItemRef(itemId.substring(0, idx), itemId.substring(idx + 1));
    }

    @Override
    public String toString() {
        return contentType + SEPARATOR + contentId;
    }
}
