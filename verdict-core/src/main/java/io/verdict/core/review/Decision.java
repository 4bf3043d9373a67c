package io.verdict.core.review;

import io.verdict.core.exception.ValidationException;
import java.util.Locale;

/// Verdict a reviewer gives on one item for one pass kind.
public enum Decision {

    /// The reviewer accepts the item for this pass kind.
    APPROVED,

    /// The reviewer objects; a single surviving rejection vetoes the item.
    REJECTED;

    /// Returns the lower-case wire name, e.g. `"approved"`.
    ///
    /// @return wire name, never null
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /// Parses a decision from its wire name, case-insensitively.
    ///
    /// @param value wire name such as `"approved"`, may be null
    /// @return the matching decision, never null
    /// @throws ValidationException if the value is null or unknown
    public static Decision fromWireName(String value) {
        if (value != null) {
            for (Decision d : values()) {
                if (d.name().equalsIgnoreCase(value.trim())) {
                    return d;
                }
            }
        }
        throw new ValidationException("Unknown decision: " + value);
    }
}
