package io.verdict.core.workspace;

import java.util.Objects;

/// One item whose remote copy differs from the merged baseline.
///
/// @param itemId affected item, not null
/// @param reason description of the difference, not null
public record DriftEntry(String itemId, String reason) {

    public DriftEntry {
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(reason, "reason must not be null");
    }
}
