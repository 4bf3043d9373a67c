package io.verdict.core.exception;

import java.io.Serial;

/// A stored record contradicts the engine's invariants, e.g. an item status that cannot be
/// derived from its passes.
///
/// This is fatal for the operation that discovered it. The record is flagged for operator
/// inspection instead of being repaired by guessing.
public class InvariantViolationException extends VerdictException {

    @Serial private static final long serialVersionUID = -4987340021915233651L;

    public InvariantViolationException(String message) {
        super(message);
    }

    public InvariantViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
