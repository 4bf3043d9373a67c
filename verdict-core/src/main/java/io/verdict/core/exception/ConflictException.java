package io.verdict.core.exception;

import java.io.Serial;

/// The operation collides with existing state: a duplicate active session, a second
/// concurrent merge of the same session, or a write against a session whose merge is in
/// progress.
///
/// Callers may retry after inspecting the current state.
public class ConflictException extends VerdictException {

    @Serial private static final long serialVersionUID = 6811208451720928905L;

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
