package io.verdict.core.exception;

import java.io.Serial;

/// Malformed input: a pass, item id or policy reference that can never be accepted.
///
/// Callers must not retry the same input.
public class ValidationException extends VerdictException {

    @Serial private static final long serialVersionUID = 1187712939476130541L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
