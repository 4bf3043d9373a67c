package io.verdict.core.exception;

import java.io.Serial;

/// The operation is not legal for the current status of its target, e.g. escalating an
/// item that is not rejected or overriding an item without a pending escalation.
public class InvalidStateException extends VerdictException {

    @Serial private static final long serialVersionUID = -7440390542962173309L;

    public InvalidStateException(String message) {
        super(message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
