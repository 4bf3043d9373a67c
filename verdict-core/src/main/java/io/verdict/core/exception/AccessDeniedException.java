package io.verdict.core.exception;

import java.io.Serial;

/// The authorization collaborator refused the caller for the requested operation.
public class AccessDeniedException extends VerdictException {

    @Serial private static final long serialVersionUID = 8016734651247795525L;

    public AccessDeniedException(String message) {
        super(message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(message, cause);
    }
}
