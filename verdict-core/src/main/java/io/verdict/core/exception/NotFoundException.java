package io.verdict.core.exception;

import java.io.Serial;

/// Unknown session or item identifier.
public class NotFoundException extends VerdictException {

    @Serial private static final long serialVersionUID = -3022640875151960338L;

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
