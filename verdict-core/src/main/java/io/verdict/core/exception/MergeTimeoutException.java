package io.verdict.core.exception;

import java.io.Serial;

/// The external workspace merge did not complete within the configured timeout.
///
/// The session is left unarchived, so retrying is safe.
public class MergeTimeoutException extends VerdictException {

    @Serial private static final long serialVersionUID = 2916373012487340218L;

    public MergeTimeoutException(String message) {
        super(message);
    }

    public MergeTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
