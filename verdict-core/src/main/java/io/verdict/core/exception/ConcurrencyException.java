package io.verdict.core.exception;

import java.io.Serial;

/// The store could not apply a write atomically after exhausting its internal retries.
///
/// Raised only when the backing storage keeps reporting concurrent modification of the same
/// session; in-process writers are serialized and never see this.
public class ConcurrencyException extends VerdictException {

    @Serial private static final long serialVersionUID = -1552845712002371954L;

    public ConcurrencyException(String message) {
        super(message);
    }

    public ConcurrencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
