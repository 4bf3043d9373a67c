package io.verdict.core.exception;

import java.io.Serial;

/// A durable read or write failed.
///
/// Writes that fail with this exception were not partially applied; the caller must retry
/// the whole operation.
public class StorageException extends VerdictException {

    @Serial private static final long serialVersionUID = 5172390412339807113L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
