package io.verdict.core.exception;

import java.io.Serial;

/// Base type for every typed failure the review engine reports to its callers.
///
/// Rejections and escalations are not failures: a `REJECTED` or
/// `ESCALATION_PENDING` item status is a successfully computed result. Only
/// operations that could not be carried out raise a subclass of this type.
///
/// @see ValidationException
/// @see NotFoundException
/// @see ConflictException
/// @see InvalidStateException
/// @see NotMergeableException
/// @see StorageException
public class VerdictException extends RuntimeException {

    @Serial private static final long serialVersionUID = 4402283547611087312L;

    public VerdictException(String message) {
        super(message);
    }

    public VerdictException(String message, Throwable cause) {
        super(message, cause);
    }
}
