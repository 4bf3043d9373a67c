package io.verdict.core.access;

/// Engine operations subject to authorization.
public enum Operation {
    CREATE_SESSION,
    SUBMIT_REVIEW,
    READ,
    ESCALATE,
    APPROVE_AND_MERGE
}
