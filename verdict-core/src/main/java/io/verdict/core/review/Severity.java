package io.verdict.core.review;

/// Weight of an objection. Only meaningful on rejected passes.
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
