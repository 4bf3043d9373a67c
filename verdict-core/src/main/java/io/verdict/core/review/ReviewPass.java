package io.verdict.core.review;

import io.verdict.core.exception.ValidationException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// One reviewer's verdict on one item for one pass kind.
///
/// Instances are immutable. A reviewer revises a verdict by submitting a new pass of the
/// same kind; the consensus evaluator then counts only the latest one, while the item
/// keeps every pass for audit.
///
/// ### Contracts
/// - **Precondition**: `passKind` and `reviewerId` are not blank, `decision` and
///   `reasoning` are not null
/// - **Precondition**: a rejected pass carries non-blank reasoning
/// - **Postcondition**: `severity` is null for approvals and defaults to `MEDIUM` for
///   rejections that do not state one
///
/// Whether the pass kind is known for the item's type is checked against the workflow
/// policy when the pass is submitted, since a pass on its own does not know the type.
///
/// @see io.verdict.core.policy.WorkflowPolicy#validatePass(String, ReviewPass)
/// @see ItemReview
public final class ReviewPass {

    private final String passKind;
    private final String reviewerId;
    private final String reviewerRole;
    private final Decision decision;
    private final String reasoning;
    private final Severity severity;
    private final List<String> references;
    private final Instant timestamp;

    private ReviewPass(Builder builder) {
        this.passKind = requireText(builder.passKind, "passKind");
        this.reviewerId = requireText(builder.reviewerId, "reviewerId");
        this.reviewerRole = builder.reviewerRole;
        if (builder.decision == null) {
            throw new ValidationException("decision must not be null");
        }
        this.decision = builder.decision;
        if (builder.reasoning == null) {
            throw new ValidationException("reasoning must not be null");
        }
        if (decision == Decision.REJECTED && builder.reasoning.isBlank()) {
            throw new ValidationException(
                    "A rejected " + passKind + " pass must explain its reasoning");
        }
        this.reasoning = builder.reasoning;
        this.severity =
                decision == Decision.REJECTED
                        ? (builder.severity != null ? builder.severity : Severity.MEDIUM)
                        : null;
        this.references = builder.references != null ? List.copyOf(builder.references) : List.of();
        this.timestamp = builder.timestamp;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " must not be blank");
        }
        return value;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Returns a builder pre-filled with this pass's values.
    ///
    /// @return new builder, never null
    public Builder toBuilder() {
        return new Builder()
                .passKind(passKind)
                .reviewerId(reviewerId)
                .reviewerRole(reviewerRole)
                .decision(decision)
                .reasoning(reasoning)
                .severity(severity)
                .references(references)
                .timestamp(timestamp);
    }

    /// Returns a copy of this pass stamped with the given acceptance time.
    ///
    /// @param acceptedAt the time the store accepted the pass, not null
    /// @return new pass, never null
    public ReviewPass withTimestamp(Instant acceptedAt) {
        return toBuilder().timestamp(Objects.requireNonNull(acceptedAt, "acceptedAt")).build();
    }

    public String getPassKind() {
        return passKind;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    /// Returns the role the reviewer acted in, e.g. `fact_check_agent`.
    ///
    /// @return the role, may be null for passes recorded without caller context
    public String getReviewerRole() {
        return reviewerRole;
    }

    public Decision getDecision() {
        return decision;
    }

    public String getReasoning() {
        return reasoning;
    }

    /// Returns the severity of the objection.
    ///
    /// @return severity for rejections, null for approvals
    public Severity getSeverity() {
        return severity;
    }

    /// Returns identifiers of items cited as evidence, in the order given.
    ///
    /// @return immutable list, never null
    public List<String> getReferences() {
        return references;
    }

    /// Returns when the store accepted this pass.
    ///
    /// @return acceptance time, null only before the pass has been submitted
    public Instant getTimestamp() {
        return timestamp;
    }

    public boolean approves() {
        return decision == Decision.APPROVED;
    }

    public boolean rejects() {
        return decision == Decision.REJECTED;
    }

    /// Builder for {@link ReviewPass}.
    public static final class Builder {
        private String passKind;
        private String reviewerId;
        private String reviewerRole;
        private Decision decision;
        private String reasoning;
        private Severity severity;
        private List<String> references;
        private Instant timestamp;

        private Builder() {}

        public Builder passKind(String passKind) {
            this.passKind = passKind;
            return this;
        }

        public Builder reviewerId(String reviewerId) {
            this.reviewerId = reviewerId;
            return this;
        }

        public Builder reviewerRole(String reviewerRole) {
            this.reviewerRole = reviewerRole;
            return this;
        }

        public Builder decision(Decision decision) {
            this.decision = decision;
            return this;
        }

        public Builder reasoning(String reasoning) {
            this.reasoning = reasoning;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder references(List<String> references) {
            this.references = references;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        /// Builds the pass.
        ///
        /// @return a new immutable pass, never null
        /// @throws ValidationException if a required field is missing or a rejection has
        /// no reasoning
        public ReviewPass build() {
            return new ReviewPass(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewPass that = (ReviewPass) o;
        return Objects.equals(passKind, that.passKind)
                && Objects.equals(reviewerId, that.reviewerId)
                && Objects.equals(reviewerRole, that.reviewerRole)
                && decision == that.decision
                && Objects.equals(reasoning, that.reasoning)
                && severity == that.severity
                && Objects.equals(references, that.references)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(passKind, reviewerId, decision, timestamp);
    }

    @Override
    public String toString() {
        return "ReviewPass{"
                + "passKind='"
                + passKind
                + '\''
                + ", reviewerId='"
                + reviewerId
                + '\''
                + ", decision="
                + decision
                + ", severity="
                + severity
                + ", timestamp="
                + timestamp
                + '}';
    }
}
