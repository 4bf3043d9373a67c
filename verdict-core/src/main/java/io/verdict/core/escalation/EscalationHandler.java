package io.verdict.core.escalation;

import io.verdict.core.consensus.ConsensusEvaluator;
import io.verdict.core.consensus.ConsensusOutcome;
import io.verdict.core.exception.InvalidStateException;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.policy.ItemTypePolicy;
import io.verdict.core.policy.PassKinds;
import io.verdict.core.review.Escalation;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewPass;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/// Layers the escalation state machine over consensus evaluation.
///
/// ```
/// PENDING / APPROVED ──────────────── escalate ──> InvalidStateException
/// REJECTED ────────────────────────── escalate ──> ESCALATION_PENDING
/// ESCALATION_PENDING ── human_override approved ──> RESOLVED_APPROVED, consensus re-run
/// ESCALATION_PENDING ── human_override rejected ──> RESOLVED_REVISE, consensus re-run
/// ```
///
/// While an escalation is pending the item's status is `ESCALATION_PENDING` whatever the
/// passes say, which blocks the merge of the containing session. Once resolved, the
/// override pass takes part in consensus and outranks the vetoes accepted before it.
///
/// @implNote Stateless and thread-safe. Works on immutable `ItemReview` values; the
/// session store persists the results.
///
/// @see ConsensusEvaluator
public class EscalationHandler {

    private final ConsensusEvaluator evaluator;

    public EscalationHandler(ConsensusEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    /// Derives the status an item must carry.
    ///
    /// @param item the item, not null
    /// @param policy the policy for the item's type, not null
    /// @return `ESCALATION_PENDING` while escalated, otherwise the consensus status
    public ItemStatus deriveStatus(ItemReview item, ItemTypePolicy policy) {
        if (item.escalationPending()) {
            return ItemStatus.ESCALATION_PENDING;
        }
        return evaluator.evaluate(item.passes(), policy).status();
    }

    /// Returns the item with its status recomputed.
    public ItemReview recompute(ItemReview item, ItemTypePolicy policy) {
        return item.withStatus(deriveStatus(item, policy));
    }

    /// Escalates a vetoed item.
    ///
    /// @param item the item, not null
    /// @param policy the policy for the item's type, not null
    /// @param reason why human resolution is needed, not blank
    /// @param evidence supporting item ids or references, may be null
    /// @param escalatedBy caller id, not null
    /// @param escalatedAt timestamp, not null
    /// @return the escalated item with status `ESCALATION_PENDING`, never null
    /// @throws ValidationException if `reason` is blank
    /// @throws InvalidStateException if the item is not currently `REJECTED`
    public ItemReview escalate(
            ItemReview item,
            ItemTypePolicy policy,
            String reason,
            List<String> evidence,
            String escalatedBy,
            Instant escalatedAt) {
        Objects.requireNonNull(item, "item must not be null");
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Escalation reason must not be blank");
        }
        if (item.escalationPending()) {
            throw new InvalidStateException(
                    "Item " + item.itemId() + " is already awaiting human resolution");
        }
        ConsensusOutcome outcome = evaluator.evaluate(item.passes(), policy);
        if (outcome.status() != ItemStatus.REJECTED) {
            throw new InvalidStateException(
                    "Only rejected items can be escalated; item "
                            + item.itemId()
                            + " is "
                            + outcome.status());
        }
        Escalation escalation =
                Escalation.open(reason, evidence, outcome.vetoes(), escalatedBy, escalatedAt);
        return item.withEscalation(escalation).withStatus(ItemStatus.ESCALATION_PENDING);
    }

    /// Resolves the pending escalation with an accepted override pass.
    ///
    /// @param item the item, already containing `override` as its latest pass, not null
    /// @param policy the policy for the item's type, not null
    /// @param override the accepted `human_override` pass, not null
    /// @return the item with the escalation resolved and status recomputed, never null
    /// @throws InvalidStateException if the item has no pending escalation
    public ItemReview resolve(ItemReview item, ItemTypePolicy policy, ReviewPass override) {
        if (!PassKinds.HUMAN_OVERRIDE.equals(override.getPassKind())) {
            throw new ValidationException(
                    "Escalations are resolved by " + PassKinds.HUMAN_OVERRIDE + " passes only");
        }
        if (!item.escalationPending()) {
            throw new InvalidStateException(
                    "Item " + item.itemId() + " has no escalation awaiting resolution");
        }
        ItemReview resolved = item.withEscalation(item.escalation().resolve(override));
        return recompute(resolved, policy);
    }
}
