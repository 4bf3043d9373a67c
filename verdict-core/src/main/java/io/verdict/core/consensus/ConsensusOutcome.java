package io.verdict.core.consensus;

import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewPass;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Result of evaluating one item's passes against its item-type policy.
///
/// Besides the status, carries the evidence that produced it so that callers can
/// explain a decision or attach the vetoing passes to an escalation.
///
/// @param status computed status, one of `PENDING`, `APPROVED`, `REJECTED`, not null
/// @param missingKinds required kinds without any surviving pass, in policy order, not null
/// @param vetoes surviving rejections that decide a `REJECTED` outcome, not null
/// @param approvers distinct reviewers whose surviving passes approve, not null
/// @param requiredApprovals approval threshold of the policy that was applied
/// @param override the `human_override` pass in effect, may be null
/// @param reasoning human-readable explanation of the outcome, not null
///
/// @see ConsensusEvaluator
public record ConsensusOutcome(
        ItemStatus status,
        List<String> missingKinds,
        List<ReviewPass> vetoes,
        Set<String> approvers,
        int requiredApprovals,
        ReviewPass override,
        String reasoning) {

    public ConsensusOutcome {
        missingKinds = List.copyOf(missingKinds);
        vetoes = List.copyOf(vetoes);
        approvers = Collections.unmodifiableSet(new LinkedHashSet<>(approvers));
    }

    public int approvalCount() {
        return approvers.size();
    }
}
