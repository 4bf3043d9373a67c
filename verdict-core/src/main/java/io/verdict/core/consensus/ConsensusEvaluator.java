package io.verdict.core.consensus;

import io.verdict.core.policy.ItemTypePolicy;
import io.verdict.core.policy.PassKinds;
import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewPass;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Derives an item's aggregate status from its passes and its item-type policy.
///
/// ### Algorithm
/// 1. **Supersession**: keep only the latest pass per `(reviewerId, passKind)`, where
///    "latest" means accepted last. Caller timestamps are never consulted.
/// 2. **Coverage**: if any required kind has no surviving pass, the item is `PENDING`.
/// 3. **Override**: the latest surviving `human_override` pass outranks every pass
///    accepted before it. An override that rejects asks for revision: `REJECTED`.
/// 4. **Veto**: any surviving rejection of a required kind that is not outranked makes
///    the item `REJECTED`, however many approvals exist.
/// 5. **Threshold**: otherwise count distinct reviewers approving a required kind (an
///    approving override counts as one more); `APPROVED` when the count reaches the
///    policy's threshold, `PENDING` otherwise.
///
/// Rejection is a veto while approval is a threshold: a wrong approval reaching the
/// shared baseline costs more than a delayed merge.
///
/// @implNote Stateless and thread-safe. The result depends only on the order and content
/// of `passes` and on `policy`, so recomputation always yields the same status.
///
/// @see ConsensusOutcome
/// @see io.verdict.core.escalation.EscalationHandler
public class ConsensusEvaluator {

    /// Evaluates one item.
    ///
    /// @param passes the item's passes in acceptance order, not null
    /// @param policy the policy for the item's type, not null
    /// @return the outcome, never null
    public ConsensusOutcome evaluate(List<ReviewPass> passes, ItemTypePolicy policy) {
        Objects.requireNonNull(passes, "passes must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        Map<String, Ranked> surviving = supersede(passes);

        Ranked override = null;
        for (Ranked r : surviving.values()) {
            if (PassKinds.HUMAN_OVERRIDE.equals(r.pass().getPassKind())
                    && (override == null || r.index() > override.index())) {
                override = r;
            }
        }
        ReviewPass overridePass = override != null ? override.pass() : null;

        List<String> missing = new ArrayList<>();
        for (String kind : policy.requiredPassKinds()) {
            boolean covered =
                    surviving.values().stream()
                            .anyMatch(r -> r.pass().getPassKind().equals(kind));
            if (!covered) {
                missing.add(kind);
            }
        }

        Set<String> approvers = new LinkedHashSet<>();
        List<ReviewPass> vetoes = new ArrayList<>();
        int outranksBefore = override != null ? override.index() : -1;
        for (Ranked r : surviving.values()) {
            ReviewPass p = r.pass();
            if (!policy.requires(p.getPassKind())) {
                continue;
            }
            if (p.approves()) {
                approvers.add(p.getReviewerId());
            } else if (r.index() > outranksBefore) {
                vetoes.add(p);
            }
        }

        int threshold = policy.requiredApprovals();

        if (!missing.isEmpty()) {
            return new ConsensusOutcome(
                    ItemStatus.PENDING,
                    missing,
                    List.of(),
                    approvers,
                    threshold,
                    overridePass,
                    "Awaiting required passes: " + String.join(", ", missing));
        }

        if (overridePass != null && overridePass.rejects()) {
            return new ConsensusOutcome(
                    ItemStatus.REJECTED,
                    missing,
                    List.of(overridePass),
                    approvers,
                    threshold,
                    overridePass,
                    "Human override by "
                            + overridePass.getReviewerId()
                            + " requested revision");
        }

        if (!vetoes.isEmpty()) {
            return new ConsensusOutcome(
                    ItemStatus.REJECTED,
                    missing,
                    vetoes,
                    approvers,
                    threshold,
                    overridePass,
                    String.format(
                            "Vetoed by %d rejection(s): %s",
                            vetoes.size(), describe(vetoes)));
        }

        if (overridePass != null) {
            approvers.add(overridePass.getReviewerId());
        }

        boolean approved = approvers.size() >= threshold;
        String reasoning =
                String.format(
                        "%d of %d required approval(s) from distinct reviewers%s",
                        approvers.size(),
                        threshold,
                        overridePass != null
                                ? ", including override by " + overridePass.getReviewerId()
                                : "");
        return new ConsensusOutcome(
                approved ? ItemStatus.APPROVED : ItemStatus.PENDING,
                missing,
                List.of(),
                approvers,
                threshold,
                overridePass,
                reasoning);
    }

    /// Keeps the last-accepted pass for each reviewer and kind, remembering its position.
    private static Map<String, Ranked> supersede(List<ReviewPass> passes) {
        Map<String, Ranked> latest = new LinkedHashMap<>();
        for (int i = 0; i < passes.size(); i++) {
            ReviewPass p = passes.get(i);
            String key = p.getReviewerId() + '\u0000' + p.getPassKind();
            latest.remove(key);
            latest.put(key, new Ranked(p, i));
        }
        return latest;
    }

    private static String describe(List<ReviewPass> vetoes) {
        StringBuilder sb = new StringBuilder();
        for (ReviewPass p : vetoes) {
            if (sb.length() > 0) {
                sb.append("; ");
            }
            sb.append(p.getPassKind()).append(" by ").append(p.getReviewerId());
            if (p.getSeverity() != null) {
                sb.append(" (").append(p.getSeverity().name().toLowerCase()).append(')');
            }
        }
        return sb.toString();
    }

    private record Ranked(ReviewPass pass, int index) {}
}
