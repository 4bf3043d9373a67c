package io.verdict.core.escalation;

import static io.verdict.core.ReviewFixtures.INTRO_PAGE;
import static io.verdict.core.ReviewFixtures.approve;
import static io.verdict.core.ReviewFixtures.override;
import static io.verdict.core.ReviewFixtures.reject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verdict.core.consensus.ConsensusEvaluator;
import io.verdict.core.exception.InvalidStateException;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.policy.ItemTypePolicy;
import io.verdict.core.policy.PassKinds;
import io.verdict.core.review.Decision;
import io.verdict.core.review.EscalationState;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewPass;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EscalationHandlerTest {

    private static final ItemTypePolicy POLICY =
            ItemTypePolicy.of(2, PassKinds.STYLE, PassKinds.FACT_CHECK);
    private static final Instant NOW = Instant.parse("2026-05-04T09:00:00Z");

    private final EscalationHandler handler = new EscalationHandler(new ConsensusEvaluator());

    private ItemReview item(ReviewPass... passes) {
        ItemReview item = ItemReview.open("page:intro", INTRO_PAGE);
        for (ReviewPass p : passes) {
            item = item.withPass(p.withTimestamp(NOW));
        }
        return handler.recompute(item, POLICY);
    }

    private ItemReview vetoed() {
        return item(approve(PassKinds.STYLE, "r1"), reject(PassKinds.FACT_CHECK, "r2", "date conflict"));
    }

    @Nested
    class Escalate {

        @Test
        void shouldEscalateRejectedItemWithConflictingEvidence() {
            ItemReview escalated =
                    handler.escalate(
                            vetoed(), POLICY, "reviewers disagree", List.of("page:syllabus"), "lead", NOW);

            assertThat(escalated.status()).isEqualTo(ItemStatus.ESCALATION_PENDING);
            assertThat(escalated.escalation().state()).isEqualTo(EscalationState.PENDING);
            assertThat(escalated.escalation().evidence()).containsExactly("page:syllabus");
            assertThat(escalated.escalation().conflictingPasses())
                    .extracting(ReviewPass::getReviewerId)
                    .containsExactly("r2");
        }

        @Test
        void shouldRefuseToEscalatePendingItem() {
            ItemReview pending = item(approve(PassKinds.STYLE, "r1"));

            assertThatThrownBy(() -> handler.escalate(pending, POLICY, "why", null, "lead", NOW))
                    .isInstanceOf(InvalidStateException.class)
                    .hasMessageContaining("PENDING");
        }

        @Test
        void shouldRefuseToEscalateApprovedItem() {
            ItemReview approved =
                    item(approve(PassKinds.STYLE, "r1"), approve(PassKinds.FACT_CHECK, "r2"));

            assertThatThrownBy(() -> handler.escalate(approved, POLICY, "why", null, "lead", NOW))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        void shouldRefuseToEscalateTwice() {
            ItemReview escalated = handler.escalate(vetoed(), POLICY, "why", null, "lead", NOW);

            assertThatThrownBy(() -> handler.escalate(escalated, POLICY, "again", null, "lead", NOW))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        void shouldRequireReason() {
            assertThatThrownBy(() -> handler.escalate(vetoed(), POLICY, " ", null, "lead", NOW))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    class Resolve {

        @Test
        void shouldStayEscalatedWhileOrdinaryPassesArrive() {
            ItemReview escalated = handler.escalate(vetoed(), POLICY, "why", null, "lead", NOW);

            ItemReview updated =
                    handler.recompute(
                            escalated.withPass(approve(PassKinds.STYLE, "r5").withTimestamp(NOW)),
                            POLICY);

            assertThat(updated.status()).isEqualTo(ItemStatus.ESCALATION_PENDING);
        }

        @Test
        void shouldApproveWhenOverrideApproves() {
            ItemReview escalated = handler.escalate(vetoed(), POLICY, "why", null, "lead", NOW);
            ReviewPass decision =
                    override("r3", Decision.APPROVED, "confirmed correct").withTimestamp(NOW);

            ItemReview resolved = handler.resolve(escalated.withPass(decision), POLICY, decision);

            assertThat(resolved.status()).isEqualTo(ItemStatus.APPROVED);
            assertThat(resolved.escalation().state()).isEqualTo(EscalationState.RESOLVED_APPROVED);
            assertThat(resolved.escalation().resolvedBy()).isEqualTo("r3");
            assertThat(resolved.escalation().resolution()).isEqualTo("confirmed correct");
        }

        @Test
        void shouldRequestRevisionWhenOverrideRejects() {
            ItemReview escalated = handler.escalate(vetoed(), POLICY, "why", null, "lead", NOW);
            ReviewPass decision = override("r3", Decision.REJECTED, "fix the date").withTimestamp(NOW);

            ItemReview resolved = handler.resolve(escalated.withPass(decision), POLICY, decision);

            assertThat(resolved.status()).isEqualTo(ItemStatus.REJECTED);
            assertThat(resolved.escalation().state()).isEqualTo(EscalationState.RESOLVED_REVISE);
        }

        @Test
        void shouldRefuseOverrideWithoutPendingEscalation() {
            ReviewPass decision = override("r3", Decision.APPROVED, "ok").withTimestamp(NOW);
            ItemReview item = vetoed().withPass(decision);

            assertThatThrownBy(() -> handler.resolve(item, POLICY, decision))
                    .isInstanceOf(InvalidStateException.class);
        }
    }
}
