package io.verdict.core.access;

import static org.assertj.core.api.Assertions.assertThat;

import io.verdict.core.policy.PassKinds;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class RoleBasedAccessPolicyTest {

    private final RoleBasedAccessPolicy policy = new RoleBasedAccessPolicy();

    private static AccessTarget submit(String passKind) {
        return new AccessTarget("ws-1", "pages", passKind);
    }

    @ParameterizedTest
    @CsvSource({
        "style_agent, style, true",
        "style_agent, fact_check, false",
        "fact_check_agent, fact_check, true",
        "consistency_agent, consistency, true",
        "consistency_agent, human_override, false",
        "content_agent, style, false",
        "approval_agent, fact_check, true",
        "approval_agent, human_override, true"
    })
    void shouldLimitSubmissionsToTheRolesOwnKind(String role, String passKind, boolean allowed) {
        CallerContext caller = CallerContext.of("agent", role);

        assertThat(policy.isAllowed(caller, Operation.SUBMIT_REVIEW, submit(passKind))).isEqualTo(allowed);
    }

    @Test
    void shouldReserveEscalationAndMergeForApprovers() {
        CallerContext approver = CallerContext.of("a", RoleBasedAccessPolicy.APPROVAL_AGENT);
        CallerContext styler = CallerContext.of("s", RoleBasedAccessPolicy.STYLE_AGENT);
        AccessTarget session = AccessTarget.session("ws-1");

        assertThat(policy.isAllowed(approver, Operation.ESCALATE, session)).isTrue();
        assertThat(policy.isAllowed(approver, Operation.APPROVE_AND_MERGE, session)).isTrue();
        assertThat(policy.isAllowed(styler, Operation.ESCALATE, session)).isFalse();
        assertThat(policy.isAllowed(styler, Operation.APPROVE_AND_MERGE, session)).isFalse();
    }

    @Test
    void shouldGiveUnknownRolesReadOnlyAccess() {
        CallerContext stranger = CallerContext.of("x", "translator_agent");

        assertThat(policy.isAllowed(stranger, Operation.READ, AccessTarget.any())).isTrue();
        assertThat(policy.isAllowed(stranger, Operation.CREATE_SESSION, AccessTarget.any())).isFalse();
        assertThat(policy.isAllowed(stranger, Operation.SUBMIT_REVIEW, submit(PassKinds.STYLE))).isFalse();
    }

    @Test
    void shouldAllowOperatorsWithoutRole() {
        CallerContext operator = CallerContext.operator("admin");

        assertThat(policy.isAllowed(operator, Operation.APPROVE_AND_MERGE, AccessTarget.session("ws-1")))
                .isTrue();
    }

    @Test
    void shouldEnforceItemTypeScope() {
        CallerContext quizStyler =
                new CallerContext("s", RoleBasedAccessPolicy.STYLE_AGENT, Set.of("quizzes"));

        assertThat(policy.isAllowed(quizStyler, Operation.SUBMIT_REVIEW, submit(PassKinds.STYLE))).isFalse();
        assertThat(
                        policy.isAllowed(
                                quizStyler,
                                Operation.SUBMIT_REVIEW,
                                new AccessTarget("ws-1", "quizzes", PassKinds.STYLE)))
                .isTrue();
    }
}
