package io.verdict.core.engine;

import static io.verdict.core.ReviewFixtures.INTRO_PAGE;
import static io.verdict.core.ReviewFixtures.approve;
import static io.verdict.core.ReviewFixtures.override;
import static io.verdict.core.ReviewFixtures.reject;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.verdict.core.VerdictEnvironment;
import io.verdict.core.VerdictFactory;
import io.verdict.core.access.CallerContext;
import io.verdict.core.access.RoleBasedAccessPolicy;
import io.verdict.core.exception.AccessDeniedException;
import io.verdict.core.exception.ConflictException;
import io.verdict.core.exception.InvalidStateException;
import io.verdict.core.exception.StorageException;
import io.verdict.core.merge.MergeResult;
import io.verdict.core.policy.ItemTypePolicy;
import io.verdict.core.policy.PassKinds;
import io.verdict.core.policy.WorkflowPolicy;
import io.verdict.core.review.Decision;
import io.verdict.core.review.ItemMetadata;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewSession;
import io.verdict.core.workspace.WorkspaceException;
import io.verdict.core.workspace.WorkspaceManager;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReviewEngineTest {

    private static final CallerContext STYLE = CallerContext.of("r1", RoleBasedAccessPolicy.STYLE_AGENT);
    private static final CallerContext FACTS =
            CallerContext.of("r2", RoleBasedAccessPolicy.FACT_CHECK_AGENT);
    private static final CallerContext APPROVER =
            CallerContext.of("r3", RoleBasedAccessPolicy.APPROVAL_AGENT);
    private static final CallerContext CONTENT =
            CallerContext.of("writer", RoleBasedAccessPolicy.CONTENT_AGENT);

    @Mock private WorkspaceManager workspaceManager;

    private VerdictEnvironment env;
    private ReviewEngine engine;

    @BeforeEach
    void setUp() {
        env =
                VerdictFactory.builder()
                        .policy(
                                WorkflowPolicy.builder()
                                        .itemType(
                                                "pages",
                                                ItemTypePolicy.of(2, PassKinds.STYLE, PassKinds.FACT_CHECK))
                                        .build())
                        .workspaceManager(workspaceManager)
                        .accessPolicy(new RoleBasedAccessPolicy())
                        .build();
        engine = env.getReviewEngine();
    }

    @AfterEach
    void tearDown() {
        env.close();
    }

    @Test
    void shouldRunVetoEscalationOverrideAndMerge() throws Exception {
        // Given
        engine.createSession(CONTENT, "ws-1");
        when(workspaceManager.mergeWorkspace("ws-1")).thenReturn("c0ffee");

        // When
        engine.submitReview(STYLE, "ws-1", "page:intro", INTRO_PAGE, approve(PassKinds.STYLE, "r1"));
        ItemReview vetoed =
                engine.submitReview(
                        FACTS, "ws-1", "page:intro", null, reject(PassKinds.FACT_CHECK, "r2", "date conflict"));
        ItemReview escalated = engine.escalate(APPROVER, "ws-1", "page:intro", "reviewers disagree", List.of());
        ItemReview resolved =
                engine.submitReview(
                        APPROVER,
                        "ws-1",
                        "page:intro",
                        null,
                        override("r3", Decision.APPROVED, "confirmed correct"));
        MergeResult merged = engine.approveAndMerge(APPROVER, "ws-1", "intro reviewed");

        // Then
        assertThat(vetoed.status()).isEqualTo(ItemStatus.REJECTED);
        assertThat(escalated.status()).isEqualTo(ItemStatus.ESCALATION_PENDING);
        assertThat(resolved.status()).isEqualTo(ItemStatus.APPROVED);
        assertThat(merged.session().archivedAt()).isNotNull();
        assertThat(merged.session().mergedBy()).isEqualTo("r3");
        verify(workspaceManager).removeWorkspace("ws-1");
        assertThat(engine.getItemHistory(STYLE, "page:intro", true).get(0).mergeReference())
                .isEqualTo("c0ffee");
    }

    @Nested
    class Authorization {

        @BeforeEach
        void createSession() {
            engine.createSession(CONTENT, "ws-1");
        }

        @Test
        void shouldRefuseReviewAgentSubmittingAnotherKind() {
            assertThatThrownBy(
                            () ->
                                    engine.submitReview(
                                            STYLE, "ws-1", "page:intro", INTRO_PAGE, approve(PassKinds.FACT_CHECK, "r1")))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        void shouldRefusePassOnBehalfOfAnotherReviewer() {
            assertThatThrownBy(
                            () ->
                                    engine.submitReview(
                                            STYLE, "ws-1", "page:intro", INTRO_PAGE, approve(PassKinds.STYLE, "r9")))
                    .isInstanceOf(AccessDeniedException.class)
                    .hasMessageContaining("r9");
        }

        @Test
        void shouldRefuseEscalationAndMergeByReviewAgents() {
            engine.submitReview(STYLE, "ws-1", "page:intro", INTRO_PAGE, approve(PassKinds.STYLE, "r1"));

            assertThatThrownBy(() -> engine.escalate(STYLE, "ws-1", "page:intro", "why", null))
                    .isInstanceOf(AccessDeniedException.class);
            assertThatThrownBy(() -> engine.approveAndMerge(FACTS, "ws-1", null))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        void shouldRefuseSubmissionOutsideCallerScope() {
            CallerContext quizOnly =
                    new CallerContext("r1", RoleBasedAccessPolicy.STYLE_AGENT, Set.of("quizzes"));

            assertThatThrownBy(
                            () ->
                                    engine.submitReview(
                                            quizOnly, "ws-1", "page:intro", INTRO_PAGE, approve(PassKinds.STYLE, "r1")))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        void shouldCheckScopeAgainstStoredItemTypeNotSuppliedMetadata() {
            // Given
            try (VerdictEnvironment mixed =
                    VerdictFactory.builder()
                            .policy(
                                    WorkflowPolicy.builder()
                                            .itemType("pages", ItemTypePolicy.of(1, PassKinds.STYLE))
                                            .itemType("quizzes", ItemTypePolicy.of(1, PassKinds.STYLE))
                                            .build())
                            .accessPolicy(new RoleBasedAccessPolicy())
                            .build()) {
                ReviewEngine mixedEngine = mixed.getReviewEngine();
                mixedEngine.createSession(CONTENT, "ws-9");
                mixedEngine.submitReview(
                        STYLE, "ws-9", "quiz:q1", ItemMetadata.of("Quiz", "quizzes"), approve(PassKinds.STYLE, "r1"));
                CallerContext pagesOnly =
                        new CallerContext("r4", RoleBasedAccessPolicy.STYLE_AGENT, Set.of("pages"));

                // When / Then
                assertThatThrownBy(
                                () ->
                                        mixedEngine.submitReview(
                                                pagesOnly,
                                                "ws-9",
                                                "quiz:q1",
                                                ItemMetadata.of("Quiz", "pages"),
                                                approve(PassKinds.STYLE, "r4")))
                        .isInstanceOf(AccessDeniedException.class);
                assertThat(mixedEngine.getSession(CONTENT, "ws-9").item("quiz:q1").orElseThrow().passes())
                        .hasSize(1);
            }
        }

        @Test
        void shouldLetUnknownRolesRead() {
            CallerContext auditor = CallerContext.of("audit", "auditor");

            assertThat(engine.getSessionStatus(auditor, "ws-1").totalItems()).isZero();
            assertThatThrownBy(() -> engine.createSession(auditor, "ws-2"))
                    .isInstanceOf(AccessDeniedException.class);
        }
    }

    @Nested
    class Workspaces {

        @Test
        void shouldOpenSessionForNewWorkspace() throws Exception {
            when(workspaceManager.createWorkspace("main")).thenReturn("ws-7");

            ReviewSession session = engine.openWorkspaceSession(CONTENT, "main");

            assertThat(session.sessionId()).isEqualTo("ws-7");
            assertThat(engine.getSession(STYLE, "ws-7").items()).isEmpty();
        }

        @Test
        void shouldRemoveWorkspaceWhenSessionCannotBeCreated() throws Exception {
            engine.createSession(CONTENT, "ws-7");
            when(workspaceManager.createWorkspace("main")).thenReturn("ws-7");

            assertThatThrownBy(() -> engine.openWorkspaceSession(CONTENT, "main"))
                    .isInstanceOf(ConflictException.class);
            verify(workspaceManager).removeWorkspace("ws-7");
        }

        @Test
        void shouldReportWorkspaceCreationFailure() throws Exception {
            when(workspaceManager.createWorkspace("main")).thenThrow(new WorkspaceException("disk full"));

            assertThatThrownBy(() -> engine.openWorkspaceSession(CONTENT, "main"))
                    .isInstanceOf(StorageException.class);
        }
    }

    @Test
    void shouldRefuseEscalationOfApprovedItem() {
        engine.createSession(CONTENT, "ws-1");
        engine.submitReview(STYLE, "ws-1", "page:intro", INTRO_PAGE, approve(PassKinds.STYLE, "r1"));
        engine.submitReview(
                APPROVER, "ws-1", "page:intro", null, approve(PassKinds.FACT_CHECK, "r3"));

        assertThatThrownBy(() -> engine.escalate(APPROVER, "ws-1", "page:intro", "why", null))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void shouldListConflictsAcrossActiveSessions() {
        engine.createSession(CONTENT, "ws-1");
        engine.createSession(CONTENT, "ws-2");
        ItemMetadata syllabus = ItemMetadata.of("Syllabus", "pages");
        for (String ws : List.of("ws-1", "ws-2")) {
            engine.submitReview(STYLE, ws, "page:syllabus", syllabus, approve(PassKinds.STYLE, "r1"));
            engine.submitReview(
                    FACTS, ws, "page:syllabus", null, reject(PassKinds.FACT_CHECK, "r2", "old dates"));
        }
        engine.escalate(APPROVER, "ws-2", "page:syllabus", "needs the instructor", null);

        assertThat(engine.getConflicts(STYLE, null))
                .extracting(c -> c.sessionId())
                .containsExactly("ws-2");
    }
}
