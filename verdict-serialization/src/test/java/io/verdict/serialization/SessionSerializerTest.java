package io.verdict.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.verdict.core.review.Decision;
import io.verdict.core.review.Escalation;
import io.verdict.core.review.ItemMetadata;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewPass;
import io.verdict.core.review.ReviewSession;
import io.verdict.core.review.Severity;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SessionSerializerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T09:00:00Z");

    private static ReviewPass styleApproval() {
        return ReviewPass.builder()
                .passKind("style")
                .reviewerId("r1")
                .reviewerRole("style_agent")
                .decision(Decision.APPROVED)
                .reasoning("reads well")
                .timestamp(CREATED.plusSeconds(10))
                .build();
    }

    private static ReviewPass factRejection() {
        return ReviewPass.builder()
                .passKind("fact_check")
                .reviewerId("r2")
                .decision(Decision.REJECTED)
                .reasoning("date conflict")
                .severity(Severity.HIGH)
                .references(List.of("page:timeline", "page:sources"))
                .timestamp(CREATED.plusSeconds(20))
                .build();
    }

    private static ReviewSession escalatedSession() {
        ItemReview intro =
                ItemReview.open("page:intro", ItemMetadata.of("Introduction", "pages"))
                        .withPass(styleApproval())
                        .withPass(factRejection())
                        .withEscalation(
                                Escalation.open(
                                        "reviewers disagree",
                                        List.of("page:timeline"),
                                        List.of(factRejection()),
                                        "approver",
                                        CREATED.plusSeconds(30)))
                        .withStatus(ItemStatus.ESCALATION_PENDING);
        ItemReview quiz =
                ItemReview.open("quiz:week-1", ItemMetadata.of("Week 1", "quizzes"))
                        .withPass(styleApproval());
        return ReviewSession.create("ws-42", CREATED).withItem(intro).withItem(quiz);
    }

    @Nested
    class WholeSession {

        @Test
        void shouldPreserveEveryFieldOfAnEscalatedSession() {
            // Given
            ReviewSession session = escalatedSession();

            // When
            ReviewSession restored = SessionSerializer.fromJson(SessionSerializer.toJson(session));

            // Then
            assertThat(restored).isEqualTo(session);
            assertThat(restored.items()).containsOnlyKeys("page:intro", "quiz:week-1");
            assertThat(restored.item("page:intro").orElseThrow().escalationPending()).isTrue();
        }

        @Test
        void shouldPreserveArchiveMetadata() {
            // Given
            ReviewSession archived =
                    escalatedSession()
                            .archive(CREATED.plusSeconds(60), "approver", "abc123", "ship it");

            // When
            ReviewSession restored =
                    SessionSerializer.fromJson(SessionSerializer.toJson(archived));

            // Then
            assertThat(restored.archived()).isTrue();
            assertThat(restored.mergedBy()).isEqualTo("approver");
            assertThat(restored.mergeReference()).isEqualTo("abc123");
            assertThat(restored.mergeSummary()).isEqualTo("ship it");
        }

        @Test
        void shouldWriteDecisionsAndTimestampsAsText() {
            // When
            String json = SessionSerializer.toJson(escalatedSession());

            // Then
            assertThat(json)
                    .contains("\"decision\" : \"rejected\"")
                    .contains("\"createdAt\" : \"2026-03-01T09:00:00Z\"")
                    .contains("\"passKind\" : \"fact_check\"")
                    .doesNotContain("toBuilder");
        }

        @Test
        void shouldIgnoreUnknownProperties() {
            // Given
            String json =
                    "{\"sessionId\":\"ws-1\",\"createdAt\":\"2026-03-01T09:00:00Z\","
                            + "\"items\":{},\"version\":3,\"futureField\":true}";

            // When
            ReviewSession session = SessionSerializer.fromJson(json);

            // Then
            assertThat(session.sessionId()).isEqualTo("ws-1");
            assertThat(session.version()).isEqualTo(3L);
            assertThat(session.items()).isEmpty();
        }
    }

    @Nested
    class Items {

        @Test
        void shouldKeepFirstSubmissionOrder() {
            // Given
            ReviewSession session = escalatedSession();

            // When
            Map<String, ItemReview> items =
                    SessionSerializer.itemsFromJson(
                            SessionSerializer.itemsToJson(session.items().values()));

            // Then
            assertThat(items.keySet()).containsExactly("page:intro", "quiz:week-1");
            assertThat(items).isEqualTo(session.items());
        }

        @Test
        void shouldRejectDuplicateItemIds() {
            // Given
            ItemReview quiz = escalatedSession().item("quiz:week-1").orElseThrow();
            String json = SessionSerializer.itemsToJson(List.of(quiz, quiz));

            // When / Then
            assertThatThrownBy(() -> SessionSerializer.itemsFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("quiz:week-1");
        }
    }

    @Nested
    class MalformedInput {

        @Test
        void shouldRejectUnknownDecision() {
            // Given
            String json =
                    "[{\"itemId\":\"page:a\",\"itemTitle\":\"A\",\"itemType\":\"pages\","
                            + "\"status\":\"PENDING\",\"passes\":[{\"passKind\":\"style\","
                            + "\"reviewerId\":\"r1\",\"decision\":\"maybe\","
                            + "\"reasoning\":\"x\"}]}]";

            // When / Then
            assertThatThrownBy(() -> SessionSerializer.itemsFromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Failed to deserialize items");
        }

        @Test
        void shouldRejectSessionWithoutId() {
            // Given
            String json = "{\"createdAt\":\"2026-03-01T09:00:00Z\",\"items\":{}}";

            // When / Then
            assertThatThrownBy(() -> SessionSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
