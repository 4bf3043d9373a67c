package io.verdict.server.review;

import static org.assertj.core.api.Assertions.assertThatCode;

import io.verdict.core.exception.MergeTimeoutException;
import io.verdict.core.review.Decision;
import io.verdict.core.review.Escalation;
import io.verdict.core.review.ItemMetadata;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ReviewPass;
import io.verdict.core.review.ReviewSession;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class LoggingReviewListenerTest {

    private static final Instant T0 = Instant.parse("2026-02-01T10:00:00Z");

    private final LoggingReviewListener listener = new LoggingReviewListener();

    @Test
    void shouldLogEveryCallbackWithoutFailing() {
        // Given
        ReviewPass pass =
                ReviewPass.builder()
                        .passKind("fact_check")
                        .reviewerId("r2\nforged")
                        .decision(Decision.REJECTED)
                        .reasoning("x".repeat(500))
                        .timestamp(T0)
                        .build();
        ItemReview item =
                ItemReview.open("page:intro", ItemMetadata.of("Introduction", "pages"))
                        .withPass(pass);
        ItemReview escalated =
                item.withEscalation(
                        Escalation.open("dispute", List.of(), List.of(pass), "lead", T0));
        ReviewSession session = ReviewSession.create("ws-1", T0).withItem(escalated);

        // When / Then
        assertThatCode(
                        () -> {
                            listener.onSessionCreated(session);
                            listener.onPassAccepted("ws-1", item, pass);
                            listener.onEscalated("ws-1", escalated);
                            listener.onEscalated("ws-1", item);
                            listener.onEscalationResolved("ws-1", escalated);
                            listener.onSessionArchived(session.archive(T0, "lead", "abc", null));
                            listener.onMergeFailed("ws-1", new MergeTimeoutException("slow"));
                        })
                .doesNotThrowAnyException();
    }
}
