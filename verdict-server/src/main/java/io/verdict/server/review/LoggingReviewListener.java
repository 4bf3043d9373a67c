package io.verdict.server.review;

import static io.verdict.server.validation.LogSanitizer.abbreviate;
import static io.verdict.server.validation.LogSanitizer.sanitize;

import io.verdict.core.exception.VerdictException;
import io.verdict.core.listener.ReviewListener;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ReviewPass;
import io.verdict.core.review.ReviewSession;
import org.jboss.logging.Logger;

/// Writes the review lifecycle to the server log.
///
/// ### Log Format
/// ```
/// Session created: session=ws-42
/// Pass accepted: session=ws-42 item=page:intro kind=fact_check reviewer=r2 decision=rejected
///   status=REJECTED reasoning=date conflict
/// Item escalated: session=ws-42 item=page:intro reason=...
/// Session archived: session=ws-42 mergedBy=lead ref=abc123 items=3
/// ```
///
/// Every caller-supplied value passes through {@link io.verdict.server.validation.LogSanitizer}.
/// Reasoning is abbreviated to 200 characters.
///
/// @apiNote **Side effects**: writes to the JBoss log category
/// `io.verdict.server.review.LoggingReviewListener`. Merge failures are logged at WARN,
/// everything else at INFO.
///
/// @see io.verdict.core.listener.CompositeReviewListener
public class LoggingReviewListener implements ReviewListener {

    private static final Logger LOG = Logger.getLogger(LoggingReviewListener.class);

    static final int MAX_REASONING = 200;

    @Override
    public void onSessionCreated(ReviewSession session) {
        LOG.infov("Session created: session={0}", sanitize(session.sessionId()));
    }

    @Override
    public void onPassAccepted(String sessionId, ItemReview item, ReviewPass pass) {
        LOG.infov(
                "Pass accepted: session={0} item={1} kind={2} reviewer={3} decision={4}"
                        + " status={5} reasoning={6}",
                sanitize(sessionId),
                sanitize(item.itemId()),
                sanitize(pass.getPassKind()),
                sanitize(pass.getReviewerId()),
                pass.getDecision().wireName(),
                item.status(),
                abbreviate(pass.getReasoning(), MAX_REASONING));
    }

    @Override
    public void onEscalated(String sessionId, ItemReview item) {
        LOG.infov(
                "Item escalated: session={0} item={1} reason={2}",
                sanitize(sessionId),
                sanitize(item.itemId()),
                item.escalation() != null
                        ? abbreviate(item.escalation().reason(), MAX_REASONING)
                        : "");
    }

    @Override
    public void onEscalationResolved(String sessionId, ItemReview item) {
        LOG.infov(
                "Escalation resolved: session={0} item={1} state={2} status={3}",
                sanitize(sessionId),
                sanitize(item.itemId()),
                item.escalation() != null ? item.escalation().state() : null,
                item.status());
    }

    @Override
    public void onSessionArchived(ReviewSession archived) {
        LOG.infov(
                "Session archived: session={0} mergedBy={1} ref={2} items={3}",
                sanitize(archived.sessionId()),
                sanitize(archived.mergedBy()),
                sanitize(archived.mergeReference()),
                archived.items().size());
    }

    @Override
    public void onMergeFailed(String sessionId, VerdictException failure) {
        LOG.warnv(
                "Merge failed: session={0} error={1}: {2}",
                sanitize(sessionId),
                failure.getClass().getSimpleName(),
                sanitize(failure.getMessage()));
    }
}
