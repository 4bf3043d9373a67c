package io.verdict.core.listener;

import io.verdict.core.exception.VerdictException;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ReviewPass;
import io.verdict.core.review.ReviewSession;
import java.util.List;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Fans out review events to an ordered list of delegates.
///
/// Delegates are invoked in declaration order. An exception thrown by one delegate is
/// logged and does not prevent the remaining delegates from receiving the event, nor
/// does it reach the operation that raised the event.
///
/// @implNote Thread-safe if all delegates are thread-safe. Delegates are captured at
/// construction and never mutated.
public final class CompositeReviewListener implements ReviewListener {

    private static final Logger logger =
            Logger.getLogger(CompositeReviewListener.class.getName());

    private final List<ReviewListener> delegates;

    /// @param delegates listeners to notify, not null, elements not null
    public CompositeReviewListener(List<ReviewListener> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public CompositeReviewListener(ReviewListener... delegates) {
        this(List.of(delegates));
    }

    @Override
    public void onSessionCreated(ReviewSession session) {
        dispatch("onSessionCreated", d -> d.onSessionCreated(session));
    }

    @Override
    public void onPassAccepted(String sessionId, ItemReview item, ReviewPass pass) {
        dispatch("onPassAccepted", d -> d.onPassAccepted(sessionId, item, pass));
    }

    @Override
    public void onEscalated(String sessionId, ItemReview item) {
        dispatch("onEscalated", d -> d.onEscalated(sessionId, item));
    }

    @Override
    public void onEscalationResolved(String sessionId, ItemReview item) {
        dispatch("onEscalationResolved", d -> d.onEscalationResolved(sessionId, item));
    }

    @Override
    public void onSessionArchived(ReviewSession archived) {
        dispatch("onSessionArchived", d -> d.onSessionArchived(archived));
    }

    @Override
    public void onMergeFailed(String sessionId, VerdictException failure) {
        dispatch("onMergeFailed", d -> d.onMergeFailed(sessionId, failure));
    }

    private void dispatch(String event, Consumer<ReviewListener> call) {
        for (ReviewListener d : delegates) {
            try {
                call.accept(d);
            } catch (RuntimeException e) {
                logger.log(
                        Level.WARNING,
                        "Listener " + d.getClass().getName() + " failed on " + event,
                        e);
            }
        }
    }
}
