package io.verdict.core.merge;

import io.verdict.core.exception.MergeConflictException;
import io.verdict.core.exception.MergeTimeoutException;
import io.verdict.core.exception.NotMergeableException;
import io.verdict.core.exception.VerdictException;
import io.verdict.core.listener.CompositeReviewListener;
import io.verdict.core.listener.ReviewListener;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewSession;
import io.verdict.core.storage.SessionStore;
import io.verdict.core.workspace.DriftEntry;
import io.verdict.core.workspace.RemoteSyncChecker;
import io.verdict.core.workspace.WorkspaceConflictException;
import io.verdict.core.workspace.WorkspaceException;
import io.verdict.core.workspace.WorkspaceManager;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Validates, merges and archives a review session.
///
/// ### Merge sequence
/// 1. Reserve the session; a concurrent merge of the same session fails fast with
///    {@link io.verdict.core.exception.ConflictException}.
/// 2. Re-validate the reserved snapshot: every item `APPROVED`, no escalation pending,
///    at least one item. Otherwise {@link NotMergeableException}.
/// 3. Merge the workspace on the merge executor, bounded by `mergeTimeout`.
///    Conflicts and other workspace failures map to {@link MergeConflictException}, a timeout to
///    {@link MergeTimeoutException}; the session stays unarchived and retry is safe.
/// 4. Archive the session. This is the only irreversible step.
/// 5. Remove the workspace, best effort: a failure is logged, never rolled back.
/// 6. Ask the remote-sync checker for drift and attach its report.
///
/// @implNote Thread-safe. The reservation is held from step 1 until the method returns.
///
/// @see SessionStore#reserveForMerge(String)
public class MergeCoordinator {

    private static final Logger logger = Logger.getLogger(MergeCoordinator.class.getName());

    private final SessionStore store;
    private final WorkspaceManager workspaceManager;
    private final RemoteSyncChecker syncChecker;
    private final ExecutorService mergeExecutor;
    private final Duration mergeTimeout;
    private final ReviewListener listener;

    public MergeCoordinator(
            SessionStore store,
            WorkspaceManager workspaceManager,
            RemoteSyncChecker syncChecker,
            ExecutorService mergeExecutor,
            Duration mergeTimeout,
            ReviewListener listener) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.workspaceManager =
                Objects.requireNonNull(workspaceManager, "workspaceManager must not be null");
        this.syncChecker = Objects.requireNonNull(syncChecker, "syncChecker must not be null");
        this.mergeExecutor =
                Objects.requireNonNull(mergeExecutor, "mergeExecutor must not be null");
        this.mergeTimeout = Objects.requireNonNull(mergeTimeout, "mergeTimeout must not be null");
        this.listener =
                new CompositeReviewListener(
                        Objects.requireNonNull(listener, "listener must not be null"));
    }

    /// Merges an approved session into the baseline and archives it.
    ///
    /// @param sessionId session to merge, not null
    /// @param approverId approver id recorded as `mergedBy`, not null
    /// @param summary free-text merge summary, may be null
    /// @return the merge result, never null
    /// @throws NotMergeableException if the session is empty, has unapproved items or a
    ///     pending escalation
    /// @throws MergeConflictException if the workspace system reports a conflict
    /// @throws MergeTimeoutException if the merge did not finish within the timeout
    /// @throws io.verdict.core.exception.ConflictException if the session is already
    ///     being merged
    public MergeResult approveAndMerge(String sessionId, String approverId, String summary) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(approverId, "approverId must not be null");

        ReviewSession snapshot = store.reserveForMerge(sessionId);
        try {
            ensureMergeable(snapshot);
            logger.info("Merging session " + sessionId + " approved by " + approverId);

            String mergeReference = mergeWorkspace(sessionId);
            ReviewSession archived =
                    store.archive(
                            sessionId, snapshot.version(), approverId, mergeReference, summary);

            boolean removed = removeWorkspace(sessionId);
            List<DriftEntry> drift = List.of();
            boolean driftChecked = true;
            try {
                drift = syncChecker.checkDrift(sessionId);
            } catch (WorkspaceException | RuntimeException e) {
                driftChecked = false;
                logger.log(Level.WARNING, "Remote sync check failed for session " + sessionId, e);
            }
            return new MergeResult(archived, mergeReference, removed, drift, driftChecked);
        } catch (VerdictException e) {
            listener.onMergeFailed(sessionId, e);
            throw e;
        } finally {
            store.releaseMerge(sessionId);
        }
    }

    private void ensureMergeable(ReviewSession session) {
        if (session.items().isEmpty()) {
            throw new NotMergeableException(
                    session.sessionId(),
                    List.of(),
                    "Session " + session.sessionId() + " has no reviewed items");
        }
        List<String> blocking = new ArrayList<>();
        for (ItemReview item : session.items().values()) {
            if (item.status() != ItemStatus.APPROVED || item.escalationPending()) {
                blocking.add(item.itemId());
            }
        }
        if (!blocking.isEmpty()) {
            throw new NotMergeableException(
                    session.sessionId(),
                    blocking,
                    "Session "
                            + session.sessionId()
                            + " has items that are not approved: "
                            + String.join(", ", blocking));
        }
    }

    private String mergeWorkspace(String sessionId) {
        Future<String> merge =
                mergeExecutor.submit(() -> workspaceManager.mergeWorkspace(sessionId));
        try {
            String reference = merge.get(mergeTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (reference == null || reference.isBlank()) {
                throw new MergeConflictException(
                        "Workspace system returned no commit reference for " + sessionId,
                        List.of(),
                        null);
            }
            return reference;
        } catch (TimeoutException e) {
            merge.cancel(true);
            throw new MergeTimeoutException(
                    "Merge of session " + sessionId + " did not finish within " + mergeTimeout, e);
        } catch (InterruptedException e) {
            merge.cancel(true);
            Thread.currentThread().interrupt();
            throw new MergeTimeoutException("Interrupted while merging session " + sessionId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof WorkspaceConflictException conflict) {
                throw new MergeConflictException(
                        "Merge of session " + sessionId + " conflicts: " + conflict.getMessage(),
                        conflict.getConflictingPaths(),
                        conflict);
            }
            throw new MergeConflictException(
                    "Merge of session " + sessionId + " failed: " + cause.getMessage(),
                    List.of(),
                    cause);
        }
    }

    private boolean removeWorkspace(String sessionId) {
        try {
            workspaceManager.removeWorkspace(sessionId);
            return true;
        } catch (WorkspaceException | RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Session " + sessionId + " archived but its workspace could not be removed",
                    e);
            return false;
        }
    }
}
