package io.verdict.core.engine;

import io.verdict.core.access.AccessPolicy;
import io.verdict.core.access.AccessTarget;
import io.verdict.core.access.CallerContext;
import io.verdict.core.access.Operation;
import io.verdict.core.exception.AccessDeniedException;
import io.verdict.core.exception.StorageException;
import io.verdict.core.exception.VerdictException;
import io.verdict.core.merge.MergeCoordinator;
import io.verdict.core.merge.MergeResult;
import io.verdict.core.review.ConflictReport;
import io.verdict.core.review.ItemHistoryEntry;
import io.verdict.core.review.ItemMetadata;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ReviewPass;
import io.verdict.core.review.ReviewSession;
import io.verdict.core.review.SessionSummary;
import io.verdict.core.storage.SessionStore;
import io.verdict.core.workspace.WorkspaceException;
import io.verdict.core.workspace.WorkspaceManager;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Public operation set of the review engine.
///
/// Every operation takes the caller's identity explicitly, asks the {@link AccessPolicy}
/// whether the caller may proceed, and delegates to the {@link SessionStore} or the
/// {@link MergeCoordinator}. Rejected and escalated items are ordinary results; only
/// failed operations throw, always with a subclass of {@link VerdictException}.
///
/// ### Usage
/// {@snippet :
/// try (VerdictEnvironment env = VerdictFactory.builder().workspaceManager(git).build()) {
///     ReviewEngine engine = env.getReviewEngine();
///     CallerContext style = CallerContext.of("style-1", "style_agent");
///     engine.submitReview(style, "ws-42", "page:intro",
///             ItemMetadata.of("Introduction", "pages"), pass);
/// }
/// }
///
/// @implNote Thread-safe.
public class ReviewEngine {

    private static final Logger logger = Logger.getLogger(ReviewEngine.class.getName());

    private final SessionStore store;
    private final MergeCoordinator mergeCoordinator;
    private final WorkspaceManager workspaceManager;
    private final AccessPolicy accessPolicy;

    public ReviewEngine(
            SessionStore store,
            MergeCoordinator mergeCoordinator,
            WorkspaceManager workspaceManager,
            AccessPolicy accessPolicy) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.mergeCoordinator =
                Objects.requireNonNull(mergeCoordinator, "mergeCoordinator must not be null");
        this.workspaceManager =
                Objects.requireNonNull(workspaceManager, "workspaceManager must not be null");
        this.accessPolicy = Objects.requireNonNull(accessPolicy, "accessPolicy must not be null");
    }

    /// Creates an empty session for an existing workspace.
    public ReviewSession createSession(CallerContext caller, String sessionId) {
        authorize(caller, Operation.CREATE_SESSION, AccessTarget.session(sessionId));
        return store.createSession(sessionId);
    }

    /// Creates a new workspace from `base` and a session keyed by its id.
    ///
    /// If the session cannot be created, the new workspace is removed again.
    ///
    /// @param caller who is asking, not null
    /// @param base baseline to branch from, not null
    /// @return the new, empty session, never null
    /// @throws StorageException if the workspace system could not create the workspace
    public ReviewSession openWorkspaceSession(CallerContext caller, String base) {
        authorize(caller, Operation.CREATE_SESSION, AccessTarget.any());
        Objects.requireNonNull(base, "base must not be null");

        String workspaceId;
        try {
            workspaceId = workspaceManager.createWorkspace(base);
        } catch (WorkspaceException e) {
            throw new StorageException("Could not create a workspace from " + base, e);
        }
        try {
            return store.createSession(workspaceId);
        } catch (VerdictException e) {
            try {
                workspaceManager.removeWorkspace(workspaceId);
            } catch (WorkspaceException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    /// Submits a review pass for an item.
    ///
    /// @param caller the reviewer, whose id must equal the pass's `reviewerId`, not null
    /// @param sessionId target session, not null
    /// @param itemId item identifier, not null
    /// @param metadata item title and type, required on the item's first pass; access is
    ///     checked against the stored type once the item exists
    /// @param pass the verdict, not null
    /// @return the item as stored, never null
    /// @throws AccessDeniedException if the caller may not submit this pass
    public ItemReview submitReview(
            CallerContext caller,
            String sessionId,
            String itemId,
            ItemMetadata metadata,
            ReviewPass pass) {
        Objects.requireNonNull(pass, "pass must not be null");
        if (!caller.callerId().equals(pass.getReviewerId())) {
            throw denied(
                    caller, Operation.SUBMIT_REVIEW, "on behalf of " + pass.getReviewerId());
        }
        String itemType =
                store.findItemType(sessionId, itemId)
                        .orElse(metadata != null ? metadata.itemType() : null);
        authorize(
                caller,
                Operation.SUBMIT_REVIEW,
                new AccessTarget(sessionId, itemType, pass.getPassKind()));
        return store.appendPass(sessionId, itemId, metadata, pass);
    }

    public ReviewSession getSession(CallerContext caller, String sessionId) {
        authorize(caller, Operation.READ, AccessTarget.session(sessionId));
        return store.getSession(sessionId);
    }

    public List<ItemHistoryEntry> getItemHistory(
            CallerContext caller, String itemId, boolean includeArchived) {
        authorize(caller, Operation.READ, AccessTarget.any());
        return store.getItemHistory(itemId, includeArchived);
    }

    public SessionSummary getSessionStatus(CallerContext caller, String sessionId) {
        authorize(caller, Operation.READ, AccessTarget.session(sessionId));
        return store.getSessionStatus(sessionId);
    }

    /// Lists unresolved escalations of one session, or of all active sessions when
    /// `sessionId` is null.
    public List<ConflictReport> getConflicts(CallerContext caller, String sessionId) {
        authorize(
                caller,
                Operation.READ,
                sessionId != null ? AccessTarget.session(sessionId) : AccessTarget.any());
        return store.getConflicts(sessionId);
    }

    /// Escalates a vetoed item for human resolution.
    ///
    /// @throws io.verdict.core.exception.InvalidStateException if the item is not rejected
    public ItemReview escalate(
            CallerContext caller,
            String sessionId,
            String itemId,
            String reason,
            List<String> evidence) {
        String itemType =
                store.getSession(sessionId).item(itemId).map(ItemReview::itemType).orElse(null);
        authorize(caller, Operation.ESCALATE, new AccessTarget(sessionId, itemType, null));
        return store.escalate(sessionId, itemId, reason, evidence, caller.callerId());
    }

    /// Merges a fully approved session and archives it, with the caller as approver.
    ///
    /// @see MergeCoordinator#approveAndMerge(String, String, String)
    public MergeResult approveAndMerge(CallerContext caller, String sessionId, String summary) {
        authorize(caller, Operation.APPROVE_AND_MERGE, AccessTarget.session(sessionId));
        return mergeCoordinator.approveAndMerge(sessionId, caller.callerId(), summary);
    }

    private void authorize(CallerContext caller, Operation operation, AccessTarget target) {
        Objects.requireNonNull(caller, "caller must not be null");
        if (!accessPolicy.isAllowed(caller, operation, target)) {
            throw denied(
                    caller,
                    operation,
                    target.sessionId() != null ? "on session " + target.sessionId() : "");
        }
    }

    private static AccessDeniedException denied(
            CallerContext caller, Operation operation, String detail) {
        String message =
                "Caller "
                        + caller.callerId()
                        + (caller.role() != null ? " (" + caller.role() + ")" : "")
                        + " may not perform "
                        + operation
                        + (detail.isEmpty() ? "" : " " + detail);
        logger.log(Level.WARNING, message);
        return new AccessDeniedException(message);
    }
}
