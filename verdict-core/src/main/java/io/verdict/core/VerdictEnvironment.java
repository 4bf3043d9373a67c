package io.verdict.core;

import io.verdict.core.engine.ReviewEngine;
import io.verdict.core.merge.MergeCoordinator;
import io.verdict.core.policy.WorkflowPolicy;
import io.verdict.core.storage.SessionRepository;
import io.verdict.core.storage.SessionStore;
import java.util.concurrent.ExecutorService;

/// Container holding the wired review engine and its components.
///
/// Implements {@link AutoCloseable} to release the merge thread pool when the environment
/// created it.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link VerdictFactory} rather than direct construction.
///
/// @see VerdictFactory.Builder
public final class VerdictEnvironment implements AutoCloseable {

    private final ReviewEngine reviewEngine;
    private final SessionStore sessionStore;
    private final MergeCoordinator mergeCoordinator;
    private final SessionRepository sessionRepository;
    private final WorkflowPolicy workflowPolicy;
    private final ExecutorService mergeExecutor;
    private final boolean ownsMergeExecutor;

    public VerdictEnvironment(
            ReviewEngine reviewEngine,
            SessionStore sessionStore,
            MergeCoordinator mergeCoordinator,
            SessionRepository sessionRepository,
            WorkflowPolicy workflowPolicy,
            ExecutorService mergeExecutor,
            boolean ownsMergeExecutor) {
        this.reviewEngine = reviewEngine;
        this.sessionStore = sessionStore;
        this.mergeCoordinator = mergeCoordinator;
        this.sessionRepository = sessionRepository;
        this.workflowPolicy = workflowPolicy;
        this.mergeExecutor = mergeExecutor;
        this.ownsMergeExecutor = ownsMergeExecutor;
    }

    /// Returns the facade exposing the public operation set.
    ///
    /// @return the engine, never null
    public ReviewEngine getReviewEngine() {
        return reviewEngine;
    }

    public SessionStore getSessionStore() {
        return sessionStore;
    }

    public MergeCoordinator getMergeCoordinator() {
        return mergeCoordinator;
    }

    /// Returns the repository holding session records.
    ///
    /// Defaults to {@link io.verdict.core.storage.InMemorySessionRepository} when no custom
    /// implementation is registered via {@link VerdictFactory.Builder}.
    ///
    /// @return the repository, never null
    public SessionRepository getSessionRepository() {
        return sessionRepository;
    }

    public WorkflowPolicy getWorkflowPolicy() {
        return workflowPolicy;
    }

    /// Shuts down the merge executor if this environment created it.
    ///
    /// An executor supplied through {@link VerdictFactory.Builder#mergeExecutor} is left
    /// running for its owner to stop.
    ///
    /// @implNote Calls `ExecutorService.shutdown()` which does not block; a merge already
    /// running completes.
    @Override
    public void close() {
        if (ownsMergeExecutor) {
            mergeExecutor.shutdown();
        }
    }
}
