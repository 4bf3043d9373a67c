package io.verdict.core;

import io.verdict.core.access.AccessPolicy;
import io.verdict.core.consensus.ConsensusEvaluator;
import io.verdict.core.engine.ReviewEngine;
import io.verdict.core.escalation.EscalationHandler;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.listener.CompositeReviewListener;
import io.verdict.core.listener.ReviewListener;
import io.verdict.core.merge.MergeCoordinator;
import io.verdict.core.policy.WorkflowPolicy;
import io.verdict.core.storage.InMemorySessionRepository;
import io.verdict.core.storage.SessionRepository;
import io.verdict.core.storage.SessionStore;
import io.verdict.core.workspace.RemoteSyncChecker;
import io.verdict.core.workspace.UnconfiguredWorkspaceManager;
import io.verdict.core.workspace.WorkspaceManager;
import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Factory for creating and wiring Verdict review environments.
///
/// ### Usage Patterns
///
/// **Builder with explicit collaborators** (recommended):
/// {@snippet :
/// var env = VerdictFactory.builder()
///     .config(VerdictConfig.builder().mergeTimeout(Duration.ofMinutes(2)).build())
///     .policy(WorkflowPolicy.defaults())
///     .workspaceManager(gitWorkspaces)
///     .accessPolicy(new RoleBasedAccessPolicy())
///     .build();
/// }
///
/// **Quick start** (in-memory storage, default policy, no workspace system):
/// {@snippet :
/// var env = VerdictFactory.createEnvironment();
/// }
///
/// @implNote Utility class with only static methods. All dependencies are wired
/// explicitly via constructor injection in created components.
///
/// @see VerdictEnvironment
/// @see VerdictConfig
public final class VerdictFactory {

    private static final Logger logger = Logger.getLogger(VerdictFactory.class.getName());

    static final String MERGE_TIMEOUT_KEY = "verdict.merge.timeout";
    static final String MERGE_POOL_SIZE_KEY = "verdict.merge.pool-size";
    static final String MAX_APPEND_ATTEMPTS_KEY = "verdict.store.max-append-attempts";
    static final String STORAGE_TYPE_KEY = "verdict.store.type";

    private VerdictFactory() {}

    /// Creates an environment with default configuration.
    ///
    /// @return a fully-wired environment, never null
    public static VerdictEnvironment createEnvironment() {
        return builder().build();
    }

    /// Creates an environment with custom configuration and default collaborators.
    ///
    /// @param config configuration options, not null
    /// @return a fully-wired environment, never null
    public static VerdictEnvironment createEnvironment(VerdictConfig config) {
        return builder().config(config).build();
    }

    /// Reads configuration from properties, falling back to defaults for absent keys.
    ///
    /// Recognized keys:
    /// - `verdict.merge.timeout`: ISO-8601 duration (`PT5M`) or whole seconds
    /// - `verdict.merge.pool-size`: positive integer
    /// - `verdict.store.max-append-attempts`: positive integer
    /// - `verdict.store.type`: `memory` or `jdbc`
    ///
    /// @param properties source properties, not null
    /// @return populated configuration, never null
    /// @throws ValidationException if a value cannot be parsed
    public static VerdictConfig loadConfigFromProperties(Properties properties) {
        VerdictConfig config = new VerdictConfig();
        String timeout = properties.getProperty(MERGE_TIMEOUT_KEY);
        if (timeout != null && !timeout.isBlank()) {
            config.setMergeTimeout(parseDuration(MERGE_TIMEOUT_KEY, timeout.trim()));
        }
        String poolSize = properties.getProperty(MERGE_POOL_SIZE_KEY);
        if (poolSize != null && !poolSize.isBlank()) {
            config.setMergeThreadPoolSize(parsePositive(MERGE_POOL_SIZE_KEY, poolSize.trim()));
        }
        String attempts = properties.getProperty(MAX_APPEND_ATTEMPTS_KEY);
        if (attempts != null && !attempts.isBlank()) {
            config.setMaxAppendAttempts(parsePositive(MAX_APPEND_ATTEMPTS_KEY, attempts.trim()));
        }
        String storageType = properties.getProperty(STORAGE_TYPE_KEY);
        if (storageType != null && !storageType.isBlank()) {
            config.setStorageType(storageType.trim());
        }
        return config;
    }

    private static Duration parseDuration(String key, String value) {
        Duration parsed;
        try {
            parsed =
                    value.chars().allMatch(Character::isDigit)
                            ? Duration.ofSeconds(Long.parseLong(value))
                            : Duration.parse(value);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new ValidationException("Invalid duration for " + key + ": " + value, e);
        }
        if (parsed.isNegative() || parsed.isZero()) {
            throw new ValidationException(key + " must be positive: " + value);
        }
        return parsed;
    }

    private static int parsePositive(String key, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid integer for " + key + ": " + value, e);
        }
        if (parsed < 1) {
            throw new ValidationException(key + " must be at least 1: " + value);
        }
        return parsed;
    }

    private static ExecutorService createMergeExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory =
                runnable -> {
                    Thread thread =
                            new Thread(runnable, "verdict-merge-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                };
        return Executors.newFixedThreadPool(threads, factory);
    }

    /// Creates a new builder.
    ///
    /// @return a new builder, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link VerdictEnvironment} instances.
    ///
    /// Unset collaborators default to: in-memory repository, {@link WorkflowPolicy#defaults()},
    /// a workspace manager that refuses every call, no drift checking, allow-all access,
    /// no listeners and the system UTC clock.
    ///
    /// @implNote **Not thread-safe**. Intended for single-threaded configuration before
    /// calling {@link #build()}.
    public static class Builder {
        private VerdictConfig config = new VerdictConfig();
        private WorkflowPolicy policy;
        private SessionRepository repository;
        private WorkspaceManager workspaceManager;
        private RemoteSyncChecker syncChecker = RemoteSyncChecker.NONE;
        private AccessPolicy accessPolicy = AccessPolicy.ALLOW_ALL;
        private final List<ReviewListener> listeners = new ArrayList<>();
        private Clock clock = Clock.systemUTC();
        private ExecutorService mergeExecutor;

        public Builder config(VerdictConfig config) {
            this.config = config;
            return this;
        }

        /// Sets the workflow policy.
        ///
        /// @param policy per item type pass requirements, not null
        /// @return this builder for chaining, never null
        public Builder policy(WorkflowPolicy policy) {
            this.policy = policy;
            return this;
        }

        /// Sets the session repository.
        ///
        /// @param repository durable session storage, not null
        /// @return this builder for chaining, never null
        public Builder repository(SessionRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder workspaceManager(WorkspaceManager workspaceManager) {
            this.workspaceManager = workspaceManager;
            return this;
        }

        public Builder syncChecker(RemoteSyncChecker syncChecker) {
            this.syncChecker = syncChecker;
            return this;
        }

        public Builder accessPolicy(AccessPolicy accessPolicy) {
            this.accessPolicy = accessPolicy;
            return this;
        }

        /// Adds a lifecycle listener. Listeners are notified in registration order.
        ///
        /// @param listener the listener, not null
        /// @return this builder for chaining, never null
        public Builder listener(ReviewListener listener) {
            this.listeners.add(listener);
            return this;
        }

        /// Sets the clock used for session, pass and archive timestamps.
        ///
        /// @param clock the clock, not null
        /// @return this builder for chaining, never null
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /// Sets an externally managed merge executor.
        ///
        /// When unset, a fixed pool of `config.mergeThreadPoolSize` daemon threads is created
        /// and shut down by {@link VerdictEnvironment#close()}. A supplied executor is never
        /// shut down by the environment.
        ///
        /// @param mergeExecutor executor running workspace merges, not null
        /// @return this builder for chaining, never null
        public Builder mergeExecutor(ExecutorService mergeExecutor) {
            this.mergeExecutor = mergeExecutor;
            return this;
        }

        /// Wires and returns the environment.
        ///
        /// @return a fully-wired environment, never null
        public VerdictEnvironment build() {
            WorkflowPolicy effectivePolicy = policy != null ? policy : WorkflowPolicy.defaults();
            SessionRepository effectiveRepository =
                    repository != null ? repository : new InMemorySessionRepository();
            WorkspaceManager effectiveWorkspaces =
                    workspaceManager != null
                            ? workspaceManager
                            : new UnconfiguredWorkspaceManager();
            ExecutorService executor =
                    mergeExecutor != null
                            ? mergeExecutor
                            : createMergeExecutor(config.getMergeThreadPoolSize());
            ReviewListener listener = new CompositeReviewListener(listeners);

            EscalationHandler escalationHandler = new EscalationHandler(new ConsensusEvaluator());
            SessionStore store =
                    new SessionStore(
                            effectiveRepository,
                            effectivePolicy,
                            escalationHandler,
                            listener,
                            clock,
                            config.getMaxAppendAttempts());
            MergeCoordinator mergeCoordinator =
                    new MergeCoordinator(
                            store,
                            effectiveWorkspaces,
                            syncChecker,
                            executor,
                            config.getMergeTimeout(),
                            listener);
            ReviewEngine engine =
                    new ReviewEngine(store, mergeCoordinator, effectiveWorkspaces, accessPolicy);

            logger.info(
                    "Verdict environment ready: storage="
                            + effectiveRepository.getClass().getSimpleName()
                            + ", itemTypes="
                            + effectivePolicy.itemTypes().keySet()
                            + ", mergeTimeout="
                            + config.getMergeTimeout());
            return new VerdictEnvironment(
                    engine,
                    store,
                    mergeCoordinator,
                    effectiveRepository,
                    effectivePolicy,
                    executor,
                    mergeExecutor == null);
        }
    }
}
