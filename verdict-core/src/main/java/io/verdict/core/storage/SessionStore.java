package io.verdict.core.storage;

import io.verdict.core.escalation.EscalationHandler;
import io.verdict.core.exception.ConcurrencyException;
import io.verdict.core.exception.ConflictException;
import io.verdict.core.exception.InvalidStateException;
import io.verdict.core.exception.InvariantViolationException;
import io.verdict.core.exception.NotFoundException;
import io.verdict.core.exception.StorageException;
import io.verdict.core.exception.ValidationException;
import io.verdict.core.listener.CompositeReviewListener;
import io.verdict.core.listener.ReviewListener;
import io.verdict.core.policy.ItemTypePolicy;
import io.verdict.core.policy.PassKinds;
import io.verdict.core.policy.WorkflowPolicy;
import io.verdict.core.review.ConflictReport;
import io.verdict.core.review.ItemHistoryEntry;
import io.verdict.core.review.ItemMetadata;
import io.verdict.core.review.ItemRef;
import io.verdict.core.review.ItemReview;
import io.verdict.core.review.ItemStatus;
import io.verdict.core.review.ReviewPass;
import io.verdict.core.review.ReviewSession;
import io.verdict.core.review.SessionSummary;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.logging.Logger;

/// Persistence and query layer for review sessions.
///
/// Every write loads the active record, applies the change to an immutable copy and
/// stores it with a compare-and-set on the record version. Writers to the same session
/// are serialized by a per-session lock; sessions never contend with each other. A
/// version mismatch (another process wrote the same record) is retried internally and
/// only surfaces as {@link ConcurrencyException} once `maxAttempts` is exhausted.
///
/// ### Contracts
/// - **No lost updates**: N concurrent appends to one item leave exactly N new passes,
///   in acceptance order
/// - **Timestamps**: accepted passes carry the store's clock, never earlier than the
///   reviewer's previous pass in the same session
/// - **Reads**: never take the write lock; they return the last committed record
/// - **Invariant**: every stored item status is derivable from its passes and policy;
///   a record that breaks this is flagged for inspection and the operation aborts with
///   {@link InvariantViolationException}
///
/// While a merge holds the session (see {@link #reserveForMerge}), appends and
/// escalations fail with {@link ConflictException}.
///
/// @implNote Thread-safe.
///
/// @see SessionRepository
/// @see EscalationHandler
public class SessionStore {

    private static final Logger logger = Logger.getLogger(SessionStore.class.getName());

    private final SessionRepository repository;
    private final WorkflowPolicy policy;
    private final EscalationHandler escalationHandler;
    private final ReviewListener listener;
    private final Clock clock;
    private final int maxAttempts;

    // One lock per session id for the store's lifetime, shared across archive and reuse.
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Set<String> merging = ConcurrentHashMap.newKeySet();

    public SessionStore(
            SessionRepository repository,
            WorkflowPolicy policy,
            EscalationHandler escalationHandler,
            ReviewListener listener,
            Clock clock,
            int maxAttempts) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.escalationHandler =
                Objects.requireNonNull(escalationHandler, "escalationHandler must not be null");
        this.listener =
                new CompositeReviewListener(
                        Objects.requireNonNull(listener, "listener must not be null"));
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
    }

    public WorkflowPolicy getPolicy() {
        return policy;
    }

    // -- Writes ---------------------------------------------------------------

    /// Creates an empty session.
    ///
    /// @param sessionId workspace identifier, not blank
    /// @return the stored session, never null
    /// @throws ValidationException if `sessionId` is blank
    /// @throws ConflictException if the id already has an active session
    public ReviewSession createSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new ValidationException("sessionId must not be blank");
        }
        ReviewSession session = ReviewSession.create(sessionId, clock.instant());
        repository.insert(session);
        logger.info("Created review session: " + sessionId);
        listener.onSessionCreated(session);
        return session;
    }

    /// Appends a pass to an item, creating the item on its first pass.
    ///
    /// @param sessionId target session, not null
    /// @param itemId item identifier `<contentType>:<contentId>`, not null
    /// @param metadata title and type, required when the item is new; for an existing item
    ///     its type must match the stored one
    /// @param pass the submitted pass, not null
    /// @return the item as stored, with its recomputed status, never null
    /// @throws ValidationException on a malformed item id, missing or mismatched metadata,
    ///     or a pass kind the item's policy does not recognize
    /// @throws InvalidStateException for a `human_override` without pending escalation,
    ///     or if the session is archived
    /// @throws NotFoundException if the session does not exist
    /// @throws ConflictException while the session is being merged
    /// @throws ConcurrencyException if retries were exhausted
    public ItemReview appendPass(
            String sessionId, String itemId, ItemMetadata metadata, ReviewPass pass) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(pass, "pass must not be null");
        ItemRef.parse(itemId);

        Written<ReviewPass> written =
                write(
                        sessionId,
                        current -> {
                            ItemReview item =
                                    current.item(itemId)
                                            .orElseGet(() -> openItem(itemId, metadata));
                            if (metadata != null
                                    && !metadata.itemType().equals(item.itemType())) {
                                throw new ValidationException(
                                        "Item "
                                                + itemId
                                                + " has type "
                                                + item.itemType()
                                                + ", not "
                                                + metadata.itemType());
                            }
                            ItemTypePolicy typePolicy = policy.forItemType(item.itemType());
                            policy.validatePass(item.itemType(), pass);

                            ReviewPass accepted =
                                    pass.withTimestamp(
                                            acceptanceTime(current, pass.getReviewerId()));
                            ItemReview appended = item.withPass(accepted);
                            ItemReview updated =
                                    PassKinds.HUMAN_OVERRIDE.equals(accepted.getPassKind())
                                            ? escalationHandler.resolve(
                                                    appended, typePolicy, accepted)
                                            : escalationHandler.recompute(appended, typePolicy);
                            return new Written<>(current.withItem(updated), itemId, accepted);
                        });

        ItemReview stored = written.item();
        ReviewPass accepted = written.result();
        logger.info(
                "Accepted "
                        + accepted.getPassKind()
                        + " pass from "
                        + accepted.getReviewerId()
                        + " on "
                        + itemId
                        + " in "
                        + sessionId
                        + ": "
                        + stored.status());
        listener.onPassAccepted(sessionId, stored, accepted);
        if (PassKinds.HUMAN_OVERRIDE.equals(accepted.getPassKind())) {
            logger.info(
                    "Escalation on " + itemId + " resolved: " + stored.escalation().state());
            listener.onEscalationResolved(sessionId, stored);
        }
        return stored;
    }

    /// Escalates a vetoed item for human resolution.
    ///
    /// @param sessionId target session, not null
    /// @param itemId the item, not null
    /// @param reason why the item needs a human, not blank
    /// @param evidence supporting references, may be null
    /// @param escalatedBy caller id, not null
    /// @return the escalated item, never null
    /// @throws NotFoundException if the session or item does not exist
    /// @throws InvalidStateException if the item is not `REJECTED`
    /// @throws ConflictException while the session is being merged
    public ItemReview escalate(
            String sessionId,
            String itemId,
            String reason,
            List<String> evidence,
            String escalatedBy) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(itemId, "itemId must not be null");
        Objects.requireNonNull(escalatedBy, "escalatedBy must not be null");

        Written<Void> written =
                write(
                        sessionId,
                        current -> {
                            ItemReview item =
                                    current.item(itemId)
                                            .orElseThrow(
                                                    () ->
                                                            new NotFoundException(
                                                                    "Item "
                                                                            + itemId
                                                                            + " not found in session "
                                                                            + sessionId));
                            ItemReview escalated =
                                    escalationHandler.escalate(
                                            item,
                                            policy.forItemType(item.itemType()),
                                            reason,
                                            evidence,
                                            escalatedBy,
                                            clock.instant());
                            return new Written<>(current.withItem(escalated), itemId, null);
                        });

        logger.info("Escalated " + itemId + " in " + sessionId + " by " + escalatedBy);
        listener.onEscalated(sessionId, written.item());
        return written.item();
    }

    // -- Merge support --------------------------------------------------------

    /// Claims the session for a merge and returns a freshly validated snapshot.
    ///
    /// Until {@link #releaseMerge} is called, appends and escalations to the session fail
    /// and a second reservation fails.
    ///
    /// @param sessionId session to merge, not null
    /// @return the active session as of the reservation, never null
    /// @throws ConflictException if a merge of this session is already in progress
    /// @throws NotFoundException if the session does not exist
    /// @throws InvalidStateException if the session is already archived
    public ReviewSession reserveForMerge(String sessionId) {
        ReentrantLock lock = lockFor(sessionId);
        lock.lock();
        try {
            ReviewSession current = loadActive(sessionId);
            if (!merging.add(sessionId)) {
                throw new ConflictException("A merge of session " + sessionId + " is in progress");
            }
            return current;
        } finally {
            lock.unlock();
        }
    }

    /// Archives a reserved session with its merge metadata.
    ///
    /// The archive is one record write: either the full archive is visible or none of it.
    ///
    /// @param sessionId reserved session, not null
    /// @param expectedVersion version validated at reservation time
    /// @param approverId approver id, not null
    /// @param mergeReference commit reference of the merge, not null
    /// @param summary approver's summary, may be null
    /// @return the archived record, never null
    /// @throws ConflictException if the record changed since it was validated
    public ReviewSession archive(
            String sessionId,
            long expectedVersion,
            String approverId,
            String mergeReference,
            String summary) {
        Objects.requireNonNull(approverId, "approverId must not be null");
        Objects.requireNonNull(mergeReference, "mergeReference must not be null");

        ReentrantLock lock = lockFor(sessionId);
        ReviewSession archived;
        lock.lock();
        try {
            ReviewSession current = loadActive(sessionId);
            if (current.version() != expectedVersion) {
                throw new ConflictException(
                        "Session " + sessionId + " changed while it was being merged");
            }
            archived = current.archive(clock.instant(), approverId, mergeReference, summary);
            if (!repository.update(archived, expectedVersion)) {
                throw new ConflictException(
                        "Session " + sessionId + " changed while it was being merged");
            }
        } finally {
            lock.unlock();
        }
        logger.info(
                "Archived session "
                        + sessionId
                        + " merged by "
                        + approverId
                        + " as "
                        + mergeReference);
        listener.onSessionArchived(archived);
        return archived;
    }

    /// Releases a merge reservation. Safe to call when none is held.
    public void releaseMerge(String sessionId) {
        merging.remove(sessionId);
    }

    // -- Reads ----------------------------------------------------------------

    /// Returns the active session, or the latest archived one with that id.
    ///
    /// @throws NotFoundException if the id was never used
    public ReviewSession getSession(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        ReviewSession session =
                repository
                        .findLatest(sessionId)
                        .orElseThrow(
                                () -> new NotFoundException("Session not found: " + sessionId));
        return verified(session);
    }

    /// Returns every occurrence of an item across sessions, oldest session first.
    ///
    /// @param itemId item identifier, not null
    /// @param includeArchived whether archived sessions are scanned
    /// @return history entries, never empty
    /// @throws ValidationException on a malformed item id
    /// @throws NotFoundException if no scanned session contains the item
    public List<ItemHistoryEntry> getItemHistory(String itemId, boolean includeArchived) {
        ItemRef.parse(itemId);
        List<ItemHistoryEntry> history = new ArrayList<>();
        for (ReviewSession session : repository.findContainingItem(itemId, includeArchived)) {
            ReviewSession checked = verified(session);
            history.add(ItemHistoryEntry.of(checked, checked.items().get(itemId)));
        }
        if (history.isEmpty()) {
            throw new NotFoundException("No reviews recorded for item " + itemId);
        }
        return history;
    }

    /// Returns the stored type of an item, empty when the session or item does not exist.
    public Optional<String> findItemType(String sessionId, String itemId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        return repository
                .findLatest(sessionId)
                .flatMap(session -> session.item(itemId))
                .map(ItemReview::itemType);
    }

    /// Summarizes one session.
    ///
    /// @throws NotFoundException if the session does not exist
    public SessionSummary getSessionStatus(String sessionId) {
        return SessionSummary.of(getSession(sessionId));
    }

    /// Lists items awaiting human resolution.
    ///
    /// @param sessionId session to inspect, or null for every active session
    /// @return unresolved escalations, never null
    /// @throws NotFoundException if `sessionId` is given and unknown
    public List<ConflictReport> getConflicts(String sessionId) {
        List<ReviewSession> sessions =
                sessionId != null ? List.of(getSession(sessionId)) : repository.findAll(false);
        List<ConflictReport> conflicts = new ArrayList<>();
        for (ReviewSession session : sessions) {
            ReviewSession checked = sessionId != null ? session : verified(session);
            for (ItemReview item : checked.items().values()) {
                if (item.escalationPending()) {
                    conflicts.add(new ConflictReport(checked.sessionId(), item));
                }
            }
        }
        return conflicts;
    }

    // -- Internals ------------------------------------------------------------

    private <T> Written<T> write(String sessionId, Function<ReviewSession, Written<T>> change) {
        ReentrantLock lock = lockFor(sessionId);
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            lock.lock();
            try {
                ReviewSession current = loadActive(sessionId);
                if (merging.contains(sessionId)) {
                    throw new ConflictException(
                            "Session " + sessionId + " is being merged and accepts no changes");
                }
                Written<T> written = change.apply(current);
                if (repository.update(written.session(), current.version())) {
                    return written;
                }
            } finally {
                lock.unlock();
            }
            logger.warning(
                    "Concurrent write to session "
                            + sessionId
                            + " detected, retrying (attempt "
                            + attempt
                            + " of "
                            + maxAttempts
                            + ")");
        }
        throw new ConcurrencyException(
                "Could not write session " + sessionId + " after " + maxAttempts + " attempts");
    }

    private ReviewSession loadActive(String sessionId) {
        Optional<ReviewSession> active = repository.findActive(sessionId);
        if (active.isPresent()) {
            return verified(active.get());
        }
        if (repository.findLatest(sessionId).isPresent()) {
            throw new InvalidStateException("Session " + sessionId + " is archived");
        }
        throw new NotFoundException("Session not found: " + sessionId);
    }

    private ItemReview openItem(String itemId, ItemMetadata metadata) {
        if (metadata == null) {
            throw new ValidationException(
                    "The first pass on item " + itemId + " must carry item metadata");
        }
        policy.forItemType(metadata.itemType());
        return ItemReview.open(itemId, metadata);
    }

    private Instant acceptanceTime(ReviewSession session, String reviewerId) {
        Instant now = clock.instant();
        for (ItemReview item : session.items().values()) {
            for (ReviewPass p : item.passes()) {
                if (p.getReviewerId().equals(reviewerId)
                        && p.getTimestamp() != null
                        && p.getTimestamp().isAfter(now)) {
                    now = p.getTimestamp();
                }
            }
        }
        return now;
    }

    /// Re-derives every item's status, aborting on records no policy can explain.
    ///
    /// Archived sessions are returned as stored: their statuses were fixed at merge time
    /// and stay readable after the policy that produced them is replaced.
    private ReviewSession verified(ReviewSession session) {
        if (session.archived()) {
            return session;
        }
        Map<String, ItemReview> items = new LinkedHashMap<>();
        for (Map.Entry<String, ItemReview> entry : session.items().entrySet()) {
            ItemReview item = entry.getValue();
            String problem = inconsistency(entry.getKey(), item);
            if (problem != null) {
                throw invariantViolation(session.sessionId(), problem);
            }
            ItemTypePolicy typePolicy = policy.forItemType(item.itemType());
            items.put(entry.getKey(), escalationHandler.recompute(item, typePolicy));
        }
        return new ReviewSession(
                session.sessionId(),
                session.createdAt(),
                items,
                session.archivedAt(),
                session.mergedBy(),
                session.mergeReference(),
                session.mergeSummary(),
                session.version());
    }

    private String inconsistency(String key, ItemReview item) {
        if (!key.equals(item.itemId())) {
            return "item stored under " + key + " has id " + item.itemId();
        }
        if (policy.find(item.itemType()).isEmpty()) {
            return "item " + item.itemId() + " has unknown item type " + item.itemType();
        }
        boolean markedEscalated = item.status() == ItemStatus.ESCALATION_PENDING;
        if (markedEscalated != item.escalationPending()) {
            return "item "
                    + item.itemId()
                    + " has status "
                    + item.status()
                    + " but escalation "
                    + (item.escalation() != null ? item.escalation().state() : "absent");
        }
        return null;
    }

    private InvariantViolationException invariantViolation(String sessionId, String problem) {
        String note = "Underivable item status in session " + sessionId + ": " + problem;
        logger.severe(note);
        InvariantViolationException violation = new InvariantViolationException(note);
        try {
            repository.flagForInspection(sessionId, note);
        } catch (StorageException e) {
            violation.addSuppressed(e);
        }
        return violation;
    }

    private ReentrantLock lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, id -> new ReentrantLock());
    }

    private record Written<T>(ReviewSession session, String itemId, T result) {

        ItemReview item() {
            return session.items().get(itemId);
        }
    }
}
