package in.pollwall.service;

import in.pollwall.domain.error.DomainException;
import in.pollwall.domain.error.ForbiddenOperationException;
import in.pollwall.domain.error.InvalidRequestException;
import in.pollwall.domain.error.PollNotFoundException;
import in.pollwall.domain.error.TransientStoreException;
import in.pollwall.domain.error.VoteValidationException;
import in.pollwall.domain.event.PollEvent;
import in.pollwall.domain.poll.NewPoll;
import in.pollwall.domain.poll.PageRequest;
import in.pollwall.domain.poll.Poll;
import in.pollwall.domain.poll.PollAction;
import in.pollwall.domain.poll.Reaction;
import in.pollwall.domain.repository.Transactor;
import in.pollwall.domain.repository.UnitOfWork;
import in.pollwall.infrastructure.metrics.PollMetrics;
import in.pollwall.service.event.PollEventBus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static in.pollwall.service.ServiceErrorLogger.context;

/**
 * Poll use cases.
 *
 * Every write runs in one transaction through {@link CounterSync}; the resulting
 * snapshot is read inside that same transaction and the matching event is published
 * only after commit. A failed transaction publishes nothing. A failing publish is
 * logged and never turns a committed write into an error.
 */
public final class PollAggregateService {
    private static final Logger log = LoggerFactory.getLogger(PollAggregateService.class);

    private final Transactor transactor;
    private final CounterSync counterSync;
    private final PollEventBus eventBus;
    private final PollMetrics metrics;

    public PollAggregateService(Transactor transactor, CounterSync counterSync,
                                PollEventBus eventBus, PollMetrics metrics) {
        this.transactor = transactor;
        this.counterSync = counterSync;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Poll createPoll(String userId, NewPoll newPoll) {
        return ServiceErrorLogger.call("create_poll", context("user_id", userId, "title", newPoll.title()), () -> {
            Poll poll = timed("create", () -> transactor.inTransaction("create_poll", uow -> {
                String pollId = uow.polls().insertPoll(userId, newPoll);
                return readSnapshot(uow, pollId);
            }));
            log.info("[PollService] Poll {} created by {} with {} options",
                poll.id(), userId, poll.options().size());
            publishAfterCommit(PollEvent.created(poll));
            return poll;
        });
    }

    /**
     * @param viewerId caller's user id for {@code my_vote_option_id}, or null when anonymous
     */
    public Poll getPoll(String pollId, String viewerId) {
        return ServiceErrorLogger.call("get_poll", context("poll_id", pollId), () ->
            transactor.inTransaction("get_poll", uow -> {
                Poll poll = readSnapshot(uow, pollId);
                if (viewerId == null) {
                    return poll;
                }
                String optionId = uow.votes().findOptionIdsByUser(viewerId, List.of(pollId)).get(pollId);
                return poll.withViewerVote(optionId);
            }));
    }

    public List<Poll> listPolls(PageRequest page, String viewerId) {
        return ServiceErrorLogger.call("list_polls", context("sort", page.sort(), "limit", page.limit(),
                "offset", page.offset()), () ->
            transactor.inTransaction("list_polls", uow ->
                withViewerVotes(uow, uow.polls().listSnapshots(page, null), viewerId)));
    }

    public List<Poll> listPollsByUser(String userId, PageRequest page) {
        return ServiceErrorLogger.call("list_polls_by_user", context("user_id", userId, "sort", page.sort()), () ->
            transactor.inTransaction("list_polls_by_user", uow ->
                withViewerVotes(uow, uow.polls().listSnapshots(page, userId), userId)));
    }

    public Poll likePoll(String pollId, String userId) {
        return mutate(pollId, userId, PollAction.like());
    }

    public Poll dislikePoll(String pollId, String userId) {
        return mutate(pollId, userId, PollAction.dislike());
    }

    public Poll castVote(String userId, String pollId, String optionId) {
        if (optionId == null || optionId.isBlank()) {
            throw new InvalidRequestException("option_id is required");
        }
        return mutate(pollId, userId, PollAction.vote(optionId));
    }

    /**
     * Apply a counter-affecting action and broadcast the post-commit snapshot.
     *
     * @return the snapshot; for votes it carries the caller's option as
     *         {@code my_vote_option_id}
     */
    public Poll mutate(String pollId, String userId, PollAction action) {
        String operation = action.label() + "_poll";
        return ServiceErrorLogger.call(operation,
                context("poll_id", pollId, "user_id", userId, "option_id", action.optionId()), () -> {
            Poll snapshot = timed(action.label(), () -> transactor.inTransaction(operation, uow -> {
                apply(uow, pollId, userId, action);
                return readSnapshot(uow, pollId);
            }));
            publishAfterCommit(PollEvent.updated(snapshot));
            return action.kind() == PollAction.Kind.VOTE ? snapshot.withViewerVote(action.optionId()) : snapshot;
        });
    }

    /**
     * Delete a poll. Allowed for its creator and for admins.
     */
    public void deletePoll(String pollId, String requesterId, boolean requesterIsAdmin) {
        ServiceErrorLogger.run("delete_poll", context("poll_id", pollId, "user_id", requesterId), () -> {
            timed("delete", () -> transactor.inTransaction("delete_poll", uow -> {
                if (!uow.polls().lockPoll(pollId)) {
                    throw new PollNotFoundException(pollId);
                }
                Poll poll = readSnapshot(uow, pollId);
                if (!poll.isOwnedBy(requesterId) && !requesterIsAdmin) {
                    throw new ForbiddenOperationException(requesterId, pollId, "delete");
                }
                return uow.polls().deletePoll(pollId);
            }));
            log.info("[PollService] Poll {} deleted by {}{}", pollId, requesterId, requesterIsAdmin ? " (admin)" : "");
            publishAfterCommit(PollEvent.deleted(pollId));
        });
    }

    public PollEventBus.Subscription subscribeToUpdates() {
        return eventBus.subscribe();
    }

    private void apply(UnitOfWork uow, String pollId, String userId, PollAction action) throws SQLException {
        switch (action.kind()) {
            case LIKE -> counterSync.syncLikeState(uow, pollId, userId, Reaction.LIKE);
            case DISLIKE -> counterSync.syncLikeState(uow, pollId, userId, Reaction.DISLIKE);
            case VOTE -> counterSync.castVote(uow, userId, pollId, action.optionId());
        }
    }

    private static Poll readSnapshot(UnitOfWork uow, String pollId) throws SQLException {
        return uow.polls().findSnapshot(pollId).orElseThrow(() -> new PollNotFoundException(pollId));
    }

    private static List<Poll> withViewerVotes(UnitOfWork uow, List<Poll> polls, String viewerId) throws SQLException {
        if (viewerId == null || polls.isEmpty()) {
            return polls;
        }
        List<String> ids = polls.stream().map(Poll::id).toList();
        Map<String, String> votes = uow.votes().findOptionIdsByUser(viewerId, ids);
        List<Poll> enriched = new ArrayList<>(polls.size());
        for (Poll poll : polls) {
            enriched.add(poll.withViewerVote(votes.get(poll.id())));
        }
        return enriched;
    }

    private void publishAfterCommit(PollEvent event) {
        try {
            eventBus.publish(event);
        } catch (RuntimeException e) {
            log.error("[PollService] Committed {} for {} but publish failed: {}",
                event.type().wireName(), event.pollId(), e.getMessage(), e);
        }
    }

    private <T> T timed(String action, Supplier<T> body) {
        long start = System.nanoTime();
        try {
            T result = body.get();
            metrics.recordMutation(action, "success", Duration.ofNanos(System.nanoTime() - start));
            return result;
        } catch (RuntimeException e) {
            metrics.recordMutation(action, outcome(e), Duration.ofNanos(System.nanoTime() - start));
            throw e;
        }
    }

    private static String outcome(RuntimeException e) {
        if (e instanceof PollNotFoundException) return "not_found";
        if (e instanceof ForbiddenOperationException) return "forbidden";
        if (e instanceof VoteValidationException || e instanceof InvalidRequestException) return "invalid";
        if (e instanceof TransientStoreException) return "transient";
        if (e instanceof DomainException) return "rejected";
        return "error";
    }
}
