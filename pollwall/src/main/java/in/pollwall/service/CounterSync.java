package in.pollwall.service;

import in.pollwall.domain.error.PollNotFoundException;
import in.pollwall.domain.error.VoteValidationException;
import in.pollwall.domain.poll.Reaction;
import in.pollwall.domain.poll.ReactionCounts;
import in.pollwall.domain.poll.Vote;
import in.pollwall.domain.repository.UnitOfWork;
import in.pollwall.domain.repository.VoteRepository;
import in.pollwall.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

/**
 * Keeps poll counters equal to the cardinality of the rows they summarize.
 *
 * Every operation starts by taking the poll row lock, so all counter mutations for one
 * poll are serialized until the caller's transaction ends. Counters are always
 * recounted from the relation and vote rows and written back; they are never
 * incremented in place. Commit and rollback belong to the caller.
 */
public final class CounterSync {
    private static final Logger log = LoggerFactory.getLogger(CounterSync.class);

    /**
     * Make {@code target} the user's only reaction on the poll and refresh both counters.
     *
     * @throws PollNotFoundException before any row is touched if the poll is missing
     */
    public ReactionCounts syncLikeState(UnitOfWork uow, String pollId, String userId, Reaction target)
            throws SQLException {
        lockOrThrow(uow, pollId);

        uow.reactions().remove(target.opposite(), pollId, userId);
        boolean inserted = uow.reactions().addIfAbsent(target, pollId, userId);

        int likes = uow.reactions().count(Reaction.LIKE, pollId);
        int dislikes = uow.reactions().count(Reaction.DISLIKE, pollId);
        uow.polls().updateReactionCounts(pollId, likes, dislikes);

        log.debug("[CounterSync] {} {} on {} (new={}) -> likes={}, dislikes={}",
            userId, target, pollId, inserted, likes, dislikes);
        return new ReactionCounts(likes, dislikes);
    }

    /**
     * Record the user's vote on the poll, moving an earlier vote if the option differs.
     *
     * @return the vote row as it stands after the call
     * @throws PollNotFoundException if the poll is missing
     * @throws VoteValidationException if the option is missing or belongs to another poll
     */
    public Vote castVote(UnitOfWork uow, String userId, String pollId, String optionId) throws SQLException {
        lockOrThrow(uow, pollId);

        VoteRepository votes = uow.votes();
        if (!votes.optionBelongsToPoll(optionId, pollId)) {
            throw new VoteValidationException(pollId, optionId);
        }

        Optional<Vote> existing = votes.findByUserAndPoll(userId, pollId);
        if (existing.isEmpty()) {
            Vote vote = new Vote(Ids.vote(), userId, pollId, optionId, Instant.now());
            if (votes.insertIfAbsent(vote)) {
                recount(votes, optionId);
                log.debug("[CounterSync] {} voted {} on {}", userId, optionId, pollId);
                return vote;
            }
            // Unique (user_id, poll_id) kept a row written outside the poll lock
            existing = votes.findByUserAndPoll(userId, pollId);
            if (existing.isEmpty()) {
                throw new IllegalStateException(String.format(
                    "Vote of %s on %s conflicted but cannot be read back", userId, pollId));
            }
        }

        Vote current = existing.get();
        if (current.optionId().equals(optionId)) {
            return current;
        }

        votes.updateOption(current.id(), optionId);
        recount(votes, current.optionId());
        recount(votes, optionId);
        log.debug("[CounterSync] {} moved vote on {} from {} to {}", userId, pollId, current.optionId(), optionId);
        return current.withOption(optionId);
    }

    private void lockOrThrow(UnitOfWork uow, String pollId) throws SQLException {
        if (!uow.polls().lockPoll(pollId)) {
            throw new PollNotFoundException(pollId);
        }
    }

    private void recount(VoteRepository votes, String optionId) throws SQLException {
        votes.updateOptionVotes(optionId, votes.countForOption(optionId));
    }
}
