package in.pollwall.domain.repository;

import in.pollwall.domain.poll.NewPoll;
import in.pollwall.domain.poll.PageRequest;
import in.pollwall.domain.poll.Poll;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Poll rows and their options. Bound to one open transaction.
 */
public interface PollRepository {

    /**
     * Take the exclusive row lock on the poll ({@code SELECT ... FOR UPDATE}).
     *
     * @return false if the poll does not exist
     */
    boolean lockPoll(String pollId) throws SQLException;

    /**
     * Insert a poll and its options in list order.
     *
     * @return the new poll id
     */
    String insertPoll(String createdBy, NewPoll newPoll) throws SQLException;

    Optional<Poll> findSnapshot(String pollId) throws SQLException;

    /**
     * @param createdBy restrict to one creator, or null for all polls
     */
    List<Poll> listSnapshots(PageRequest page, String createdBy) throws SQLException;

    void updateReactionCounts(String pollId, int likes, int dislikes) throws SQLException;

    /**
     * Delete the poll. Options, relations and vote rows cascade.
     *
     * @return false if nothing was deleted
     */
    boolean deletePoll(String pollId) throws SQLException;
}
