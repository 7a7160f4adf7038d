package in.pollwall.domain.repository;

import in.pollwall.domain.poll.Vote;

import java.sql.SQLException;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Vote fact rows and the derived option counters.
 */
public interface VoteRepository {

    boolean optionBelongsToPoll(String optionId, String pollId) throws SQLException;

    Optional<Vote> findByUserAndPoll(String userId, String pollId) throws SQLException;

    /**
     * Insert the vote unless (user, poll) already has one.
     *
     * @return false if the unique constraint kept the existing row
     */
    boolean insertIfAbsent(Vote vote) throws SQLException;

    void updateOption(String voteId, String optionId) throws SQLException;

    int countForOption(String optionId) throws SQLException;

    void updateOptionVotes(String optionId, int votes) throws SQLException;

    /**
     * @return pollId to optionId for the polls the user voted on
     */
    Map<String, String> findOptionIdsByUser(String userId, Collection<String> pollIds) throws SQLException;
}
