package in.pollwall.domain.repository;

import in.pollwall.domain.poll.Reaction;

import java.sql.SQLException;

/**
 * Like and dislike relation rows, keyed by (user, poll).
 */
public interface ReactionRepository {

    /**
     * Idempotent delete.
     */
    void remove(Reaction reaction, String pollId, String userId) throws SQLException;

    /**
     * Insert unless the row exists. A concurrent duplicate insert is absorbed.
     *
     * @return true if a row was inserted
     */
    boolean addIfAbsent(Reaction reaction, String pollId, String userId) throws SQLException;

    int count(Reaction reaction, String pollId) throws SQLException;
}
