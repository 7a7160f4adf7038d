package in.pollwall.infrastructure.persistence;

import in.pollwall.domain.repository.PollRepository;
import in.pollwall.domain.repository.ReactionRepository;
import in.pollwall.domain.repository.UnitOfWork;
import in.pollwall.domain.repository.UserRepository;
import in.pollwall.domain.repository.VoteRepository;

import java.sql.Connection;

/**
 * Postgres repositories bound to one transactional connection. Created per transaction.
 */
public final class JdbcUnitOfWork implements UnitOfWork {

    private final PollRepository polls;
    private final ReactionRepository reactions;
    private final VoteRepository votes;
    private final UserRepository users;

    public JdbcUnitOfWork(Connection conn) {
        this.polls = new PostgresPollRepository(conn);
        this.reactions = new PostgresReactionRepository(conn);
        this.votes = new PostgresVoteRepository(conn);
        this.users = new PostgresUserRepository(conn);
    }

    @Override
    public PollRepository polls() {
        return polls;
    }

    @Override
    public ReactionRepository reactions() {
        return reactions;
    }

    @Override
    public VoteRepository votes() {
        return votes;
    }

    @Override
    public UserRepository users() {
        return users;
    }
}
