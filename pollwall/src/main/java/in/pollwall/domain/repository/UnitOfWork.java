package in.pollwall.domain.repository;

/**
 * Repositories sharing one open transaction. Valid only inside
 * {@link Transactor#inTransaction}; never keep a reference past it.
 */
public interface UnitOfWork {

    PollRepository polls();

    ReactionRepository reactions();

    VoteRepository votes();

    UserRepository users();
}
