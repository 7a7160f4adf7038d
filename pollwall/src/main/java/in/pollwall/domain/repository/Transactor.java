package in.pollwall.domain.repository;

import java.sql.SQLException;

/**
 * Runs work in a single transaction: commit on normal return, rollback on any failure.
 */
public interface Transactor {

    <T> T inTransaction(String name, TransactionWork<T> work);

    @FunctionalInterface
    interface TransactionWork<T> {
        T execute(UnitOfWork uow) throws SQLException;
    }
}
