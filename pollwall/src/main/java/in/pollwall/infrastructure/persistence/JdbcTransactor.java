package in.pollwall.infrastructure.persistence;

import in.pollwall.domain.error.StoreException;
import in.pollwall.domain.error.TransientStoreException;
import in.pollwall.domain.repository.Transactor;
import in.pollwall.infrastructure.metrics.PollMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

/**
 * JDBC transaction runner.
 *
 * Each attempt borrows one pooled connection, sets a local {@code lock_timeout} so a
 * blocked row lock fails instead of waiting forever, and runs the work against a fresh
 * {@link JdbcUnitOfWork}. Transient failures are retried with exponential backoff;
 * domain exceptions roll back and propagate unchanged.
 */
public final class JdbcTransactor implements Transactor {
    private static final Logger log = LoggerFactory.getLogger(JdbcTransactor.class);
    private static final long MAX_BACKOFF_MS = 1000;

    private final DataSource dataSource;
    private final PollMetrics metrics;
    private final int maxAttempts;
    private final Duration lockTimeout;
    private final Duration baseBackoff;

    public JdbcTransactor(DataSource dataSource, PollMetrics metrics, int maxAttempts,
                          Duration lockTimeout, Duration baseBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
        }
        this.dataSource = dataSource;
        this.metrics = metrics;
        this.maxAttempts = maxAttempts;
        this.lockTimeout = lockTimeout;
        this.baseBackoff = baseBackoff;
    }

    @Override
    public <T> T inTransaction(String name, TransactionWork<T> work) {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return runOnce(work);
            } catch (SQLException e) {
                String sqlState = SqlStates.of(e);
                if (!SqlStates.isTransient(sqlState)) {
                    throw new StoreException("Transaction " + name + " failed: " + e.getMessage(), e);
                }
                if (attempt >= maxAttempts) {
                    log.warn("[TX] {} gave up after {} attempts (SQLState {})", name, attempt, sqlState);
                    throw new TransientStoreException("Transaction " + name + " failed after "
                        + attempt + " attempts", sqlState, e);
                }
                metrics.recordTransactionRetry(name, sqlState);
                log.warn("[TX] {} attempt {}/{} hit transient failure {}: {}",
                    name, attempt, maxAttempts, sqlState, e.getMessage());
                backoff(name, attempt, sqlState, e);
            }
        }
    }

    private <T> T runOnce(TransactionWork<T> work) throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                applyLockTimeout(conn);
                T result = work.execute(new JdbcUnitOfWork(conn));
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(conn, e);
                throw e;
            }
        }
    }

    private void applyLockTimeout(Connection conn) throws SQLException {
        if (lockTimeout == null || lockTimeout.isZero() || lockTimeout.isNegative()) {
            return;
        }
        try (Statement st = conn.createStatement()) {
            st.execute("SET LOCAL lock_timeout = '" + lockTimeout.toMillis() + "ms'");
        }
    }

    private void rollback(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            log.error("[TX] Rollback failed: {}", rollbackError.getMessage());
            cause.addSuppressed(rollbackError);
        }
    }

    private void backoff(String name, int attempt, String sqlState, SQLException cause) {
        long delay = Math.min(MAX_BACKOFF_MS, baseBackoff.toMillis() * (1L << (attempt - 1)));
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Transaction " + name + " interrupted during retry",
                sqlState, cause);
        }
    }
}
