package in.pollwall.infrastructure.persistence;

import java.sql.SQLException;

/**
 * PostgreSQL SQLState classification.
 */
final class SqlStates {

    static final String SERIALIZATION_FAILURE = "40001";
    static final String DEADLOCK_DETECTED = "40P01";
    static final String LOCK_NOT_AVAILABLE = "55P03";
    static final String UNIQUE_VIOLATION = "23505";

    /**
     * First SQLState found along the exception chain, or null.
     */
    static String of(SQLException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof SQLException) {
                SQLException sql = (SQLException) current;
                if (sql.getSQLState() != null) {
                    return sql.getSQLState();
                }
                if (sql.getNextException() != null && sql.getNextException() != current) {
                    String next = of(sql.getNextException());
                    if (next != null) return next;
                }
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return null;
    }

    /**
     * Serialization failures, deadlocks, lock timeouts and connection exceptions (class 08).
     */
    static boolean isTransient(String sqlState) {
        if (sqlState == null) return false;
        return SERIALIZATION_FAILURE.equals(sqlState)
            || DEADLOCK_DETECTED.equals(sqlState)
            || LOCK_NOT_AVAILABLE.equals(sqlState)
            || sqlState.startsWith("08");
    }

    private SqlStates() {}
}
