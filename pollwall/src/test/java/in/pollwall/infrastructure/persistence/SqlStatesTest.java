package in.pollwall.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

class SqlStatesTest {

    @Test
    void classifiesTransientStates() {
        assertTrue(SqlStates.isTransient("40001"));
        assertTrue(SqlStates.isTransient("40P01"));
        assertTrue(SqlStates.isTransient("55P03"));
        assertTrue(SqlStates.isTransient("08006"));
        assertFalse(SqlStates.isTransient("23505"));
        assertFalse(SqlStates.isTransient("42P01"));
        assertFalse(SqlStates.isTransient(null));
    }

    @Test
    void findsStateInCauseChain() {
        SQLException inner = new SQLException("serialization failure", "40001");
        SQLException outer = new SQLException("wrapped", null, inner);

        assertEquals("40001", SqlStates.of(outer));
    }

    @Test
    void findsStateInNextException() {
        SQLException batch = new SQLException("batch failed");
        batch.setNextException(new SQLException("duplicate key", "23505"));

        assertEquals("23505", SqlStates.of(batch));
    }
}
