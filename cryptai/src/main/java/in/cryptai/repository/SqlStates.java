package in.cryptai.repository;

import java.sql.SQLException;

/**
 * SQLState classification shared by the JDBC repositories.
 */
public final class SqlStates {

    // Class 23: integrity constraint violation (23505 unique_violation on PostgreSQL and H2)
    private static final String INTEGRITY_CONSTRAINT_CLASS = "23";

    public static boolean isIntegrityViolation(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && hasIntegrityState(sql)) {
                return true;
            }
        }
        SQLException next = e.getNextException();
        return next != null && hasIntegrityState(next);
    }

    private static boolean hasIntegrityState(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith(INTEGRITY_CONSTRAINT_CLASS);
    }

    private SqlStates() {}
}
