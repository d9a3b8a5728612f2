package org.longtrace.config.database;

import org.longtrace.exceptions.LongTraceException;
import org.longtrace.exceptions.TraceConnectionException;
import org.longtrace.exceptions.TraceWriteException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Splits {@link SQLException}s into "store unreachable" and "store rejected the write".
 */
public final class SqlErrors {

    static final String QUERY_CANCELED = "57014";

    private SqlErrors() {}

    public static boolean isConnectionFailure(SQLException e) {
        for (SQLException current = e; current != null; current = current.getNextException()) {
            if (current instanceof SQLTransientConnectionException
                    || current instanceof SQLNonTransientConnectionException
                    || current instanceof SQLTimeoutException) {
                return true;
            }
            String state = current.getSQLState();
            // 08: connection exception, 28: invalid authorization, 57P01-03: server shutting down,
            // 57014: statement cancelled, which is how the server enforces setQueryTimeout
            if (state != null && (state.startsWith("08") || state.startsWith("28") || state.startsWith("57P")
                    || QUERY_CANCELED.equals(state))) {
                return true;
            }
        }
        return false;
    }

    public static LongTraceException classify(String action, SQLException e) {
        String message = action + ": " + e.getMessage();
        if (isConnectionFailure(e)) {
            return new TraceConnectionException(message, e);
        }
        return new TraceWriteException(message, e);
    }
}
