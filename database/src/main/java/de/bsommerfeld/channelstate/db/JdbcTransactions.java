package de.bsommerfeld.channelstate.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Scoped connection and transaction handling shared by the schema
 * initializer and the SQL store.
 *
 * <p>
 * The connection is opened per call and always closed. Close and rollback
 * failures are logged and swallowed so they can never replace the result or
 * the exception of the work itself.
 */
final class JdbcTransactions {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcTransactions.class);

    @FunctionalInterface
    interface ConnectionSource {
        Connection open() throws SQLException;
    }

    @FunctionalInterface
    interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    private JdbcTransactions() {
    }

    /**
     * Runs {@code work} in a single transaction. Commits if it returns,
     * rolls back if it throws, then rethrows the original exception.
     */
    static <T> T inTransaction(ConnectionSource source, SqlWork<T> work) throws SQLException {
        Connection conn = source.open();
        try {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn);
                throw e;
            }
        } finally {
            closeQuietly(conn);
        }
    }

    /** Runs read-only {@code work} in auto-commit mode. */
    static <T> T withConnection(ConnectionSource source, SqlWork<T> work) throws SQLException {
        Connection conn = source.open();
        try {
            return work.execute(conn);
        } finally {
            closeQuietly(conn);
        }
    }

    static void rollbackQuietly(Connection conn) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            LOG.error("Rollback failed", e);
        }
    }

    static void closeQuietly(Connection conn) {
        try {
            conn.close();
        } catch (SQLException e) {
            LOG.error("Failed to close database connection", e);
        }
    }
}
