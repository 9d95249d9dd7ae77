package de.bsommerfeld.channelstate.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Creates the status and history tables if they do not exist yet.
 *
 * <p>
 * Every DDL statement uses {@code IF NOT EXISTS}, so {@link #ensureSchema()}
 * is safe to run on every startup. All statements run in one transaction;
 * a failure leaves the database as it was.
 */
public class SchemaInitializer {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaInitializer.class);

    private static final List<String> DDL = List.of(
            "create-status-table",
            "create-history-table",
            "create-history-channel-index");

    private final SqliteConnectionFactory connectionFactory;
    private final TableNames tables;

    public SchemaInitializer(SqliteConnectionFactory connectionFactory, TableNames tables) {
        this.connectionFactory = connectionFactory;
        this.tables = tables;
    }

    /**
     * @throws SchemaException if a table name is not a plain identifier or the
     *                         DDL cannot be applied
     */
    public void ensureSchema() {
        try {
            tables.validate();
        } catch (ValidationException e) {
            throw new SchemaException("Refusing to create tables with invalid names", e);
        }

        LOG.info("Ensuring connection schema ({}, {}) at {}",
                tables.statusTable(), tables.historyTable(), connectionFactory.getUrl());
        try {
            JdbcTransactions.inTransaction(connectionFactory::open, conn -> {
                try (Statement stmt = conn.createStatement()) {
                    for (String name : DDL) {
                        stmt.execute(SqlLoader.load(name, tables));
                    }
                }
                return null;
            });
        } catch (SQLException e) {
            LOG.error("Failed to create connection tables", e);
            throw new SchemaException("Failed to create connection tables", e);
        }
        LOG.info("Connection schema ready.");
    }
}
