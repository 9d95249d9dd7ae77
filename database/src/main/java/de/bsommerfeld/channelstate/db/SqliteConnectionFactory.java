package de.bsommerfeld.channelstate.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;

/**
 * Opens JDBC connections to the SQLite file that holds connection state.
 *
 * <p>
 * A new {@link Connection} is opened per operation and closed by the caller
 * right after. Every connection is configured with
 * <ul>
 * <li>{@code IMMEDIATE} transaction mode, so a transaction takes the database
 * write lock at {@code BEGIN} instead of at its first write. Two writers can
 * therefore never both read the status row before either of them writes it.</li>
 * <li>a busy timeout, so a writer waiting for that lock blocks for a bounded
 * time and then fails with {@code SQLITE_BUSY}.</li>
 * </ul>
 */
public class SqliteConnectionFactory {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteConnectionFactory.class);

    private final String url;
    private final Properties properties;

    public SqliteConnectionFactory(Path databaseFile, Duration busyTimeout) {
        Path absolute = databaseFile.toAbsolutePath();
        createParentDirectories(absolute);
        this.url = "jdbc:sqlite:" + absolute;

        SQLiteConfig config = new SQLiteConfig();
        config.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        config.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, busyTimeout.toMillis()));
        this.properties = config.toProperties();
    }

    public Connection open() throws SQLException {
        return DriverManager.getConnection(url, properties);
    }

    public String getUrl() {
        return url;
    }

    private static void createParentDirectories(Path file) {
        Path parent = file.getParent();
        if (parent == null || Files.exists(parent))
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            // Opening the connection will fail with a clearer SQLException
            LOG.error("Failed to create database directory {}", parent, e);
        }
    }
}
