package de.bsommerfeld.channelstate.core.config;

import de.bsommerfeld.channelstate.core.util.StorageUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.function.Function;

/**
 * Settings of the connection state store.
 *
 * <p>
 * Every value has a default. {@link #fromEnvironment()} overlays the defaults
 * with system properties, falling back to environment variables, following
 * the same lookup order as {@link ApplicationMode#get()}:
 *
 * <pre>
 * channelstate.db.file              CHANNELSTATE_DB_FILE
 * channelstate.db.status-table      CHANNELSTATE_DB_STATUS_TABLE
 * channelstate.db.history-table     CHANNELSTATE_DB_HISTORY_TABLE
 * channelstate.db.busy-timeout-ms   CHANNELSTATE_DB_BUSY_TIMEOUT_MS
 * channelstate.timezone             CHANNELSTATE_TIMEZONE
 * </pre>
 *
 * Malformed values are logged and replaced by the default. Table names are
 * not validated here; the database layer rejects names it cannot use.
 */
public class StoreConfig {

    public static final String APP_NAME = "channel-state";
    public static final String DEFAULT_DB_FILE_NAME = "channel-state.db";
    public static final String DEFAULT_STATUS_TABLE = "connection_status";
    public static final String DEFAULT_HISTORY_TABLE = "connection_history";
    public static final Duration DEFAULT_BUSY_TIMEOUT = Duration.ofSeconds(5);

    private static final Logger LOG = LoggerFactory.getLogger(StoreConfig.class);

    private Path databaseFile = StorageUtils.getDataFile(APP_NAME, DEFAULT_DB_FILE_NAME);
    private String statusTable = DEFAULT_STATUS_TABLE;
    private String historyTable = DEFAULT_HISTORY_TABLE;
    private Duration busyTimeout = DEFAULT_BUSY_TIMEOUT;
    private ZoneId timezone = ZoneId.of("UTC");

    public static StoreConfig fromEnvironment() {
        StoreConfig config = new StoreConfig();
        config.databaseFile = lookup("channelstate.db.file", "CHANNELSTATE_DB_FILE",
                Paths::get, config.databaseFile);
        config.statusTable = lookup("channelstate.db.status-table", "CHANNELSTATE_DB_STATUS_TABLE",
                String::trim, config.statusTable);
        config.historyTable = lookup("channelstate.db.history-table", "CHANNELSTATE_DB_HISTORY_TABLE",
                String::trim, config.historyTable);
        config.busyTimeout = lookup("channelstate.db.busy-timeout-ms", "CHANNELSTATE_DB_BUSY_TIMEOUT_MS",
                StoreConfig::parseTimeout, config.busyTimeout);
        config.timezone = lookup("channelstate.timezone", "CHANNELSTATE_TIMEZONE",
                ZoneId::of, config.timezone);
        return config;
    }

    private static <T> T lookup(String property, String env, Function<String, T> parser, T fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            raw = System.getenv(env);
        }
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return parser.apply(raw.trim());
        } catch (IllegalArgumentException | DateTimeException e) {
            LOG.warn("Ignoring invalid value '{}' for {}: {}. Using default {}.",
                    raw, property, e.getMessage(), fallback);
            return fallback;
        }
    }

    private static Duration parseTimeout(String raw) {
        long millis = Long.parseLong(raw);
        if (millis < 0) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
        return Duration.ofMillis(millis);
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    public void setDatabaseFile(Path databaseFile) {
        this.databaseFile = databaseFile;
    }

    public String getStatusTable() {
        return statusTable;
    }

    public void setStatusTable(String statusTable) {
        this.statusTable = statusTable;
    }

    public String getHistoryTable() {
        return historyTable;
    }

    public void setHistoryTable(String historyTable) {
        this.historyTable = historyTable;
    }

    public Duration getBusyTimeout() {
        return busyTimeout;
    }

    public void setBusyTimeout(Duration busyTimeout) {
        this.busyTimeout = busyTimeout;
    }

    public ZoneId getTimezone() {
        return timezone;
    }

    public void setTimezone(ZoneId timezone) {
        this.timezone = timezone;
    }
}
