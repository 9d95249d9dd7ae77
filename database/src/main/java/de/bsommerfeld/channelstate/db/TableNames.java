package de.bsommerfeld.channelstate.db;

import de.bsommerfeld.channelstate.core.config.StoreConfig;

import java.util.regex.Pattern;

/**
 * The two table names the store works with. Names are spliced into SQL text,
 * so they must be plain identifiers: ASCII letters, digits and underscores.
 * Anything else is rejected before it reaches a statement.
 */
public record TableNames(String statusTable, String historyTable) {

    static final String STATUS_PLACEHOLDER = "${status_table}";
    static final String HISTORY_PLACEHOLDER = "${history_table}";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    public static TableNames defaults() {
        return new TableNames(StoreConfig.DEFAULT_STATUS_TABLE, StoreConfig.DEFAULT_HISTORY_TABLE);
    }

    public static TableNames from(StoreConfig config) {
        return new TableNames(config.getStatusTable(), config.getHistoryTable());
    }

    public static boolean isValidIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    /**
     * @throws ValidationException naming the first table that is not a plain
     *                             identifier
     */
    public TableNames validate() {
        requireIdentifier(statusTable);
        requireIdentifier(historyTable);
        if (statusTable.equalsIgnoreCase(historyTable)) {
            throw new ValidationException("Status and history table must differ: " + statusTable);
        }
        return this;
    }

    String render(String sql) {
        validate();
        return sql.replace(STATUS_PLACEHOLDER, statusTable).replace(HISTORY_PLACEHOLDER, historyTable);
    }

    private static void requireIdentifier(String name) {
        if (!isValidIdentifier(name)) {
            throw new ValidationException("Invalid table name '" + name
                    + "': only alphanumeric characters and underscores are allowed");
        }
    }
}
