package de.bsommerfeld.channelstate.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath files named
 * {@code sql/<operation>-<entity>.sql}, e.g. {@code upsert-status.sql}.
 *
 * <p>
 * Statements reference their tables through the {@code ${status_table}} and
 * {@code ${history_table}} placeholders so the table names stay configurable.
 * {@link #load(String, TableNames)} fills them in from validated
 * {@link TableNames}; the raw template is cached, rendering is not.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the raw template from {@code sql/<name>.sql}, trimmed.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Returns the statement from {@code sql/<name>.sql} with the table
     * placeholders replaced.
     *
     * @throws ValidationException if either table name is not a plain identifier
     */
    public static String load(String name, TableNames tables) {
        return tables.render(load(name));
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
