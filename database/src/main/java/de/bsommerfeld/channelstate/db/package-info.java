/**
 * Persistence of the active channel connection and its audit history:
 * SQLite-backed in production, in-memory in TEST mode.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 *   [Command layer]
 *        │
 *        ▼
 *   ConnectionTracker       ← async facade, publishes ConnectionEvents
 *        │
 *        ▼
 *   ConnectionStateStore    ← interface (PROD ↔ TEST swap via Guice)
 *    ┌───┴───────┐
 *    │           │
 *  SqlStore   InMemoryStore
 * </pre>
 *
 * <h2>Tables</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ connection_status (at most one row)                              │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK)         │ Always 1, enforced by CHECK (id = 1)          │
 * │ channel_id       │ Active channel                                │
 * │ guild_id         │ Optional grouping ID                          │
 * │ connected_at     │ ISO-8601 with offset, set once per connect    │
 * │ last_updated     │ ISO-8601 with offset, refreshed on each write │
 * └──────────────────┴────────────────────────────────────────────────┘
 *
 * ┌───────────────────────────────────────────────────────────────────┐
 * │ connection_history (append-only)                                 │
 * ├──────────────────┬────────────────────────────────────────────────┤
 * │ id  (PK, auto)   │ AUTOINCREMENT, never reused                   │
 * │ channel_id       │ By value, no FK: status rows come and go      │
 * │ guild_id         │ Optional grouping ID                          │
 * │ action           │ CONNECT | DISCONNECT | ERROR                  │
 * │ timestamp        │ ISO-8601 with offset                          │
 * │ error_message    │ ERROR detail, or reason of a superseded       │
 * │                  │ DISCONNECT                                    │
 * └──────────────────┴────────────────────────────────────────────────┘
 * </pre>
 *
 * Both table names are configurable and checked by {@link
 * de.bsommerfeld.channelstate.db.TableNames} before any SQL is rendered.
 *
 * <h2>Transitions</h2>
 * <ul>
 * <li><strong>connect</strong>: existing row logged as DISCONNECT
 * ({@code "superseded by new connection"}), row upserted, CONNECT logged.
 * One transaction.</li>
 * <li><strong>disconnect</strong>: row deleted, DISCONNECT logged. One
 * transaction. Without a row nothing is written.</li>
 * <li><strong>failure</strong>: rollback, then a separate best-effort
 * transaction logs ERROR.</li>
 * </ul>
 */
package de.bsommerfeld.channelstate.db;
