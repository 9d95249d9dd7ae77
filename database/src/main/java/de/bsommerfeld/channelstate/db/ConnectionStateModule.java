package de.bsommerfeld.channelstate.db;

import com.google.inject.AbstractModule;
import com.google.inject.Provider;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import de.bsommerfeld.channelstate.core.config.ApplicationMode;
import de.bsommerfeld.channelstate.core.config.StoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Guice wiring for the connection state layer.
 *
 * <p>
 * In PROD mode the store is created only after {@link SchemaInitializer} has
 * succeeded; a {@link SchemaException} escapes the provider and fails
 * injector creation. In TEST mode the in-memory store is bound and SQLite is
 * never opened.
 */
public class ConnectionStateModule extends AbstractModule {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectionStateModule.class);

    private final StoreConfig config;
    private final ApplicationMode mode;

    public ConnectionStateModule() {
        this(StoreConfig.fromEnvironment(), ApplicationMode.get());
    }

    public ConnectionStateModule(StoreConfig config, ApplicationMode mode) {
        this.config = config;
        this.mode = mode;
    }

    @Override
    protected void configure() {
        LOG.info("Connection state mode: {}", mode);
        bind(StoreConfig.class).toInstance(config);
        bind(ApplicationMode.class).toInstance(mode);
    }

    @Provides
    @Singleton
    Clock provideClock() {
        return Clock.system(config.getTimezone());
    }

    @Provides
    @Singleton
    TableNames provideTableNames() {
        return TableNames.from(config);
    }

    @Provides
    @Singleton
    SqliteConnectionFactory provideConnectionFactory() {
        return new SqliteConnectionFactory(config.getDatabaseFile(), config.getBusyTimeout());
    }

    @Provides
    @Singleton
    SchemaInitializer provideSchemaInitializer(SqliteConnectionFactory connectionFactory, TableNames tables) {
        return new SchemaInitializer(connectionFactory, tables);
    }

    @Provides
    @Singleton
    ConnectionStateStore provideStore(Provider<SchemaInitializer> schemaInitializer,
            Provider<SqliteConnectionFactory> connectionFactory, TableNames tables, Clock clock) {
        if (mode.isTest()) {
            return new InMemoryConnectionStateStore(clock);
        }
        schemaInitializer.get().ensureSchema();
        return new SqlConnectionStateStore(connectionFactory.get(), tables, clock);
    }
}
