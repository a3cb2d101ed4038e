package com.aura.core.store;

import com.aura.core.model.AuraObject;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.util.concurrent.CompletionException;

/**
 * Spring {@link Configuration} that provides the {@link ObjectStore} bean.
 * <p>
 * With {@code aura.store.backend=jdbc} a pooled DataSource is built from
 * {@code aura.store.jdbc.*} and a {@link JdbcObjectStore} is created on it.
 * With {@code memory} (the default) an {@link InMemoryObjectStore} is used, suitable
 * for development and testing but not durable across restarts.
 */
@Configuration
public class ObjectStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(ObjectStoreConfig.class);

    static final String SYSTEM_OBJECT_ID = "system";

    @Bean
    @ConditionalOnProperty(name = "aura.store.backend", havingValue = "jdbc")
    public DataSource objectStoreDataSource(StoreProperties properties) {
        var jdbc = properties.getJdbc();
        HikariDataSource dataSource = DataSourceBuilder.create()
                .type(HikariDataSource.class)
                .url(jdbc.getUrl())
                .username(jdbc.getUsername())
                .password(jdbc.getPassword())
                .build();
        dataSource.setMaximumPoolSize(jdbc.getMaxPoolSize());
        dataSource.setPoolName("aura-store");
        return dataSource;
    }

    /**
     * JDBC-backed store, activated by {@code aura.store.backend=jdbc}.
     * Creates the required tables on startup.
     */
    @Bean
    @ConditionalOnProperty(name = "aura.store.backend", havingValue = "jdbc")
    public ObjectStore jdbcObjectStore(DataSource objectStoreDataSource, ObjectMapper objectMapper,
                                       StoreProperties properties) {
        log.info("Configuring JDBC object store ({})", properties.getJdbc().getUrl());
        var store = new JdbcObjectStore(objectStoreDataSource, objectMapper,
                properties.getThreads(), properties.getCasAttempts());
        prepare(store, properties);
        return store;
    }

    /**
     * In-memory fallback store, used when no JDBC backend is configured.
     */
    @Bean
    @ConditionalOnProperty(name = "aura.store.backend", havingValue = "memory", matchIfMissing = true)
    public ObjectStore memoryObjectStore(StoreProperties properties) {
        log.info("No JDBC backend configured; using in-memory object store (state will not persist across restarts)");
        var store = new InMemoryObjectStore();
        prepare(store, properties);
        return store;
    }

    /**
     * Initializes the store and, when enabled, seeds the {@code system} object
     * delegating to {@code nil}.
     */
    static void prepare(ObjectStore store, StoreProperties properties) {
        store.initialize();
        if (!properties.isSeedSystemObject()) {
            return;
        }
        try {
            boolean exists = store.get(SYSTEM_OBJECT_ID).join().isPresent();
            if (!exists) {
                store.create(AuraObject.empty(SYSTEM_OBJECT_ID)).join();
                log.info("Created '{}' object", SYSTEM_OBJECT_ID);
            }
            store.link(SYSTEM_OBJECT_ID, AuraObject.NIL_ID).join();
        } catch (CompletionException e) {
            throw new PersistenceException("Failed to seed '" + SYSTEM_OBJECT_ID + "' object", e.getCause());
        }
    }
}
