package com.sectune.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link TrainingStore} bean.
 * <p>
 * With {@code sectune.store.type=jdbc} a {@link JdbcTrainingStore} is created on the
 * configured PostgreSQL {@link DataSource} and its tables are ensured on startup.
 * Otherwise an {@link InMemoryTrainingStore} is used, which is fine for development
 * and tests but loses everything on restart.
 */
@Configuration
public class TrainingStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TrainingStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "sectune.store.type", havingValue = "jdbc")
    public TrainingStore jdbcTrainingStore(DataSource dataSource) throws Exception {
        log.info("Configuring JDBC training store (PostgreSQL)");
        var store = new JdbcTrainingStore(dataSource);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "sectune.store.type", havingValue = "memory", matchIfMissing = true)
    public TrainingStore inMemoryTrainingStore() {
        log.info("Using in-memory training store (state will not persist across restarts)");
        return new InMemoryTrainingStore();
    }
}
