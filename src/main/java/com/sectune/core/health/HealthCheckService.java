package com.sectune.core.health;

import com.sectune.core.persistence.InMemoryTrainingStore;
import com.sectune.core.persistence.TrainingStore;
import com.sectune.provider.FineTuningProvider;
import com.sectune.provider.ProviderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final TrainingStore store;
    private final DataSource dataSource;
    private final FineTuningProvider provider;
    private final ProviderProperties providerProperties;

    public HealthCheckService(
            @Autowired(required = false) TrainingStore store,
            @Autowired(required = false) DataSource dataSource,
            @Autowired(required = false) FineTuningProvider provider,
            ProviderProperties providerProperties) {
        this.store = store;
        this.dataSource = dataSource;
        this.provider = provider;
        this.providerProperties = providerProperties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkStore());
        results.add(checkDatabase());
        results.add(checkProvider());
        return results;
    }

    private HealthStatus checkStore() {
        if (store == null) {
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "No TrainingStore configured", Map.of());
        }
        try {
            store.findJobsByStatus(Set.of());
        } catch (RuntimeException e) {
            log.warn("Store health check failed: {}", e.getMessage());
            return new HealthStatus("store", HealthStatus.Status.DOWN,
                    "Store error: " + e.getMessage(), Map.of());
        }
        if (store instanceof InMemoryTrainingStore) {
            return new HealthStatus("store", HealthStatus.Status.DEGRADED,
                    "In-memory store; data is lost on restart", Map.of("type", "memory"));
        }
        return new HealthStatus("store", HealthStatus.Status.UP,
                "Store available (" + store.getClass().getSimpleName() + ")", Map.of("type", "jdbc"));
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkProvider() {
        if (provider == null) {
            return new HealthStatus("provider", HealthStatus.Status.DOWN,
                    "No FineTuningProvider configured", Map.of());
        }
        var metadata = Map.of("name", provider.name(), "baseUrl", providerProperties.getBaseUrl());
        if (!providerProperties.hasApiKey()) {
            return new HealthStatus("provider", HealthStatus.Status.DEGRADED,
                    "Provider API key not configured", metadata);
        }
        return new HealthStatus("provider", HealthStatus.Status.UP,
                "Provider configured (" + provider.name() + ")", metadata);
    }
}
