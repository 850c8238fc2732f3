package com.registry.engine.health;

import com.registry.core.repository.EntityDefinitionRepository;
import com.registry.engine.config.RegistryProperties;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Custom health indicator for the entity registry.
 * Reports health status based on:
 * - Database connectivity (JDBC store only)
 * - Whether the definition store answers queries
 */
@Component
public class RegistryHealthIndicator implements HealthIndicator {

    private final RegistryProperties properties;
    private final EntityDefinitionRepository definitionRepository;
    private final ObjectProvider<JdbcTemplate> jdbcTemplate;

    public RegistryHealthIndicator(
            RegistryProperties properties,
            EntityDefinitionRepository definitionRepository,
            ObjectProvider<JdbcTemplate> jdbcTemplate) {
        this.properties = properties;
        this.definitionRepository = definitionRepository;
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("store", properties.getStore());

        if (RegistryProperties.STORE_JDBC.equals(properties.getStore()) && !checkDatabase(details)) {
            return Health.down()
                .withDetails(details)
                .build();
        }

        try {
            details.put("definitions", definitionRepository.count());
            return Health.up()
                .withDetails(details)
                .build();
        } catch (RuntimeException e) {
            return Health.down()
                .withException(e)
                .withDetails(details)
                .build();
        }
    }

    private boolean checkDatabase(Map<String, Object> details) {
        JdbcTemplate template = jdbcTemplate.getIfAvailable();
        if (template == null) {
            details.put("database", "not configured");
            return false;
        }
        try {
            Integer result = template.queryForObject("SELECT 1", Integer.class);
            boolean healthy = result != null && result == 1;
            details.put("database", healthy ? "connected" : "unexpected response");
            return healthy;
        } catch (RuntimeException e) {
            details.put("database", "disconnected");
            details.put("databaseError", e.getMessage());
            return false;
        }
    }
}
