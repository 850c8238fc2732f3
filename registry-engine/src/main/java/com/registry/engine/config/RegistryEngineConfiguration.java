package com.registry.engine.config;

import com.registry.core.audit.AuditRecorder;
import com.registry.core.repository.EntityDefinitionRepository;
import com.registry.core.repository.EntityRecordRepository;
import com.registry.core.schema.SchemaDefinitionChecker;
import com.registry.core.schema.SchemaValidator;
import com.registry.engine.audit.Slf4jAuditRecorder;
import com.registry.engine.coordinator.DefinitionCoordinator;
import com.registry.engine.coordinator.RecordCoordinator;
import com.registry.engine.lifecycle.RecordLifecycleManager;
import com.registry.engine.metrics.RegistryMetrics;
import com.registry.engine.service.DefinitionRegistry;
import com.registry.engine.service.RecordService;
import com.registry.engine.versioning.BusinessKeyResolver;
import com.registry.engine.versioning.VersioningEngine;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the registry engine. Repositories come from component scanning,
 * selected by {@code registry.store}.
 */
@Configuration
@EnableConfigurationProperties(RegistryProperties.class)
public class RegistryEngineConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditRecorder auditRecorder() {
        return new Slf4jAuditRecorder();
    }

    @Bean
    public SchemaValidator schemaValidator() {
        return new SchemaValidator();
    }

    @Bean
    public SchemaDefinitionChecker schemaDefinitionChecker(SchemaValidator schemaValidator) {
        return new SchemaDefinitionChecker(schemaValidator);
    }

    @Bean
    public BusinessKeyResolver businessKeyResolver() {
        return new BusinessKeyResolver();
    }

    @Bean
    public DefinitionRegistry definitionRegistry(
            EntityDefinitionRepository definitionRepository,
            EntityRecordRepository recordRepository,
            BusinessKeyResolver businessKeyResolver,
            SchemaDefinitionChecker schemaDefinitionChecker,
            AuditRecorder auditRecorder,
            RegistryMetrics registryMetrics,
            Clock clock) {
        return new DefinitionCoordinator(definitionRepository, recordRepository, businessKeyResolver,
            schemaDefinitionChecker, auditRecorder, registryMetrics, clock);
    }

    @Bean
    public RecordLifecycleManager recordLifecycleManager(
            SchemaValidator schemaValidator,
            EntityRecordRepository recordRepository,
            RegistryMetrics registryMetrics,
            Clock clock) {
        return new RecordLifecycleManager(schemaValidator, recordRepository, registryMetrics, clock);
    }

    @Bean
    public VersioningEngine versioningEngine(
            RecordLifecycleManager recordLifecycleManager,
            EntityRecordRepository recordRepository,
            BusinessKeyResolver businessKeyResolver,
            RegistryMetrics registryMetrics,
            Clock clock) {
        return new VersioningEngine(recordLifecycleManager, recordRepository, businessKeyResolver,
            registryMetrics, clock);
    }

    @Bean
    public RecordService recordService(
            DefinitionRegistry definitionRegistry,
            RecordLifecycleManager recordLifecycleManager,
            VersioningEngine versioningEngine,
            EntityRecordRepository recordRepository,
            AuditRecorder auditRecorder,
            RegistryMetrics registryMetrics,
            Clock clock) {
        return new RecordCoordinator(definitionRegistry, recordLifecycleManager, versioningEngine,
            recordRepository, auditRecorder, registryMetrics, clock);
    }
}
