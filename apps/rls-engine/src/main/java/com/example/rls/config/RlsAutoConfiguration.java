package com.example.rls.config;

import com.example.rls.audit.RlsAuditLogger;
import com.example.rls.audit.RlsMetrics;
import com.example.rls.audit.StructuredRlsAuditLogger;
import com.example.rls.engine.ActivationContextProvider;
import com.example.rls.engine.EvaluatorSettings;
import com.example.rls.engine.PolicyEvaluator;
import com.example.rls.fieldaccess.FieldAccessProcessor;
import com.example.rls.fieldaccess.FieldAccessRegistry;
import com.example.rls.fieldaccess.FieldAccessSchema;
import com.example.rls.guard.MutationGuard;
import com.example.rls.policy.RlsSchema;
import com.example.rls.registry.PolicyRegistry;
import com.example.rls.resolver.ContextResolver;
import com.example.rls.resolver.ResolverManager;
import com.example.rls.transformer.SelectTransformer;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Wires the row-level security engine.
 *
 * <p>Every {@link RlsSchema} and {@link FieldAccessSchema} bean is loaded into
 * the registries at startup; a table declared by two schema beans fails the
 * context. Host applications can replace any bean by declaring their own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(RlsProperties.class)
public class RlsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public PolicyRegistry rlsPolicyRegistry(ObjectProvider<RlsSchema> schemas) {
        PolicyRegistry registry = new PolicyRegistry();
        schemas.orderedStream().forEach(registry::loadSchema);
        log.info("RLS policy registry initialized with tables {}", registry.getTables());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldAccessRegistry rlsFieldAccessRegistry(ObjectProvider<FieldAccessSchema> schemas) {
        FieldAccessRegistry registry = new FieldAccessRegistry();
        schemas.orderedStream().forEach(registry::loadSchema);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ActivationContextProvider rlsActivationContextProvider(
            RlsProperties properties, ObjectProvider<Clock> clock) {
        return new PropertiesActivationContextProvider(properties, clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "app.rls.audit.enabled", havingValue = "true", matchIfMissing = true)
    public RlsAuditLogger rlsAuditLogger(
            RlsProperties properties,
            ObjectProvider<ObjectMapper> objectMapper,
            ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return new StructuredRlsAuditLogger(
                objectMapper.getIfAvailable(ObjectMapper::new),
                properties.audit(),
                registry != null ? new RlsMetrics(registry) : null);
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyEvaluator rlsPolicyEvaluator(
            PolicyRegistry registry,
            ActivationContextProvider activationContextProvider,
            ObjectProvider<RlsAuditLogger> auditLogger,
            RlsProperties properties) {
        EvaluatorSettings settings = EvaluatorSettings.builder()
                .requireRegisteredTables(properties.requireRegisteredTables())
                .bypassRoles(properties.bypassRoles())
                .excludeTables(properties.excludeTables())
                .build();
        return new PolicyEvaluator(registry, activationContextProvider, auditLogger.getIfAvailable(), settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public SelectTransformer rlsSelectTransformer(PolicyEvaluator evaluator) {
        return new SelectTransformer(evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public MutationGuard rlsMutationGuard(PolicyEvaluator evaluator) {
        return new MutationGuard(evaluator);
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldAccessProcessor rlsFieldAccessProcessor(FieldAccessRegistry registry) {
        return new FieldAccessProcessor(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResolverManager rlsResolverManager(RlsProperties properties, ObjectProvider<ContextResolver> resolvers) {
        return new ResolverManager(properties.resolverCache(), resolvers.orderedStream().toList());
    }
}
