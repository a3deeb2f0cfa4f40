package com.example.rls.audit;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.config.RlsProperties.AuditProperties;
import com.example.rls.context.Operation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Writes RLS decisions as JSON lines to the {@code RLS_AUDIT} logger.
 * Deny events are never sampled out.
 */
public class StructuredRlsAuditLogger implements RlsAuditLogger {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("RLS_AUDIT");

    private final ObjectMapper objectMapper;
    private final AuditProperties properties;
    @Nullable
    private final RlsMetrics metrics;
    private final DoubleSupplier sampler;

    public StructuredRlsAuditLogger(ObjectMapper objectMapper, AuditProperties properties, @Nullable RlsMetrics metrics) {
        this(objectMapper, properties, metrics, () -> ThreadLocalRandom.current().nextDouble());
    }

    StructuredRlsAuditLogger(
            ObjectMapper objectMapper,
            AuditProperties properties,
            @Nullable RlsMetrics metrics,
            DoubleSupplier sampler) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metrics = metrics;
        this.sampler = sampler;
    }

    @Override
    public void logAllow(Operation operation, String table, @Nullable String policyName, Map<String, Object> extra) {
        if (metrics != null) {
            metrics.recordDecision(true, operation, table);
        }
        if (!properties.logAllowed() || !sampled()) {
            return;
        }
        logEvent(RlsAuditEvent.decision(RlsAuditEvent.Outcome.ALLOW, operation, table, policyName, extra));
    }

    @Override
    public void logDeny(Operation operation, String table, @Nullable String policyName, Map<String, Object> extra) {
        if (metrics != null) {
            metrics.recordDecision(false, operation, table);
        }
        if (!properties.logDenied()) {
            return;
        }
        logEvent(RlsAuditEvent.decision(RlsAuditEvent.Outcome.DENY, operation, table, policyName, extra));
    }

    @Override
    public void logFilter(String table, List<String> appliedFilters, Map<String, Object> extra) {
        if (metrics != null) {
            metrics.recordFilter(table, appliedFilters.size());
        }
        if (!properties.logFilters() || !sampled()) {
            return;
        }
        logEvent(RlsAuditEvent.filter(table, appliedFilters, extra));
    }

    private boolean sampled() {
        return properties.sampleRate() >= 1.0d || sampler.getAsDouble() < properties.sampleRate();
    }

    private void logEvent(@NonNull RlsAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize RLS audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(RlsAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW, FILTER -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
        }
    }

    private void logFallback(@NonNull RlsAuditEvent event) {
        AUDIT_LOG.warn("RLS {} - table={}, operation={}, policy={}",
                event.outcome(),
                StringSanitizer.forLog(event.table()),
                event.operation(),
                StringSanitizer.forLog(event.policyName()));
    }
}
