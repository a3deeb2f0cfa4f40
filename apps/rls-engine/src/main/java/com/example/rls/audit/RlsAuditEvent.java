package com.example.rls.audit;

import com.example.rls.context.Operation;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit event for row-level decisions.
 */
public record RlsAuditEvent(
        String eventId,
        Instant timestamp,
        Outcome outcome,
        @Nullable Operation operation,
        String table,
        @Nullable String policyName,
        List<String> appliedFilters,
        Map<String, Object> extra
) {
    public enum Outcome {
        ALLOW, DENY, FILTER
    }

    public RlsAuditEvent {
        appliedFilters = appliedFilters != null ? List.copyOf(appliedFilters) : List.of();
        extra = extra != null ? new LinkedHashMap<>(extra) : Map.of();
    }

    public static RlsAuditEvent decision(
            Outcome outcome, Operation operation, String table, @Nullable String policyName, Map<String, Object> extra) {
        return new RlsAuditEvent(UUID.randomUUID().toString(), Instant.now(), outcome,
                operation, table, policyName, List.of(), extra);
    }

    public static RlsAuditEvent filter(String table, List<String> appliedFilters, Map<String, Object> extra) {
        return new RlsAuditEvent(UUID.randomUUID().toString(), Instant.now(), Outcome.FILTER,
                Operation.READ, table, null, appliedFilters, extra);
    }

    /**
     * Converts event to structured map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        Map<String, Object> log = new LinkedHashMap<>();
        log.put("event_type", "rls_decision");
        log.put("event_id", eventId);
        log.put("timestamp", timestamp.toString());
        log.put("outcome", outcome.name());
        log.put("operation", operation != null ? operation.value() : "");
        log.put("table", table != null ? table : "");
        log.put("policy_name", policyName != null ? policyName : "");
        if (!appliedFilters.isEmpty()) {
            log.put("applied_filters", appliedFilters);
        }
        extra.forEach((key, value) -> log.put(key, value != null ? value : ""));
        return log;
    }
}
