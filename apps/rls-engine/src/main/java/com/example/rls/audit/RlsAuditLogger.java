package com.example.rls.audit;

import com.example.rls.context.Operation;
import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Receives access decisions from the evaluator.
 *
 * <p>Calls are fire-and-forget: implementations own buffering, sampling and
 * delivery, and must not block or throw back into the evaluation.
 */
public interface RlsAuditLogger {

    void logAllow(Operation operation, String table, @Nullable String policyName, Map<String, Object> extra);

    void logDeny(Operation operation, String table, @Nullable String policyName, Map<String, Object> extra);

    default void logFilter(String table, List<String> appliedFilters, Map<String, Object> extra) {
    }
}
