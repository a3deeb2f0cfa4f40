package com.example.rls.audit;

import com.example.rls.common.util.StringSanitizer;
import com.example.rls.context.Operation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.lang.NonNull;

/**
 * Decision counters. Tag values are bounded to keep cardinality under control.
 */
public class RlsMetrics {

    static final String DECISION_METRIC = "rls.decision";
    static final String FILTER_METRIC = "rls.filter.applied";

    private final MeterRegistry registry;

    public RlsMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDecision(boolean allowed, Operation operation, String table) {
        Counter.builder(DECISION_METRIC)
                .tag("outcome", allowed ? "allow" : "deny")
                .tag("operation", operation.value())
                .tag("table", StringSanitizer.forTag(table))
                .description("Row-level access decisions")
                .register(registry)
                .increment();
    }

    public void recordFilter(String table, int filterCount) {
        Counter.builder(FILTER_METRIC)
                .tag("table", StringSanitizer.forTag(table))
                .description("Filter policies applied to read queries")
                .register(registry)
                .increment(filterCount);
    }
}
