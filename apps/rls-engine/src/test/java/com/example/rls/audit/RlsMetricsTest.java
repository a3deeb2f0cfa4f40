package com.example.rls.audit;

import com.example.rls.context.Operation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RlsMetrics")
class RlsMetricsTest {

    private SimpleMeterRegistry registry;
    private RlsMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new RlsMetrics(registry);
    }

    @Test
    @DisplayName("should count decisions by outcome, operation and table")
    void shouldCountDecisions() {
        metrics.recordDecision(true, Operation.READ, "posts");
        metrics.recordDecision(true, Operation.READ, "posts");
        metrics.recordDecision(false, Operation.DELETE, "posts");

        assertThat(registry.get(RlsMetrics.DECISION_METRIC)
                .tags("outcome", "allow", "operation", "read", "table", "posts")
                .counter().count()).isEqualTo(2.0d);
        assertThat(registry.get(RlsMetrics.DECISION_METRIC)
                .tags("outcome", "deny", "operation", "delete", "table", "posts")
                .counter().count()).isEqualTo(1.0d);
    }

    @Test
    @DisplayName("should bound table tag values")
    void shouldSanitizeTableTag() {
        metrics.recordDecision(false, Operation.READ, "Posts; DROP TABLE users");

        assertThat(registry.get(RlsMetrics.DECISION_METRIC).counters())
                .allSatisfy(counter -> assertThat(counter.getId().getTag("table"))
                        .matches("[a-z0-9_.\\-]{1,50}"));
    }

    @Test
    @DisplayName("should add the number of applied filters")
    void shouldCountFilters() {
        metrics.recordFilter("users", 2);
        metrics.recordFilter("users", 1);

        assertThat(registry.get(RlsMetrics.FILTER_METRIC).tag("table", "users").counter().count())
                .isEqualTo(3.0d);
    }
}
