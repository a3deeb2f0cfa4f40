package com.example.rls.policy;

import lombok.Builder;
import lombok.Singular;

import java.util.List;
import java.util.Set;

/**
 * Row-level rules for one table.
 *
 * @param policies    rules in declaration order; the registry sorts them by priority
 * @param defaultDeny result when no allow/deny policy matches
 * @param skipFor     roles that bypass every row-level check on this table
 */
@Builder(toBuilder = true)
public record TableSchema(
        @Singular List<PolicyDefinition> policies,
        boolean defaultDeny,
        @Singular("skipForRole") Set<String> skipFor
) {
    public TableSchema {
        policies = policies != null ? List.copyOf(policies) : List.of();
        skipFor = skipFor != null ? Set.copyOf(skipFor) : Set.of();
    }

    public static TableSchema of(PolicyDefinition... policies) {
        return new TableSchema(List.of(policies), false, Set.of());
    }

    public static class TableSchemaBuilder {

        /**
         * Appends every policy of {@code reusable}, keeping its order.
         */
        public TableSchemaBuilder include(ReusablePolicy reusable) {
            reusable.policies().forEach(this::policy);
            return this;
        }
    }
}
