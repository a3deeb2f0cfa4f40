package com.example.rls.registry;

import com.example.rls.policy.PolicyDefinition;

import java.util.List;
import java.util.Set;

/**
 * Registered form of a table schema. {@code policies} are sorted by priority
 * descending, ties in declaration order.
 */
public record CompiledTable(
        String table,
        List<PolicyDefinition> policies,
        boolean defaultDeny,
        Set<String> skipFor
) {
    public CompiledTable {
        policies = List.copyOf(policies);
        skipFor = Set.copyOf(skipFor);
    }

    public boolean isSkippedFor(Set<String> roles) {
        return roles.stream().anyMatch(skipFor::contains);
    }
}
